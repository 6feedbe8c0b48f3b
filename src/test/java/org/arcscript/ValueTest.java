/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.arcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.math.BigDecimal;
import java.text.DecimalFormat;

import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Coercion rules of {@link Value}
 *
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class ValueTest {
	private static final DecimalFormat FORMAT = Value.decimalFormat (3);

	@Test
	public void _01_Truthiness () {
		assertEquals (false, Value.NULL.asBoolean ());
		assertEquals (false, Value.ZERO.asBoolean ());
		assertEquals (true, Value.of (-2).asBoolean ());
		assertEquals (false, Value.of (0.0).asBoolean ());
		assertEquals (false, Value.of ("").asBoolean ());
		assertEquals (true, Value.of ("false").asBoolean ());
		assertEquals (true, Value.TRUE.asBoolean ());
	}

	@Test
	public void _02_AddConcatenatesStrings () {
		assertEquals (Value.of ("a1"), Value.add (Value.of ("a"), Value.of (1), FORMAT));
		assertEquals (Value.of ("0.5x"), Value.add (Value.of (0.5), Value.of ("x"), FORMAT));
		assertEquals (Value.of ("x"), Value.add (Value.of ("x"), Value.NULL, FORMAT));
		assertEquals (Value.of (3), Value.add (Value.of (1), Value.of (2), FORMAT));
		assertEquals (Value.of (2), Value.add (Value.TRUE, Value.TRUE, FORMAT));
		assertEquals (Value.of (1.5), Value.add (Value.of (1), Value.of (0.5), FORMAT));
	}

	@Test
	public void _03_Arithmetic () {
		assertEquals (Value.of (4), Value.subtract (Value.of ("7"), Value.of (3)));
		assertEquals (Value.of (6), Value.multiply (Value.of (2), Value.of (3)));
		assertEquals (Value.of (2), Value.divide (Value.of (6), Value.of (3)));
		assertEquals (Value.of (2.5), Value.divide (Value.of (5), Value.of (2)));
		assertEquals (Value.of (1), Value.modulo (Value.of (7), Value.of (3)));
		assertEquals (Value.of (-3), Value.negate (Value.of (3)));
		assertEquals (Value.ZERO, Value.multiply (Value.NULL, Value.of (9)));
	}

	@Test
	public void _04_Failures () {
		try {
			Value.divide (Value.of (1), Value.ZERO);
			fail ("Division by zero passed");
		} catch (EvaluationException e) {
			assertEquals (ErrorType.EXECUTION_ERROR, e.type ());
			assertEquals ("Division by zero", e.getMessage ());
		}

		try {
			Value.subtract (Value.of ("apple"), Value.of (1));
			fail ("Subtracting from text passed");
		} catch (EvaluationException e) {
			assertEquals (ErrorType.EXECUTION_ERROR, e.type ());
		}

		try {
			Value.compare (Value.TRUE, Value.of ("x"));
			fail ("Comparing boolean with text passed");
		} catch (EvaluationException e) {
			assertEquals ("Cannot compare boolean with string", e.getMessage ());
		}
	}

	@Test
	public void _05_Equality () {
		assertEquals (true, Value.equal (Value.of (1), Value.of (1.0)));
		assertEquals (true, Value.equal (Value.of ("2"), Value.of (2)));
		assertEquals (false, Value.equal (Value.of ("2"), Value.of ("2.0")));
		assertEquals (true, Value.equal (Value.NULL, Value.NULL));
		assertEquals (false, Value.equal (Value.NULL, Value.ZERO));
		assertEquals (true, Value.equal (Value.TRUE, Value.of (1)));
	}

	@Test
	public void _06_Ordering () {
		assertEquals (true, Value.compare (Value.of (2), Value.of (10)) < 0);
		assertEquals (true, Value.compare (Value.of ("b"), Value.of ("a")) > 0);
		assertEquals (0, Value.compare (Value.of ("10"), Value.of (10.0)));
	}

	@Test
	public void _07_Text () {
		assertEquals ("", Value.NULL.asString (FORMAT));
		assertEquals ("0.667", Value.of (2.0 / 3).asString (FORMAT));
		assertEquals ("3", Value.of (3.0).asString (FORMAT));
		assertEquals ("1.3", Value.of (1.25).asString (Value.decimalFormat (1)));
		assertEquals ("true", Value.TRUE.toString ());
	}

	@Test
	public void _08_HostObjects () {
		assertEquals (Value.of (5), Value.ofObject (Integer.valueOf (5)));
		assertEquals (Value.of (2.5), Value.ofObject (new BigDecimal ("2.5")));
		assertEquals (Value.TRUE, Value.ofObject (Boolean.TRUE));
		assertEquals (Value.NULL, Value.ofObject (null));
		assertEquals (Value.of ("x"), Value.ofObject (new StringBuilder ("x")));
		assertEquals (Value.Type.STRING, Value.of ("").type ());
		assertEquals (true, Value.of ("12").isNumeric ());
		assertEquals (false, Value.of ("1 2").isNumeric ());
	}

	@Test
	public void _09_IntegerOverflow () {
		Value max = Value.of (Long.MAX_VALUE), min = Value.of (Long.MIN_VALUE);

		try {
			Value.add (max, Value.of (1), FORMAT);
			fail ("Adding past the largest integer passed");
		} catch (EvaluationException e) {
			assertEquals (ErrorType.EXECUTION_ERROR, e.type ());
			assertEquals ("Integer overflow: 9223372036854775807 + 1", e.getMessage ());
		}

		try {
			Value.subtract (min, Value.of (1));
			fail ("Subtracting past the smallest integer passed");
		} catch (EvaluationException e) {
			assertEquals ("Integer overflow: -9223372036854775808 - 1", e.getMessage ());
		}

		try {
			Value.multiply (max, Value.of (2));
			fail ("Multiplying past the largest integer passed");
		} catch (EvaluationException e) {
			assertEquals (ErrorType.EXECUTION_ERROR, e.type ());
		}

		try {
			Value.divide (min, Value.of (-1));
			fail ("Dividing the smallest integer by -1 passed");
		} catch (EvaluationException e) {
			assertEquals (ErrorType.EXECUTION_ERROR, e.type ());
		}

		try {
			Value.negate (min);
			fail ("Negating the smallest integer passed");
		} catch (EvaluationException e) {
			assertEquals (ErrorType.EXECUTION_ERROR, e.type ());
		}

		// Floats never overflow into an error
		assertEquals (Value.of (Long.MAX_VALUE + 1.0), Value.add (max, Value.of (1.0), FORMAT));
		assertEquals (Value.of (Long.MAX_VALUE - 1), Value.add (max, Value.of (-1), FORMAT));
	}
}
