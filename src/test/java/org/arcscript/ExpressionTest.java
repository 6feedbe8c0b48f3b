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

import java.util.List;

import org.junit.Before;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

/**
 * Lexing, parsing and evaluating single expressions
 *
 * @version 1.0
 * @since 1.0
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class ExpressionTest {
	private Arcscript arcscript;

	@Before
	public void setUp () {
		arcscript = new Arcscript ();
		arcscript.variableSet ("a", 2);
		arcscript.variableSet ("b", 5);
		arcscript.variableSet ("name", "Ada");
		arcscript.variableSet ("flag", false);
	}

	private Value evaluate (String expression) {
		return Parser.parse (expression).evaluate (arcscript);
	}

	private void assertParseError (String expression, String message) {
		try {
			Parser.parse (expression);
			fail ("Parsed: " + expression);
		} catch (EvaluationException e) {
			assertEquals (ErrorType.PARSE_ERROR, e.type ());
			assertEquals (message, e.getMessage ());
		}
	}

	@Test
	public void _01_Precedence () {
		assertEquals (Value.of (17), evaluate ("a + b * 3"));
		assertEquals (Value.of (21), evaluate ("(a + b) * 3"));
		assertEquals (Value.of (1), evaluate ("b % a"));
		assertEquals (Value.of (-3), evaluate ("a - b"));
		assertEquals (Value.of (8), evaluate ("a - -b - -1"));
		assertEquals (Value.TRUE, evaluate ("a < b && b < 10 || flag"));
		assertEquals (Value.TRUE, evaluate ("flag or a + 1 == 3 and not flag"));
		assertEquals (Value.FALSE, evaluate ("!(a <= 2)"));
	}

	@Test
	public void _02_Literals () {
		assertEquals (Value.of (1.5), evaluate ("1.5"));
		assertEquals (Value.of (0.5), evaluate (".5"));
		assertEquals (Value.of (3), evaluate ("+3"));
		assertEquals (Value.of ("it's"), evaluate ("'it\\'s'"));
		assertEquals (Value.of ("say \"hi\""), evaluate ("\"say \\\"hi\\\"\""));
		assertEquals (Value.of ("a\nb"), evaluate ("\"a\\nb\""));
		assertEquals (Value.NULL, evaluate ("null"));
		assertEquals (Value.TRUE, evaluate ("true"));
	}

	@Test
	public void _03_TextualOperators () {
		assertEquals ("name == \"is not\" && a != 3", Lexer.normalise ("name is \"is not\" && a is not 3"));
		assertEquals ("island == 1", Lexer.normalise ("island is 1"));
		assertEquals (Value.TRUE, evaluate ("name is \"Ada\""));
		assertEquals (Value.TRUE, evaluate ("b is not a"));
		assertEquals (Value.TRUE, evaluate ("a &lt; b &amp;&amp; b &gt; a"));
	}

	@Test
	public void _04_Logical () {
		// The right side is never evaluated, so no unknown variable is reported
		assertEquals (Value.FALSE, evaluate ("flag and missing"));
		assertEquals (Value.TRUE, evaluate ("a or missing"));
		assertEquals (0, arcscript.diagnosticsGet ().size ());

		// Results are booleans
		assertEquals (Value.TRUE, evaluate ("name && a"));
	}

	@Test
	public void _05_UnknownVariable () {
		assertEquals (Value.of (1), evaluate ("missing + 1"));
		assertEquals (ErrorType.UNKNOWN_VARIABLE, arcscript.diagnosticsGet ().get (0).type ());
		assertEquals ("Unknown variable: missing", arcscript.stderr);
	}

	@Test
	public void _06_Calls () {
		assertEquals (Value.of (9), evaluate ("max(a, b, 9)"));
		assertEquals (Value.of (2), evaluate ("min(b, a)"));
		assertEquals (Value.of (25), evaluate ("sqr(b)"));
		assertEquals (Value.of (3.0), evaluate ("sqrt(9)"));

		try {
			evaluate ("fly(1)");
			fail ("Unknown function called");
		} catch (EvaluationException e) {
			assertEquals (ErrorType.UNKNOWN_FUNCTION, e.type ());
		}

		try {
			evaluate ("sqr()");
			fail ("Missing argument accepted");
		} catch (EvaluationException e) {
			assertEquals ("sqr() is missing argument 1", e.getMessage ());
		}
	}

	@Test
	public void _07_ArgumentNames () {
		final StringBuilder seen = new StringBuilder ();
		arcscript.functionAdd ("names", new Arcscript.Function () {
			public Value call (Arcscript arcscript, Arguments arguments) {
				seen.append (arguments.names ());
				return Value.of (arguments.size ());
			}
		});

		assertEquals (Value.of (4), evaluate ("names(a, \"b c\", 1 + 1, undefined)"));
		assertEquals ("[a, b c, 2, undefined]", seen.toString ());
		assertEquals (0, arcscript.diagnosticsGet ().size ());
	}

	@Test
	public void _08_ParseErrors () {
		assertParseError ("", "Empty expression");
		assertParseError ("1 +", "Unexpected end of expression");
		assertParseError ("(1", "Expected ')' but found end of expression");
		assertParseError ("1 2", "Unexpected '2' at position 3");
		assertParseError ("a = 1", "Unexpected character: =");
		assertParseError ("\"open", "Unterminated string");
		assertParseError ("3x", "Invalid number: 3x");
		assertParseError ("max(1, 2", "Expected ')' after arguments of max but found end of expression");
	}

	@Test
	public void _09_Tokens () {
		List<Lexer.Token> tokens = Lexer.tokenise ("a<=1||b");
		assertEquals (6, tokens.size ());
		assertEquals (Lexer.TokenType.LE, tokens.get (1).type);
		assertEquals (Lexer.TokenType.OR, tokens.get (3).type);
		assertEquals (4, tokens.get (3).position);
		assertEquals (Lexer.TokenType.END, tokens.get (5).type);
	}
}
