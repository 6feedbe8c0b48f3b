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

import java.util.ArrayList;
import java.util.List;

/**
 * The arguments of a function call as seen by an {@link Arcscript.Function}
 * <p>Arguments are evaluated lazily and at most once. Functions such as <code>reset</code> or <code>visits</code>
 * that take a name rather than a value use {@link #name(int)}, which reads a bare identifier or a string literal
 * without looking anything up.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public final class Arguments {
	private final Arcscript arcscript;
	private final String functionName;
	private final List<Expression> expressions;
	private final Value[] values;

	Arguments (Arcscript arcscript, String functionName, List<Expression> expressions) {
		this.arcscript = arcscript;
		this.functionName = functionName;
		this.expressions = expressions;
		this.values = new Value[expressions.size ()];
	}

	public int size () {
		return expressions.size ();
	}

	/**
	 * Evaluates an argument
	 *
	 * @param index Argument position
	 * @return The argument value
	 * @throws EvaluationException If the argument is missing or fails to evaluate
	 */
	public Value value (int index) {
		if (index < 0 || index >= expressions.size ())
			throw new EvaluationException (ErrorType.EXECUTION_ERROR, functionName + "() is missing argument " + (index + 1));

		if (values[index] == null)
			values[index] = expressions.get (index).evaluate (arcscript);

		return values[index];
	}

	/**
	 * @param index Argument position
	 * @param valueDefault Returned when the argument was not given
	 */
	public Value value (int index, Value valueDefault) {
		return index < expressions.size () ? value (index) : valueDefault;
	}

	/**
	 * Reads an argument as a name
	 *
	 * @param index Argument position
	 * @return The identifier or string literal text, otherwise the text of the evaluated value
	 */
	public String name (int index) {
		if (index < 0 || index >= expressions.size ())
			throw new EvaluationException (ErrorType.EXECUTION_ERROR, functionName + "() is missing argument " + (index + 1));

		Expression expression = expressions.get (index);
		if (expression instanceof Expression.Variable)
			return ((Expression.Variable) expression).name;

		return value (index).asString (arcscript.decimalFormat ());
	}

	/**
	 * @return Every argument read as a name, in order
	 */
	public List<String> names () {
		List<String> names = new ArrayList<String> ();
		for (int i = 0, j = expressions.size (); i < j; ++i)
			names.add (name (i));

		return names;
	}

	/**
	 * @return Every argument evaluated, in order
	 */
	public List<Value> values () {
		List<Value> list = new ArrayList<Value> ();
		for (int i = 0, j = expressions.size (); i < j; ++i)
			list.add (value (i));

		return list;
	}
}
