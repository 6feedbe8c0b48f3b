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

import java.util.List;

import org.arcscript.Lexer.TokenType;

/**
 * Parsed expression tree, evaluated against the state held by an {@link Arcscript} instance
 *
 * @version 1.0
 * @since 1.0
 */
abstract class Expression {
	/**
	 * @param arcscript Engine providing variables, functions and formatting
	 * @return The resulting value
	 * @throws EvaluationException On any runtime failure
	 */
	abstract Value evaluate (Arcscript arcscript);

	/** Number, string, boolean or null constant */
	static final class Literal extends Expression {
		final Value value;

		Literal (Value value) {
			this.value = value;
		}

		Value evaluate (Arcscript arcscript) {
			return value;
		}
	}

	/** Variable read, shadow variables first */
	static final class Variable extends Expression {
		final String name;

		Variable (String name) {
			this.name = name;
		}

		Value evaluate (Arcscript arcscript) {
			return arcscript.variableRead (name);
		}
	}

	/** Prefix operator */
	static final class Unary extends Expression {
		final TokenType operator;
		final Expression operand;

		Unary (TokenType operator, Expression operand) {
			this.operator = operator;
			this.operand = operand;
		}

		Value evaluate (Arcscript arcscript) {
			Value value = operand.evaluate (arcscript);

			switch (operator) {
				case NOT:
					return Value.of (!value.asBoolean ());
				case MINUS:
					return Value.negate (value);
				default:
					// Unary plus converts the operand to a number
					return Value.subtract (value, Value.ZERO);
			}
		}
	}

	/** Infix arithmetic, comparison and equality */
	static final class Binary extends Expression {
		final TokenType operator;
		final Expression left;
		final Expression right;

		Binary (TokenType operator, Expression left, Expression right) {
			this.operator = operator;
			this.left = left;
			this.right = right;
		}

		Value evaluate (Arcscript arcscript) {
			Value l = left.evaluate (arcscript);
			Value r = right.evaluate (arcscript);

			switch (operator) {
				case PLUS:
					return Value.add (l, r, arcscript.decimalFormat ());
				case MINUS:
					return Value.subtract (l, r);
				case STAR:
					return Value.multiply (l, r);
				case SLASH:
					return Value.divide (l, r);
				case PERCENT:
					return Value.modulo (l, r);
				case EQ:
					return Value.of (Value.equal (l, r));
				case NE:
					return Value.of (!Value.equal (l, r));
				case LT:
					return Value.of (Value.compare (l, r) < 0);
				case LE:
					return Value.of (Value.compare (l, r) <= 0);
				case GT:
					return Value.of (Value.compare (l, r) > 0);
				case GE:
					return Value.of (Value.compare (l, r) >= 0);
				default:
					throw new EvaluationException (ErrorType.PARSE_ERROR, "Unknown operator: " + operator);
			}
		}
	}

	/** Short-circuit <code>and</code> / <code>or</code> */
	static final class Logical extends Expression {
		final boolean and;
		final Expression left;
		final Expression right;

		Logical (boolean and, Expression left, Expression right) {
			this.and = and;
			this.left = left;
			this.right = right;
		}

		Value evaluate (Arcscript arcscript) {
			boolean l = left.evaluate (arcscript).asBoolean ();
			if (and ? !l : l)
				return Value.of (l);

			return Value.of (right.evaluate (arcscript).asBoolean ());
		}
	}

	/** Built-in or host registered function call */
	static final class Call extends Expression {
		final String name;
		final List<Expression> arguments;

		Call (String name, List<Expression> arguments) {
			this.name = name;
			this.arguments = arguments;
		}

		Value evaluate (Arcscript arcscript) {
			Arcscript.Function function = arcscript.functionGet (name);
			if (function == null)
				throw new EvaluationException (ErrorType.UNKNOWN_FUNCTION, "Unknown function: " + name);

			Value value;
			try {
				value = function.call (arcscript, new Arguments (arcscript, name, arguments));
			} catch (EvaluationException e) {
				throw e;
			} catch (RuntimeException e) {
				// Host code may throw anything
				throw new EvaluationException (ErrorType.EXECUTION_ERROR, name + "() failed: " + e.getMessage ());
			}

			return value == null ? Value.NULL : value;
		}
	}
}
