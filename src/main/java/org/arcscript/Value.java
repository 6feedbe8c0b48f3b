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

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * An Arcscript value: integer, float, boolean, string or null
 * <p>All coercion happens here. Operands are widened to a number where an operator needs one (booleans are 1/0,
 * null is 0, strings only when they hold a number), integer arithmetic stays integer and any float operand makes
 * the result a float. The <code>+</code> operator concatenates when either side is a string.</p>
 *
 * @version 1.0
 * @since 1.0
 */
public final class Value {
	/** The kinds of value */
	public static enum Type {
		NULL,
		INTEGER,
		FLOAT,
		BOOLEAN,
		STRING
	}

	public static final Value NULL = new Value (Type.NULL, null);
	public static final Value TRUE = new Value (Type.BOOLEAN, Boolean.TRUE);
	public static final Value FALSE = new Value (Type.BOOLEAN, Boolean.FALSE);
	public static final Value ZERO = new Value (Type.INTEGER, Long.valueOf (0));

	private static final Pattern NUMBER_INTEGER = Pattern.compile ("[+-]?\\d+");
	private static final Pattern NUMBER_FLOAT = Pattern.compile ("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

	private final Type type;
	private final Object value;

	private Value (Type type, Object value) {
		this.type = type;
		this.value = value;
	}

	public static Value of (long number) {
		return new Value (Type.INTEGER, Long.valueOf (number));
	}

	public static Value of (double number) {
		return new Value (Type.FLOAT, Double.valueOf (number));
	}

	public static Value of (boolean bool) {
		return bool ? TRUE : FALSE;
	}

	/**
	 * @param string Text content, null gives {@link #NULL}
	 */
	public static Value of (String string) {
		return string == null ? NULL : new Value (Type.STRING, string);
	}

	/**
	 * Wraps a plain Java object, as handed over by a host (numbers, booleans, strings, or null)
	 *
	 * @param object The object to wrap
	 * @return The matching value, strings for anything unrecognised
	 */
	public static Value ofObject (Object object) {
		if (object == null)
			return NULL;

		if (object instanceof Value)
			return (Value) object;

		if (object instanceof Boolean)
			return of (((Boolean) object).booleanValue ());

		if (object instanceof Integer || object instanceof Long || object instanceof Short || object instanceof Byte)
			return of (((Number) object).longValue ());

		if (object instanceof Number)
			return of (((Number) object).doubleValue ());

		return of (object.toString ());
	}

	/**
	 * Creates the formatter used when floats are turned into text
	 *
	 * @param scale Number of decimal places kept (rounded half up)
	 * @return A formatter independent of the default locale
	 */
	public static DecimalFormat decimalFormat (int scale) {
		DecimalFormat decimalFormat = new DecimalFormat ("0" + (scale > 0 ? "." + new String (new char[scale]).replace ("\0", "#") : ""), DecimalFormatSymbols.getInstance (Locale.ROOT));
		decimalFormat.setRoundingMode (RoundingMode.HALF_UP);
		return decimalFormat;
	}

	public Type type () {
		return type;
	}

	public boolean isNull () {
		return type == Type.NULL;
	}

	public boolean isString () {
		return type == Type.STRING;
	}

	/**
	 * @return Whether this value takes part in arithmetic without conversion errors
	 */
	public boolean isNumeric () {
		return numeric (this) != null;
	}

	/**
	 * Truthiness used by conditions: booleans as is, numbers when non-zero, strings when non-empty, null never
	 */
	public boolean asBoolean () {
		switch (type) {
			case BOOLEAN:
				return ((Boolean) value).booleanValue ();
			case INTEGER:
				return ((Long) value).longValue () != 0;
			case FLOAT:
				return ((Double) value).doubleValue () != 0;
			case STRING:
				return !((String) value).isEmpty ();
			default:
				return false;
		}
	}

	/**
	 * @return This value as a whole number, floats are truncated
	 * @throws EvaluationException If the value is not numeric
	 */
	public long asLong () {
		Value number = numericOrFail (this);
		return number.type == Type.INTEGER ? ((Long) number.value).longValue () : (long) ((Double) number.value).doubleValue ();
	}

	/**
	 * @throws EvaluationException If the value is not numeric
	 */
	public double asDouble () {
		Value number = numericOrFail (this);
		return number.type == Type.INTEGER ? ((Long) number.value).doubleValue () : ((Double) number.value).doubleValue ();
	}

	/**
	 * Text form of the value, null is the empty string
	 *
	 * @param decimalFormat Formatter applied to floats
	 * @return The text form
	 */
	public String asString (DecimalFormat decimalFormat) {
		switch (type) {
			case NULL:
				return "";
			case FLOAT:
				return decimalFormat.format (((Double) value).doubleValue ());
			default:
				return value.toString ();
		}
	}

	/**
	 * @return The wrapped Java object (Long, Double, Boolean, String) or null
	 */
	public Object toObject () {
		return value;
	}

	@Override
	public String toString () {
		return asString (decimalFormat (3));
	}

	@Override
	public boolean equals (Object other) {
		if (this == other)
			return true;

		if (!(other instanceof Value))
			return false;

		Value that = (Value) other;
		return type == that.type && (value == null ? that.value == null : value.equals (that.value));
	}

	@Override
	public int hashCode () {
		return type.hashCode () * 31 + (value == null ? 0 : value.hashCode ());
	}

	/**
	 * Addition, or concatenation when either operand is a string
	 */
	public static Value add (Value left, Value right, DecimalFormat decimalFormat) {
		if (left.type == Type.STRING || right.type == Type.STRING)
			return of (left.asString (decimalFormat) + right.asString (decimalFormat));

		Value l = numericOrFail (left), r = numericOrFail (right);
		if (l.type == Type.INTEGER && r.type == Type.INTEGER) {
			try {
				return of (Math.addExact (l.asLong (), r.asLong ()));
			} catch (ArithmeticException e) {
				throw overflow (l, "+", r);
			}
		}

		return of (l.asDouble () + r.asDouble ());
	}

	public static Value subtract (Value left, Value right) {
		Value l = numericOrFail (left), r = numericOrFail (right);
		if (l.type == Type.INTEGER && r.type == Type.INTEGER) {
			try {
				return of (Math.subtractExact (l.asLong (), r.asLong ()));
			} catch (ArithmeticException e) {
				throw overflow (l, "-", r);
			}
		}

		return of (l.asDouble () - r.asDouble ());
	}

	public static Value multiply (Value left, Value right) {
		Value l = numericOrFail (left), r = numericOrFail (right);
		if (l.type == Type.INTEGER && r.type == Type.INTEGER) {
			try {
				return of (Math.multiplyExact (l.asLong (), r.asLong ()));
			} catch (ArithmeticException e) {
				throw overflow (l, "*", r);
			}
		}

		return of (l.asDouble () * r.asDouble ());
	}

	/**
	 * Division, integer when both operands are integers and the division is exact
	 *
	 * @throws EvaluationException On a zero divisor
	 */
	public static Value divide (Value left, Value right) {
		Value l = numericOrFail (left), r = numericOrFail (right);
		if (r.asDouble () == 0)
			throw new EvaluationException (ErrorType.EXECUTION_ERROR, "Division by zero");

		if (l.type == Type.INTEGER && r.type == Type.INTEGER && l.asLong () % r.asLong () == 0) {
			if (l.asLong () == Long.MIN_VALUE && r.asLong () == -1)
				throw overflow (l, "/", r);

			return of (l.asLong () / r.asLong ());
		}

		return of (l.asDouble () / r.asDouble ());
	}

	/**
	 * @throws EvaluationException On a zero divisor
	 */
	public static Value modulo (Value left, Value right) {
		Value l = numericOrFail (left), r = numericOrFail (right);
		if (r.asDouble () == 0)
			throw new EvaluationException (ErrorType.EXECUTION_ERROR, "Modulo by zero");

		if (l.type == Type.INTEGER && r.type == Type.INTEGER)
			return of (l.asLong () % r.asLong ());

		return of (l.asDouble () % r.asDouble ());
	}

	public static Value negate (Value operand) {
		Value number = numericOrFail (operand);
		if (number.type == Type.INTEGER) {
			if (number.asLong () == Long.MIN_VALUE)
				throw new EvaluationException (ErrorType.EXECUTION_ERROR, "Integer overflow: -(" + number.asLong () + ")");

			return of (-number.asLong ());
		}

		return of (-number.asDouble ());
	}

	private static EvaluationException overflow (Value left, String operator, Value right) {
		return new EvaluationException (ErrorType.EXECUTION_ERROR, "Integer overflow: " + left.asLong () + " " + operator + " " + right.asLong ());
	}

	/**
	 * Loose equality: numeric when both sides are numbers (or numeric strings), text otherwise, null equals null only
	 */
	public static boolean equal (Value left, Value right) {
		if (left.type == Type.NULL || right.type == Type.NULL)
			return left.type == right.type;

		if (left.type == Type.STRING && right.type == Type.STRING)
			return left.value.equals (right.value);

		Value l = numeric (left), r = numeric (right);
		if (l != null && r != null)
			return l.asDouble () == r.asDouble ();

		return left.asString (decimalFormat (3)).equals (right.asString (decimalFormat (3)));
	}

	/**
	 * Ordering used by the relational operators
	 *
	 * @return Negative, zero or positive as left is less than, equal to or greater than right
	 * @throws EvaluationException When the operands cannot be ordered
	 */
	public static int compare (Value left, Value right) {
		Value l = numeric (left), r = numeric (right);
		if (l != null && r != null)
			return Double.compare (l.asDouble (), r.asDouble ());

		if (left.type == Type.STRING && right.type == Type.STRING)
			return ((String) left.value).compareTo ((String) right.value);

		throw new EvaluationException (ErrorType.EXECUTION_ERROR, "Cannot compare " + left.type.toString ().toLowerCase () + " with " + right.type.toString ().toLowerCase ());
	}

	/**
	 * Widens a value to INTEGER or FLOAT
	 *
	 * @return The numeric value, or null if it has none (non-numeric string)
	 */
	private static Value numeric (Value operand) {
		switch (operand.type) {
			case INTEGER:
			case FLOAT:
				return operand;
			case BOOLEAN:
				return ((Boolean) operand.value).booleanValue () ? of (1) : ZERO;
			case NULL:
				return ZERO;
			default:
				String string = ((String) operand.value).trim ();
				if (NUMBER_INTEGER.matcher (string).matches ()) {
					try {
						return of (Long.parseLong (string));
					} catch (NumberFormatException e) {
						return of (Double.parseDouble (string));
					}
				}

				if (NUMBER_FLOAT.matcher (string).matches ())
					return of (Double.parseDouble (string));

				return null;
		}
	}

	private static Value numericOrFail (Value operand) {
		Value number = numeric (operand);
		if (number == null)
			throw new EvaluationException (ErrorType.EXECUTION_ERROR, "Not a number: \"" + operand.value + "\"");

		return number;
	}
}
