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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a script into lines and classifies each one; nothing is evaluated here
 *
 * @version 1.0
 * @since 1.0
 */
public final class LineScanner {
	/** Line kinds the interpreter understands */
	public static enum LineType {
		IF,
		ELSEIF,
		ELSE,
		ENDIF,
		ASSIGNMENT,
		SHOW,
		CALL,
		COMMENT,
		BLANK,
		TEXT
	}

	/** Operators for writing values, compound first so they win over a plain = */
	private static final String[] operatorAssignment = {
		"+=",
		"-=",
		"*=",
		"/=",
		"="
	};

	/** Operators for comparisons containing =, never an assignment */
	private static final String[] operatorComparator = {
		"==",
		"!=",
		">=",
		"<="
	};

	private static final Pattern IDENTIFIER = Pattern.compile ("[A-Za-z_][A-Za-z0-9_]*");
	private static final Pattern CALL = Pattern.compile ("[A-Za-z_][A-Za-z0-9_]*\\(");

	/** Holds one classified line */
	public static final class Line {
		private final LineType type;
		private final int number;
		private final String text;
		private final String argument;
		private final String operator;
		private final String target;

		Line (LineType type, int number, String text, String argument, String operator, String target) {
			this.type = type;
			this.number = number;
			this.text = text;
			this.argument = argument;
			this.operator = operator;
			this.target = target;
		}

		public LineType type () {
			return type;
		}

		/**
		 * @return The 1-based line number within the script
		 */
		public int number () {
			return number;
		}

		/**
		 * @return The line as written
		 */
		public String text () {
			return text;
		}

		/**
		 * @return The condition of an if/elseif, the right-hand side of an assignment, the argument list of a
		 * show(), the whole call of a function statement, otherwise null
		 */
		public String argument () {
			return argument;
		}

		/**
		 * @return The assignment operator (<code>=</code>, <code>+=</code>, ...) or null
		 */
		public String operator () {
			return operator;
		}

		/**
		 * @return The variable assigned to, or null
		 */
		public String target () {
			return target;
		}
	}

	private LineScanner () {
	}

	/**
	 * Splits and classifies a script
	 *
	 * @param script Script text, any line endings
	 * @return One entry per line, in order
	 */
	public static List<Line> scan (String script) {
		List<Line> lines = new ArrayList<Line> ();
		if (script == null)
			return lines;

		// Remove any UTF BOM
		if (script.startsWith ("\uFEFF"))
			script = script.substring (1);

		// UNIX-ify any line endings
		String[] rows = script.replace ("\r\n", "\n").replace ("\r", "\n").split ("\n", -1);
		for (int i = 0; i < rows.length; ++i)
			lines.add (classify (rows[i], i + 1));

		return lines;
	}

	/**
	 * Classifies a single line
	 *
	 * @param text The line
	 * @param number Its 1-based line number
	 * @return The classified line
	 */
	public static Line classify (String text, int number) {
		String trimmed = text.trim ();

		if (trimmed.isEmpty ())
			return new Line (LineType.BLANK, number, text, null, null, null);

		if (trimmed.startsWith ("//"))
			return new Line (LineType.COMMENT, number, text, null, null, null);

		if (trimmed.equals ("else"))
			return new Line (LineType.ELSE, number, text, null, null, null);

		if (trimmed.equals ("endif"))
			return new Line (LineType.ENDIF, number, text, null, null, null);

		String condition = keywordArgument (trimmed, "elseif");
		if (condition != null)
			return new Line (LineType.ELSEIF, number, text, condition, null, null);

		condition = keywordArgument (trimmed, "if");
		if (condition != null)
			return new Line (LineType.IF, number, text, condition, null, null);

		if (trimmed.startsWith ("show(") && closingParenthesis (trimmed, 4) == trimmed.length () - 1)
			return new Line (LineType.SHOW, number, text, trimmed.substring (5, trimmed.length () - 1), null, null);

		// A function called for its effect, such as resetVisits()
		Matcher call = CALL.matcher (trimmed);
		if (call.lookingAt () && closingParenthesis (trimmed, call.end () - 1) == trimmed.length () - 1)
			return new Line (LineType.CALL, number, text, trimmed, null, null);

		Line assignment = assignment (text, trimmed, number);
		if (assignment != null)
			return assignment;

		return new Line (LineType.TEXT, number, text, null, null, null);
	}

	/**
	 * @return The text after a keyword when followed by whitespace or '(', and non-empty; null otherwise
	 */
	private static String keywordArgument (String trimmed, String keyword) {
		if (!trimmed.startsWith (keyword) || trimmed.length () == keyword.length ())
			return null;

		char next = trimmed.charAt (keyword.length ());
		if (!Character.isWhitespace (next) && next != '(')
			return null;

		String argument = trimmed.substring (keyword.length ()).trim ();
		return argument.isEmpty () ? null : argument;
	}

	/**
	 * Detects an assignment: exactly one assignment operator outside strings and comparisons, an identifier on
	 * the left and something on the right
	 */
	private static Line assignment (String text, String trimmed, int number) {
		int found = -1;
		String foundOperator = null;

		for (int i = 0, j = trimmed.length (); i < j; ++i) {
			char c = trimmed.charAt (i);

			if (c == '"' || c == '\'') {
				i = Lexer.stringEnd (trimmed, i) - 1;
				continue;
			}

			String comparator = operatorAt (trimmed, i, operatorComparator);
			if (comparator != null) {
				i += comparator.length () - 1;
				continue;
			}

			String operator = operatorAt (trimmed, i, operatorAssignment);
			if (operator != null) {
				if (found > -1)
					return null;

				found = i;
				foundOperator = operator;
				i += operator.length () - 1;
			}
		}

		if (found < 0)
			return null;

		String target = trimmed.substring (0, found).trim ();
		String expression = trimmed.substring (found + foundOperator.length ()).trim ();

		if (target.startsWith ("<") || !IDENTIFIER.matcher (target).matches () || expression.isEmpty ())
			return null;

		return new Line (LineType.ASSIGNMENT, number, text, expression, foundOperator, target);
	}

	private static String operatorAt (String text, int index, String[] operators) {
		for (String operator : operators) {
			if (text.startsWith (operator, index))
				return operator;
		}

		return null;
	}

	/**
	 * Finds the parenthesis closing the one at an index, skipping quoted strings
	 *
	 * @param text Text to search
	 * @param open Index of the opening parenthesis
	 * @return Index of the closing parenthesis, or -1 if unbalanced
	 */
	static int closingParenthesis (String text, int open) {
		int depth = 0;
		for (int i = open, j = text.length (); i < j; ++i) {
			char c = text.charAt (i);

			if (c == '"' || c == '\'') {
				i = Lexer.stringEnd (text, i) - 1;
			} else if (c == '(') {
				++depth;
			} else if (c == ')') {
				if (--depth == 0)
					return i;
			}
		}

		return -1;
	}
}
