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

import org.arcscript.LineScanner.Line;
import org.arcscript.LineScanner.LineType;

/**
 * Executes classified lines: conditionals, assignments, <code>show()</code> and text with interpolation
 * <p>Blocks are walked by structured recursion. {@link #block(int)} runs lines until it meets an
 * <code>elseif</code>, <code>else</code> or <code>endif</code> belonging to its caller and returns that cursor;
 * {@link #conditional(int)} runs one <code>if ... endif</code> group, picking at most one body, and returns
 * the cursor after its <code>endif</code>.</p>
 * <pre>
 * text            emitted, blank line between consecutive text
 * show(a, b)      emitted as "ab " (one space after text before it)
 * if/elseif/else  exactly one body per group, conditions only evaluated while no body has run
 * x op= expr      applied unless assignments are suppressed
 * name(args)      called for its effect, emits nothing, also suppressed; text if no such function
 * </pre>
 *
 * @version 1.0
 * @since 1.0
 */
final class BlockInterpreter {
	private static final String LOG_TAG = BlockInterpreter.class.getSimpleName ();
	private static final boolean DEBUG = false;

	private final Arcscript arcscript;
	private final List<Line> lines;
	private final boolean suppressAssignments;
	private final Output output = new Output ();

	/** Collects emitted segments and decides the separator between them */
	static final class Output {
		private static final String SEPARATOR_TEXT = "\n\n";
		private static final String SEPARATOR_SHOW = " ";

		private final StringBuilder sb = new StringBuilder ();
		private boolean lastShow = false;

		void text (String text) {
			if (sb.length () > 0 && !lastShow)
				sb.append (SEPARATOR_TEXT);

			sb.append (text);
			lastShow = false;
		}

		void show (String text) {
			if (sb.length () > 0 && !lastShow)
				sb.append (SEPARATOR_SHOW);

			sb.append (text);
			lastShow = true;
		}

		@Override
		public String toString () {
			return sb.toString ();
		}
	}

	BlockInterpreter (Arcscript arcscript, List<Line> lines, boolean suppressAssignments) {
		this.arcscript = arcscript;
		this.lines = lines;
		this.suppressAssignments = suppressAssignments;
	}

	/**
	 * Runs every line
	 *
	 * @return The produced text
	 */
	String run () {
		if (DEBUG)
			Arcscript.logV (LOG_TAG, "Interpreting " + lines.size () + " lines" + (suppressAssignments ? " (assignments suppressed)" : ""));

		int cursor = 0;
		while (cursor < lines.size ()) {
			cursor = block (cursor);

			// Only a stray elseif/else/endif stops a top level block early
			if (cursor < lines.size ()) {
				located (lines.get (cursor));
				arcscript.error (ErrorType.MALFORMED_CONTROL_FLOW, "Unexpected " + lines.get (cursor).type ().toString ().toLowerCase () + " without if");
				++cursor;
			}
		}

		if (DEBUG)
			arcscript.debugDumpState ();

		return output.toString ();
	}

	/**
	 * Runs lines from a cursor until the end, or until an elseif/else/endif which ends the block
	 *
	 * @param cursor Index of the first line
	 * @return Index of the line that ended the block, or the line count
	 */
	private int block (int cursor) {
		while (cursor < lines.size ()) {
			Line line = lines.get (cursor);

			switch (line.type ()) {
				case IF:
					cursor = conditional (cursor);
					break;
				case ELSEIF:
				case ELSE:
				case ENDIF:
					return cursor;
				case ASSIGNMENT:
					located (line);
					assign (line);
					++cursor;
					break;
				case SHOW:
					located (line);
					output.show (show (line.argument ()));
					++cursor;
					break;
				case CALL:
					located (line);
					call (line);
					++cursor;
					break;
				case TEXT:
					located (line);
					output.text (interpolate (line.text ().trim ()));
					++cursor;
					break;
				default:
					++cursor;
			}
		}

		return cursor;
	}

	/**
	 * Runs one if/elseif/else/endif group
	 *
	 * @param cursor Index of the if line
	 * @return Index of the line after the matching endif, or the line count if there is none
	 */
	private int conditional (int cursor) {
		boolean taken = false;
		boolean sawElse = false;
		Line opening = lines.get (cursor);

		while (true) {
			Line line = lines.get (cursor);
			boolean live = false;

			if (line.type () == LineType.ELSE) {
				sawElse = true;
				live = !taken;
			} else if (!taken) {
				located (line);
				live = arcscript.evaluateCondition (line.argument ());
			}

			if (DEBUG)
				Arcscript.logV (LOG_TAG, "Line " + line.number () + " " + line.type () + (line.argument () != null ? " " + line.argument () : "") + (live ? " runs" : " skipped"));

			if (live) {
				taken = true;
				cursor = block (cursor + 1);
			} else {
				cursor = skip (cursor + 1);
			}

			if (cursor >= lines.size ()) {
				located (opening);
				arcscript.error (ErrorType.MALFORMED_CONTROL_FLOW, "Missing endif for if on line " + opening.number ());
				return cursor;
			}

			line = lines.get (cursor);
			if (line.type () == LineType.ENDIF)
				return cursor + 1;

			if (sawElse) {
				located (line);
				arcscript.error (ErrorType.MALFORMED_CONTROL_FLOW, "Unexpected " + line.type ().toString ().toLowerCase () + " after else");
			}
		}
	}

	/**
	 * Skips a body without running it, stepping over nested groups
	 *
	 * @param cursor Index of the first line of the body
	 * @return Index of the elseif/else/endif at the same depth, or the line count
	 */
	private int skip (int cursor) {
		int nests = 0;
		for (int j = lines.size (); cursor < j; ++cursor) {
			LineType type = lines.get (cursor).type ();

			if (type == LineType.IF) {
				++nests;
			} else if (type == LineType.ENDIF) {
				if (nests == 0)
					return cursor;

				--nests;
			} else if ((type == LineType.ELSEIF || type == LineType.ELSE) && nests == 0) {
				return cursor;
			}
		}

		return cursor;
	}

	/**
	 * Applies an assignment; the right-hand side is evaluated first and, for compound operators, combined with the
	 * current value. Any failure leaves the variable unchanged.
	 *
	 * @param line The assignment line
	 * @return True if the variable was written
	 */
	private boolean assign (Line line) {
		if (suppressAssignments) {
			if (DEBUG)
				Arcscript.logV (LOG_TAG, "Suppressed assignment: " + line.text ().trim ());

			return false;
		}

		String name = line.target ();
		String operator = line.operator ();

		try {
			Value value = Parser.parse (line.argument ()).evaluate (arcscript);

			if (!operator.equals ("=")) {
				Value current = arcscript.variableRead (name);

				if (operator.equals ("+=")) {
					value = Value.add (current, value, arcscript.decimalFormat ());
				} else if (operator.equals ("-=")) {
					value = Value.subtract (current, value);
				} else if (operator.equals ("*=")) {
					value = Value.multiply (current, value);
				} else {
					value = Value.divide (current, value);
				}
			}

			return arcscript.variableWrite (name, value);
		} catch (EvaluationException e) {
			return arcscript.error (e.type (), e.getMessage () + ", " + name + " left unchanged");
		}
	}

	/**
	 * Runs a function statement for its effect; like assignments it does not run when assignments are suppressed.
	 * A line naming no known function is prose such as <code>Wow(really)</code> and is emitted as text.
	 *
	 * @param line The function statement line
	 */
	private void call (Line line) {
		String statement = line.argument ();
		if (arcscript.functionGet (statement.substring (0, statement.indexOf ('(')).trim ()) == null) {
			output.text (interpolate (line.text ().trim ()));
			return;
		}

		if (suppressAssignments) {
			if (DEBUG)
				Arcscript.logV (LOG_TAG, "Suppressed call: " + line.argument ());

			return;
		}

		arcscript.evaluateExpression (statement);
	}

	/**
	 * Replaces each <code>{expr}</code> with the text of its value, left to right; an unclosed brace stays as text
	 *
	 * @param text Text line
	 * @return Text with markers replaced
	 */
	String interpolate (String text) {
		StringBuilder sb = new StringBuilder ();
		int i = 0, j = text.length ();

		while (i < j) {
			int open = text.indexOf ('{', i);
			if (open < 0)
				break;

			int close = closingBrace (text, open);
			if (close < 0)
				break;

			sb.append (text, i, open);
			sb.append (arcscript.format (arcscript.evaluateExpression (text.substring (open + 1, close))));
			i = close + 1;
		}

		sb.append (text, i, j);
		return sb.toString ();
	}

	private static int closingBrace (String text, int open) {
		for (int i = open + 1, j = text.length (); i < j; ++i) {
			char c = text.charAt (i);

			if (c == '"' || c == '\'') {
				i = Lexer.stringEnd (text, i) - 1;
			} else if (c == '}') {
				return i;
			}
		}

		return -1;
	}

	/**
	 * Evaluates the arguments of a show() call and joins them
	 *
	 * @param argumentList Text between the parentheses
	 * @return The joined results followed by one space
	 */
	String show (String argumentList) {
		StringBuilder sb = new StringBuilder ();

		for (String argument : splitArguments (argumentList)) {
			String literal = literal (argument);
			if (literal != null) {
				sb.append (literal);
			} else if (!argument.isEmpty ()) {
				sb.append (arcscript.format (arcscript.evaluateExpression (argument)));
			}
		}

		return sb.append (' ').toString ();
	}

	/**
	 * Splits on commas outside quotes and parentheses
	 *
	 * @param argumentList Comma separated arguments
	 * @return Trimmed arguments
	 */
	static List<String> splitArguments (String argumentList) {
		List<String> arguments = new ArrayList<String> ();
		int depth = 0, start = 0;

		for (int i = 0, j = argumentList.length (); i < j; ++i) {
			char c = argumentList.charAt (i);

			if (c == '"' || c == '\'') {
				i = Lexer.stringEnd (argumentList, i) - 1;
			} else if (c == '(') {
				++depth;
			} else if (c == ')') {
				--depth;
			} else if (c == ',' && depth == 0) {
				arguments.add (argumentList.substring (start, i).trim ());
				start = i + 1;
			}
		}

		String last = argumentList.substring (start).trim ();
		if (!last.isEmpty () || !arguments.isEmpty ())
			arguments.add (last);

		return arguments;
	}

	/**
	 * @return The content of an argument that is exactly one quoted string, escapes resolved; null otherwise
	 */
	private static String literal (String argument) {
		if (argument.length () < 2)
			return null;

		char quote = argument.charAt (0);
		if ((quote != '"' && quote != '\'') || Lexer.stringEnd (argument, 0) != argument.length () || argument.charAt (argument.length () - 1) != quote)
			return null;

		StringBuilder sb = new StringBuilder ();
		for (int i = 1, j = argument.length () - 1; i < j; ++i) {
			char c = argument.charAt (i);
			if (c == '\\' && i + 1 < j)
				c = Lexer.unescape (argument.charAt (++i));

			sb.append (c);
		}

		return sb.toString ();
	}

	private void located (Line line) {
		arcscript.lineNumberSet (line.number ());
	}
}
