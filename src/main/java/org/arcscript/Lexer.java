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
 * Splits an Arcscript expression into tokens
 *
 * @version 1.0
 * @since 1.0
 */
final class Lexer {
	/** Token types the parser understands */
	static enum TokenType {
		NUMBER,
		STRING,
		IDENTIFIER,
		TRUE,
		FALSE,
		NULL,
		LPAREN,
		RPAREN,
		COMMA,
		PLUS,
		MINUS,
		STAR,
		SLASH,
		PERCENT,
		NOT,
		AND,
		OR,
		EQ,
		NE,
		LT,
		LE,
		GT,
		GE,
		END
	}

	/** Holds a token, the lowest unit of an expression */
	static final class Token {
		final TokenType type;
		final String text;
		final int position;

		Token (TokenType type, String text, int position) {
			this.type = type;
			this.text = text;
			this.position = position;
		}

		@Override
		public String toString () {
			return type == TokenType.END ? "end of expression" : "'" + text + "'";
		}
	}

	/** HTML entities rich text editors leave in scripts, &amp;amp; last so it cannot create new entities */
	private static final String[][] htmlEntities = {
		{ "&lt;", "<" },
		{ "&gt;", ">" },
		{ "&quot;", "\"" },
		{ "&apos;", "'" },
		{ "&#39;", "'" },
		{ "&nbsp;", " " },
		{ "&amp;", "&" }
	};

	private final String expression;
	private int position = 0;

	private Lexer (String expression) {
		this.expression = expression;
	}

	/**
	 * Tokenises an expression which has already been through {@link #normalise(String)}
	 *
	 * @param expression The expression text
	 * @return Tokens, always ending with an END token
	 * @throws EvaluationException With {@link ErrorType#PARSE_ERROR} on an unexpected character
	 */
	static List<Token> tokenise (String expression) {
		Lexer lexer = new Lexer (expression);
		List<Token> tokens = new ArrayList<Token> ();
		Token token;

		do {
			token = lexer.next ();
			tokens.add (token);
		} while (token.type != TokenType.END);

		return tokens;
	}

	/**
	 * Decodes HTML entities and rewrites the textual operators <code>is not</code> and <code>is</code> to
	 * <code>!=</code> and <code>==</code>, leaving string literals untouched
	 *
	 * @param expression Raw expression text
	 * @return Text ready for {@link #tokenise(String)}
	 */
	static String normalise (String expression) {
		String decoded = expression;
		for (String[] entity : htmlEntities)
			decoded = decoded.replace (entity[0], entity[1]);

		StringBuilder sb = new StringBuilder ();
		int i = 0, j = decoded.length ();
		while (i < j) {
			char c = decoded.charAt (i);

			if (c == '"' || c == '\'') {
				int end = stringEnd (decoded, i);
				sb.append (decoded, i, end);
				i = end;
			} else if (isIdentifierStart (c) && (i == 0 || !isIdentifierPart (decoded.charAt (i - 1)))) {
				int end = i + 1;
				while (end < j && isIdentifierPart (decoded.charAt (end)))
					++end;

				String word = decoded.substring (i, end);
				if (word.equals ("is")) {
					int next = end;
					while (next < j && Character.isWhitespace (decoded.charAt (next)))
						++next;

					if (decoded.startsWith ("not", next) && (next + 3 == j || !isIdentifierPart (decoded.charAt (next + 3)))) {
						sb.append ("!=");
						end = next + 3;
					} else {
						sb.append ("==");
					}
				} else {
					sb.append (word);
				}

				i = end;
			} else {
				sb.append (c);
				++i;
			}
		}

		return sb.toString ();
	}

	/**
	 * Finds the end of a quoted string, honouring backslash escapes
	 *
	 * @param text Text containing the string
	 * @param start Index of the opening quote
	 * @return Index just past the closing quote, or the text length if unterminated
	 */
	static int stringEnd (String text, int start) {
		char quote = text.charAt (start);
		for (int i = start + 1, j = text.length (); i < j; ++i) {
			char c = text.charAt (i);
			if (c == '\\') {
				++i;
			} else if (c == quote) {
				return i + 1;
			}
		}

		return text.length ();
	}

	static boolean isIdentifierStart (char c) {
		return Character.isLetter (c) || c == '_';
	}

	static boolean isIdentifierPart (char c) {
		return Character.isLetterOrDigit (c) || c == '_';
	}

	private Token next () {
		while (position < expression.length () && Character.isWhitespace (expression.charAt (position)))
			++position;

		int start = position;
		if (position >= expression.length ())
			return new Token (TokenType.END, "", start);

		char c = expression.charAt (position);

		if (isIdentifierStart (c)) {
			while (position < expression.length () && isIdentifierPart (expression.charAt (position)))
				++position;

			String word = expression.substring (start, position);
			if (word.equals ("true"))
				return new Token (TokenType.TRUE, word, start);
			if (word.equals ("false"))
				return new Token (TokenType.FALSE, word, start);
			if (word.equals ("null"))
				return new Token (TokenType.NULL, word, start);
			if (word.equals ("and"))
				return new Token (TokenType.AND, word, start);
			if (word.equals ("or"))
				return new Token (TokenType.OR, word, start);
			if (word.equals ("not"))
				return new Token (TokenType.NOT, word, start);

			return new Token (TokenType.IDENTIFIER, word, start);
		}

		if (Character.isDigit (c) || (c == '.' && position + 1 < expression.length () && Character.isDigit (expression.charAt (position + 1))))
			return number (start);

		if (c == '"' || c == '\'')
			return string (start);

		if (position + 1 < expression.length ()) {
			String pair = expression.substring (position, position + 2);
			TokenType pairType = null;

			if (pair.equals ("==")) {
				pairType = TokenType.EQ;
			} else if (pair.equals ("!=")) {
				pairType = TokenType.NE;
			} else if (pair.equals ("<=")) {
				pairType = TokenType.LE;
			} else if (pair.equals (">=")) {
				pairType = TokenType.GE;
			} else if (pair.equals ("&&")) {
				pairType = TokenType.AND;
			} else if (pair.equals ("||")) {
				pairType = TokenType.OR;
			}

			if (pairType != null) {
				position += 2;
				return new Token (pairType, pair, start);
			}
		}

		++position;
		switch (c) {
			case '(':
				return new Token (TokenType.LPAREN, "(", start);
			case ')':
				return new Token (TokenType.RPAREN, ")", start);
			case ',':
				return new Token (TokenType.COMMA, ",", start);
			case '+':
				return new Token (TokenType.PLUS, "+", start);
			case '-':
				return new Token (TokenType.MINUS, "-", start);
			case '*':
				return new Token (TokenType.STAR, "*", start);
			case '/':
				return new Token (TokenType.SLASH, "/", start);
			case '%':
				return new Token (TokenType.PERCENT, "%", start);
			case '!':
				return new Token (TokenType.NOT, "!", start);
			case '<':
				return new Token (TokenType.LT, "<", start);
			case '>':
				return new Token (TokenType.GT, ">", start);
			default:
				throw new EvaluationException (ErrorType.PARSE_ERROR, "Unexpected character: " + String.valueOf (Character.toChars (expression.codePointAt (start))));
		}
	}

	private Token number (int start) {
		boolean decimal = false;
		while (position < expression.length ()) {
			char c = expression.charAt (position);
			if (c == '.' && !decimal) {
				decimal = true;
			} else if (!Character.isDigit (c)) {
				break;
			}
			++position;
		}

		if (position < expression.length () && isIdentifierStart (expression.charAt (position)))
			throw new EvaluationException (ErrorType.PARSE_ERROR, "Invalid number: " + expression.substring (start, position + 1));

		return new Token (TokenType.NUMBER, expression.substring (start, position), start);
	}

	/**
	 * @param escaped The character after a backslash in a quoted string
	 * @return The character it stands for
	 */
	static char unescape (char escaped) {
		switch (escaped) {
			case 'n':
				return '\n';
			case 't':
				return '\t';
			default:
				return escaped;
		}
	}

	private Token string (int start) {
		char quote = expression.charAt (position++);
		StringBuilder sb = new StringBuilder ();

		while (position < expression.length ()) {
			char c = expression.charAt (position++);
			if (c == quote)
				return new Token (TokenType.STRING, sb.toString (), start);

			if (c == '\\') {
				if (position >= expression.length ())
					break;

				sb.append (unescape (expression.charAt (position++)));
			} else {
				sb.append (c);
			}
		}

		throw new EvaluationException (ErrorType.PARSE_ERROR, "Unterminated string");
	}
}
