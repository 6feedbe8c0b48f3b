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

import org.arcscript.Lexer.Token;
import org.arcscript.Lexer.TokenType;

/**
 * Recursive descent parser for Arcscript expressions
 * <p>Precedence, lowest first:</p>
 * <pre>
 * or      ||  or
 * and     &amp;&amp;  and
 * equal   ==  !=
 * compare &lt;  &lt;=  &gt;  &gt;=
 * add     +  -
 * mult    *  /  %
 * unary   !  not  -  +
 * primary number | string | true | false | null | name | name(args) | (expr)
 * </pre>
 *
 * @version 1.0
 * @since 1.0
 */
final class Parser {
	private final List<Token> tokens;
	private int index = 0;

	private Parser (List<Token> tokens) {
		this.tokens = tokens;
	}

	/**
	 * Normalises, tokenises and parses an expression
	 *
	 * @param expression Expression text
	 * @return The expression tree
	 * @throws EvaluationException With {@link ErrorType#PARSE_ERROR} on malformed syntax
	 */
	static Expression parse (String expression) {
		if (expression == null || expression.trim ().isEmpty ())
			throw new EvaluationException (ErrorType.PARSE_ERROR, "Empty expression");

		Parser parser = new Parser (Lexer.tokenise (Lexer.normalise (expression.trim ())));
		Expression tree = parser.or ();

		if (parser.peek ().type != TokenType.END)
			throw new EvaluationException (ErrorType.PARSE_ERROR, "Unexpected " + parser.peek () + " at position " + (parser.peek ().position + 1));

		return tree;
	}

	private Token peek () {
		return tokens.get (index);
	}

	private boolean match (TokenType type) {
		if (peek ().type != type)
			return false;

		++index;
		return true;
	}

	private Token expect (TokenType type, String what) {
		Token token = peek ();
		if (token.type != type)
			throw new EvaluationException (ErrorType.PARSE_ERROR, "Expected " + what + " but found " + token);

		++index;
		return token;
	}

	private Expression or () {
		Expression left = and ();
		while (match (TokenType.OR))
			left = new Expression.Logical (false, left, and ());

		return left;
	}

	private Expression and () {
		Expression left = equality ();
		while (match (TokenType.AND))
			left = new Expression.Logical (true, left, equality ());

		return left;
	}

	private Expression equality () {
		Expression left = comparison ();
		while (peek ().type == TokenType.EQ || peek ().type == TokenType.NE) {
			TokenType operator = tokens.get (index++).type;
			left = new Expression.Binary (operator, left, comparison ());
		}

		return left;
	}

	private Expression comparison () {
		Expression left = additive ();
		while (peek ().type == TokenType.LT || peek ().type == TokenType.LE || peek ().type == TokenType.GT || peek ().type == TokenType.GE) {
			TokenType operator = tokens.get (index++).type;
			left = new Expression.Binary (operator, left, additive ());
		}

		return left;
	}

	private Expression additive () {
		Expression left = multiplicative ();
		while (peek ().type == TokenType.PLUS || peek ().type == TokenType.MINUS) {
			TokenType operator = tokens.get (index++).type;
			left = new Expression.Binary (operator, left, multiplicative ());
		}

		return left;
	}

	private Expression multiplicative () {
		Expression left = unary ();
		while (peek ().type == TokenType.STAR || peek ().type == TokenType.SLASH || peek ().type == TokenType.PERCENT) {
			TokenType operator = tokens.get (index++).type;
			left = new Expression.Binary (operator, left, unary ());
		}

		return left;
	}

	private Expression unary () {
		if (peek ().type == TokenType.NOT || peek ().type == TokenType.MINUS || peek ().type == TokenType.PLUS) {
			TokenType operator = tokens.get (index++).type;
			return new Expression.Unary (operator, unary ());
		}

		return primary ();
	}

	private Expression primary () {
		Token token = peek ();

		switch (token.type) {
			case NUMBER:
				++index;
				if (token.text.indexOf ('.') > -1)
					return new Expression.Literal (Value.of (Double.parseDouble (token.text)));

				try {
					return new Expression.Literal (Value.of (Long.parseLong (token.text)));
				} catch (NumberFormatException e) {
					return new Expression.Literal (Value.of (Double.parseDouble (token.text)));
				}
			case STRING:
				++index;
				return new Expression.Literal (Value.of (token.text));
			case TRUE:
				++index;
				return new Expression.Literal (Value.TRUE);
			case FALSE:
				++index;
				return new Expression.Literal (Value.FALSE);
			case NULL:
				++index;
				return new Expression.Literal (Value.NULL);
			case IDENTIFIER:
				++index;
				if (match (TokenType.LPAREN)) {
					List<Expression> arguments = new ArrayList<Expression> ();
					if (!match (TokenType.RPAREN)) {
						do {
							arguments.add (or ());
						} while (match (TokenType.COMMA));

						expect (TokenType.RPAREN, "')' after arguments of " + token.text);
					}

					return new Expression.Call (token.text, arguments);
				}

				return new Expression.Variable (token.text);
			case LPAREN:
				++index;
				Expression inner = or ();
				expect (TokenType.RPAREN, "')'");
				return inner;
			default:
				throw new EvaluationException (ErrorType.PARSE_ERROR, "Unexpected " + token + (token.type == TokenType.END ? "" : " at position " + (token.position + 1)));
		}
	}
}
