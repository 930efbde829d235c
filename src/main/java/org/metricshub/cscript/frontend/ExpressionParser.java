package org.metricshub.cscript.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.cscript.jrt.BuiltinFunction;
import org.metricshub.cscript.jrt.ScriptRuntimeException;
import org.metricshub.cscript.jrt.Value;

/**
 * Tokenizes and parses one expression or condition fragment into an
 * {@link AstNode} tree.
 * <p>
 * The operator binding of the language is unusual and is reproduced as is.
 * From the loosest to the tightest:
 * <ol>
 * <li>{@code +} string concatenation of every operand
 * <li>{@code **}
 * <li>{@code *}
 * <li>{@code /}
 * <li>{@code -}
 * </ol>
 * Each arithmetic operator associates to the right, so {@code 8 - 4 - 2}
 * evaluates to {@code 6} and {@code a - b * c} to {@code (a - b) * c}.
 * There are no grouping parentheses and no negative literals.
 * <p>
 * A condition is an expression, optionally compared to another expression
 * with exactly one of {@code == != >= <= > <}, and optionally negated by a
 * leading {@code not}.
 */
public class ExpressionParser {

	/** Lexer token values. */
	enum Token {
		EOF,
		INTEGER,
		DOUBLE,
		STRING,
		ID,
		PLACEHOLDER,
		KW_NOT,

		PLUS,
		MINUS,
		MULT,
		DIVIDE,
		POW,

		EQ,
		NE,
		GE,
		LE,
		GT,
		LT,

		OPEN_PAREN,
		CLOSE_PAREN
	}

	private final String source;
	private int position;
	private Token token;
	private final StringBuilder text = new StringBuilder();

	/**
	 * <p>
	 * Constructor for ExpressionParser.
	 * </p>
	 *
	 * @param source the fragment to parse, surrounding whitespace is ignored
	 */
	public ExpressionParser(String source) {
		this.source = source == null ? "" : source.trim();
	}

	/**
	 * Parses an expression fragment.
	 *
	 * @param fragment the fragment to parse
	 * @return the expression tree
	 * @throws ParserException if the fragment is not a valid expression
	 */
	public static AstNode expression(String fragment) {
		return new ExpressionParser(fragment).parseExpression();
	}

	/**
	 * Parses a condition fragment.
	 *
	 * @param fragment the fragment to parse
	 * @return the condition tree
	 * @throws ParserException if the fragment is not a valid condition
	 */
	public static AstNode condition(String fragment) {
		return new ExpressionParser(fragment).parseCondition();
	}

	/**
	 * Parses the whole source as an expression.
	 *
	 * @return the expression tree
	 * @throws ParserException if the source is not a valid expression
	 */
	public AstNode parseExpression() {
		position = 0;
		lexer();
		AST expression = EXPRESSION();
		expectEnd();
		return expression;
	}

	/**
	 * Parses the whole source as a condition.
	 *
	 * @return the condition tree
	 * @throws ParserException if the source is not a valid condition
	 */
	public AstNode parseCondition() {
		position = 0;
		lexer();
		AST condition = CONDITION();
		expectEnd();
		return condition;
	}

	private void expectEnd() {
		if (token != Token.EOF) {
			throw parserException("unexpected " + describeToken());
		}
	}

	private ParserException parserException(String detail) {
		return new ParserException("Invalid expression: " + source + " (" + detail + ")");
	}

	private String describeToken() {
		return token == Token.EOF ? "end of expression" : "'" + text + "'";
	}

	// lexer

	private int peek() {
		return position < source.length() ? source.charAt(position) : -1;
	}

	private int peek(int offset) {
		int index = position + offset;
		return index < source.length() ? source.charAt(index) : -1;
	}

	private void read() {
		text.append(source.charAt(position++));
	}

	private static boolean isDigit(int c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(int c) {
		return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isIdentifierPart(int c) {
		return isIdentifierStart(c) || isDigit(c);
	}

	private Token lexer() {
		while (peek() == ' ' || peek() == '\t') {
			position++;
		}
		text.setLength(0);
		int c = peek();
		if (c < 0) {
			return token = Token.EOF;
		}
		if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
			while (isDigit(peek())) {
				read();
			}
			if (peek() == '.') {
				read();
				while (isDigit(peek())) {
					read();
				}
				return token = Token.DOUBLE;
			}
			return token = Token.INTEGER;
		}
		if (isIdentifierStart(c)) {
			while (isIdentifierPart(peek())) {
				read();
			}
			return token = "not".equals(text.toString()) ? Token.KW_NOT : Token.ID;
		}
		if (c == '"') {
			position++;
			while (peek() >= 0 && peek() != '"') {
				read();
			}
			if (peek() < 0) {
				throw parserException("unterminated string");
			}
			position++;
			return token = Token.STRING;
		}
		read();
		switch (c) {
		case '$':
			if (peek() == '$') {
				read();
				return token = Token.PLACEHOLDER;
			}
			break;
		case '+':
			return token = Token.PLUS;
		case '-':
			return token = Token.MINUS;
		case '*':
			if (peek() == '*') {
				read();
				return token = Token.POW;
			}
			return token = Token.MULT;
		case '/':
			return token = Token.DIVIDE;
		case '(':
			return token = Token.OPEN_PAREN;
		case ')':
			return token = Token.CLOSE_PAREN;
		case '=':
			if (peek() == '=') {
				read();
				return token = Token.EQ;
			}
			break;
		case '!':
			if (peek() == '=') {
				read();
				return token = Token.NE;
			}
			break;
		case '>':
			if (peek() == '=') {
				read();
				return token = Token.GE;
			}
			return token = Token.GT;
		case '<':
			if (peek() == '=') {
				read();
				return token = Token.LE;
			}
			return token = Token.LT;
		default:
			break;
		}
		throw parserException("invalid character '" + (char) c + "'");
	}

	// parser

	private static boolean isComparison(Token t) {
		return t == Token.EQ || t == Token.NE || t == Token.GE || t == Token.LE || t == Token.GT || t == Token.LT;
	}

	// CONDITION = not CONDITION | EXPRESSION [ COMPARISON_OPERATOR EXPRESSION ]
	AST CONDITION() {
		if (token == Token.KW_NOT) {
			lexer();
			return new NotAst(CONDITION());
		}
		AST left = EXPRESSION();
		if (isComparison(token)) {
			Token op = token;
			String opText = text.toString();
			lexer();
			AST right = EXPRESSION();
			return new ComparisonAst(op, opText, left, right);
		}
		return left;
	}

	// EXPRESSION = CONCATENATION
	// CONCATENATION = POWER_EXPRESSION { + POWER_EXPRESSION }
	AST EXPRESSION() {
		AST first = POWER_EXPRESSION();
		if (token != Token.PLUS) {
			return first;
		}
		List<AST> parts = new ArrayList<AST>();
		parts.add(first);
		while (token == Token.PLUS) {
			lexer();
			parts.add(POWER_EXPRESSION());
		}
		return new ConcatenationAst(parts);
	}

	// POWER_EXPRESSION = PRODUCT_EXPRESSION [ ** POWER_EXPRESSION ]
	AST POWER_EXPRESSION() {
		AST left = PRODUCT_EXPRESSION();
		if (token == Token.POW) {
			lexer();
			return new BinaryExpressionAst(Token.POW, left, POWER_EXPRESSION());
		}
		return left;
	}

	// PRODUCT_EXPRESSION = QUOTIENT_EXPRESSION [ * PRODUCT_EXPRESSION ]
	AST PRODUCT_EXPRESSION() {
		AST left = QUOTIENT_EXPRESSION();
		if (token == Token.MULT) {
			lexer();
			return new BinaryExpressionAst(Token.MULT, left, PRODUCT_EXPRESSION());
		}
		return left;
	}

	// QUOTIENT_EXPRESSION = DIFFERENCE_EXPRESSION [ / QUOTIENT_EXPRESSION ]
	AST QUOTIENT_EXPRESSION() {
		AST left = DIFFERENCE_EXPRESSION();
		if (token == Token.DIVIDE) {
			lexer();
			return new BinaryExpressionAst(Token.DIVIDE, left, QUOTIENT_EXPRESSION());
		}
		return left;
	}

	// DIFFERENCE_EXPRESSION = PRIMARY [ - DIFFERENCE_EXPRESSION ]
	AST DIFFERENCE_EXPRESSION() {
		AST left = PRIMARY();
		if (token == Token.MINUS) {
			lexer();
			return new BinaryExpressionAst(Token.MINUS, left, DIFFERENCE_EXPRESSION());
		}
		return left;
	}

	// PRIMARY = INTEGER | DOUBLE | STRING | $$ | FUNCTION_NAME ( EXPRESSION ) | ID
	AST PRIMARY() {
		AST primary;
		switch (token) {
		case INTEGER:
			try {
				primary = new LiteralAst(Value.of(Long.parseLong(text.toString())));
			} catch (NumberFormatException nfe) {
				throw parserException("integer literal out of range");
			}
			break;
		case DOUBLE:
			primary = new LiteralAst(Value.of(Double.parseDouble(text.toString())));
			break;
		case STRING:
			primary = new LiteralAst(Value.of(text.toString()));
			break;
		case PLACEHOLDER:
			primary = new PlaceholderAst();
			break;
		case ID: {
			String name = text.toString();
			if (peekNonBlank() == '(') {
				BuiltinFunction function = BuiltinFunction.forName(name);
				if (function == null) {
					throw parserException("unknown function " + name);
				}
				// skip the name and the opening parenthesis
				lexer();
				lexer();
				AST argument = EXPRESSION();
				if (token != Token.CLOSE_PAREN) {
					throw parserException("expecting ')' but got " + describeToken());
				}
				primary = new FunctionCallAst(function, argument);
			} else {
				primary = new VariableAst(name);
			}
			break;
		}
		default:
			throw parserException("unexpected " + describeToken());
		}
		lexer();
		return primary;
	}

	private int peekNonBlank() {
		int index = position;
		while (index < source.length() && (source.charAt(index) == ' ' || source.charAt(index) == '\t')) {
			index++;
		}
		return index < source.length() ? source.charAt(index) : -1;
	}

	// AST class defs

	private abstract static class AST extends AstNode {}

	private static final class LiteralAst extends AST {

		private final Value value;

		private LiteralAst(Value value) {
			this.value = value;
		}

		@Override
		public Value evaluate(EvaluationContext context) {
			return value;
		}

		@Override
		public String toString() {
			return value.getType() == Value.Type.STRING ? "\"" + value + "\"" : value.toString();
		}
	}

	private static final class VariableAst extends AST {

		private final String name;

		private VariableAst(String name) {
			this.name = name;
		}

		@Override
		public Value evaluate(EvaluationContext context) {
			Value value = context.getVariable(name);
			if (value == null) {
				throw new ScriptRuntimeException("Undefined variable '" + name + "'");
			}
			return value;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	private static final class PlaceholderAst extends AST {

		@Override
		public Value evaluate(EvaluationContext context) {
			Value element = context.getPlaceholder();
			if (element == null) {
				throw new ScriptRuntimeException("Placeholder $$ can only be used in a filter condition");
			}
			return element;
		}

		@Override
		public String toString() {
			return "$$";
		}
	}

	private static final class FunctionCallAst extends AST {

		private final BuiltinFunction function;
		private final AST argument;

		private FunctionCallAst(BuiltinFunction function, AST argument) {
			this.function = function;
			this.argument = argument;
		}

		@Override
		public Value evaluate(EvaluationContext context) {
			return function.apply(argument.evaluate(context));
		}

		@Override
		public String toString() {
			return function.getFunctionName() + "(" + argument + ")";
		}
	}

	private static final class ConcatenationAst extends AST {

		private final List<AST> parts;

		private ConcatenationAst(List<AST> parts) {
			this.parts = Collections.unmodifiableList(parts);
		}

		@Override
		public Value evaluate(EvaluationContext context) {
			StringBuilder sb = new StringBuilder();
			for (AST part : parts) {
				sb.append(part.evaluate(context).toString());
			}
			return Value.of(sb.toString());
		}

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder("(+");
			for (AST part : parts) {
				sb.append(' ').append(part);
			}
			return sb.append(')').toString();
		}
	}

	private static final class BinaryExpressionAst extends AST {

		private final Token op;
		private final AST left;
		private final AST right;

		private BinaryExpressionAst(Token op, AST left, AST right) {
			this.op = op;
			this.left = left;
			this.right = right;
		}

		@Override
		public Value evaluate(EvaluationContext context) {
			Value a = left.evaluate(context);
			Value b = right.evaluate(context);
			switch (op) {
			case MINUS:
				return a.subtract(b);
			case MULT:
				return a.multiply(b);
			case DIVIDE:
				return a.divide(b);
			case POW:
				return a.power(b);
			default:
				throw new IllegalStateException("Not an arithmetic operator: " + op);
			}
		}

		@Override
		public String toString() {
			String symbol;
			switch (op) {
			case MINUS:
				symbol = "-";
				break;
			case MULT:
				symbol = "*";
				break;
			case DIVIDE:
				symbol = "/";
				break;
			default:
				symbol = "**";
				break;
			}
			return "(" + symbol + " " + left + " " + right + ")";
		}
	}

	private static final class ComparisonAst extends AST {

		private final Token op;
		private final String opText;
		private final AST left;
		private final AST right;

		private ComparisonAst(Token op, String opText, AST left, AST right) {
			this.op = op;
			this.opText = opText;
			this.left = left;
			this.right = right;
		}

		@Override
		public Value evaluate(EvaluationContext context) {
			Value a = left.evaluate(context);
			Value b = right.evaluate(context);
			switch (op) {
			case EQ:
				return Value.of(a.equals(b));
			case NE:
				return Value.of(!a.equals(b));
			case GE:
				return Value.of(a.order(b, opText) >= 0);
			case LE:
				return Value.of(a.order(b, opText) <= 0);
			case GT:
				return Value.of(a.order(b, opText) > 0);
			case LT:
				return Value.of(a.order(b, opText) < 0);
			default:
				throw new IllegalStateException("Not a comparison operator: " + op);
			}
		}

		@Override
		public String toString() {
			return "(" + opText + " " + left + " " + right + ")";
		}
	}

	private static final class NotAst extends AST {

		private final AST operand;

		private NotAst(AST operand) {
			this.operand = operand;
		}

		@Override
		public Value evaluate(EvaluationContext context) {
			return Value.of(!operand.isTrue(context));
		}

		@Override
		public String toString() {
			return "(not " + operand + ")";
		}
	}
}
