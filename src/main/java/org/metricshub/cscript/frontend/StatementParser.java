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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a single preprocessed line into a {@link Statement}. The line is
 * first classified by {@link StatementKind#classify(String)}, then checked
 * against the exact shape of that kind, and its expression or condition
 * fragments are handed to the {@link ExpressionParser}.
 */
public final class StatementParser {

	private static final Pattern PROCEDURE_DEFINITION_PATTERN = Pattern.compile("def procedure\\s+(\\w+)\\s*(?:\\(\\s*\\))?\\s*:");
	private static final Pattern PROCEDURE_CALL_PATTERN = Pattern.compile("call\\s+(\\w+)\\s*(?:\\(\\s*\\))?\\s*;?");
	private static final Pattern VARIABLE_DEFINITION_PATTERN = Pattern.compile("def (var|const) (\\w+) = (.+);");
	private static final Pattern INPUT_PATTERN = Pattern.compile("input from \"(.*)\"");
	private static final Pattern CONSOLE_OUTPUT_PATTERN = Pattern.compile("console\\.type\\((.*)\\);");
	private static final Pattern LIST_CREATE_PATTERN = Pattern.compile("create list\\(\"([^\"]*)\"\\);");
	private static final Pattern LIST_APPEND_PATTERN = Pattern.compile("append\\(\"([^\"]*)\",\\s*(.*)\\);");
	private static final Pattern LIST_REMOVE_PATTERN = Pattern.compile("remove\\(\"([^\"]*)\",\\s*(.*)\\);");
	private static final Pattern LIST_LENGTH_PATTERN = Pattern.compile("List (\\w+) length\\(\\);");
	private static final Pattern LIST_FILTER_PATTERN = Pattern.compile("filter\\(\"([^\"]*)\",\\s*(.*)\\);");

	private StatementParser() {}

	/**
	 * Parses the specified line.
	 *
	 * @param line a preprocessed line, other than <code>End;</code>
	 * @return the parsed statement
	 * @throws ParserException if the line has no known shape or one of its
	 *         fragments is invalid
	 */
	public static Statement parse(String line) {
		StatementKind kind = StatementKind.classify(line);
		if (kind == null) {
			throw new ParserException("Unknown statement: " + line);
		}
		Matcher m;
		switch (kind) {
		case PROCEDURE_DEFINITION:
			if (!line.endsWith(":")) {
				throw new ParserException("Procedure definition must end with ':'");
			}
			m = match(PROCEDURE_DEFINITION_PATTERN, line, "Invalid procedure definition");
			return Statement.named(kind, line, m.group(1));
		case PROCEDURE_CALL:
			m = match(PROCEDURE_CALL_PATTERN, line, "Invalid procedure call");
			return Statement.named(kind, line, m.group(1));
		case VARIABLE_DEFINITION:
			return parseDefinition(line);
		case CONSOLE_OUTPUT:
			m = match(CONSOLE_OUTPUT_PATTERN, line, "Invalid console.type");
			return Statement.withExpression(kind, line, null, ExpressionParser.expression(m.group(1)));
		case IF:
			return Statement.withCondition(kind, line, null, ExpressionParser.condition(blockCondition(line, "if ")));
		case ELSE:
			return Statement.simple(kind, line);
		case WHILE:
			return Statement.withCondition(kind, line, null, ExpressionParser.condition(blockCondition(line, "while ")));
		case LIST_CREATE:
			m = match(LIST_CREATE_PATTERN, line, "Invalid list creation");
			return Statement.named(kind, line, m.group(1));
		case LIST_APPEND:
			m = match(LIST_APPEND_PATTERN, line, "Invalid append");
			return Statement.withExpression(kind, line, m.group(1), ExpressionParser.expression(m.group(2)));
		case LIST_REMOVE:
			m = match(LIST_REMOVE_PATTERN, line, "Invalid remove");
			return Statement.withExpression(kind, line, m.group(1), ExpressionParser.expression(m.group(2)));
		case LIST_LENGTH:
			m = match(LIST_LENGTH_PATTERN, line, "Invalid list length");
			return Statement.named(kind, line, m.group(1));
		case LIST_FILTER:
			m = match(LIST_FILTER_PATTERN, line, "Invalid filter");
			return Statement.withCondition(kind, line, m.group(1), ExpressionParser.condition(m.group(2)));
		default:
			// break, skip, return
			return Statement.simple(kind, line);
		}
	}

	private static Statement parseDefinition(String line) {
		Matcher m = match(VARIABLE_DEFINITION_PATTERN, line, "Invalid variable definition");
		boolean constant = "const".equals(m.group(1));
		String name = m.group(2);
		String fragment = m.group(3).trim();
		if (fragment.startsWith("input from")) {
			Matcher input = match(INPUT_PATTERN, fragment, "Invalid input syntax");
			return Statement.inputDefinition(line, name, constant, input.group(1));
		}
		return Statement.definition(line, name, constant, ExpressionParser.expression(fragment));
	}

	private static String blockCondition(String line, String keyword) {
		if (!line.endsWith(":")) {
			throw new ParserException("Block header must end with ':': " + line);
		}
		return line.substring(keyword.length(), line.length() - 1).trim();
	}

	private static Matcher match(Pattern pattern, String text, String errorMessage) {
		Matcher m = pattern.matcher(text);
		if (!m.matches()) {
			throw new ParserException(errorMessage);
		}
		return m;
	}
}
