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

/**
 * One parsed line: its kind plus the operands that kind needs. Operands a
 * kind does not use are {@code null}.
 * <ul>
 * <li>{@code name}: procedure, variable or list name
 * <li>{@code expression}: value to define, print, append or remove
 * <li>{@code condition}: {@code if}, {@code while} or filter condition
 * <li>{@code inputPrompt}: prompt of an {@code input from} definition
 * </ul>
 */
public final class Statement {

	/** Closes an {@code if}, {@code else}, {@code while} or procedure block, and the main container. */
	public static final String BLOCK_TERMINATOR = "End;";

	/** Required first line of every program. */
	public static final String ENTRY_HEADER = "When container main(int):";

	private final StatementKind kind;
	private final String line;
	private final String name;
	private final boolean constant;
	private final AstNode expression;
	private final AstNode condition;
	private final String inputPrompt;

	private Statement(
			StatementKind kind,
			String line,
			String name,
			boolean constant,
			AstNode expression,
			AstNode condition,
			String inputPrompt) {
		this.kind = kind;
		this.line = line;
		this.name = name;
		this.constant = constant;
		this.expression = expression;
		this.condition = condition;
		this.inputPrompt = inputPrompt;
	}

	static Statement simple(StatementKind kind, String line) {
		return new Statement(kind, line, null, false, null, null, null);
	}

	static Statement named(StatementKind kind, String line, String name) {
		return new Statement(kind, line, name, false, null, null, null);
	}

	static Statement withExpression(StatementKind kind, String line, String name, AstNode expression) {
		return new Statement(kind, line, name, false, expression, null, null);
	}

	static Statement withCondition(StatementKind kind, String line, String name, AstNode condition) {
		return new Statement(kind, line, name, false, null, condition, null);
	}

	static Statement definition(String line, String name, boolean constant, AstNode expression) {
		return new Statement(StatementKind.VARIABLE_DEFINITION, line, name, constant, expression, null, null);
	}

	static Statement inputDefinition(String line, String name, boolean constant, String prompt) {
		return new Statement(StatementKind.VARIABLE_DEFINITION, line, name, constant, null, null, prompt);
	}

	public StatementKind getKind() {
		return kind;
	}

	/**
	 * @return the source line this statement was parsed from
	 */
	public String getLine() {
		return line;
	}

	public String getName() {
		return name;
	}

	public boolean isConstant() {
		return constant;
	}

	public AstNode getExpression() {
		return expression;
	}

	public AstNode getCondition() {
		return condition;
	}

	/**
	 * @return the prompt of an {@code input from} definition, {@code null} for
	 *         any other statement
	 */
	public String getInputPrompt() {
		return inputPrompt;
	}

	@Override
	public String toString() {
		return kind + ": " + line;
	}
}
