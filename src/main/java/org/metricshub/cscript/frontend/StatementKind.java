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

import java.util.function.Predicate;

/**
 * The shapes a line can take, in classification priority order: a line is of
 * the first kind whose test accepts it. The tests look at the line text only,
 * so {@code def procedure p:} is a {@link #PROCEDURE_DEFINITION} even though
 * it also starts with {@code def }.
 */
public enum StatementKind {
	/**
	 * <code>def procedure name:</code> opens a procedure body, collected up to
	 * its <code>End;</code>.
	 */
	PROCEDURE_DEFINITION(line -> line.startsWith("def procedure"), true),
	/** <code>call name;</code> */
	PROCEDURE_CALL(line -> line.startsWith("call "), false),
	/**
	 * <code>def var name = expression;</code>,
	 * <code>def const name = expression;</code> or
	 * <code>def var name = input from "prompt";</code>
	 */
	VARIABLE_DEFINITION(line -> line.startsWith("def "), false),
	/** <code>console.type(expression);</code> */
	CONSOLE_OUTPUT(line -> line.startsWith("console.type"), false),
	/** <code>if condition:</code> */
	IF(line -> line.startsWith("if "), true),
	/** <code>else:</code> */
	ELSE(line -> line.startsWith("else:"), true),
	/** <code>while condition:</code> */
	WHILE(line -> line.startsWith("while "), true),
	/** <code>create list("name");</code> */
	LIST_CREATE(line -> line.startsWith("create list"), false),
	/** <code>append("name", expression);</code> */
	LIST_APPEND(line -> line.startsWith("append"), false),
	/** <code>remove("name", expression);</code> */
	LIST_REMOVE(line -> line.startsWith("remove"), false),
	/** <code>List name length();</code> prints the number of elements. */
	LIST_LENGTH(line -> line.startsWith("List ") && line.contains(" length()"), false),
	/** <code>filter("name", condition);</code> where the condition may use <code>$$</code>. */
	LIST_FILTER(line -> line.startsWith("filter"), false),
	/** <code>break;</code> */
	BREAK(line -> line.equals("break;"), false),
	/** <code>skip;</code> */
	SKIP(line -> line.equals("skip;"), false),
	/** <code>return</code>, accepted and ignored. */
	RETURN(line -> line.startsWith("return"), false);

	private final Predicate<String> test;
	private final boolean blockHeader;

	StatementKind(Predicate<String> test, boolean blockHeader) {
		this.test = test;
		this.blockHeader = blockHeader;
	}

	/**
	 * @return {@code true} if statements of this kind open a block closed by
	 *         <code>End;</code>
	 */
	public boolean isBlockHeader() {
		return blockHeader;
	}

	/**
	 * Classifies a preprocessed line.
	 *
	 * @param line the line
	 * @return the first matching kind, or {@code null} if none matches
	 */
	public static StatementKind classify(String line) {
		for (StatementKind kind : values()) {
			if (kind.test.test(line)) {
				return kind;
			}
		}
		return null;
	}
}
