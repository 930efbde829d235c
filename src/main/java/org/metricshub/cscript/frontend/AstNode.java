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

import org.metricshub.cscript.jrt.Value;

/**
 * A node of a parsed expression or condition. Conditions evaluate to
 * {@link Value#TRUE} or {@link Value#FALSE}.
 */
public abstract class AstNode {

	/**
	 * Evaluates this node.
	 *
	 * @param context variable and placeholder lookups
	 * @return the resulting value
	 * @throws org.metricshub.cscript.jrt.ScriptRuntimeException if evaluation
	 *         fails
	 */
	public abstract Value evaluate(EvaluationContext context);

	/**
	 * Evaluates this node and converts the result to a truth value.
	 *
	 * @param context variable and placeholder lookups
	 * @return {@code true} if the result is a non-zero number or a non-empty
	 *         string
	 */
	public boolean isTrue(EvaluationContext context) {
		return evaluate(context).isTrue();
	}
}
