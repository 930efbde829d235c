package org.metricshub.cscript;

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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.metricshub.cscript.frontend.AstNode;
import org.metricshub.cscript.frontend.EvaluationContext;
import org.metricshub.cscript.frontend.ExpressionParser;
import org.metricshub.cscript.jrt.Value;

/**
 * Utility class to evaluate standalone CScript expressions and conditions.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {}

	/**
	 * Evaluates an expression.
	 *
	 * @param expression the expression, e.g. {@code "x - 1"}
	 * @param variables variables visible to the expression; integral numbers
	 *        become integers, other numbers floats, anything else strings
	 * @return a {@link Long}, {@link Double} or {@link String}
	 */
	public static Object eval(String expression, Map<String, Object> variables) {
		AstNode node = ExpressionParser.expression(expression);
		return toJava(node.evaluate(new MapContext(variables)));
	}

	/**
	 * Evaluates a condition.
	 *
	 * @param condition the condition, e.g. {@code "not x >= 2"}
	 * @param variables variables visible to the condition
	 * @return the truth value of the condition
	 */
	public static boolean test(String condition, Map<String, Object> variables) {
		AstNode node = ExpressionParser.condition(condition);
		return node.isTrue(new MapContext(variables));
	}

	private static Object toJava(Value value) {
		switch (value.getType()) {
		case INTEGER:
			return value.toLong();
		case FLOAT:
			return value.toDouble();
		default:
			return value.toString();
		}
	}

	private static final class MapContext implements EvaluationContext {

		private final Map<String, Value> values;

		private MapContext(Map<String, Object> variables) {
			if (variables == null) {
				values = Collections.emptyMap();
			} else {
				values = new HashMap<String, Value>();
				for (Map.Entry<String, Object> entry : variables.entrySet()) {
					values.put(entry.getKey(), Value.fromObject(entry.getValue()));
				}
			}
		}

		@Override
		public Value getVariable(String name) {
			return values.get(name);
		}

		@Override
		public Value getPlaceholder() {
			return null;
		}
	}
}
