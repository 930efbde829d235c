package org.metricshub.cscript.jrt;

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

/**
 * Unary math functions callable from expressions, e.g. {@code sqrt(x)}.
 */
public enum BuiltinFunction {
	SQRT("sqrt") {
		@Override
		Value compute(Value argument) {
			double d = argument.toDouble();
			if (d < 0) {
				throw new ScriptRuntimeException("math domain error");
			}
			return Value.of(Math.sqrt(d));
		}
	},
	/** Computed as {@code x ** (1/3)}, so a negative argument gives {@code nan}. */
	CBRT("cbrt") {
		@Override
		Value compute(Value argument) {
			return Value.of(Math.pow(argument.toDouble(), 1.0 / 3.0));
		}
	},
	/** Rounds half to even. */
	ROUND("round") {
		@Override
		Value compute(Value argument) {
			if (argument.isInteger()) {
				return argument;
			}
			return toIntegral(Math.rint(argument.toDouble()));
		}
	},
	FLOOR("floor") {
		@Override
		Value compute(Value argument) {
			if (argument.isInteger()) {
				return argument;
			}
			return toIntegral(Math.floor(argument.toDouble()));
		}
	},
	CEILING("ceiling") {
		@Override
		Value compute(Value argument) {
			if (argument.isInteger()) {
				return argument;
			}
			return toIntegral(Math.ceil(argument.toDouble()));
		}
	};

	private static final Map<String, BuiltinFunction> BY_NAME;

	static {
		Map<String, BuiltinFunction> byName = new HashMap<String, BuiltinFunction>();
		for (BuiltinFunction function : values()) {
			byName.put(function.functionName, function);
		}
		BY_NAME = Collections.unmodifiableMap(byName);
	}

	private final String functionName;

	BuiltinFunction(String functionName) {
		this.functionName = functionName;
	}

	/**
	 * @return the name used to call this function in a script
	 */
	public String getFunctionName() {
		return functionName;
	}

	/**
	 * Looks up a function by its script name.
	 *
	 * @param name name as written in the script
	 * @return the function, or {@code null} if there is no such function
	 */
	public static BuiltinFunction forName(String name) {
		return BY_NAME.get(name);
	}

	/**
	 * Applies this function to the specified argument.
	 *
	 * @param argument evaluated argument
	 * @return the result
	 * @throws ScriptRuntimeException if the argument is not a number or is out
	 *         of the function's domain
	 */
	public Value apply(Value argument) {
		if (!argument.isNumeric()) {
			throw new ScriptRuntimeException(
					"Unsupported operand type for " + functionName + "(): " + argument.getType().getDisplayName());
		}
		return compute(argument);
	}

	abstract Value compute(Value argument);

	private static Value toIntegral(double d) {
		if (Double.isNaN(d)) {
			throw new ScriptRuntimeException("cannot convert float nan to integer");
		}
		if (Double.isInfinite(d) || d >= 0x1p63 || d < -0x1p63) {
			throw new ScriptRuntimeException("cannot convert float " + Value.formatFloat(d) + " to integer");
		}
		return Value.of((long) d);
	}
}
