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
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The single global scope of a run: variable name to current value, plus the
 * set of names declared {@code const}.
 */
public class VariableStore {

	private final Map<String, Value> variables = new HashMap<String, Value>();

	private final Set<String> constants = new HashSet<String>();

	/**
	 * Creates or redefines a variable.
	 *
	 * @param name variable name
	 * @param value new value
	 * @param constant whether the variable is declared {@code const}
	 * @throws ScriptRuntimeException if {@code name} is already a constant
	 */
	public void define(String name, Value value, boolean constant) {
		if (constants.contains(name)) {
			throw new ScriptRuntimeException("Cannot redefine constant '" + name + "'");
		}
		variables.put(name, value);
		if (constant) {
			constants.add(name);
		}
	}

	/**
	 * @param name variable name
	 * @return the current value, or {@code null} if the variable is not defined
	 */
	public Value get(String name) {
		return variables.get(name);
	}

	public boolean contains(String name) {
		return variables.containsKey(name);
	}

	public boolean isConstant(String name) {
		return constants.contains(name);
	}

	/**
	 * @return a read-only view of all variables
	 */
	public Map<String, Value> asMap() {
		return Collections.unmodifiableMap(variables);
	}

	public int size() {
		return variables.size();
	}
}
