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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Procedures defined so far in a run, by name. Defining a procedure again
 * replaces its body.
 */
public class ProcedureRegistry {

	private final Map<String, Procedure> procedures = new LinkedHashMap<String, Procedure>();

	public void define(Procedure procedure) {
		procedures.put(procedure.getName(), procedure);
	}

	public boolean contains(String name) {
		return procedures.containsKey(name);
	}

	/**
	 * @param name procedure name
	 * @return the procedure
	 * @throws ScriptRuntimeException if no procedure of that name was defined
	 */
	public Procedure lookup(String name) {
		Procedure procedure = procedures.get(name);
		if (procedure == null) {
			throw new ScriptRuntimeException("Procedure '" + name + "' not defined");
		}
		return procedure;
	}

	public Map<String, Procedure> asMap() {
		return Collections.unmodifiableMap(procedures);
	}
}
