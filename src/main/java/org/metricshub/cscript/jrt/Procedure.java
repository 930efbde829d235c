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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A user-defined procedure: a name and the raw lines of its body, captured
 * verbatim and evaluated only when the procedure is called.
 */
public final class Procedure {

	private final String name;
	private final List<String> body;
	private final int definitionLine;

	/**
	 * @param name procedure name
	 * @param body raw body lines, without the header and the closing {@code End;}
	 * @param definitionLine 1-based index of the header line
	 */
	public Procedure(String name, List<String> body, int definitionLine) {
		this.name = name;
		this.body = Collections.unmodifiableList(new ArrayList<String>(body));
		this.definitionLine = definitionLine;
	}

	public String getName() {
		return name;
	}

	public List<String> getBody() {
		return body;
	}

	public int getDefinitionLine() {
		return definitionLine;
	}

	@Override
	public String toString() {
		return name + body;
	}
}
