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

import org.metricshub.cscript.jrt.ScriptRuntimeException;

/**
 * Raised when a line or an expression fragment does not have a valid shape.
 */
public class ParserException extends ScriptRuntimeException {

	private static final long serialVersionUID = 1L;

	public ParserException(String msg) {
		super(msg);
	}

	public ParserException(int lineno, String msg) {
		super(lineno, msg);
	}

	@Override
	public ScriptRuntimeException atLine(int lineno) {
		if (getLineNumber() >= 0) {
			return this;
		}
		ParserException located = new ParserException(lineno, getMessage());
		located.setStackTrace(getStackTrace());
		return located;
	}
}
