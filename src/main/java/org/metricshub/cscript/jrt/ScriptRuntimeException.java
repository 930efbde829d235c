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

/**
 * The single fault kind raised while preprocessing, parsing or executing a
 * CScript program. The first such exception aborts the run.
 * <p>
 * When the fault can be attributed to a preprocessed line, its 1-based index
 * is available through {@link #getLineNumber()}.
 */
public class ScriptRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for ScriptRuntimeException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public ScriptRuntimeException(String msg) {
		super(msg);
		this.lineNumber = -1;
	}

	public ScriptRuntimeException(String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = -1;
	}

	/**
	 * <p>
	 * Constructor for ScriptRuntimeException.
	 * </p>
	 *
	 * @param lineno a int
	 * @param msg a {@link java.lang.String} object
	 */
	public ScriptRuntimeException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	public ScriptRuntimeException(int lineno, String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = lineno;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Returns a copy of this exception attributed to the specified line, unless
	 * a line is already known.
	 *
	 * @param lineno 1-based index of the preprocessed line
	 * @return this exception if it already carries a line, a new one otherwise
	 */
	public ScriptRuntimeException atLine(int lineno) {
		if (lineNumber >= 0) {
			return this;
		}
		ScriptRuntimeException located = new ScriptRuntimeException(lineno, getMessage(), getCause());
		located.setStackTrace(getStackTrace());
		return located;
	}
}
