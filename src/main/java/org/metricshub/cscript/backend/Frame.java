package org.metricshub.cscript.backend;

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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Execution state of one line sequence: the main program or the body of one
 * procedure invocation. Each frame owns its line pointer, so control flow in
 * a procedure body never moves the caller's position.
 */
final class Frame {

	private final String name;
	private final List<String> lines;
	private final int firstLineNumber;

	/** Index of the line being executed. */
	int pc;

	/** Header indices of the <code>while</code> loops currently running in this frame. */
	private final Deque<Integer> loopMarkers = new ArrayDeque<Integer>();

	/** Outcome of the <code>if</code> block that just completed, {@code null} otherwise. */
	private Boolean lastIfOutcome;

	/**
	 * @param name "main" or the procedure name, for diagnostics
	 * @param lines the lines to execute
	 * @param firstLineNumber 1-based program line number of {@code lines.get(0)}
	 */
	Frame(String name, List<String> lines, int firstLineNumber) {
		this.name = name;
		this.lines = lines;
		this.firstLineNumber = firstLineNumber;
	}

	String getName() {
		return name;
	}

	List<String> getLines() {
		return lines;
	}

	int size() {
		return lines.size();
	}

	String line(int index) {
		return lines.get(index);
	}

	/**
	 * @param index index in this frame
	 * @return the 1-based line number in the preprocessed program
	 */
	int lineNumber(int index) {
		return firstLineNumber + index;
	}

	void enterLoop(int headerIndex) {
		loopMarkers.push(headerIndex);
	}

	void exitLoop() {
		loopMarkers.pop();
	}

	boolean isInLoop() {
		return !loopMarkers.isEmpty();
	}

	void setLastIfOutcome(boolean outcome) {
		lastIfOutcome = outcome;
	}

	/**
	 * Returns and clears the outcome of the <code>if</code> block that just
	 * completed.
	 *
	 * @return the outcome, or {@code null} if the previous statement was not an
	 *         <code>if</code> block
	 */
	Boolean takeLastIfOutcome() {
		Boolean outcome = lastIfOutcome;
		lastIfOutcome = null;
		return outcome;
	}
}
