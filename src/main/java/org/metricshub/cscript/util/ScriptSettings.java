package org.metricshub.cscript.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;

/**
 * A simple container for the parameters of a single CScript run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking CScript programmatically, from within Java code.
 */
public class ScriptSettings {

	/** Default ceiling of nested procedure calls. */
	public static final int DEFAULT_MAX_CALL_DEPTH = 1000;

	/**
	 * Values answering <code>input from "prompt"</code> definitions, by
	 * prompt. A prompt with no entry reads as the empty string.
	 */
	private Map<String, String> inputs = new HashMap<String, String>();

	/**
	 * Where <code>console.type</code> writes;
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Maximum number of nested procedure calls;
	 * {@value #DEFAULT_MAX_CALL_DEPTH} by default, 0 means unlimited.
	 */
	private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

	/**
	 * Maximum number of statements executed in one run;
	 * 0 (unlimited) by default.
	 */
	private long maxSteps = 0;

	/**
	 * Whether to reproduce the historical control flow, where
	 * <code>else:</code> blocks never run and both <code>break;</code> and
	 * <code>skip;</code> only leave the innermost block;
	 * <code>false</code> by default.
	 */
	private boolean legacyControlFlow = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("inputs = ").append(getInputs()).append(newLine);
		desc.append("maxCallDepth = ").append(getMaxCallDepth()).append(newLine);
		desc.append("maxSteps = ").append(getMaxSteps()).append(newLine);
		desc.append("legacyControlFlow = ").append(isLegacyControlFlow()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the input values, by prompt
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Map<String, String> getInputs() {
		return inputs;
	}

	/**
	 * @param inputs the input values, by prompt
	 */
	public void setInputs(Map<String, String> inputs) {
		this.inputs = new HashMap<String, String>(inputs);
	}

	/**
	 * Registers the value answering the specified prompt.
	 *
	 * @param prompt the prompt, as written in the program
	 * @param value the raw value
	 */
	public void putInput(String prompt, String value) {
		inputs.put(prompt, value);
	}

	/**
	 * @return the output stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param outputStream the output stream to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}

	public int getMaxCallDepth() {
		return maxCallDepth;
	}

	/**
	 * @param maxCallDepth maximum number of nested procedure calls, 0 for no
	 *        limit
	 */
	public void setMaxCallDepth(int maxCallDepth) {
		if (maxCallDepth < 0) {
			throw new IllegalArgumentException("maxCallDepth must not be negative");
		}
		this.maxCallDepth = maxCallDepth;
	}

	public long getMaxSteps() {
		return maxSteps;
	}

	/**
	 * @param maxSteps maximum number of executed statements, 0 for no limit
	 */
	public void setMaxSteps(long maxSteps) {
		if (maxSteps < 0) {
			throw new IllegalArgumentException("maxSteps must not be negative");
		}
		this.maxSteps = maxSteps;
	}

	public boolean isLegacyControlFlow() {
		return legacyControlFlow;
	}

	public void setLegacyControlFlow(boolean legacyControlFlow) {
		this.legacyControlFlow = legacyControlFlow;
	}
}
