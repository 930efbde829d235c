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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.cscript.backend.Interpreter;
import org.metricshub.cscript.frontend.Preprocessor;
import org.metricshub.cscript.jrt.ScriptRuntimeException;
import org.metricshub.cscript.util.CScriptLogger;
import org.metricshub.cscript.util.ScriptSettings;
import org.metricshub.cscript.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the preprocessing and execution of a CScript program.
 * This entry point is used both when CScript is embedded as a library and
 * when invoked from the command line.
 * <p>
 * The overall process to execute a program is as follows:
 * <ul>
 * <li>Preprocess the program text, dropping blank lines and comments.
 * <li>Check the entry header, then walk the remaining lines, parsing and
 * executing each one when it is reached.
 * </ul>
 * Every invocation runs against fresh variable, list and procedure stores, so
 * nothing is shared between runs.
 *
 * @see org.metricshub.cscript.backend.Interpreter
 */
public class CScript {

	private static final Logger LOGGER = CScriptLogger.getLogger(CScript.class);

	/**
	 * Create a new instance of CScript
	 */
	public CScript() {}

	/**
	 * Creates the interpreter for one run. Subclasses may return a customized
	 * interpreter.
	 *
	 * @param settings run configuration
	 * @return a fresh interpreter
	 */
	protected Interpreter createInterpreter(ScriptSettings settings) {
		return new Interpreter(settings);
	}

	/**
	 * Reads and preprocesses a program.
	 *
	 * @param script program source
	 * @return the executable lines
	 * @throws IOException upon an IO error
	 */
	public List<String> preprocess(ScriptSource script) throws IOException {
		return Preprocessor.preprocess(script.getReader());
	}

	/**
	 * Preprocesses a program text.
	 *
	 * @param script program text
	 * @return the executable lines
	 */
	public List<String> preprocess(String script) {
		return Preprocessor.preprocess(script);
	}

	/**
	 * Runs the specified program text.
	 *
	 * @param script program text
	 * @param settings run configuration (inputs, output stream, limits)
	 * @throws ScriptRuntimeException at the first fault
	 */
	public void invoke(String script, ScriptSettings settings) {
		try {
			invoke(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(script)), settings);
		} catch (IOException e) {
			// StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Reads and runs the specified program.
	 *
	 * @param script program source
	 * @param settings run configuration (inputs, output stream, limits)
	 * @throws IOException upon an IO error while reading the program
	 * @throws ScriptRuntimeException at the first fault
	 */
	public void invoke(ScriptSource script, ScriptSettings settings) throws IOException {
		List<String> lines = preprocess(script);
		LOGGER.debug("Running {} ({} line(s) after preprocessing)", script.getDescription(), lines.size());
		createInterpreter(settings).interpret(lines);
	}

	/**
	 * Runs the specified program and returns what it printed.
	 *
	 * @param script program text
	 * @param inputs values answering <code>input from "prompt"</code>, by
	 *        prompt
	 * @return the printed lines, each followed by a line feed
	 * @throws ScriptRuntimeException at the first fault
	 */
	public String run(String script, Map<String, String> inputs) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ScriptSettings settings = new ScriptSettings();
		settings.setInputs(inputs == null ? Collections.<String, String>emptyMap() : inputs);
		settings.setOutputStream(new PrintStream(out, false, StandardCharsets.UTF_8));
		invoke(script, settings);
		return out.toString(StandardCharsets.UTF_8);
	}

	/**
	 * Runs the specified program for a caller that does not distinguish
	 * success from failure: the result is either everything the program
	 * printed, or the message of the fault that stopped it.
	 *
	 * @param script program text
	 * @param inputs values answering <code>input from "prompt"</code>, by
	 *        prompt
	 * @return the printed text, or the fault message
	 */
	public String execute(String script, Map<String, String> inputs) {
		try {
			return run(script, inputs);
		} catch (ScriptRuntimeException e) {
			LOGGER.debug("Program failed at line {}: {}", e.getLineNumber(), e.getMessage());
			return e.getMessage();
		}
	}
}
