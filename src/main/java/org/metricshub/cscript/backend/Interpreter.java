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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.cscript.frontend.AstNode;
import org.metricshub.cscript.frontend.EvaluationContext;
import org.metricshub.cscript.frontend.Statement;
import org.metricshub.cscript.frontend.StatementKind;
import org.metricshub.cscript.frontend.StatementParser;
import org.metricshub.cscript.jrt.ListStore;
import org.metricshub.cscript.jrt.Procedure;
import org.metricshub.cscript.jrt.ProcedureRegistry;
import org.metricshub.cscript.jrt.ScriptRuntimeException;
import org.metricshub.cscript.jrt.Value;
import org.metricshub.cscript.jrt.VariableStore;
import org.metricshub.cscript.util.CScriptLogger;
import org.metricshub.cscript.util.ScriptSettings;
import org.slf4j.Logger;

/**
 * Executes a preprocessed CScript program.
 * <p>
 * There is no compile phase: each line is parsed when it is first reached
 * (and cached for the rest of the run), then executed against the run's
 * variable, list and procedure stores. Block statements locate their
 * matching <code>End;</code> by counting nesting depth, where every line
 * ending with <code>:</code> opens a level and every <code>End;</code> closes
 * one.
 * <p>
 * One instance executes one program. It is not thread-safe.
 */
public class Interpreter implements EvaluationContext {

	private static final Logger LOGGER = CScriptLogger.getLogger(Interpreter.class);

	private final ScriptSettings settings;
	private final PrintStream output;

	private final VariableStore variables = new VariableStore();
	private final ListStore lists = new ListStore();
	private final ProcedureRegistry procedures = new ProcedureRegistry();

	private final Map<String, Statement> statementCache = new HashMap<String, Statement>();

	private long steps;
	private int callDepth;

	/**
	 * <p>
	 * Constructor for Interpreter.
	 * </p>
	 *
	 * @param settings run configuration: inputs, output and limits
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Interpreter(ScriptSettings settings) {
		this.settings = settings;
		this.output = settings.getOutputStream();
	}

	/**
	 * Executes the specified program.
	 *
	 * @param lines the preprocessed program, starting with the entry header
	 * @throws ScriptRuntimeException at the first fault; output written so far
	 *         is left in place
	 */
	public void interpret(List<String> lines) {
		if (lines.isEmpty() || !Statement.ENTRY_HEADER.equals(lines.get(0))) {
			throw new ScriptRuntimeException(1, "Program must start with " + Statement.ENTRY_HEADER);
		}
		LOGGER.debug("Interpreting {} line(s)", lines.size());
		Frame main = new Frame("main", lines, 1);
		main.pc = 1;
		try {
			runBody(main, main.size());
		} catch (StackOverflowError e) {
			throw new ScriptRuntimeException("Maximum recursion depth exceeded", e);
		} finally {
			output.flush();
		}
		LOGGER.debug("Program completed after {} step(s)", steps);
	}

	/**
	 * Executes the lines of a frame from its current position up to, but not
	 * including, {@code end}. A bare <code>End;</code> (the end of the main
	 * container) stops the execution as well.
	 *
	 * @param frame the frame to run
	 * @param end index to stop at
	 * @return how the body ended
	 */
	private ControlSignal runBody(Frame frame, int end) {
		while (frame.pc < end) {
			String line = frame.line(frame.pc);
			if (Statement.BLOCK_TERMINATOR.equals(line)) {
				return ControlSignal.NORMAL;
			}
			Boolean previousIfOutcome = frame.takeLastIfOutcome();
			ControlSignal signal;
			try {
				signal = execute(frame, line, previousIfOutcome);
			} catch (ScriptRuntimeException e) {
				throw e.atLine(frame.lineNumber(frame.pc));
			}
			if (signal != ControlSignal.NORMAL) {
				return signal;
			}
			frame.pc++;
		}
		return ControlSignal.NORMAL;
	}

	private ControlSignal execute(Frame frame, String line, Boolean previousIfOutcome) {
		step();
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("{}:{} {}", frame.getName(), frame.lineNumber(frame.pc), line);
		}
		Statement statement = parse(line);
		switch (statement.getKind()) {
		case PROCEDURE_DEFINITION:
			defineProcedure(frame, statement);
			return ControlSignal.NORMAL;
		case PROCEDURE_CALL:
			return callProcedure(statement.getName());
		case VARIABLE_DEFINITION:
			defineVariable(statement);
			return ControlSignal.NORMAL;
		case CONSOLE_OUTPUT:
			type(evaluate(statement.getExpression()).toString());
			return ControlSignal.NORMAL;
		case IF:
			return executeIf(frame, statement);
		case ELSE:
			return executeElse(frame, previousIfOutcome);
		case WHILE:
			return executeWhile(frame, statement);
		case LIST_CREATE:
			lists.create(statement.getName());
			LOGGER.debug("Created list '{}'", statement.getName());
			return ControlSignal.NORMAL;
		case LIST_APPEND:
			lists.append(statement.getName(), evaluate(statement.getExpression()));
			return ControlSignal.NORMAL;
		case LIST_REMOVE:
			lists.remove(statement.getName(), evaluate(statement.getExpression()));
			return ControlSignal.NORMAL;
		case LIST_LENGTH:
			type(Integer.toString(lists.length(statement.getName())));
			return ControlSignal.NORMAL;
		case LIST_FILTER:
			filterList(statement);
			return ControlSignal.NORMAL;
		case BREAK:
			return loopSignal(frame, ControlSignal.BREAK, "break;");
		case SKIP:
			return loopSignal(frame, ControlSignal.SKIP, "skip;");
		case RETURN:
			return ControlSignal.NORMAL;
		default:
			throw new IllegalStateException("Unhandled statement kind: " + statement.getKind());
		}
	}

	private Statement parse(String line) {
		Statement statement = statementCache.get(line);
		if (statement == null) {
			statement = StatementParser.parse(line);
			statementCache.put(line, statement);
		}
		return statement;
	}

	private void step() {
		steps++;
		long maxSteps = settings.getMaxSteps();
		if (maxSteps > 0 && steps > maxSteps) {
			throw new ScriptRuntimeException("Step limit of " + maxSteps + " exceeded");
		}
	}

	private Value evaluate(AstNode node) {
		return node.evaluate(this);
	}

	private void type(String text) {
		output.print(text);
		output.print('\n');
	}

	/**
	 * Finds the <code>End;</code> matching the block header at the specified
	 * index.
	 */
	private static int findBlockEnd(Frame frame, int headerIndex) {
		int depth = 1;
		int index = headerIndex;
		while (depth > 0) {
			index++;
			if (index >= frame.size()) {
				throw new ScriptRuntimeException("Missing " + Statement.BLOCK_TERMINATOR + " for block: " + frame.line(headerIndex));
			}
			String line = frame.line(index);
			if (line.endsWith(":")) {
				depth++;
			} else if (Statement.BLOCK_TERMINATOR.equals(line)) {
				depth--;
			}
		}
		return index;
	}

	// procedures

	private void defineProcedure(Frame frame, Statement statement) {
		int header = frame.pc;
		int end = findBlockEnd(frame, header);
		List<String> body = new ArrayList<String>(frame.getLines().subList(header + 1, end));
		for (int i = 0; i < body.size(); i++) {
			if (StatementKind.classify(body.get(i)) == StatementKind.PROCEDURE_DEFINITION) {
				throw new ScriptRuntimeException(
						frame.lineNumber(header + 1 + i),
						"Nested procedure definitions are not supported");
			}
		}
		procedures.define(new Procedure(statement.getName(), body, frame.lineNumber(header)));
		LOGGER.debug("Defined procedure '{}' with {} line(s)", statement.getName(), body.size());
		frame.pc = end;
	}

	private ControlSignal callProcedure(String name) {
		Procedure procedure = procedures.lookup(name);
		int maxCallDepth = settings.getMaxCallDepth();
		if (maxCallDepth > 0 && callDepth >= maxCallDepth) {
			throw new ScriptRuntimeException("Maximum recursion depth exceeded");
		}
		LOGGER.debug("Calling procedure '{}' at depth {}", name, callDepth + 1);
		Frame frame = new Frame(name, procedure.getBody(), procedure.getDefinitionLine() + 1);
		callDepth++;
		try {
			// a legacy block exit at the top of the body simply ends the call
			runBody(frame, frame.size());
		} finally {
			callDepth--;
		}
		return ControlSignal.NORMAL;
	}

	// variables

	private void defineVariable(Statement statement) {
		Value value;
		if (statement.getInputPrompt() != null) {
			String raw = settings.getInputs().get(statement.getInputPrompt());
			value = Value.deduce(raw == null ? "" : raw);
		} else {
			value = evaluate(statement.getExpression());
		}
		variables.define(statement.getName(), value, statement.isConstant());
	}

	// control flow

	private ControlSignal executeIf(Frame frame, Statement statement) {
		int header = frame.pc;
		int end = findBlockEnd(frame, header);
		boolean outcome = statement.getCondition().isTrue(this);
		ControlSignal signal = ControlSignal.NORMAL;
		if (outcome) {
			frame.pc = header + 1;
			signal = runBody(frame, end);
		}
		frame.pc = end;
		frame.setLastIfOutcome(outcome);
		return signal == ControlSignal.EXIT_BLOCK ? ControlSignal.NORMAL : signal;
	}

	private ControlSignal executeElse(Frame frame, Boolean previousIfOutcome) {
		int header = frame.pc;
		int end = findBlockEnd(frame, header);
		ControlSignal signal = ControlSignal.NORMAL;
		if (!settings.isLegacyControlFlow()) {
			if (previousIfOutcome == null) {
				throw new ScriptRuntimeException("else: must directly follow an if block");
			}
			if (!previousIfOutcome.booleanValue()) {
				frame.pc = header + 1;
				signal = runBody(frame, end);
			}
		}
		frame.pc = end;
		// an if closing the else body does not chain to a following else:
		frame.takeLastIfOutcome();
		return signal;
	}

	private ControlSignal executeWhile(Frame frame, Statement statement) {
		int header = frame.pc;
		int end = findBlockEnd(frame, header);
		AstNode condition = statement.getCondition();
		frame.enterLoop(header);
		try {
			while (condition.isTrue(this)) {
				frame.pc = header + 1;
				frame.takeLastIfOutcome();
				ControlSignal signal = runBody(frame, end);
				if (signal == ControlSignal.BREAK) {
					LOGGER.debug("Leaving loop at line {}", frame.lineNumber(header));
					break;
				}
				step();
			}
		} finally {
			frame.exitLoop();
		}
		frame.pc = end;
		frame.takeLastIfOutcome();
		return ControlSignal.NORMAL;
	}

	private ControlSignal loopSignal(Frame frame, ControlSignal signal, String keyword) {
		if (settings.isLegacyControlFlow()) {
			return ControlSignal.EXIT_BLOCK;
		}
		if (!frame.isInLoop()) {
			throw new ScriptRuntimeException(keyword + " used outside of a loop");
		}
		return signal;
	}

	// lists

	private void filterList(Statement statement) {
		final AstNode condition = statement.getCondition();
		lists.filter(statement.getName(), element -> condition.isTrue(new ElementContext(element)));
	}

	/**
	 * Binds the <code>$$</code> placeholder to one list element.
	 */
	private final class ElementContext implements EvaluationContext {

		private final Value element;

		private ElementContext(Value element) {
			this.element = element;
		}

		@Override
		public Value getVariable(String name) {
			return variables.get(name);
		}

		@Override
		public Value getPlaceholder() {
			return element;
		}
	}

	// EvaluationContext

	@Override
	public Value getVariable(String name) {
		return variables.get(name);
	}

	@Override
	public Value getPlaceholder() {
		return null;
	}

	/**
	 * @return the variables of this run
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public VariableStore getVariables() {
		return variables;
	}

	/**
	 * @return the lists of this run
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ListStore getLists() {
		return lists;
	}

	/**
	 * @return the procedures defined in this run
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ProcedureRegistry getProcedures() {
		return procedures;
	}

	/**
	 * @return the number of statements executed so far
	 */
	public long getSteps() {
		return steps;
	}
}
