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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.metricshub.cscript.jrt.ScriptRuntimeException;
import org.metricshub.cscript.util.ScriptFileSource;
import org.metricshub.cscript.util.ScriptSettings;
import org.metricshub.cscript.util.ScriptSource;

/**
 * Command-line interface for CScript.
 */
public final class Cli {

	private static final String JAR_NAME;

	/** Description of a program read from the standard input. */
	static final String DESCRIPTION_STDIN_SCRIPT = "<stdin>";

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "CScript.jar";
		}
		JAR_NAME = myName;
	}

	private final ScriptSettings settings = new ScriptSettings();
	private final InputStream in;
	private final PrintStream out;

	private ScriptSource scriptSource;
	private boolean dumpLines;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams. The error stream is
	 * currently unused but kept for API symmetry with typical Java main methods.
	 *
	 * @param in stream from which the program is read with {@code -f -}
	 * @param out stream where program output is written
	 * @param err stream where error messages could be written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, @SuppressWarnings("unused") PrintStream err) {
		this.in = in;
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link ScriptSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ScriptSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the program source specified on the command line.
	 *
	 * @return the program source, or {@code null} if only usage was requested
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isDumpLines() {
		return dumpLines;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		// Parse the arguments
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the program text follows
				break;
			} else if (arg.equals("-")) {
				// single dash indicates end of options as well
				++argIdx;
				break;
			} else if (arg.equals("-i")) {
				// -i prompt=value : answer an input prompt
				checkParameterHasArgument(args, argIdx);
				addInput(settings, args[++argIdx]);
			} else if (arg.equals("-f")) {
				// -f filename : load the program from a file, or from stdin with "-"
				checkParameterHasArgument(args, argIdx);
				String file = args[++argIdx];
				if ("-".equals(file)) {
					scriptSource = new ScriptSource(
							DESCRIPTION_STDIN_SCRIPT,
							new InputStreamReader(in, StandardCharsets.UTF_8));
				} else {
					scriptSource = new ScriptFileSource(file);
				}
			} else if (arg.equals("--max-steps")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxSteps(parseCount(arg, args[++argIdx]));
			} else if (arg.equals("--max-depth")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaxCallDepth((int) Math.min(Integer.MAX_VALUE, parseCount(arg, args[++argIdx])));
			} else if (arg.equals("--legacy")) {
				// --legacy : historical else/break/skip behavior
				settings.setLegacyControlFlow(true);
			} else if (arg.equals("--dump-lines")) {
				// --dump-lines : print the preprocessed program and exit
				dumpLines = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("CScript program not provided.");
			}
			scriptSource = new ScriptSource(
					ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT,
					new StringReader(args[argIdx++]));
		}

		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static long parseCount(String option, String value) {
		try {
			long count = Long.parseLong(value);
			if (count >= 0) {
				return count;
			}
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException(option + " expects a non-negative integer, got \"" + value + "\"", nfe);
		}
		throw new IllegalArgumentException(option + " expects a non-negative integer, got \"" + value + "\"");
	}

	/**
	 * Parses an input passed via <code>-i</code> and stores it in the provided
	 * settings instance.
	 *
	 * @param settings settings to mutate
	 * @param promptValue string of the form {@code prompt=value}
	 */
	private static void addInput(ScriptSettings settings, String promptValue) {
		int equalsIdx = promptValue.indexOf('=');
		if (equalsIdx <= 0) {
			throw new IllegalArgumentException(
					"promptValue \"" + promptValue + "\" must be of the form \"prompt=value\"");
		}
		settings.putInput(promptValue.substring(0, equalsIdx), promptValue.substring(equalsIdx + 1));
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the program cannot be read
	 * @throws ScriptRuntimeException if the program fails
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		CScript cscript = new CScript();
		if (dumpLines) {
			List<String> lines = cscript.preprocess(scriptSource);
			for (int i = 0; i < lines.size(); i++) {
				out.println((i + 1) + ": " + lines.get(i));
			}
			return;
		}
		cscript.invoke(scriptSource, settings);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f script-filename]" +
								" [-i prompt=value]..." +
								" [--max-steps n]" +
								" [--max-depth n]" +
								" [--legacy]" +
								" [--dump-lines]" +
								" [script]");
		dest.println();
		dest.println(" -f filename = Use contents of filename for the program (- for standard input).");
		dest.println(" -i prompt=value = Answer 'input from \"prompt\"' with value.");
		dest.println(" --max-steps n = Stop with an error after n statements (0 = no limit, the default).");
		dest.println(" --max-depth n = Maximum nesting of procedure calls (0 = no limit, default "
				+ ScriptSettings.DEFAULT_MAX_CALL_DEPTH + ").");
		dest.println(" --legacy = Never run else: blocks; break; and skip; only leave the innermost block.");
		dest.println(" --dump-lines = Print the preprocessed program lines and exit.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream, read by {@code -f -}
	 * @param os output stream for program output
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if the program cannot be read
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ScriptRuntimeException e) {
			if (e.getLineNumber() >= 0) {
				System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
