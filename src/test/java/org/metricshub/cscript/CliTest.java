package org.metricshub.cscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.cscript.CScriptTestSupport.program;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.cscript.jrt.ScriptRuntimeException;
import org.metricshub.cscript.util.ScriptFileSource;
import org.metricshub.cscript.util.ScriptSettings;

public class CliTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static String runCli(InputStream in, String... args) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		PrintStream printStream = new PrintStream(out, true, StandardCharsets.UTF_8);
		Cli.create(args, in, printStream, printStream);
		return out.toString(StandardCharsets.UTF_8);
	}

	private static String runCli(String... args) throws IOException {
		return runCli(new ByteArrayInputStream(new byte[0]), args);
	}

	@Test
	public void testInlineProgram() throws Exception {
		assertEquals("hello\n", runCli(program("console.type(\"hello\");")));
	}

	@Test
	public void testInputs() throws Exception {
		String output = runCli(
				"-i",
				"Number=41",
				"-i",
				"Name=x=y",
				program(
						"def var n = input from \"Number\";",
						"def var s = input from \"Name\";",
						"console.type(n - 1);",
						"console.type(s);"));
		assertEquals("40\nx=y\n", output);
	}

	@Test
	public void testProgramFromFile() throws Exception {
		File script = folder.newFile("prog.cscript");
		Files.write(script.toPath(), Arrays.asList(program("console.type(2 ** 8);").split("\n")), StandardCharsets.UTF_8);
		assertEquals("256\n", runCli("-f", script.getAbsolutePath()));
	}

	@Test
	public void testProgramFromStdin() throws Exception {
		InputStream in = new ByteArrayInputStream(program("console.type(\"stdin\");").getBytes(StandardCharsets.UTF_8));
		assertEquals("stdin\n", runCli(in, "-f", "-"));
	}

	@Test
	public void testDumpLines() throws Exception {
		String output = runCli("--dump-lines", "When container main(int):\n\n  # comment\n  console.type(1);\nEnd;");
		assertEquals("1: When container main(int):\n2: console.type(1);\n3: End;\n", output);
	}

	@Test
	public void testUsage() throws Exception {
		assertTrue(runCli("-h").startsWith("Usage:"));
		assertTrue(runCli().startsWith("Usage:"));
	}

	@Test
	public void testLimitsAndModes() {
		Cli cli = new Cli();
		cli.parse(new String[] { "--max-steps", "100", "--max-depth", "20", "--legacy", "-f", "x.cscript" });
		ScriptSettings settings = cli.getSettings();
		assertEquals(100, settings.getMaxSteps());
		assertEquals(20, settings.getMaxCallDepth());
		assertTrue(settings.isLegacyControlFlow());
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		assertFalse(cli.isDumpLines());
	}

	@Test
	public void testDefaults() {
		Cli cli = new Cli();
		cli.parse(new String[] { program("console.type(1);") });
		assertEquals(0, cli.getSettings().getMaxSteps());
		assertEquals(ScriptSettings.DEFAULT_MAX_CALL_DEPTH, cli.getSettings().getMaxCallDepth());
		assertFalse(cli.getSettings().isLegacyControlFlow());
		assertTrue(cli.getSettings().getInputs().isEmpty());
	}

	@Test
	public void testUsageOnlyHasNoSource() {
		Cli cli = new Cli();
		cli.parse(new String[] { "-h" });
		assertNull(cli.getScriptSource());
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--unknown" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-i" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-i", "novalue", "x" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--max-steps", "-1", "x" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--max-depth", "ten", "x" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "--legacy" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "a", "b" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-h", "x" }));
	}

	@Test
	public void testProgramFailure() {
		ScriptRuntimeException e = assertThrows(
				ScriptRuntimeException.class,
				() -> runCli("--max-steps", "5", program("while 1:", "console.type(1);", "End;")));
		assertEquals("Step limit of 5 exceeded", e.getMessage());
	}
}
