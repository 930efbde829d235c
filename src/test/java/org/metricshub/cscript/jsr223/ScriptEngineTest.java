package org.metricshub.cscript.jsr223;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import javax.script.Bindings;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptEngineManager;
import javax.script.ScriptException;
import org.junit.Test;
import org.metricshub.cscript.jrt.ScriptRuntimeException;

public class ScriptEngineTest {

	@Test
	public void testCScriptScriptEngine() throws Exception {
		ScriptEngineManager manager = new ScriptEngineManager();
		ScriptEngine engine = manager.getEngineByName("cscript");
		assertNotNull("CScript ScriptEngine not found", engine);

		String script = "When container main(int):\n"
				+ "def var name = input from \"name\";\n"
				+ "console.type(\"Hello \" + name);\n"
				+ "End;\n";

		Bindings bindings = engine.createBindings();
		bindings.put(CScriptEngine.INPUTS_ATTRIBUTE, Collections.singletonMap("name", "World"));

		StringWriter result = new StringWriter();
		engine.getContext().setWriter(new PrintWriter(result));

		Object returned = engine.eval(script, bindings);

		assertEquals("Hello World\n", result.toString());
		assertEquals("Hello World\n", returned);
	}

	@Test
	public void testLookupByExtensionAndMimeType() {
		ScriptEngineManager manager = new ScriptEngineManager();
		assertNotNull(manager.getEngineByExtension("cscript"));
		assertNotNull(manager.getEngineByMimeType("application/x-cscript"));
	}

	@Test
	public void testFailureBecomesScriptException() {
		ScriptEngine engine = new CScriptEngineFactory().getScriptEngine();
		engine.getContext().setWriter(new StringWriter());
		ScriptException e = assertThrows(
				ScriptException.class,
				() -> engine.eval("When container main(int):\nconsole.type(1);\ncall missing;\nEnd;\n"));
		assertEquals(3, e.getLineNumber());
		assertTrue(e.getCause() instanceof ScriptRuntimeException);
		assertEquals("Procedure 'missing' not defined", e.getCause().getMessage());
	}

	@Test
	public void testFactoryProgram() throws Exception {
		ScriptEngineFactory factory = new CScriptEngineFactory();
		String program = factory.getProgram(factory.getOutputStatement("one"), factory.getOutputStatement("two"));
		ScriptEngine engine = factory.getScriptEngine();
		engine.getContext().setWriter(new StringWriter());
		assertEquals("one\ntwo\n", engine.eval(program));
		assertEquals("CScript", factory.getParameter(ScriptEngine.ENGINE));
	}
}
