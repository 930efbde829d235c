package org.metricshub.cscript.jsr223;

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
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.cscript.CScript;
import org.metricshub.cscript.jrt.ScriptRuntimeException;
import org.metricshub.cscript.util.ScriptSettings;
import org.metricshub.cscript.util.ScriptSource;

/**
 * Simple JSR-223 script engine for CScript. The optional {@code inputs}
 * attribute (a {@link Map}) answers <code>input from "prompt"</code>
 * definitions. The printed output is both returned and written to the
 * context writer.
 */
public class CScriptEngine extends AbstractScriptEngine {

	/** Name of the attribute holding the input values, by prompt. */
	public static final String INPUTS_ATTRIBUTE = "inputs";

	private final ScriptEngineFactory factory;

	public CScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		try {
			ScriptSettings settings = new ScriptSettings();
			Object inputs = context.getAttribute(INPUTS_ATTRIBUTE);
			if (inputs instanceof Map) {
				for (Map.Entry<?, ?> entry : ((Map<?, ?>) inputs).entrySet()) {
					settings.putInput(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
				}
			}
			ByteArrayOutputStream result = new ByteArrayOutputStream();
			settings.setOutputStream(new PrintStream(result, false, StandardCharsets.UTF_8));
			CScript cscript = new CScript();
			cscript.invoke(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, scriptReader), settings);
			String out = result.toString(StandardCharsets.UTF_8);
			Writer writer = context.getWriter();
			if (writer != null) {
				writer.write(out);
				writer.flush();
			}
			return out;
		} catch (ScriptRuntimeException e) {
			ScriptException se = new ScriptException(e.getMessage(), ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, e.getLineNumber());
			se.initCause(e);
			throw se;
		} catch (Exception e) {
			throw new ScriptException(e);
		}
	}

	@Override
	public Object eval(String script, ScriptContext context) throws ScriptException {
		return eval(new StringReader(script), context);
	}

	@Override
	public Bindings createBindings() {
		return new SimpleBindings();
	}

	@Override
	public ScriptEngineFactory getFactory() {
		return factory;
	}
}
