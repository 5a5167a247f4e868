package org.metricshub.jfloop.jsr223;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jfloop
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import org.metricshub.jfloop.Floop;
import org.metricshub.jfloop.frontend.FloopSourceException;
import org.metricshub.jfloop.runtime.FloopRuntimeException;
import org.metricshub.jfloop.runtime.Value;
import org.metricshub.jfloop.util.ScriptSource;

/**
 * Simple JSR-223 script engine for Jfloop.
 * <p>
 * {@code eval} returns the {@link Value} of the trailing call, or
 * {@code null} when the program has none. When the context attribute
 * {@value #ECHO_ATTRIBUTE} is {@code true}, the result is also written to
 * the context writer.
 */
public class FloopScriptEngine extends AbstractScriptEngine {

	/** Context attribute that turns on printing of the result. */
	public static final String ECHO_ATTRIBUTE = "echo";

	private final ScriptEngineFactory factory;

	public FloopScriptEngine(ScriptEngineFactory factory) {
		this.factory = factory;
	}

	@Override
	public Object eval(Reader scriptReader, ScriptContext context) throws ScriptException {
		Value result;
		try {
			Floop floop = new Floop();
			result = floop.run(floop.compile(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, scriptReader)));
		} catch (FloopSourceException e) {
			ScriptException se = new ScriptException(e.getDetail(), e.getSourceDescription(), e.getLineNumber(), e.getColumnNumber());
			se.initCause(e);
			throw se;
		} catch (FloopRuntimeException e) {
			ScriptException se = new ScriptException(e.getMessage(), ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, e.getLineNumber());
			se.initCause(e);
			throw se;
		} catch (IOException e) {
			throw new ScriptException(e);
		}

		if (result != null && Boolean.TRUE.equals(context.getAttribute(ECHO_ATTRIBUTE))) {
			Writer writer = context.getWriter();
			if (writer != null) {
				try {
					writer.write("Result: " + result + System.lineSeparator());
					writer.flush();
				} catch (IOException e) {
					throw new ScriptException(e);
				}
			}
		}
		return result;
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
