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

import java.util.Arrays;
import java.util.List;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;

/**
 * ScriptEngineFactory for Jfloop, registered through
 * <code>META-INF/services/javax.script.ScriptEngineFactory</code> under the
 * names <code>jfloop</code> and <code>floop</code> and the
 * <code>.floop</code> extension.
 * <p>
 * A Floop program is a list of procedure declarations followed by at most one
 * call; its "statements" as seen by {@link #getProgram(String...)} are those
 * declarations and the call, one per line. Floop has no objects, so
 * {@link #getMethodCallSyntax(String, String, String...)} produces a plain
 * procedure call, and no output statement, so
 * {@link #getOutputStatement(String)} is unsupported: the result of a program
 * is the value of its trailing call.
 */
public class FloopScriptEngineFactory implements ScriptEngineFactory {

	@Override
	public String getEngineName() {
		return "Jfloop";
	}

	@Override
	public String getEngineVersion() {
		return "1.0.0-SNAPSHOT";
	}

	@Override
	public List<String> getExtensions() {
		return Arrays.asList("floop");
	}

	@Override
	public List<String> getMimeTypes() {
		return Arrays.asList("application/x-floop");
	}

	@Override
	public List<String> getNames() {
		return Arrays.asList("jfloop", "floop");
	}

	@Override
	public String getLanguageName() {
		return "floop";
	}

	@Override
	public String getLanguageVersion() {
		return "1";
	}

	@Override
	public Object getParameter(String key) {
		if (ScriptEngine.NAME.equals(key) || ScriptEngine.ENGINE.equals(key)) {
			return getEngineName();
		}
		if (ScriptEngine.ENGINE_VERSION.equals(key)) {
			return getEngineVersion();
		}
		if (ScriptEngine.LANGUAGE.equals(key)) {
			return getLanguageName();
		}
		if (ScriptEngine.LANGUAGE_VERSION.equals(key)) {
			return getLanguageVersion();
		}
		return null;
	}

	/**
	 * Floop has no objects: the call syntax is that of a procedure call,
	 * {@code obj} is ignored.
	 */
	@Override
	public String getMethodCallSyntax(String obj, String m, String... args) {
		StringBuilder sb = new StringBuilder();
		sb.append(m).append("(");
		for (int i = 0; i < args.length; i++) {
			if (i > 0) {
				sb.append(", ");
			}
			sb.append(args[i]);
		}
		sb.append(")");
		return sb.toString();
	}

	/**
	 * Floop has no output statement.
	 *
	 * @throws UnsupportedOperationException always
	 */
	@Override
	public String getOutputStatement(String toDisplay) {
		throw new UnsupportedOperationException("Floop has no output statement");
	}

	@Override
	public String getProgram(String... statements) {
		StringBuilder sb = new StringBuilder();
		for (String s : statements) {
			sb.append(s).append('\n');
		}
		return sb.toString();
	}

	@Override
	public ScriptEngine getScriptEngine() {
		return new FloopScriptEngine(this);
	}
}
