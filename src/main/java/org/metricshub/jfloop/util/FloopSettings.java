package org.metricshub.jfloop.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A simple container for the parameters of a single Floop invocation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jfloop programmatically, from within Java code.
 */
public class FloopSettings {

	/**
	 * Where the result (or the dumped syntax tree) is printed.
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Where diagnostics are printed.
	 * <code>System.err</code> by default.
	 */
	private PrintStream errorStream = System.err;

	/**
	 * Program sources, in the order they were given.
	 * Only the first one is executed; the others are reported as usage errors.
	 */
	private final List<ScriptSource> scriptSources = new ArrayList<ScriptSource>();

	/**
	 * Whether to print the syntax tree instead of running the program;
	 * <code>false</code> by default.
	 */
	private boolean dumpSyntaxTree = false;

	/**
	 * Whether to stop after parsing and block validation;
	 * <code>false</code> by default.
	 */
	private boolean checkOnly = false;

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("scriptSources = ").append(scriptSources).append(newLine);
		desc.append("dumpSyntaxTree = ").append(dumpSyntaxTree).append(newLine);
		desc.append("checkOnly = ").append(checkOnly).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the stream to print results to (instead of System.out by default)
	 *
	 * @param pOutputStream stream to print results to
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	/**
	 * @return the error stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "ErrorStream reference is intentionally shared so callers can control output.")
	public PrintStream getErrorStream() {
		return errorStream;
	}

	/**
	 * Sets the stream to print diagnostics to (instead of System.err by default)
	 *
	 * @param pErrorStream stream to print diagnostics to
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setErrorStream(PrintStream pErrorStream) {
		errorStream = pErrorStream;
	}

	/**
	 * @return an unmodifiable view of the program sources
	 */
	public List<ScriptSource> getScriptSources() {
		return Collections.unmodifiableList(scriptSources);
	}

	/**
	 * @param scriptSource program source to add
	 */
	public void addScriptSource(ScriptSource scriptSource) {
		scriptSources.add(scriptSource);
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public void setDumpSyntaxTree(boolean pDumpSyntaxTree) {
		dumpSyntaxTree = pDumpSyntaxTree;
	}

	public boolean isCheckOnly() {
		return checkOnly;
	}

	public void setCheckOnly(boolean pCheckOnly) {
		checkOnly = pCheckOnly;
	}
}
