package org.metricshub.jfloop.runtime;

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

/**
 * A procedure was called with a number of arguments different from the
 * number of its declared parameters.
 */
public class ArityMismatchException extends FloopRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String procedureName;
	private final int expected;
	private final int actual;

	public ArityMismatchException(int lineno, String procedureName, int expected, int actual) {
		super(lineno, "Procedure \"" + procedureName + "\" expects " + expected + " argument(s), got " + actual);
		this.procedureName = procedureName;
		this.expected = expected;
		this.actual = actual;
	}

	public String getProcedureName() {
		return procedureName;
	}

	public int getExpected() {
		return expected;
	}

	public int getActual() {
		return actual;
	}
}
