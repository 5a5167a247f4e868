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
 * An operator was applied to values of the wrong type: arithmetic or
 * ordering on a non-integer, equality between values of different types,
 * a non-boolean <code>IF</code> test or a non-integer loop bound.
 */
public class TypeMismatchException extends FloopRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String operation;
	private final Value.Type actual;

	/**
	 * @param lineno line of the failing expression, or {@code -1}
	 * @param operation the operator or construct that rejected the value
	 * @param actual the type it was given
	 */
	public TypeMismatchException(int lineno, String operation, Value.Type actual) {
		super(lineno, "Cannot apply " + operation + " to " + actual);
		this.operation = operation;
		this.actual = actual;
	}

	public String getOperation() {
		return operation;
	}

	public Value.Type getActual() {
		return actual;
	}
}
