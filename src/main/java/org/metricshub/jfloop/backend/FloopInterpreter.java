package org.metricshub.jfloop.backend;

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

import org.metricshub.jfloop.ast.Program;
import org.metricshub.jfloop.runtime.Value;

/**
 * Interpret a Floop program within this JVM.
 */
public interface FloopInterpreter {
	/**
	 * Register the declarations of the program, in order, then run its
	 * trailing call.
	 *
	 * @param program the program to run
	 * @return the result of the trailing call, or {@code null} if the program
	 *         has none
	 * @throws org.metricshub.jfloop.runtime.FloopRuntimeException when the
	 *         program fails
	 */
	Value interpret(Program program);
}
