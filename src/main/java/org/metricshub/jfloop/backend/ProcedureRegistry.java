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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jfloop.ast.Block;
import org.metricshub.jfloop.util.FloopLogger;
import org.slf4j.Logger;

/**
 * The procedures known to a run, by name.
 * <p>
 * There is a single flat namespace. Declaring a name again replaces the
 * previous procedure. Calls are resolved when they execute, so a procedure
 * may call itself or one declared further down the program.
 */
public class ProcedureRegistry {

	private static final Logger LOGGER = FloopLogger.getLogger(ProcedureRegistry.class);

	private final Map<String, Procedure> procedures = new HashMap<String, Procedure>();

	/**
	 * Register a procedure, replacing any previous one of the same name.
	 *
	 * @param name procedure name
	 * @param parameters parameter names, in call order
	 * @param body procedure body
	 */
	public void declare(String name, List<String> parameters, Block body) {
		Procedure previous = procedures.put(name, new Procedure(name, parameters, body));
		if (previous != null) {
			LOGGER.debug("Procedure {} redeclared, the previous declaration is replaced", name);
		}
	}

	/**
	 * @param name procedure name
	 * @return the procedure, or {@code null} if none is declared under that name
	 */
	public Procedure lookup(String name) {
		return procedures.get(name);
	}

	public boolean contains(String name) {
		return procedures.containsKey(name);
	}

	public int size() {
		return procedures.size();
	}
}
