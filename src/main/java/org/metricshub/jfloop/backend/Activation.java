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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.metricshub.jfloop.runtime.Value;

/**
 * The storage of one procedure call: its cells and its parameter bindings.
 * <p>
 * Every call gets a fresh activation, so callers and callees never share
 * cells. Loops and blocks run in the activation of their procedure.
 */
final class Activation {

	private final Map<Integer, Value> cells = new HashMap<Integer, Value>();
	private final Map<String, Value> parameters;

	/**
	 * The caller of the top-level call: no cells, no parameters.
	 */
	Activation() {
		this.parameters = Collections.emptyMap();
	}

	/**
	 * @param parameters bound parameter values
	 * @param output initial value of the output cell
	 */
	Activation(Map<String, Value> parameters, Value output) {
		this.parameters = Collections.unmodifiableMap(new HashMap<String, Value>(parameters));
		cells.put(Value.OUTPUT_CELL, output);
	}

	/**
	 * @param index cell index
	 * @return the value of the cell, or {@code null} if it was never assigned
	 */
	Value load(int index) {
		return cells.get(index);
	}

	void store(int index, Value value) {
		cells.put(index, value);
	}

	/**
	 * @param name parameter name
	 * @return the bound value, or {@code null} if there is no such parameter
	 */
	Value parameter(String name) {
		return parameters.get(name);
	}
}
