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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jfloop.ast.Block;
import org.metricshub.jfloop.ast.Declaration;

/**
 * A declared procedure: its parameter names and its body.
 */
public final class Procedure {

	private final String name;
	private final List<String> parameters;
	private final Block body;

	public Procedure(String name, List<String> parameters, Block body) {
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<String>(parameters));
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public Block getBody() {
		return body;
	}

	/**
	 * @return whether the output cell of this procedure starts as <code>NO</code>
	 */
	public boolean isPredicate() {
		return Declaration.isPredicateName(name);
	}

	@Override
	public String toString() {
		return name + parameters;
	}
}
