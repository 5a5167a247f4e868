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
 * A <code>QUIT BLOCK</code> or <code>ABORT LOOP</code> escaped the procedure
 * activation that raised it, because no enclosing block or loop of that
 * activation carries the targeted label.
 */
public class UnhandledControlFlowException extends FloopRuntimeException {

	private static final long serialVersionUID = 1L;

	private final int label;

	/**
	 * @param lineno line of the statement that raised the exit, or {@code -1}
	 * @param label the targeted block label
	 * @param msg description of the failure
	 */
	public UnhandledControlFlowException(int lineno, int label, String msg) {
		super(lineno, msg);
		this.label = label;
	}

	/**
	 * @return the block label no enclosing block or loop carried
	 */
	public int getLabel() {
		return label;
	}
}
