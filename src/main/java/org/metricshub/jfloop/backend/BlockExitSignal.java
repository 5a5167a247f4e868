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

/**
 * Raised by <code>QUIT BLOCK n</code>; unwinds the interpreter up to the
 * enclosing block labeled <code>n</code>.
 * <p>
 * Never escapes the {@link Evaluator}: a signal nobody catches within its
 * procedure is turned into an
 * {@link org.metricshub.jfloop.runtime.UnmatchedQuitException}.
 */
final class BlockExitSignal extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int label;
	private final int lineNumber;

	BlockExitSignal(int label, int lineNumber) {
		super(null, null, false, false);
		this.label = label;
		this.lineNumber = lineNumber;
	}

	int getLabel() {
		return label;
	}

	int getLineNumber() {
		return lineNumber;
	}
}
