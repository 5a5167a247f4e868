package org.metricshub.jfloop.frontend;

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
 * A block is opened with one label and closed with another.
 * The position is the one of the opening label.
 */
public class BlockLabelMismatchException extends FloopSourceException {

	private static final long serialVersionUID = 1L;

	private final int openLabel;
	private final int closeLabel;

	public BlockLabelMismatchException(int openLabel, int closeLabel, String sourceDescription, int lineNumber, int columnNumber) {
		super("Block numbers do not match: " + openLabel + " vs " + closeLabel, sourceDescription, lineNumber, columnNumber);
		this.openLabel = openLabel;
		this.closeLabel = closeLabel;
	}

	public int getOpenLabel() {
		return openLabel;
	}

	public int getCloseLabel() {
		return closeLabel;
	}
}
