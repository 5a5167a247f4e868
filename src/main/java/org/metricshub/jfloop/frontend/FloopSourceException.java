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
 * An error located in the program text: lexical, syntactic, or a block
 * label mismatch. Carries the source description and the line and column
 * (both 1-based) of the offending token.
 */
public class FloopSourceException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String detail;
	private final String sourceDescription;
	private final int lineNumber;
	private final int columnNumber;

	public FloopSourceException(String msg, String sourceDescription, int lineNumber, int columnNumber) {
		super(msg + " (" + sourceDescription + ":" + lineNumber + ":" + columnNumber + ")");
		this.detail = msg;
		this.sourceDescription = sourceDescription;
		this.lineNumber = lineNumber;
		this.columnNumber = columnNumber;
	}

	/**
	 * @return the message without the position suffix
	 */
	public String getDetail() {
		return detail;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public int getColumnNumber() {
		return columnNumber;
	}
}
