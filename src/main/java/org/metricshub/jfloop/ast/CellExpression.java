package org.metricshub.jfloop.ast;

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

import org.metricshub.jfloop.runtime.Value;

/**
 * <code>CELL(n)</code>, or <code>OUTPUT</code> which is cell
 * {@value org.metricshub.jfloop.runtime.Value#OUTPUT_CELL}.
 * <p>
 * As an operand it reads the cell; as the target of an {@link Assignment}
 * it designates the cell to write.
 */
public final class CellExpression extends Expression {

	private final int index;

	public CellExpression(int lineNumber, int index) {
		super(lineNumber);
		this.index = index;
	}

	public static CellExpression output(int lineNumber) {
		return new CellExpression(lineNumber, Value.OUTPUT_CELL);
	}

	public int getIndex() {
		return index;
	}

	public boolean isOutput() {
		return index == Value.OUTPUT_CELL;
	}

	@Override
	public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
		return visitor.visitCell(this, context);
	}

	@Override
	public String toString() {
		return isOutput() ? "Output" : "Cell " + index;
	}
}
