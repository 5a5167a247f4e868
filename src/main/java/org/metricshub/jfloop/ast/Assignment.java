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

import java.util.Arrays;
import java.util.List;

/**
 * <code>CELL(n) &lt;= expr;</code> or <code>OUTPUT &lt;= expr;</code>
 */
public final class Assignment extends Statement {

	private final CellExpression target;
	private final Expression value;

	public Assignment(int lineNumber, CellExpression target, Expression value) {
		super(lineNumber);
		this.target = target;
		this.value = value;
	}

	public CellExpression getTarget() {
		return target;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Arrays.asList(target, value);
	}

	@Override
	public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
		return visitor.visitAssignment(this, context);
	}
}
