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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <code>BLOCK n: BEGIN ... BLOCK n: END</code>
 * <p>
 * The label is the target of <code>QUIT BLOCK n</code> and, when the block is
 * the body of a loop, of <code>ABORT LOOP n</code>.
 */
public final class Block extends AstNode {

	private final int label;
	private final List<Statement> statements;

	public Block(int lineNumber, int label, List<Statement> statements) {
		super(lineNumber);
		if (label < 0) {
			throw new IllegalArgumentException("Block labels are non-negative: " + label);
		}
		this.label = label;
		this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	public int getLabel() {
		return label;
	}

	public List<Statement> getStatements() {
		return statements;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return statements;
	}

	@Override
	public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
		return visitor.visitBlock(this, context);
	}

	@Override
	public String toString() {
		return "Block " + label;
	}
}
