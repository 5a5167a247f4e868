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
import java.util.Collections;
import java.util.List;

/**
 * A bounded loop (<code>LOOP n TIMES</code>, <code>LOOP AT MOST n TIMES</code>)
 * or, when it has no bound, a <code>MU-LOOP</code>.
 * <p>
 * Loops carry no label of their own: <code>ABORT LOOP n</code> targets the
 * loop whose body block is labeled <code>n</code>.
 */
public final class Loop extends Statement {

	private final Expression bound;
	private final Block body;

	/**
	 * @param lineNumber source line
	 * @param bound number of iterations, or {@code null} for an unbounded loop
	 * @param body the repeated block
	 */
	public Loop(int lineNumber, Expression bound, Block body) {
		super(lineNumber);
		this.bound = bound;
		this.body = body;
	}

	/**
	 * @return the bound expression, or {@code null} for a mu-loop
	 */
	public Expression getBound() {
		return bound;
	}

	public Block getBody() {
		return body;
	}

	public boolean isMuLoop() {
		return bound == null;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		if (bound == null) {
			return Collections.singletonList(body);
		}
		return Arrays.asList(bound, body);
	}

	@Override
	public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
		return visitor.visitLoop(this, context);
	}

	@Override
	public String toString() {
		return isMuLoop() ? "MuLoop" : "Loop";
	}
}
