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

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * A node of the Floop abstract syntax tree.
 * <p>
 * Nodes are immutable once built. Each one records the source line it was
 * built from, which the interpreter attaches to its runtime errors.
 */
public abstract class AstNode {

	private final int lineNumber;

	protected AstNode(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the source line of this node, or {@code -1} if unknown
	 */
	public final int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Dispatch to the visitor method matching the concrete node type.
	 *
	 * @param <R> result type of the visitor
	 * @param <C> context type passed along the traversal
	 * @param visitor the visitor
	 * @param context the context handed to the visitor method
	 * @return whatever the visitor method returns
	 */
	public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

	/**
	 * @return the direct children of this node, in source order
	 */
	public List<? extends AstNode> getChildren() {
		return Collections.emptyList();
	}

	/**
	 * Dump a meaningful text representation of this
	 * abstract syntax tree node and its children to the
	 * print stream, one node per line, indented by depth.
	 *
	 * @param ps The print stream to dump the text
	 *        representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + toString());
		for (AstNode child : getChildren()) {
			if (child != null) {
				child.dump(ps, lvl + 1);
			}
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
