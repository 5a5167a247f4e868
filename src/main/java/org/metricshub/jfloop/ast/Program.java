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
 * A whole Floop program: its procedure declarations, in source order,
 * followed by an optional top-level call whose result is the result of
 * the program.
 * <p>
 * A program holds no runtime state and can be run any number of times.
 */
public final class Program extends AstNode {

	private final List<Declaration> declarations;
	private final Call call;

	/**
	 * @param declarations procedure declarations, in source order
	 * @param call trailing top-level call, or {@code null}
	 */
	public Program(List<Declaration> declarations, Call call) {
		super(1);
		this.declarations = Collections.unmodifiableList(new ArrayList<Declaration>(declarations));
		this.call = call;
	}

	public List<Declaration> getDeclarations() {
		return declarations;
	}

	/**
	 * @return the trailing call, or {@code null} if the program has none
	 */
	public Call getCall() {
		return call;
	}

	public boolean hasCall() {
		return call != null;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		if (call == null) {
			return declarations;
		}
		List<AstNode> children = new ArrayList<AstNode>(declarations);
		children.add(call);
		return children;
	}

	@Override
	public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
		return visitor.visitProgram(this, context);
	}
}
