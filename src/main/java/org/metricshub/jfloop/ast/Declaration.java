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
 * <code>DEFINE PROCEDURE "name" [A, B, ...]: block</code>
 * <p>
 * A name ending with {@value #PREDICATE_MARKER} declares a predicate: its
 * <code>OUTPUT</code> starts as <code>NO</code> instead of <code>0</code>.
 */
public final class Declaration extends AstNode {

	/** Trailing marker of predicate procedure names. */
	public static final String PREDICATE_MARKER = "?";

	private final String name;
	private final List<String> parameters;
	private final Block body;

	public Declaration(int lineNumber, String name, List<String> parameters, Block body) {
		super(lineNumber);
		this.name = name;
		this.parameters = Collections.unmodifiableList(new ArrayList<String>(parameters));
		this.body = body;
	}

	/**
	 * @param procedureName a procedure name
	 * @return whether the name designates a predicate procedure
	 */
	public static boolean isPredicateName(String procedureName) {
		return procedureName.endsWith(PREDICATE_MARKER);
	}

	public String getName() {
		return name;
	}

	public List<String> getParameters() {
		return parameters;
	}

	public Block getBody() {
		return body;
	}

	public boolean isPredicate() {
		return isPredicateName(name);
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Collections.singletonList(body);
	}

	@Override
	public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
		return visitor.visitDeclaration(this, context);
	}

	@Override
	public String toString() {
		return "Declaration \"" + name + "\" " + parameters;
	}
}
