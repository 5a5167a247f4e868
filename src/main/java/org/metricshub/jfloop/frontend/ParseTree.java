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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Concrete syntax tree of a Floop program, as produced by {@link FloopParser}
 * and consumed by {@link BlockValidator} and {@link AstBuilder}.
 * <p>
 * Inner nodes have children; leaves (labels, numbers, names, operators...)
 * have text. Every node records the line and column of its first token.
 * <p>
 * Shapes, by symbol:
 * <ul>
 * <li>PROGRAM: DECLARATION* CALL?
 * <li>DECLARATION: NAME PARAMETERS BLOCK
 * <li>PARAMETERS: PARAMETER+
 * <li>BLOCK: LABEL statement* LABEL (opening then closing label)
 * <li>LOOP, LOOP_AT_MOST: operand BLOCK
 * <li>MU_LOOP: BLOCK
 * <li>CONDITIONAL: expression BLOCK
 * <li>QUIT, ABORT: LABEL
 * <li>ASSIGNMENT: (CELL | OUTPUT) expression
 * <li>BINARY: operand OPERATOR operand
 * <li>CALL: NAME operand+
 * <li>leaves: NAME, PARAMETER, NUMBER, BOOLEAN, CELL (text is the index),
 * OUTPUT, LABEL, OPERATOR
 * </ul>
 */
public final class ParseTree {

	/** Grammar symbols of the parse tree nodes. */
	public enum Symbol {
		PROGRAM,
		DECLARATION,
		PARAMETERS,
		BLOCK,
		LOOP,
		LOOP_AT_MOST,
		MU_LOOP,
		CONDITIONAL,
		QUIT,
		ABORT,
		ASSIGNMENT,
		BINARY,
		CALL,
		NAME,
		PARAMETER,
		NUMBER,
		BOOLEAN,
		CELL,
		OUTPUT,
		LABEL,
		OPERATOR
	}

	private final Symbol symbol;
	private final String text;
	private final List<ParseTree> children;
	private final int line;
	private final int column;

	private ParseTree(Symbol symbol, String text, List<ParseTree> children, int line, int column) {
		this.symbol = symbol;
		this.text = text;
		this.children = children;
		this.line = line;
		this.column = column;
	}

	public static ParseTree leaf(Symbol symbol, String text, int line, int column) {
		return new ParseTree(symbol, text, Collections.<ParseTree>emptyList(), line, column);
	}

	public static ParseTree node(Symbol symbol, int line, int column, List<ParseTree> children) {
		return new ParseTree(symbol, null, Collections.unmodifiableList(new ArrayList<ParseTree>(children)), line, column);
	}

	public Symbol getSymbol() {
		return symbol;
	}

	/**
	 * @return the token text of a leaf, {@code null} for inner nodes
	 */
	public String getText() {
		return text;
	}

	public List<ParseTree> getChildren() {
		return children;
	}

	public ParseTree getChild(int index) {
		return children.get(index);
	}

	public int getChildCount() {
		return children.size();
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * Prints this tree, one node per line, indented by depth.
	 *
	 * @param ps where to print
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
		for (ParseTree child : children) {
			child.dump(ps, lvl + 1);
		}
	}

	@Override
	public String toString() {
		return text == null ? symbol.name() : symbol.name() + "(" + text + ")";
	}
}
