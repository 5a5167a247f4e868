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

import org.metricshub.jfloop.frontend.ParseTree.Symbol;

/**
 * Checks that every block of a parse tree is closed with the label it was
 * opened with.
 * <p>
 * The check is a read-only pre-order walk; the first mismatch (in source
 * order) aborts it with a {@link BlockLabelMismatchException}. It must
 * complete before the tree is built and run.
 */
public final class BlockValidator {

	/** Description used when the tree does not come from a known source. */
	public static final String DESCRIPTION_PARSE_TREE = "<parse-tree>";

	private final String sourceDescription;

	public BlockValidator() {
		this(DESCRIPTION_PARSE_TREE);
	}

	/**
	 * @param sourceDescription source name reported in diagnostics
	 */
	public BlockValidator(String sourceDescription) {
		this.sourceDescription = sourceDescription;
	}

	/**
	 * @param tree the tree to check, usually a PROGRAM node
	 * @throws BlockLabelMismatchException on the first block whose labels differ
	 */
	public void validate(ParseTree tree) {
		if (tree.getSymbol() == Symbol.BLOCK) {
			ParseTree open = tree.getChild(0);
			ParseTree close = tree.getChild(tree.getChildCount() - 1);
			if (!open.getText().equals(close.getText())) {
				throw new BlockLabelMismatchException(
						Integer.parseInt(open.getText()),
						Integer.parseInt(close.getText()),
						sourceDescription,
						open.getLine(),
						open.getColumn());
			}
		}
		for (ParseTree child : tree.getChildren()) {
			validate(child);
		}
	}
}
