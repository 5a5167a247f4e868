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
 * <code>left op right</code>. The grammar allows a single operator per
 * expression, so there is no precedence to resolve.
 */
public final class BinaryExpression extends Expression {

	/** Operators of the language. */
	public enum Operator {
		ADD("+"),
		MULTIPLY("*"),
		EQUAL("="),
		LESS("<"),
		GREATER(">");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}

		/**
		 * @param symbol one of <code>+ * = &lt; &gt;</code>
		 * @return the matching operator
		 * @throws IllegalArgumentException for any other symbol
		 */
		public static Operator fromSymbol(String symbol) {
			for (Operator op : values()) {
				if (op.symbol.equals(symbol)) {
					return op;
				}
			}
			throw new IllegalArgumentException("Unknown operator: " + symbol);
		}
	}

	private final Operator operator;
	private final Expression left;
	private final Expression right;

	public BinaryExpression(int lineNumber, Operator operator, Expression left, Expression right) {
		super(lineNumber);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public Operator getOperator() {
		return operator;
	}

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Arrays.asList(left, right);
	}

	@Override
	public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
		return visitor.visitBinary(this, context);
	}

	@Override
	public String toString() {
		return "Binary " + operator.getSymbol();
	}
}
