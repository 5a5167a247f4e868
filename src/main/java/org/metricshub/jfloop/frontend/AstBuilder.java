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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jfloop.ast.Abort;
import org.metricshub.jfloop.ast.Assignment;
import org.metricshub.jfloop.ast.BinaryExpression;
import org.metricshub.jfloop.ast.Block;
import org.metricshub.jfloop.ast.Call;
import org.metricshub.jfloop.ast.CellExpression;
import org.metricshub.jfloop.ast.Conditional;
import org.metricshub.jfloop.ast.Declaration;
import org.metricshub.jfloop.ast.Expression;
import org.metricshub.jfloop.ast.Literal;
import org.metricshub.jfloop.ast.Loop;
import org.metricshub.jfloop.ast.ParameterExpression;
import org.metricshub.jfloop.ast.Program;
import org.metricshub.jfloop.ast.Quit;
import org.metricshub.jfloop.ast.Statement;
import org.metricshub.jfloop.frontend.ParseTree.Symbol;
import org.metricshub.jfloop.runtime.Value;

/**
 * Turns a validated {@link ParseTree} into the abstract syntax tree the
 * interpreter runs.
 * <p>
 * Nodes are built bottom-up: children first, then the node itself.
 * Both <code>LOOP n TIMES</code> and <code>LOOP AT MOST n TIMES</code> become
 * the same bounded {@link Loop}, a <code>MU-LOOP</code> becomes a loop without
 * bound, and <code>OUTPUT</code> becomes cell
 * {@value org.metricshub.jfloop.runtime.Value#OUTPUT_CELL}.
 * <p>
 * The builder reports nothing about the program itself: a tree of the wrong
 * shape is a bug of whoever produced it and fails with an
 * {@link IllegalArgumentException}.
 */
public class AstBuilder {

	/**
	 * @param tree a PROGRAM node
	 * @return the program
	 */
	public Program build(ParseTree tree) {
		expect(tree, Symbol.PROGRAM);
		List<Declaration> declarations = new ArrayList<Declaration>();
		Call call = null;
		for (ParseTree child : tree.getChildren()) {
			if (child.getSymbol() == Symbol.DECLARATION) {
				if (call != null) {
					throw unexpected(child);
				}
				declarations.add(buildDeclaration(child));
			} else if (child.getSymbol() == Symbol.CALL && call == null) {
				call = buildCall(child);
			} else {
				throw unexpected(child);
			}
		}
		return new Program(declarations, call);
	}

	Declaration buildDeclaration(ParseTree tree) {
		expect(tree, Symbol.DECLARATION);
		String name = tree.getChild(0).getText();
		List<String> parameters = new ArrayList<String>();
		for (ParseTree parameter : tree.getChild(1).getChildren()) {
			parameters.add(parameter.getText());
		}
		Block body = buildBlock(tree.getChild(2));
		return new Declaration(tree.getLine(), name, parameters, body);
	}

	Block buildBlock(ParseTree tree) {
		expect(tree, Symbol.BLOCK);
		int last = tree.getChildCount() - 1;
		List<Statement> statements = new ArrayList<Statement>();
		for (ParseTree child : tree.getChildren().subList(1, last)) {
			statements.add(buildStatement(child));
		}
		return new Block(tree.getLine(), Integer.parseInt(tree.getChild(0).getText()), statements);
	}

	Statement buildStatement(ParseTree tree) {
		int line = tree.getLine();
		switch (tree.getSymbol()) {
		case LOOP:
		case LOOP_AT_MOST: {
			Expression bound = buildExpression(tree.getChild(0));
			return new Loop(line, bound, buildBlock(tree.getChild(1)));
		}
		case MU_LOOP:
			return new Loop(line, null, buildBlock(tree.getChild(0)));
		case CONDITIONAL: {
			Expression test = buildExpression(tree.getChild(0));
			return new Conditional(line, test, buildBlock(tree.getChild(1)));
		}
		case QUIT:
			return new Quit(line, Integer.parseInt(tree.getChild(0).getText()));
		case ABORT:
			return new Abort(line, Integer.parseInt(tree.getChild(0).getText()));
		case ASSIGNMENT: {
			Expression target = buildExpression(tree.getChild(0));
			if (!(target instanceof CellExpression)) {
				throw unexpected(tree.getChild(0));
			}
			Expression value = buildExpression(tree.getChild(1));
			return new Assignment(line, (CellExpression) target, value);
		}
		default:
			throw unexpected(tree);
		}
	}

	Expression buildExpression(ParseTree tree) {
		int line = tree.getLine();
		switch (tree.getSymbol()) {
		case NUMBER:
			return new Literal(line, Value.of(new BigInteger(tree.getText())));
		case BOOLEAN:
			return new Literal(line, Value.of("YES".equals(tree.getText())));
		case CELL:
			return new CellExpression(line, Integer.parseInt(tree.getText()));
		case OUTPUT:
			return CellExpression.output(line);
		case PARAMETER:
			return new ParameterExpression(line, tree.getText());
		case CALL:
			return buildCall(tree);
		case BINARY: {
			Expression left = buildExpression(tree.getChild(0));
			Expression right = buildExpression(tree.getChild(2));
			BinaryExpression.Operator op = BinaryExpression.Operator.fromSymbol(tree.getChild(1).getText());
			return new BinaryExpression(line, op, left, right);
		}
		default:
			throw unexpected(tree);
		}
	}

	Call buildCall(ParseTree tree) {
		expect(tree, Symbol.CALL);
		List<Expression> arguments = new ArrayList<Expression>();
		for (ParseTree argument : tree.getChildren().subList(1, tree.getChildCount())) {
			arguments.add(buildExpression(argument));
		}
		return new Call(tree.getLine(), tree.getChild(0).getText(), arguments);
	}

	private static void expect(ParseTree tree, Symbol symbol) {
		if (tree.getSymbol() != symbol) {
			throw new IllegalArgumentException("Expecting a " + symbol + " node, got " + tree);
		}
	}

	private static IllegalArgumentException unexpected(ParseTree tree) {
		return new IllegalArgumentException(
				"Unexpected " + tree + " node at line " + tree.getLine() + ", column " + tree.getColumn());
	}
}
