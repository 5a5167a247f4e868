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

/**
 * Visitor over the Floop syntax tree.
 *
 * @param <R> result of each visit
 * @param <C> context handed down the traversal
 */
public interface AstVisitor<R, C> {

	R visitProgram(Program program, C context);

	R visitDeclaration(Declaration declaration, C context);

	R visitBlock(Block block, C context);

	R visitLoop(Loop loop, C context);

	R visitConditional(Conditional conditional, C context);

	R visitQuit(Quit quit, C context);

	R visitAbort(Abort abort, C context);

	R visitAssignment(Assignment assignment, C context);

	R visitCall(Call call, C context);

	R visitCell(CellExpression cell, C context);

	R visitParameter(ParameterExpression parameter, C context);

	R visitLiteral(Literal literal, C context);

	R visitBinary(BinaryExpression binary, C context);
}
