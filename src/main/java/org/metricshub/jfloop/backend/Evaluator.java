package org.metricshub.jfloop.backend;

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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jfloop.ast.Abort;
import org.metricshub.jfloop.ast.Assignment;
import org.metricshub.jfloop.ast.AstVisitor;
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
import org.metricshub.jfloop.runtime.ArityMismatchException;
import org.metricshub.jfloop.runtime.TypeMismatchException;
import org.metricshub.jfloop.runtime.UndefinedProcedureException;
import org.metricshub.jfloop.runtime.UninitializedCellException;
import org.metricshub.jfloop.runtime.UnknownParameterException;
import org.metricshub.jfloop.runtime.UnmatchedAbortException;
import org.metricshub.jfloop.runtime.UnmatchedQuitException;
import org.metricshub.jfloop.runtime.Value;
import org.metricshub.jfloop.util.FloopLogger;
import org.slf4j.Logger;

/**
 * The Floop interpreter.
 * <p>
 * It walks the syntax tree recursively. Statements return {@code null},
 * expressions return their {@link Value}. Every procedure call runs in a
 * fresh {@link Activation}; the {@link ProcedureRegistry} is shared by the
 * whole run.
 * <p>
 * <code>QUIT BLOCK n</code> and <code>ABORT LOOP n</code> are implemented as
 * exceptions ({@link BlockExitSignal}, {@link LoopExitSignal}) caught by the
 * block, respectively the loop, they target. A block only ever catches
 * block exits and a loop only ever catches loop exits. A signal that leaves
 * the body of a procedure becomes an
 * {@link org.metricshub.jfloop.runtime.UnhandledControlFlowException}.
 * <p>
 * Loops are not capped: a <code>MU-LOOP</code> that never aborts runs forever,
 * and deep recursion ends with the JVM's {@link StackOverflowError}.
 * <p>
 * An evaluator holds the registry of one run. Use a new instance per run.
 */
public class Evaluator implements FloopInterpreter, AstVisitor<Value, Activation> {

	private static final Logger LOGGER = FloopLogger.getLogger(Evaluator.class);

	private final ProcedureRegistry registry;

	public Evaluator() {
		this(new ProcedureRegistry());
	}

	/**
	 * @param registry where declarations are registered and calls resolved
	 */
	public Evaluator(ProcedureRegistry registry) {
		this.registry = registry;
	}

	public ProcedureRegistry getRegistry() {
		return registry;
	}

	/** {@inheritDoc} */
	@Override
	public Value interpret(Program program) {
		LOGGER.debug("Running program with {} declaration(s)", program.getDeclarations().size());
		Value result = program.accept(this, new Activation());
		LOGGER.debug("Program result: {}", result);
		return result;
	}

	@Override
	public Value visitProgram(Program program, Activation activation) {
		for (Declaration declaration : program.getDeclarations()) {
			declaration.accept(this, activation);
		}
		if (!program.hasCall()) {
			return null;
		}
		return program.getCall().accept(this, activation);
	}

	@Override
	public Value visitDeclaration(Declaration declaration, Activation activation) {
		registry.declare(declaration.getName(), declaration.getParameters(), declaration.getBody());
		return null;
	}

	@Override
	public Value visitBlock(Block block, Activation activation) {
		try {
			for (Statement statement : block.getStatements()) {
				statement.accept(this, activation);
			}
		} catch (BlockExitSignal signal) {
			if (signal.getLabel() != block.getLabel()) {
				throw signal;
			}
		}
		return null;
	}

	@Override
	public Value visitLoop(Loop loop, Activation activation) {
		if (loop.isMuLoop()) {
			while (iterate(loop, activation)) {
				// runs until ABORT LOOP targets the body
			}
			return null;
		}
		Value bound = loop.getBound().accept(this, activation);
		if (!bound.isInteger()) {
			throw new TypeMismatchException(loop.getLineNumber(), "LOOP bound", bound.getType());
		}
		BigInteger count = bound.integerValue();
		for (BigInteger i = BigInteger.ZERO; i.compareTo(count) < 0; i = i.add(BigInteger.ONE)) {
			if (!iterate(loop, activation)) {
				break;
			}
		}
		return null;
	}

	/**
	 * Runs the body of the loop once.
	 *
	 * @return {@code false} if the iteration was aborted
	 */
	private boolean iterate(Loop loop, Activation activation) {
		Block body = loop.getBody();
		try {
			body.accept(this, activation);
			return true;
		} catch (LoopExitSignal signal) {
			if (signal.getLabel() != body.getLabel()) {
				throw signal;
			}
			return false;
		}
	}

	@Override
	public Value visitConditional(Conditional conditional, Activation activation) {
		Value test = conditional.getTest().accept(this, activation);
		if (!test.isBoolean()) {
			throw new TypeMismatchException(conditional.getLineNumber(), "IF", test.getType());
		}
		if (test.booleanValue()) {
			conditional.getThenBlock().accept(this, activation);
		}
		return null;
	}

	@Override
	public Value visitQuit(Quit quit, Activation activation) {
		throw new BlockExitSignal(quit.getBlockLabel(), quit.getLineNumber());
	}

	@Override
	public Value visitAbort(Abort abort, Activation activation) {
		throw new LoopExitSignal(abort.getBlockLabel(), abort.getLineNumber());
	}

	@Override
	public Value visitAssignment(Assignment assignment, Activation activation) {
		Value.CellReference target = Value.cellReference(assignment.getTarget().getIndex());
		Value value = assignment.getValue().accept(this, activation);
		activation.store(target.getIndex(), value);
		return null;
	}

	@Override
	public Value visitCall(Call call, Activation activation) {
		List<Value> arguments = new ArrayList<Value>(call.getArguments().size());
		for (Expression argument : call.getArguments()) {
			arguments.add(argument.accept(this, activation));
		}
		Procedure procedure = registry.lookup(call.getName());
		if (procedure == null) {
			throw new UndefinedProcedureException(call.getLineNumber(), call.getName());
		}
		List<String> parameters = procedure.getParameters();
		if (parameters.size() != arguments.size()) {
			throw new ArityMismatchException(call.getLineNumber(), call.getName(), parameters.size(), arguments.size());
		}
		Map<String, Value> bindings = new HashMap<String, Value>();
		for (int i = 0; i < parameters.size(); i++) {
			bindings.put(parameters.get(i), arguments.get(i));
		}
		Activation callee = new Activation(bindings, procedure.isPredicate() ? Value.NO : Value.ZERO);

		LOGGER.debug("Calling {}{}", call.getName(), arguments);
		try {
			procedure.getBody().accept(this, callee);
		} catch (BlockExitSignal signal) {
			throw new UnmatchedQuitException(signal.getLineNumber(), signal.getLabel());
		} catch (LoopExitSignal signal) {
			throw new UnmatchedAbortException(signal.getLineNumber(), signal.getLabel());
		}
		Value result = callee.load(Value.OUTPUT_CELL);
		LOGGER.debug("{} returned {}", call.getName(), result);
		return result;
	}

	@Override
	public Value visitCell(CellExpression cell, Activation activation) {
		Value value = activation.load(cell.getIndex());
		if (value == null) {
			throw new UninitializedCellException(cell.getLineNumber(), cell.getIndex());
		}
		return value;
	}

	@Override
	public Value visitParameter(ParameterExpression parameter, Activation activation) {
		Value value = activation.parameter(parameter.getName());
		if (value == null) {
			throw new UnknownParameterException(parameter.getLineNumber(), parameter.getName());
		}
		return value;
	}

	@Override
	public Value visitLiteral(Literal literal, Activation activation) {
		return literal.getValue();
	}

	@Override
	public Value visitBinary(BinaryExpression binary, Activation activation) {
		Value left = binary.getLeft().accept(this, activation);
		Value right = binary.getRight().accept(this, activation);
		BinaryExpression.Operator op = binary.getOperator();
		int line = binary.getLineNumber();
		switch (op) {
		case ADD:
			return Value.of(integer(op, left, line).add(integer(op, right, line)));
		case MULTIPLY:
			return Value.of(integer(op, left, line).multiply(integer(op, right, line)));
		case LESS:
			return Value.of(integer(op, left, line).compareTo(integer(op, right, line)) < 0);
		case GREATER:
			return Value.of(integer(op, left, line).compareTo(integer(op, right, line)) > 0);
		case EQUAL:
			if (left.getType() == Value.Type.CELL_REFERENCE) {
				throw new TypeMismatchException(line, "operator =", left.getType());
			}
			if (left.getType() != right.getType()) {
				throw new TypeMismatchException(line, "operator = on " + left.getType(), right.getType());
			}
			return Value.of(left.equals(right));
		default:
			throw new IllegalStateException("Unhandled operator: " + op);
		}
	}

	private static BigInteger integer(BinaryExpression.Operator op, Value value, int line) {
		if (!value.isInteger()) {
			throw new TypeMismatchException(line, "operator " + op.getSymbol(), value.getType());
		}
		return value.integerValue();
	}
}
