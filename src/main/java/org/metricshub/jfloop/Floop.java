package org.metricshub.jfloop;

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

import java.io.IOException;
import java.io.StringReader;
import org.metricshub.jfloop.ast.Program;
import org.metricshub.jfloop.backend.Evaluator;
import org.metricshub.jfloop.backend.FloopInterpreter;
import org.metricshub.jfloop.frontend.AstBuilder;
import org.metricshub.jfloop.frontend.BlockValidator;
import org.metricshub.jfloop.frontend.FloopParser;
import org.metricshub.jfloop.frontend.ParseTree;
import org.metricshub.jfloop.runtime.Value;
import org.metricshub.jfloop.util.ScriptSource;

/**
 * Entry point into the parsing, validation, and execution
 * of a Floop program.
 * This entry point is used both when Jfloop is executed as a library and when
 * invoked from the command line.
 * <p>
 * The overall process to execute a Floop program is as follows:
 * <ul>
 * <li>Parse the program text, producing a {@link ParseTree}.
 * <li>Check that every block is closed with the label it was opened with.
 * <li>Build the abstract syntax tree, a {@link Program}.
 * <li>Walk the syntax tree with a fresh interpreter, which registers the
 * procedures and runs the trailing call.
 * </ul>
 * A {@link Program} can be run any number of times; every run starts with
 * an empty procedure registry.
 *
 * @see org.metricshub.jfloop.backend.Evaluator
 */
public class Floop {

	/**
	 * Parse a program and check its block labels.
	 *
	 * @param source the program text
	 * @return the validated parse tree
	 * @throws IOException upon an IO error
	 * @throws org.metricshub.jfloop.frontend.FloopSourceException if the text
	 *         is malformed or a block label does not match
	 */
	public ParseTree parse(ScriptSource source) throws IOException {
		ParseTree tree = new FloopParser().parse(source);
		new BlockValidator(source.getDescription()).validate(tree);
		return tree;
	}

	/**
	 * Parse, validate and build a program.
	 *
	 * @param source the program text
	 * @return the program, ready to {@link #run(Program)}
	 * @throws IOException upon an IO error
	 */
	public Program compile(ScriptSource source) throws IOException {
		return new AstBuilder().build(parse(source));
	}

	/**
	 * Parse, validate and build a program given as a string.
	 *
	 * @param script the program text
	 * @return the program, ready to {@link #run(Program)}
	 * @throws IOException upon an IO error
	 */
	public Program compile(String script) throws IOException {
		return compile(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(script)));
	}

	/**
	 * Validate the block labels of a parse tree produced elsewhere, then
	 * build it.
	 *
	 * @param tree a PROGRAM parse tree
	 * @return the program
	 * @throws org.metricshub.jfloop.frontend.BlockLabelMismatchException if a
	 *         block label does not match
	 */
	public Program build(ParseTree tree) {
		new BlockValidator().validate(tree);
		return new AstBuilder().build(tree);
	}

	/**
	 * Run a program with a fresh interpreter.
	 *
	 * @param program the program
	 * @return the result of the trailing call, or {@code null} without one
	 * @throws org.metricshub.jfloop.runtime.FloopRuntimeException when the
	 *         program fails
	 */
	public Value run(Program program) {
		return createInterpreter().interpret(program);
	}

	/**
	 * Compile and run a program given as a string.
	 *
	 * @param script the program text
	 * @return the result of the trailing call, or {@code null} without one
	 * @throws IOException upon an IO error
	 */
	public Value eval(String script) throws IOException {
		return run(compile(script));
	}

	/**
	 * Creates the interpreter of one run.
	 *
	 * @return a new interpreter
	 */
	protected FloopInterpreter createInterpreter() {
		return new Evaluator();
	}
}
