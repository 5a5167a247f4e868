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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import org.metricshub.jfloop.ast.Program;
import org.metricshub.jfloop.frontend.FloopSourceException;
import org.metricshub.jfloop.runtime.FloopRuntimeException;
import org.metricshub.jfloop.runtime.Value;
import org.metricshub.jfloop.util.FloopLogger;
import org.metricshub.jfloop.util.FloopSettings;
import org.metricshub.jfloop.util.ScriptFileSource;
import org.metricshub.jfloop.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Jfloop.
 */
public final class Cli {

	private static final Logger LOGGER = FloopLogger.getLogger(Cli.class);

	/** Exit status of a program that failed. */
	public static final int EXIT_FAILURE = 1;

	/** Exit status of a command line that could not be understood. */
	public static final int EXIT_USAGE = 2;

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "jfloop.jar";
		}
		JAR_NAME = myName;
	}

	private final FloopSettings settings = new FloopSettings();
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output and error streams.
	 */
	public Cli() {
		this(System.out, System.err);
	}

	/**
	 * @param out stream where results are printed
	 * @param err stream where errors are printed
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out, PrintStream err) {
		settings.setOutputStream(out);
		settings.setErrorStream(err);
	}

	/**
	 * Returns the mutable {@link FloopSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public FloopSettings getSettings() {
		return settings;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException if the arguments are not understood
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// program file
				settings.addScriptSource(new ScriptFileSource(arg));
			} else if (arg.equals("-f")) {
				// -f filename : load program from file
				checkParameterHasArgument(args, argIdx);
				settings.addScriptSource(new ScriptFileSource(args[++argIdx]));
			} else if (arg.equals("-e")) {
				// -e program : program given inline
				checkParameterHasArgument(args, argIdx);
				settings.addScriptSource(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(args[++argIdx])));
			} else if (arg.equals("-S") || arg.equals("--dump-syntax")) {
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("-c") || arg.equals("--check")) {
				settings.setCheckOnly(true);
			} else if (arg.equals("-h") || arg.equals("--help")) {
				if (args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (settings.getScriptSources().isEmpty()) {
			throw new IllegalArgumentException("Floop program not provided.");
		}
		if (settings.getScriptSources().size() > 1) {
			throw new IllegalArgumentException("Only one Floop program can be run at a time.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments and prints the
	 * outcome on the output stream.
	 *
	 * @return the result of the program, or {@code null} if it has no trailing
	 *         call or was not run
	 * @throws IOException if the program cannot be read
	 */
	public Value run() throws IOException {
		PrintStream out = settings.getOutputStream();
		if (printUsage) {
			usage(out);
			return null;
		}
		ScriptSource source = settings.getScriptSources().get(0);
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Interpreting {} with settings:\n{}", source, settings.toDescriptionString());
		}

		Floop floop = new Floop();
		if (settings.isCheckOnly()) {
			floop.parse(source);
			out.println("OK");
			return null;
		}
		Program program = floop.compile(source);
		if (settings.isDumpSyntaxTree()) {
			program.dump(out);
			return null;
		}
		Value result = floop.run(program);
		if (result != null) {
			out.println("Result: " + result);
		}
		return result;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("java -jar " + JAR_NAME + " [-S|--dump-syntax] [-c|--check] (-f program-filename | -e program | program-filename)");
		dest.println();
		dest.println(" -f filename = Run the program in filename.");
		dest.println(" -e program = Run the program given on the command line.");
		dest.println(" -S, --dump-syntax = Print the syntax tree instead of running the program.");
		dest.println(" -c, --check = Only parse the program and check its block numbers.");
		dest.println();
		dest.println(" -h, --help = This help screen.");
	}

	/**
	 * Parses the arguments, runs the program and reports any failure on the
	 * error stream.
	 *
	 * @param args command-line arguments
	 * @param out stream where results are printed
	 * @param err stream where errors are printed
	 * @return the exit status: 0 on success, {@link #EXIT_FAILURE} if the
	 *         program failed, {@link #EXIT_USAGE} if the arguments are wrong
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		Cli cli = new Cli(out, err);
		PrintStream errors = cli.getSettings().getErrorStream();
		try {
			cli.parse(args);
		} catch (IllegalArgumentException e) {
			errors.println(e.getMessage());
			errors.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			return EXIT_USAGE;
		}
		try {
			cli.run();
			return 0;
		} catch (FloopRuntimeException e) {
			if (e.getLineNumber() >= 0) {
				errors.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				errors.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
		} catch (FloopSourceException | IOException e) {
			errors.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		} catch (StackOverflowError e) {
			errors.printf("%s: recursion is too deep\n", e.getClass().getSimpleName());
		}
		return EXIT_FAILURE;
	}
}
