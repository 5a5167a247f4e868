package org.metricshub.jfloop;

import static org.junit.Assert.*;
import static org.metricshub.jfloop.FloopTestSupport.cliTest;

import org.junit.Test;
import org.metricshub.jfloop.FloopTestSupport.CliResult;
import org.metricshub.jfloop.util.ScriptFileSource;

public class CliTest {

	@Test
	public void testRunFile() throws Exception {
		cliTest("-f add.floop").args("-f").scriptFile("add.floop").expectLines("Result: 5").runAndAssert();
		cliTest("positional file").scriptFile("is_zero.floop").expectLines("Result: NO").runAndAssert();
	}

	@Test
	public void testInlineProgram() {
		cliTest("-e")
				.args("-e", "DEFINE PROCEDURE \"t?\" [N]: BLOCK 0: BEGIN OUTPUT <= N > 1; BLOCK 0: END t?(2)")
				.expectLines("Result: YES")
				.runAndAssert();
	}

	@Test
	public void testNoTrailingCallPrintsNothing() throws Exception {
		cliTest("declarations only").scriptFile("declarations_only.floop").expectOutput("").runAndAssert();
	}

	@Test
	public void testCheckOnly() throws Exception {
		cliTest("-c").args("-c").scriptFile("mu_counter.floop").expectLines("OK").runAndAssert();
		cliTest("-c with a mismatch")
				.args("--check")
				.scriptFile("mismatch.floop")
				.expectOutput("")
				.expectExitCode(Cli.EXIT_FAILURE)
				.expectErrorContaining("BlockLabelMismatchException: Block numbers do not match: 1 vs 2")
				.runAndAssert();
	}

	@Test
	public void testDumpSyntaxTree() {
		CliResult result = cliTest("-S")
				.args("-S", "-e", "DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN MU-LOOP: BLOCK 1: BEGIN ABORT LOOP 1; BLOCK 1: END BLOCK 0: END f(1)")
				.runAndAssert();
		assertEquals(
				"Program\n"
						+ " Declaration \"f\" [N]\n"
						+ "  Block 0\n"
						+ "   MuLoop\n"
						+ "    Block 1\n"
						+ "     Abort 1\n"
						+ " Call f\n"
						+ "  Literal 1\n",
				result.output());
	}

	@Test
	public void testRuntimeError() {
		CliResult result = cliTest("undefined procedure")
				.args("-e", "nowhere(1)")
				.expectExitCode(Cli.EXIT_FAILURE)
				.runAndAssert();
		assertEquals("UndefinedProcedureException (line 1): Procedure \"nowhere\" is not defined\n", result.error());
	}

	@Test
	public void testSyntaxError() {
		cliTest("syntax error")
				.args("-e", "f(1")
				.expectExitCode(Cli.EXIT_FAILURE)
				.expectErrorContaining("ParserException: Expecting CLOSE_PAREN")
				.runAndAssert();
	}

	@Test
	public void testMissingFile() {
		cliTest("missing file")
				.args("-f", "/nonexistent/jfloop/program.floop")
				.expectExitCode(Cli.EXIT_FAILURE)
				.expectErrorContaining("/nonexistent/jfloop/program.floop")
				.runAndAssert();
	}

	@Test
	public void testUsage() {
		CliResult noArgs = cliTest("no arguments").runAndAssert();
		assertTrue(noArgs.output().startsWith("Usage:"));
		CliResult help = cliTest("--help").args("--help").runAndAssert();
		assertEquals(noArgs.output(), help.output());
	}

	@Test
	public void testBadArguments() {
		cliTest("unknown option").args("-x").expectExitCode(Cli.EXIT_USAGE).expectErrorContaining("Unknown parameter: -x").runAndAssert();
		cliTest("-f without file").args("-f").expectExitCode(Cli.EXIT_USAGE).expectErrorContaining("Need additional argument for -f").runAndAssert();
		cliTest("only options").args("-S").expectExitCode(Cli.EXIT_USAGE).expectErrorContaining("Floop program not provided.").runAndAssert();
		cliTest("two programs").args("a.floop", "b.floop").expectExitCode(Cli.EXIT_USAGE).runAndAssert();
		cliTest("help with others").args("-h", "-c").expectExitCode(Cli.EXIT_USAGE).runAndAssert();
	}

	@Test
	public void testParseFillsSettings() {
		Cli cli = new Cli();
		cli.parse(new String[] { "-S", "-f", "x.floop" });
		assertTrue(cli.getSettings().isDumpSyntaxTree());
		assertFalse(cli.getSettings().isCheckOnly());
		assertEquals("x.floop", ((ScriptFileSource) cli.getSettings().getScriptSources().get(0)).getFilePath());
	}
}
