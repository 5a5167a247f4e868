package org.metricshub.jfloop;

import static org.junit.Assert.*;
import static org.metricshub.jfloop.FloopTestSupport.floopTest;

import org.junit.Test;
import org.metricshub.jfloop.ast.Program;
import org.metricshub.jfloop.frontend.BlockLabelMismatchException;
import org.metricshub.jfloop.frontend.FloopParser;
import org.metricshub.jfloop.frontend.ParseTree;
import org.metricshub.jfloop.runtime.ArityMismatchException;
import org.metricshub.jfloop.runtime.UndefinedProcedureException;
import org.metricshub.jfloop.runtime.UnmatchedAbortException;
import org.metricshub.jfloop.runtime.UnmatchedQuitException;
import org.metricshub.jfloop.runtime.Value;

public class FloopTest {

	private static final String IS_ZERO = "DEFINE PROCEDURE \"is_zero?\" [X]:\n"
			+ "BLOCK 0: BEGIN\n"
			+ "  IF X = 0, THEN:\n"
			+ "  BLOCK 1: BEGIN\n"
			+ "    OUTPUT <= YES;\n"
			+ "  BLOCK 1: END\n"
			+ "BLOCK 0: END\n";

	private static final String MINUS = "DEFINE PROCEDURE \"minus\" [M, N]:\n"
			+ "BLOCK 0: BEGIN\n"
			+ "  IF M < N, THEN:\n"
			+ "  BLOCK 1: BEGIN\n"
			+ "    QUIT BLOCK 0;\n"
			+ "  BLOCK 1: END\n"
			+ "  LOOP AT MOST M TIMES:\n"
			+ "  BLOCK 2: BEGIN\n"
			+ "    CELL(0) <= OUTPUT + N;\n"
			+ "    IF CELL(0) = M, THEN:\n"
			+ "    BLOCK 3: BEGIN\n"
			+ "      ABORT LOOP 2;\n"
			+ "    BLOCK 3: END\n"
			+ "    OUTPUT <= OUTPUT + 1;\n"
			+ "  BLOCK 2: END\n"
			+ "BLOCK 0: END\n";

	@Test
	public void testPredicateReturnsYesWhenAssigned() throws Exception {
		floopTest("is_zero?(0)").script(IS_ZERO + "is_zero?(0)").expect(true).runAndAssert();
	}

	@Test
	public void testPredicateDefaultsToNo() throws Exception {
		floopTest("is_zero?(3)").scriptResource("is_zero.floop").expect(Value.NO).runAndAssert();
	}

	@Test
	public void testAdd() throws Exception {
		floopTest("add(2, 3)").scriptResource("add.floop").expect(5).runAndAssert();
	}

	@Test
	public void testProcedureDefaultsToZero() throws Exception {
		floopTest("untouched output")
				.script("DEFINE PROCEDURE \"nothing\" [N]: BLOCK 0: BEGIN BLOCK 0: END nothing(7)")
				.expect(Value.ZERO)
				.runAndAssert();
	}

	@Test
	public void testMuLoopAbortsAfterFivePasses() throws Exception {
		floopTest("mu-loop counter").scriptResource("mu_counter.floop").expect(5).runAndAssert();
	}

	@Test
	public void testBoundedLoop() throws Exception {
		floopTest("factorial(5)").scriptResource("factorial.floop").expect(120).runAndAssert();
	}

	@Test
	public void testLoopZeroTimesRunsNothing() throws Exception {
		floopTest("LOOP 0 TIMES")
				.script("DEFINE PROCEDURE \"f\" [N]:\n"
						+ "BLOCK 0: BEGIN\n"
						+ "  OUTPUT <= 7;\n"
						+ "  LOOP 0 TIMES:\n"
						+ "  BLOCK 1: BEGIN\n"
						+ "    OUTPUT <= CELL(42);\n"
						+ "  BLOCK 1: END\n"
						+ "BLOCK 0: END\n"
						+ "f(1)")
				.expect(7)
				.runAndAssert();
	}

	@Test
	public void testProceduresCallEachOther() throws Exception {
		floopTest("minus(7, 3)").script(MINUS + "minus(7, 3)").expect(4).runAndAssert();
		floopTest("minus(2, 3) quits early").script(MINUS + "minus(2, 3)").expect(0).runAndAssert();
		floopTest("call as argument")
				.script(MINUS + IS_ZERO + "is_zero?(minus(4, 4))")
				.expect(true)
				.runAndAssert();
	}

	@Test
	public void testRecursion() throws Exception {
		String fib = "DEFINE PROCEDURE \"fib\" [N]:\n"
				+ "BLOCK 0: BEGIN\n"
				+ "  OUTPUT <= N;\n"
				+ "  IF N > 1, THEN:\n"
				+ "  BLOCK 1: BEGIN\n"
				+ "    OUTPUT <= fib(minus(N, 1)) + fib(minus(N, 2));\n"
				+ "  BLOCK 1: END\n"
				+ "BLOCK 0: END\n";
		floopTest("fib(10)").script(MINUS + fib + "fib(10)").expect(55).runAndAssert();
	}

	@Test
	public void testArbitraryPrecision() throws Exception {
		String square = "DEFINE PROCEDURE \"square\" [N]: BLOCK 0: BEGIN OUTPUT <= N * N; BLOCK 0: END\n";
		Value result = new Floop().eval(square + "square(square(square(square(square(square(square(10)))))))");
		assertEquals(129, result.toString().length());
	}

	@Test
	public void testLaterDeclarationWins() throws Exception {
		floopTest("redeclared procedure")
				.script("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN OUTPUT <= 1; BLOCK 0: END\n"
						+ "DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN OUTPUT <= 2; BLOCK 0: END\n"
						+ "f(0)")
				.expect(2)
				.runAndAssert();
	}

	@Test
	public void testLoneCarriageReturnsSeparateTokens() throws Exception {
		floopTest("CR line breaks")
				.script("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN OUTPUT <= N;\rBLOCK 0: END\rf(4)")
				.expect(4)
				.runAndAssert();
	}

	@Test
	public void testKeywordNamedParameters() throws Exception {
		floopTest("parameter AT")
				.script("DEFINE PROCEDURE \"f\" [AT]: BLOCK 0: BEGIN OUTPUT <= AT; BLOCK 0: END f(1)")
				.expect(1)
				.runAndAssert();
		floopTest("LOOP AT TIMES")
				.script("DEFINE PROCEDURE \"times\" [AT, N]:\n"
						+ "BLOCK 0: BEGIN\n"
						+ "  OUTPUT <= 0;\n"
						+ "  LOOP AT TIMES: BLOCK 1: BEGIN OUTPUT <= OUTPUT + N; BLOCK 1: END\n"
						+ "BLOCK 0: END\n"
						+ "times(3, 2)")
				.expect(6)
				.runAndAssert();
	}

	@Test
	public void testNoTrailingCall() throws Exception {
		floopTest("declarations only").scriptResource("declarations_only.floop").expectNoResult().runAndAssert();
		floopTest("empty program").script("").expectNoResult().runAndAssert();
	}

	@Test
	public void testRunningTwiceGivesTheSameResult() throws Exception {
		Floop floop = new Floop();
		Program program = floop.compile(FloopTestSupport.scriptResource("mu_counter.floop"));
		assertEquals(Value.of(5), floop.run(program));
		assertEquals(Value.of(5), floop.run(program));
	}

	@Test
	public void testRuntimeErrors() throws Exception {
		floopTest("undefined procedure").script("nowhere(1)").expectThrows(UndefinedProcedureException.class).runAndAssert();
		ArityMismatchException arity = (ArityMismatchException) floopTest("wrong arity")
				.script(FloopTestSupport.scriptResource("add.floop").replace("add(2, 3)", "add(2)"))
				.expectThrows(ArityMismatchException.class)
				.runAndAssert();
		assertEquals(2, arity.getExpected());
		assertEquals(1, arity.getActual());
		floopTest("quit of a block that does not enclose")
				.script("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN QUIT BLOCK 9; BLOCK 0: END f(1)")
				.expectThrows(UnmatchedQuitException.class)
				.runAndAssert();
		floopTest("abort of a block that is not a loop body")
				.script("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN ABORT LOOP 0; BLOCK 0: END f(1)")
				.expectThrows(UnmatchedAbortException.class)
				.runAndAssert();
	}

	@Test
	public void testBlockMismatchIsReportedBeforeRunning() throws Exception {
		BlockLabelMismatchException e = (BlockLabelMismatchException) floopTest("mismatched block")
				.scriptResource("mismatch.floop")
				.expectThrows(BlockLabelMismatchException.class)
				.runAndAssert();
		assertEquals(1, e.getOpenLabel());
		assertEquals(2, e.getCloseLabel());
		assertEquals("Block numbers do not match: 1 vs 2 (<command-line-supplied-script>:4:8)", e.getMessage());
	}

	@Test
	public void testBuildValidatesForeignTrees() throws Exception {
		ParseTree tree = new FloopParser().parse(FloopTestSupport.scriptResource("mismatch.floop"));
		BlockLabelMismatchException e = assertThrows(BlockLabelMismatchException.class, () -> new Floop().build(tree));
		assertTrue(e.getMessage().endsWith("(<parse-tree>:4:8)"));

		Program program = new Floop().build(new FloopParser().parse(FloopTestSupport.scriptResource("add.floop")));
		assertEquals(Value.of(5), new Floop().run(program));
	}
}
