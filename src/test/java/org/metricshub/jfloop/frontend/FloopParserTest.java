package org.metricshub.jfloop.frontend;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.jfloop.frontend.ParseTree.Symbol;
import org.metricshub.jfloop.util.ScriptSource;

public class FloopParserTest {

	private static ParseTree parse(String script) throws Exception {
		return new FloopParser().parse(script);
	}

	@Test
	public void testProgramShape() throws Exception {
		ParseTree program = parse("DEFINE PROCEDURE \"add\" [A, B]:\n"
				+ "BLOCK 0: BEGIN\n"
				+ "  OUTPUT <= A + B;\n"
				+ "BLOCK 0: END\n"
				+ "add(2, 3)\n");
		assertEquals(Symbol.PROGRAM, program.getSymbol());
		assertEquals(2, program.getChildCount());

		ParseTree declaration = program.getChild(0);
		assertEquals(Symbol.DECLARATION, declaration.getSymbol());
		assertEquals("add", declaration.getChild(0).getText());
		assertEquals(2, declaration.getChild(1).getChildCount());
		assertEquals("B", declaration.getChild(1).getChild(1).getText());

		ParseTree block = declaration.getChild(2);
		assertEquals(Symbol.BLOCK, block.getSymbol());
		assertEquals("0", block.getChild(0).getText());
		assertEquals("0", block.getChild(2).getText());
		ParseTree assignment = block.getChild(1);
		assertEquals(Symbol.ASSIGNMENT, assignment.getSymbol());
		assertEquals(Symbol.OUTPUT, assignment.getChild(0).getSymbol());
		assertEquals(Symbol.BINARY, assignment.getChild(1).getSymbol());
		assertEquals("+", assignment.getChild(1).getChild(1).getText());
		assertEquals(3, assignment.getLine());

		ParseTree call = program.getChild(1);
		assertEquals(Symbol.CALL, call.getSymbol());
		assertEquals("add", call.getChild(0).getText());
		assertEquals("3", call.getChild(2).getText());
		assertEquals(5, call.getLine());
		assertEquals(1, call.getColumn());
	}

	@Test
	public void testStatements() throws Exception {
		ParseTree block = parse("DEFINE PROCEDURE \"p?\" [N]:\n"
				+ "BLOCK 0: BEGIN\n"
				+ "  LOOP N TIMES: BLOCK 1: BEGIN QUIT BLOCK 1; BLOCK 1: END\n"
				+ "  LOOP AT MOST 3 TIMES: BLOCK 2: BEGIN ABORT LOOP 2; BLOCK 2: END\n"
				+ "  MU-LOOP: BLOCK 3: BEGIN ABORT LOOP 3; BLOCK 3: END\n"
				+ "  IF CELL(0) = NO, THEN: BLOCK 4: BEGIN CELL(12) <= N; BLOCK 4: END\n"
				+ "BLOCK 0: END\n").getChild(0).getChild(2);
		assertEquals(Symbol.LOOP, block.getChild(1).getSymbol());
		assertEquals(Symbol.PARAMETER, block.getChild(1).getChild(0).getSymbol());
		assertEquals(Symbol.QUIT, block.getChild(1).getChild(1).getChild(1).getSymbol());
		assertEquals(Symbol.LOOP_AT_MOST, block.getChild(2).getSymbol());
		assertEquals(Symbol.ABORT, block.getChild(2).getChild(1).getChild(1).getSymbol());
		assertEquals(Symbol.MU_LOOP, block.getChild(3).getSymbol());
		assertEquals(Symbol.CONDITIONAL, block.getChild(4).getSymbol());
		ParseTree cell = block.getChild(4).getChild(1).getChild(1).getChild(0);
		assertEquals(Symbol.CELL, cell.getSymbol());
		assertEquals("12", cell.getText());
	}

	@Test
	public void testPositions() throws Exception {
		ParserException e = assertThrows(ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]:\nBLOCK 0: BEGIN\n  OUTPUT <= ;\nBLOCK 0: END"));
		assertEquals(3, e.getLineNumber());
		assertEquals(13, e.getColumnNumber());
		assertEquals(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, e.getSourceDescription());
	}

	@Test
	public void testLexerErrors() {
		assertThrows("leading zero", LexerException.class, () -> parse("f(007)"));
		assertThrows("unterminated name", LexerException.class, () -> parse("DEFINE PROCEDURE \"f [N]:"));
		assertThrows("unknown character", LexerException.class, () -> parse("f(1) $"));
		assertThrows("broken MU-LOOP", LexerException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN MU-LOP: BLOCK 0: END"));
	}

	@Test
	public void testGrammarErrors() {
		assertThrows("lowercase parameter", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [n]: BLOCK 0: BEGIN BLOCK 0: END"));
		assertThrows("duplicate parameter", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N, N]: BLOCK 0: BEGIN BLOCK 0: END"));
		assertThrows("no parameter", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" []: BLOCK 0: BEGIN BLOCK 0: END"));
		assertThrows("unknown parameter", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN OUTPUT <= M; BLOCK 0: END"));
		assertThrows("arithmetic as a test", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN IF N + 1, THEN: BLOCK 1: BEGIN BLOCK 1: END BLOCK 0: END"));
		assertThrows("integer as a test", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN IF N, THEN: BLOCK 1: BEGIN BLOCK 1: END BLOCK 0: END"));
		assertThrows("boolean loop bound", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN LOOP YES TIMES: BLOCK 1: BEGIN BLOCK 1: END BLOCK 0: END"));
		assertThrows("adding booleans", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN OUTPUT <= YES + 1; BLOCK 0: END"));
		assertThrows("block label too large", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 99999999999: BEGIN BLOCK 0: END"));
		assertThrows("two trailing calls", ParserException.class, () -> parse("f(1) g(2)"));
		assertThrows("unclosed block", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN OUTPUT <= 1;"));
		assertThrows("call without arguments", ParserException.class, () -> parse("f()"));
	}

	@Test
	public void testCarriageReturns() throws Exception {
		ParseTree program = parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN OUTPUT <= N;\rBLOCK 0: END\rf(4)");
		assertEquals(2, program.getChildCount());
		assertEquals("0", program.getChild(0).getChild(2).getChild(2).getText());
		assertEquals(3, program.getChild(1).getLine());

		ParserException e = assertThrows(
				ParserException.class,
				() -> parse("DEFINE PROCEDURE \"f\" [N]:\rBLOCK 0: BEGIN\r\n  OUTPUT <= ;\rBLOCK 0: END"));
		assertEquals(3, e.getLineNumber());
		assertEquals(13, e.getColumnNumber());
	}

	@Test
	public void testKeywordsAsParameters() throws Exception {
		ParseTree declaration = parse("DEFINE PROCEDURE \"f\" [AT, TIMES, END]:\n"
				+ "BLOCK 0: BEGIN\n"
				+ "  LOOP AT TIMES: BLOCK 1: BEGIN OUTPUT <= TIMES + END; BLOCK 1: END\n"
				+ "  LOOP AT MOST END TIMES: BLOCK 2: BEGIN BLOCK 2: END\n"
				+ "BLOCK 0: END").getChild(0);
		assertEquals("TIMES", declaration.getChild(1).getChild(1).getText());
		ParseTree block = declaration.getChild(2);

		ParseTree loop = block.getChild(1);
		assertEquals(Symbol.LOOP, loop.getSymbol());
		assertEquals(Symbol.PARAMETER, loop.getChild(0).getSymbol());
		assertEquals("AT", loop.getChild(0).getText());
		ParseTree sum = loop.getChild(1).getChild(1).getChild(1);
		assertEquals(Symbol.PARAMETER, sum.getChild(2).getSymbol());
		assertEquals("END", sum.getChild(2).getText());

		ParseTree atMost = block.getChild(2);
		assertEquals(Symbol.LOOP_AT_MOST, atMost.getSymbol());
		assertEquals("END", atMost.getChild(0).getText());
	}

	@Test
	public void testValueKeywordsAreReserved() {
		ParserException yes = assertThrows(ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [YES]: BLOCK 0: BEGIN BLOCK 0: END"));
		assertEquals("Reserved word YES cannot be a parameter name", yes.getDetail());
		assertThrows("OUTPUT", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [N, OUTPUT]: BLOCK 0: BEGIN BLOCK 0: END"));
		assertThrows("CELL", ParserException.class, () -> parse("DEFINE PROCEDURE \"f\" [CELL]: BLOCK 0: BEGIN BLOCK 0: END"));
		assertThrows(
				"undeclared keyword",
				ParserException.class,
				() -> parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN OUTPUT <= AT; BLOCK 0: END"));
	}

	@Test
	public void testLabelsAreNotCheckedByTheParser() throws Exception {
		ParseTree block = parse("DEFINE PROCEDURE \"f\" [N]: BLOCK 1: BEGIN BLOCK 2: END").getChild(0).getChild(2);
		assertEquals("1", block.getChild(0).getText());
		assertEquals("2", block.getChild(1).getText());
	}

	@Test
	public void testDump() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		parse("f(CELL(4), 7)").dump(new PrintStream(out, true, StandardCharsets.UTF_8));
		assertArrayEquals(
				new String[] { "PROGRAM", " CALL", "  NAME(f)", "  CELL(4)", "  NUMBER(7)" },
				out.toString(StandardCharsets.UTF_8).split("\\R"));
	}
}
