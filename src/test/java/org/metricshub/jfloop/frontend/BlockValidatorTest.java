package org.metricshub.jfloop.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jfloop.frontend.ParseTree.Symbol;

public class BlockValidatorTest {

	private static final String NESTED = "DEFINE PROCEDURE \"f\" [N]:\n"
			+ "BLOCK 0: BEGIN\n"
			+ "  LOOP N TIMES:\n"
			+ "  BLOCK 1: BEGIN\n"
			+ "    IF N = 1, THEN:\n"
			+ "    BLOCK 2: BEGIN\n"
			+ "      QUIT BLOCK 0;\n"
			+ "    BLOCK %s: END\n"
			+ "  BLOCK %s: END\n"
			+ "BLOCK %s: END\n";

	private static ParseTree parse(String open2, String open1, String open0) throws Exception {
		return new FloopParser().parse(String.format(NESTED, open2, open1, open0));
	}

	@Test
	public void testMatchingLabelsPass() throws Exception {
		new BlockValidator().validate(parse("2", "1", "0"));
	}

	@Test
	public void testMismatch() throws Exception {
		BlockLabelMismatchException e = assertThrows(
				BlockLabelMismatchException.class,
				() -> new BlockValidator("f.floop").validate(parse("2", "1", "7")));
		assertEquals(0, e.getOpenLabel());
		assertEquals(7, e.getCloseLabel());
		assertEquals("Block numbers do not match: 0 vs 7 (f.floop:2:7)", e.getMessage());
		assertEquals("Block numbers do not match: 0 vs 7", e.getDetail());
	}

	@Test
	public void testFirstMismatchInSourceOrderWins() throws Exception {
		BlockLabelMismatchException e = assertThrows(
				BlockLabelMismatchException.class,
				() -> new BlockValidator().validate(parse("3", "4", "0")));
		assertEquals(1, e.getOpenLabel());
		assertEquals(4, e.getCloseLabel());
		assertEquals(4, e.getLineNumber());
		assertEquals(BlockValidator.DESCRIPTION_PARSE_TREE, e.getSourceDescription());
	}

	@Test
	public void testHandBuiltTree() {
		ParseTree block = ParseTree.node(Symbol.BLOCK, 1, 1, Arrays.asList(
				ParseTree.leaf(Symbol.LABEL, "5", 1, 7),
				ParseTree.leaf(Symbol.LABEL, "6", 2, 7)));
		ParseTree program = ParseTree.node(Symbol.PROGRAM, 1, 1, Collections.singletonList(block));
		BlockLabelMismatchException e = assertThrows(BlockLabelMismatchException.class, () -> new BlockValidator().validate(program));
		assertEquals(5, e.getOpenLabel());
		assertEquals(1, e.getLineNumber());
		assertEquals(7, e.getColumnNumber());
	}

	@Test
	public void testLabelsMayRepeatAcrossBlocks() throws Exception {
		new BlockValidator().validate(new FloopParser().parse(
				"DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN LOOP 1 TIMES: BLOCK 0: BEGIN BLOCK 0: END BLOCK 0: END"));
	}
}
