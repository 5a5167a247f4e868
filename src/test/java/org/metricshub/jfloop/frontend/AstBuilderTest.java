package org.metricshub.jfloop.frontend;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.jfloop.ast.Assignment;
import org.metricshub.jfloop.ast.BinaryExpression;
import org.metricshub.jfloop.ast.Block;
import org.metricshub.jfloop.ast.Call;
import org.metricshub.jfloop.ast.CellExpression;
import org.metricshub.jfloop.ast.Conditional;
import org.metricshub.jfloop.ast.Declaration;
import org.metricshub.jfloop.ast.Literal;
import org.metricshub.jfloop.ast.Loop;
import org.metricshub.jfloop.ast.ParameterExpression;
import org.metricshub.jfloop.ast.Program;
import org.metricshub.jfloop.ast.Quit;
import org.metricshub.jfloop.frontend.ParseTree.Symbol;
import org.metricshub.jfloop.runtime.Value;

public class AstBuilderTest {

	private static Program build(String script) throws Exception {
		return new AstBuilder().build(new FloopParser().parse(script));
	}

	@Test
	public void testDeclarationAndCall() throws Exception {
		Program program = build("DEFINE PROCEDURE \"equal?\" [A, B]:\n"
				+ "BLOCK 0: BEGIN\n"
				+ "  OUTPUT <= A = B;\n"
				+ "BLOCK 0: END\n"
				+ "equal?(1, CELL(2))");
		assertEquals(1, program.getDeclarations().size());
		Declaration declaration = program.getDeclarations().get(0);
		assertEquals("equal?", declaration.getName());
		assertTrue(declaration.isPredicate());
		assertEquals(Arrays.asList("A", "B"), declaration.getParameters());
		assertEquals(0, declaration.getBody().getLabel());

		Assignment assignment = (Assignment) declaration.getBody().getStatements().get(0);
		assertTrue(assignment.getTarget().isOutput());
		assertEquals(Value.OUTPUT_CELL, assignment.getTarget().getIndex());
		BinaryExpression equal = (BinaryExpression) assignment.getValue();
		assertEquals(BinaryExpression.Operator.EQUAL, equal.getOperator());
		assertEquals("A", ((ParameterExpression) equal.getLeft()).getName());
		assertEquals(3, assignment.getLineNumber());

		Call call = program.getCall();
		assertTrue(call.isPredicate());
		assertEquals(Value.of(1), ((Literal) call.getArguments().get(0)).getValue());
		assertEquals(2, ((CellExpression) call.getArguments().get(1)).getIndex());
	}

	@Test
	public void testLoopSpellingsBuildTheSameShape() throws Exception {
		Block body = build("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN\n"
				+ "LOOP 3 TIMES: BLOCK 1: BEGIN BLOCK 1: END\n"
				+ "LOOP AT MOST 3 TIMES: BLOCK 2: BEGIN BLOCK 2: END\n"
				+ "MU-LOOP: BLOCK 3: BEGIN QUIT BLOCK 3; BLOCK 3: END\n"
				+ "BLOCK 0: END").getDeclarations().get(0).getBody();
		Loop exactly = (Loop) body.getStatements().get(0);
		Loop atMost = (Loop) body.getStatements().get(1);
		Loop mu = (Loop) body.getStatements().get(2);
		assertFalse(exactly.isMuLoop());
		assertFalse(atMost.isMuLoop());
		assertEquals(((Literal) exactly.getBound()).getValue(), ((Literal) atMost.getBound()).getValue());
		assertTrue(mu.isMuLoop());
		assertNull(mu.getBound());
		assertEquals(3, mu.getBody().getLabel());
		assertEquals(3, ((Quit) mu.getBody().getStatements().get(0)).getBlockLabel());
	}

	@Test
	public void testConditionalWithBooleanLiteral() throws Exception {
		Block body = build("DEFINE PROCEDURE \"f\" [N]: BLOCK 0: BEGIN IF YES, THEN: BLOCK 1: BEGIN CELL(3) <= NO; BLOCK 1: END BLOCK 0: END")
				.getDeclarations()
				.get(0)
				.getBody();
		Conditional conditional = (Conditional) body.getStatements().get(0);
		assertEquals(Value.YES, ((Literal) conditional.getTest()).getValue());
		Assignment assignment = (Assignment) conditional.getThenBlock().getStatements().get(0);
		assertEquals(3, assignment.getTarget().getIndex());
		assertEquals(Value.NO, ((Literal) assignment.getValue()).getValue());
	}

	@Test
	public void testDump() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		build("DEFINE PROCEDURE \"add\" [A, B]: BLOCK 0: BEGIN OUTPUT <= A + B; BLOCK 0: END add(2, 3)")
				.dump(new PrintStream(out, true, StandardCharsets.UTF_8));
		String[] lines = out.toString(StandardCharsets.UTF_8).split("\\R");
		assertArrayEquals(
				new String[] {
						"Program",
						" Declaration \"add\" [A, B]",
						"  Block 0",
						"   Assignment",
						"    Output",
						"    Binary +",
						"     Parameter A",
						"     Parameter B",
						" Call add",
						"  Literal 2",
						"  Literal 3" },
				lines);
	}

	@Test
	public void testUnexpectedShape() {
		ParseTree notAProgram = ParseTree.leaf(Symbol.NUMBER, "1", 1, 1);
		assertThrows(IllegalArgumentException.class, () -> new AstBuilder().build(notAProgram));
		ParseTree callFirst = ParseTree.node(Symbol.PROGRAM, 1, 1, Arrays.asList(
				ParseTree.node(Symbol.CALL, 1, 1, Arrays.asList(ParseTree.leaf(Symbol.NAME, "f", 1, 1), ParseTree.leaf(Symbol.NUMBER, "1", 1, 3))),
				ParseTree.node(Symbol.CALL, 2, 1, Arrays.asList(ParseTree.leaf(Symbol.NAME, "g", 2, 1), ParseTree.leaf(Symbol.NUMBER, "1", 2, 3)))));
		assertThrows(IllegalArgumentException.class, () -> new AstBuilder().build(callFirst));
	}
}
