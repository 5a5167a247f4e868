package org.metricshub.jfloop.runtime;

import static org.junit.Assert.*;

import java.math.BigInteger;
import org.junit.Test;

public class ValueTest {

	@Test
	public void testPrinting() {
		assertEquals("YES", Value.YES.toString());
		assertEquals("NO", Value.of(false).toString());
		assertEquals("42", Value.of(42).toString());
		assertEquals("CELL(3)", Value.cellReference(3).toString());
		assertEquals("OUTPUT", Value.cellReference(Value.OUTPUT_CELL).toString());
	}

	@Test
	public void testEquality() {
		assertEquals(Value.of(7), Value.of(BigInteger.valueOf(7)));
		assertEquals(Value.of(7).hashCode(), Value.of(BigInteger.valueOf(7)).hashCode());
		assertSame(Value.ZERO, Value.of(0));
		assertSame(Value.YES, Value.of(true));
		assertNotEquals(Value.of(1), Value.YES);
		assertNotEquals(Value.ZERO, Value.NO);
		assertEquals(Value.cellReference(2), Value.cellReference(2));
		assertNotEquals(Value.cellReference(2), Value.of(2));
	}

	@Test
	public void testTypes() {
		assertEquals(Value.Type.INTEGER, Value.of(1).getType());
		assertTrue(Value.of(1).isInteger());
		assertFalse(Value.of(1).isBoolean());
		assertEquals(Value.Type.BOOLEAN, Value.NO.getType());
		assertEquals(Value.Type.CELL_REFERENCE, Value.cellReference(0).getType());
		assertEquals(4, Value.cellReference(4).getIndex());
	}

	@Test
	public void testAccessors() {
		assertEquals(new BigInteger("123456789012345678901234567890"), Value.of(new BigInteger("123456789012345678901234567890")).integerValue());
		assertTrue(Value.YES.booleanValue());
		assertThrows(IllegalStateException.class, () -> Value.YES.integerValue());
		assertThrows(IllegalStateException.class, () -> Value.of(1).booleanValue());
		assertThrows(IllegalArgumentException.class, () -> Value.of(-1));
	}

	@Test
	public void testErrorMessages() {
		assertEquals("CELL(4) is read before being assigned", new UninitializedCellException(3, 4).getMessage());
		assertEquals("Cannot apply IF to INTEGER", new TypeMismatchException(1, "IF", Value.Type.INTEGER).getMessage());
		assertEquals("Procedure \"x\" is not defined", new UndefinedProcedureException(1, "x").getMessage());
		assertEquals("QUIT BLOCK 2 does not belong to any enclosing block", new UnmatchedQuitException(1, 2).getMessage());
		assertEquals("ABORT LOOP 2 does not belong to any enclosing loop", new UnmatchedAbortException(1, 2).getMessage());
		assertEquals(-1, new FloopRuntimeException("no line").getLineNumber());
	}
}
