package org.metricshub.jfloop.jsr223;

import static org.junit.Assert.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import javax.script.ScriptContext;
import javax.script.ScriptEngine;
import javax.script.ScriptEngineManager;
import javax.script.ScriptException;
import org.junit.Test;
import org.metricshub.jfloop.runtime.UndefinedProcedureException;
import org.metricshub.jfloop.runtime.Value;

public class FloopScriptEngineTest {

	private static final String ADD = "DEFINE PROCEDURE \"add\" [A, B]: BLOCK 0: BEGIN OUTPUT <= A + B; BLOCK 0: END\n";

	@Test
	public void testFloopScriptEngine() throws Exception {
		ScriptEngineManager manager = new ScriptEngineManager();
		ScriptEngine engine = manager.getEngineByName("jfloop");
		assertNotNull("Jfloop ScriptEngine not found", engine);
		assertNotNull(manager.getEngineByExtension("floop"));

		assertEquals(Value.of(5), engine.eval(ADD + "add(2, 3)"));
		assertNull(engine.eval(ADD));
	}

	@Test
	public void testEcho() throws Exception {
		ScriptEngine engine = new FloopScriptEngineFactory().getScriptEngine();
		StringWriter result = new StringWriter();
		engine.getContext().setWriter(new PrintWriter(result));
		engine.eval(ADD + "add(1, 1)");
		assertEquals("", result.toString());

		engine.getContext().setAttribute(FloopScriptEngine.ECHO_ATTRIBUTE, Boolean.TRUE, ScriptContext.ENGINE_SCOPE);
		engine.eval(ADD + "add(1, 1)");
		assertEquals("Result: 2", result.toString().trim());
	}

	@Test
	public void testFailures() {
		ScriptEngine engine = new FloopScriptEngineFactory().getScriptEngine();
		ScriptException runtime = assertThrows(ScriptException.class, () -> engine.eval("nowhere(1)"));
		assertTrue(runtime.getCause() instanceof UndefinedProcedureException);
		assertEquals(1, runtime.getLineNumber());

		ScriptException syntax = assertThrows(ScriptException.class, () -> engine.eval("DEFINE PROCEDURE \"f\" [N]:\nBLOCK 0: BEGIN BLOCK 1: END"));
		assertEquals(2, syntax.getLineNumber());
		assertEquals(7, syntax.getColumnNumber());
	}

	@Test
	public void testFactory() {
		FloopScriptEngineFactory factory = new FloopScriptEngineFactory();
		assertEquals("floop", factory.getLanguageName());
		assertEquals("Jfloop", factory.getParameter(ScriptEngine.ENGINE));
		assertEquals("add(A, B)", factory.getMethodCallSyntax("ignored", "add", "A", "B"));
		assertThrows(UnsupportedOperationException.class, () -> factory.getOutputStatement("x"));
	}
}
