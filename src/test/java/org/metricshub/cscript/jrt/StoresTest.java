package org.metricshub.cscript.jrt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class StoresTest {

	@Test
	public void testVariableStore() {
		VariableStore store = new VariableStore();
		assertNull(store.get("x"));
		store.define("x", Value.of(1), false);
		store.define("x", Value.of("one"), false);
		assertEquals(Value.of("one"), store.get("x"));
		assertTrue(store.contains("x"));
		assertFalse(store.isConstant("x"));
		assertEquals(1, store.size());
	}

	@Test
	public void testConstantsCannotBeRedefined() {
		VariableStore store = new VariableStore();
		store.define("pi", Value.of(3.14), true);
		assertTrue(store.isConstant("pi"));
		ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> store.define("pi", Value.of(3), false));
		assertEquals("Cannot redefine constant 'pi'", e.getMessage());
		assertThrows(ScriptRuntimeException.class, () -> store.define("pi", Value.of(3), true));
		assertEquals(Value.of(3.14), store.get("pi"));
	}

	@Test
	public void testListStore() {
		ListStore store = new ListStore();
		store.create("l");
		store.append("l", Value.of(1));
		store.append("l", Value.of("a"));
		store.append("l", Value.of(1));
		assertEquals(3, store.length("l"));
		assertTrue(store.remove("l", Value.of(1)));
		assertFalse(store.remove("l", Value.of(42)));
		assertEquals(Arrays.asList(Value.of("a"), Value.of(1)), store.get("l"));
		store.create("l");
		assertEquals(0, store.length("l"));
	}

	@Test
	public void testListStoreFilter() {
		ListStore store = new ListStore();
		store.create("l");
		for (int i = 1; i <= 5; i++) {
			store.append("l", Value.of(i));
		}
		store.filter("l", v -> v.toLong() % 2 == 1);
		assertEquals(Arrays.asList(Value.of(1), Value.of(3), Value.of(5)), store.get("l"));
		store.filter("l", v -> false);
		assertEquals(Collections.emptyList(), store.get("l"));
	}

	@Test
	public void testUndefinedList() {
		ListStore store = new ListStore();
		assertFalse(store.contains("nope"));
		ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> store.length("nope"));
		assertEquals("List 'nope' not defined", e.getMessage());
	}

	@Test
	public void testListViewIsReadOnly() {
		ListStore store = new ListStore();
		store.create("l");
		List<Value> view = store.get("l");
		assertThrows(UnsupportedOperationException.class, () -> view.add(Value.of(1)));
	}

	@Test
	public void testProcedureRegistry() {
		ProcedureRegistry registry = new ProcedureRegistry();
		registry.define(new Procedure("p", Arrays.asList("console.type(1);"), 2));
		assertTrue(registry.contains("p"));
		assertEquals(2, registry.lookup("p").getDefinitionLine());
		assertEquals(Arrays.asList("console.type(1);"), registry.lookup("p").getBody());
		registry.define(new Procedure("p", Collections.<String>emptyList(), 9));
		assertEquals(9, registry.lookup("p").getDefinitionLine());
		ScriptRuntimeException e = assertThrows(ScriptRuntimeException.class, () -> registry.lookup("q"));
		assertEquals("Procedure 'q' not defined", e.getMessage());
	}

	@Test
	public void testBuiltinFunctions() {
		assertEquals(BuiltinFunction.SQRT, BuiltinFunction.forName("sqrt"));
		assertNull(BuiltinFunction.forName("abs"));
		assertEquals("3.0", BuiltinFunction.SQRT.apply(Value.of(9)).toString());
		assertEquals("nan", BuiltinFunction.CBRT.apply(Value.of(-8)).toString());
		assertEquals(Value.of(2), BuiltinFunction.ROUND.apply(Value.of(2.5)));
		assertTrue(BuiltinFunction.ROUND.apply(Value.of(2.5)).isInteger());
		assertEquals(Value.of(-3), BuiltinFunction.FLOOR.apply(Value.of(-2.5)));
		assertEquals(Value.of(-2), BuiltinFunction.CEILING.apply(Value.of(-2.5)));
		assertEquals(Value.of(7), BuiltinFunction.FLOOR.apply(Value.of(7)));
		assertThrows(ScriptRuntimeException.class, () -> BuiltinFunction.SQRT.apply(Value.of("9")));
		assertThrows(ScriptRuntimeException.class, () -> BuiltinFunction.ROUND.apply(Value.of(Double.NaN)));
		assertThrows(ScriptRuntimeException.class, () -> BuiltinFunction.FLOOR.apply(Value.of(Double.POSITIVE_INFINITY)));
	}
}
