package org.metricshub.cscript.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.cscript.CScriptTestSupport.program;
import static org.metricshub.cscript.CScriptTestSupport.scriptTest;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.Test;
import org.metricshub.cscript.CScriptTestSupport.TestResult;
import org.metricshub.cscript.frontend.ParserException;
import org.metricshub.cscript.frontend.Preprocessor;
import org.metricshub.cscript.jrt.ScriptRuntimeException;
import org.metricshub.cscript.jrt.Value;
import org.metricshub.cscript.util.ScriptSettings;

public class InterpreterTest {

	private static Interpreter interpret(String script) {
		ScriptSettings settings = new ScriptSettings();
		settings.setOutputStream(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
		Interpreter interpreter = new Interpreter(settings);
		interpreter.interpret(Preprocessor.preprocess(script));
		return interpreter;
	}

	@Test
	public void testHelloWorld() {
		scriptTest("hello world").program("console.type(\"Hello, World!\");").expectLines("Hello, World!").runAndAssert();
	}

	@Test
	public void testMissingEntryHeader() {
		TestResult result = scriptTest("missing entry header")
				.script("console.type(\"never\");\nEnd;\n")
				.expectThrow(ScriptRuntimeException.class, "Program must start with When container main(int):")
				.run();
		result.assertExpected();
		assertEquals("", result.output());
		assertEquals(1, ((ScriptRuntimeException) result.thrownException()).getLineNumber());
	}

	@Test
	public void testEmptyProgram() {
		scriptTest("empty program")
				.script("# nothing here\n\n")
				.expectThrow(ScriptRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testBareEndStopsTheProgram() {
		scriptTest("statements after the closing End; are not run")
				.script("When container main(int):\nconsole.type(\"a\");\nEnd;\nconsole.type(\"b\");\nEnd;\n")
				.expectLines("a")
				.runAndAssert();
	}

	@Test
	public void testCommentsAreIgnored() {
		scriptTest("comments")
				.script(
						"When container main(int):\n"
								+ "# a single line comment\n"
								+ "//\n"
								+ "console.type(\"hidden\");\n"
								+ "\\\\\n"
								+ "   console.type(\"shown\");   \n"
								+ "End;\n")
				.expectLines("shown")
				.runAndAssert();
	}

	@Test
	public void testPlusConcatenates() {
		scriptTest("plus is concatenation")
				.program("def var x = 2;", "console.type(x + 3);", "console.type(\"a\" + 1.5 + \"b\");")
				.expectLines("23", "a1.5b")
				.runAndAssert();
	}

	@Test
	public void testArithmeticAssociatesToTheRight() {
		scriptTest("right associative arithmetic")
				.program(
						"console.type(8 - 4 - 2);",
						"console.type(10 - 4 * 2);",
						"console.type(2 * 3 - 1);",
						"console.type(2 ** 10);",
						"console.type(2 ** 3 ** 2);")
				.expectLines("6", "12", "4", "1024", "512")
				.runAndAssert();
	}

	@Test
	public void testDivisionIsAlwaysFloat() {
		scriptTest("true division")
				.program("console.type(7 / 2);", "console.type(4 / 2);", "console.type(1 / 4);")
				.expectLines("3.5", "2.0", "0.25")
				.runAndAssert();
	}

	@Test
	public void testDivisionByZero() {
		TestResult result = scriptTest("division by zero")
				.program("console.type(\"before\");", "console.type(1 / 0);", "console.type(\"after\");")
				.expectThrow(ScriptRuntimeException.class, "Division by zero")
				.expectLines("before")
				.run();
		result.assertExpected();
		assertEquals(3, ((ScriptRuntimeException) result.thrownException()).getLineNumber());
	}

	@Test
	public void testMathFunctions() {
		scriptTest("math functions")
				.program(
						"console.type(sqrt(16));",
						"console.type(cbrt(8));",
						"console.type(floor(2.7));",
						"console.type(ceiling(2.1));",
						"console.type(round(2.5));",
						"console.type(round(3.5));",
						"console.type(sqrt(16) - 1);")
				.expectLines("4.0", "2.0", "2", "3", "2", "4", "3.0")
				.runAndAssert();
	}

	@Test
	public void testSqrtOfNegative() {
		scriptTest("sqrt of a negative number")
				.program("def var x = 0 - 4;", "console.type(sqrt(x));")
				.expectThrow(ScriptRuntimeException.class, "math domain error")
				.runAndAssert();
	}

	@Test
	public void testUndefinedVariable() {
		scriptTest("undefined variable")
				.program("console.type(y);")
				.expectThrow(ScriptRuntimeException.class, "Undefined variable 'y'")
				.runAndAssert();
	}

	@Test
	public void testStringArithmeticFails() {
		scriptTest("string operand")
				.program("console.type(\"a\" - 1);")
				.expectThrow(ScriptRuntimeException.class, "Unsupported operand types for -: string and integer")
				.runAndAssert();
	}

	@Test
	public void testUnknownStatement() {
		TestResult result = scriptTest("unknown statement")
				.program("console.type(1);", "frobnicate now;")
				.expectThrow(ParserException.class, "Unknown statement: frobnicate now;")
				.expectLines("1")
				.run();
		result.assertExpected();
		assertEquals(3, ((ScriptRuntimeException) result.thrownException()).getLineNumber());
	}

	@Test
	public void testRedefineVariable() {
		scriptTest("variables can be redefined")
				.program("def var x = 1;", "def var x = x - 5;", "console.type(x);")
				.expectLines("-4")
				.runAndAssert();
	}

	@Test
	public void testConstantCannotBeRedefined() {
		TestResult result = scriptTest("constants")
				.program("def const x = 1;", "console.type(x);", "def var x = 2;")
				.expectThrow(ScriptRuntimeException.class, "Cannot redefine constant 'x'")
				.expectLines("1")
				.run();
		result.assertExpected();
		assertEquals(4, ((ScriptRuntimeException) result.thrownException()).getLineNumber());
	}

	@Test
	public void testIntegerInput() {
		scriptTest("integer input")
				.program("def var n = input from \"Number\";", "console.type(n - 1);")
				.input("Number", "41")
				.expectLines("40")
				.runAndAssert();
	}

	@Test
	public void testFloatInput() {
		scriptTest("float input")
				.program("def var n = input from \"Number\";", "console.type(n * 2);")
				.input("Number", "2.5")
				.expectLines("5.0")
				.runAndAssert();
	}

	@Test
	public void testStringInput() {
		scriptTest("string input")
				.program("def var name = input from \"Your name\";", "console.type(\"Hello \" + name);")
				.input("Your name", "Ada")
				.expectLines("Hello Ada")
				.runAndAssert();
	}

	@Test
	public void testMissingInputIsEmpty() {
		scriptTest("missing input")
				.program("def var n = input from \"Unknown\";", "console.type(\"[\" + n + \"]\");")
				.expectLines("[]")
				.runAndAssert();
	}

	@Test
	public void testIfElse() {
		String[] statements = {
				"def var x = input from \"x\";",
				"if x > 3:",
				"console.type(\"big\");",
				"End;",
				"else:",
				"console.type(\"small\");",
				"End;",
				"console.type(\"done\");" };
		scriptTest("if taken").program(statements).input("x", "5").expectLines("big", "done").runAndAssert();
		scriptTest("else taken").program(statements).input("x", "1").expectLines("small", "done").runAndAssert();
		scriptTest("legacy else never runs")
				.program(statements)
				.input("x", "1")
				.legacy()
				.expectLines("done")
				.runAndAssert();
	}

	@Test
	public void testElseWithoutIf() {
		scriptTest("dangling else")
				.program("else:", "console.type(\"x\");", "End;")
				.expectThrow(ScriptRuntimeException.class, "else: must directly follow an if block")
				.runAndAssert();
	}

	@Test
	public void testElseAfterLoopEndingWithIf() {
		scriptTest("else after a while whose body ends with an if")
				.program(
						"def var i = 1;",
						"while i > 0:",
						"def var i = i - 1;",
						"if 1 == 2:",
						"End;",
						"End;",
						"else:",
						"console.type(\"leaked\");",
						"End;")
				.expectThrow(ScriptRuntimeException.class, "else: must directly follow an if block")
				.runAndAssert();
	}

	@Test
	public void testElseAfterElseEndingWithIf() {
		scriptTest("second else after an else body ending with an if")
				.program(
						"if 1 == 2:",
						"End;",
						"else:",
						"if 1 == 2:",
						"End;",
						"End;",
						"else:",
						"console.type(\"leaked\");",
						"End;")
				.expectThrow(ScriptRuntimeException.class, "else: must directly follow an if block")
				.runAndAssert();
	}

	@Test
	public void testNotAndComparisons() {
		scriptTest("not and comparisons")
				.program(
						"if not 1 > 2:",
						"console.type(\"not\");",
						"End;",
						"if \"a\" == 1:",
						"console.type(\"never\");",
						"End;",
						"if \"a\" != 1:",
						"console.type(\"ne\");",
						"End;",
						"if 2 == 2.0:",
						"console.type(\"eq\");",
						"End;",
						"if \"abc\" < \"abd\":",
						"console.type(\"lt\");",
						"End;")
				.expectLines("not", "ne", "eq", "lt")
				.runAndAssert();
	}

	@Test
	public void testOrderingStringAgainstNumber() {
		scriptTest("ordering a string against a number")
				.program("if \"a\" < 1:", "console.type(\"x\");", "End;")
				.expectThrow(ScriptRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testWhileLoop() {
		scriptTest("countdown")
				.program(
						"def var i = 3;",
						"while i > 0:",
						"console.type(i);",
						"def var i = i - 1;",
						"End;",
						"console.type(\"liftoff\");")
				.expectLines("3", "2", "1", "liftoff")
				.runAndAssert();
	}

	@Test
	public void testWhileConditionFalseFromTheStart() {
		scriptTest("loop never entered")
				.program("def var i = 0;", "while i > 0:", "console.type(i);", "End;", "console.type(\"done\");")
				.expectLines("done")
				.runAndAssert();
	}

	@Test
	public void testBreak() {
		scriptTest("break leaves the loop")
				.program(
						"def var i = 5;",
						"while i > 0:",
						"if i == 3:",
						"break;",
						"End;",
						"console.type(i);",
						"def var i = i - 1;",
						"End;",
						"console.type(\"after\");")
				.expectLines("5", "4", "after")
				.runAndAssert();
	}

	@Test
	public void testSkip() {
		scriptTest("skip continues the loop")
				.program(
						"def var i = 4;",
						"while i > 0:",
						"def var i = i - 1;",
						"if i == 2:",
						"skip;",
						"End;",
						"console.type(i);",
						"End;")
				.expectLines("3", "1", "0")
				.runAndAssert();
	}

	@Test
	public void testBreakOutsideLoop() {
		scriptTest("break outside of a loop")
				.program("break;")
				.expectThrow(ScriptRuntimeException.class, "break; used outside of a loop")
				.runAndAssert();
	}

	@Test
	public void testLegacyBreakLeavesOnlyTheIfBlock() {
		scriptTest("legacy break")
				.program(
						"def var i = 3;",
						"while i > 0:",
						"if i == 2:",
						"break;",
						"console.type(\"unreachable\");",
						"End;",
						"console.type(i);",
						"def var i = i - 1;",
						"End;")
				.legacy()
				.expectLines("3", "2", "1")
				.runAndAssert();
	}

	@Test
	public void testLegacyBreakAtTopLevelEndsTheProgram() {
		scriptTest("legacy top-level break")
				.program("console.type(\"a\");", "skip;", "console.type(\"b\");")
				.legacy()
				.expectLines("a")
				.runAndAssert();
	}

	@Test
	public void testReturnIsIgnored() {
		scriptTest("return")
				.program("return", "console.type(\"still running\");")
				.expectLines("still running")
				.runAndAssert();
	}

	@Test
	public void testMissingBlockEnd() {
		scriptTest("unterminated block")
				.script("When container main(int):\nwhile 1:\nconsole.type(1);\n")
				.expectThrow(ScriptRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testStepLimit() {
		TestResult result = scriptTest("infinite loop")
				.program("while 1:", "console.type(\"x\");", "End;")
				.maxSteps(10)
				.expectThrow(ScriptRuntimeException.class, "Step limit of 10 exceeded")
				.run();
		result.assertExpected();
		assertFalse(result.lines().isEmpty());
	}

	@Test
	public void testProcedureCalls() {
		scriptTest("procedure")
				.program(
						"def procedure greet:",
						"console.type(\"hi\");",
						"End;",
						"console.type(\"defined\");",
						"call greet;",
						"call greet;")
				.expectLines("defined", "hi", "hi")
				.runAndAssert();
	}

	@Test
	public void testProcedureWithEmptyParentheses() {
		scriptTest("procedure defined and called with ()")
				.program(
						"def procedure greet():",
						"console.type(\"hi\");",
						"End;",
						"call greet();")
				.expectLines("hi")
				.runAndAssert();
	}

	@Test
	public void testProcedureSeesCurrentGlobals() {
		scriptTest("procedures share the global variables")
				.program(
						"def var x = 1;",
						"def procedure show:",
						"console.type(x);",
						"def var x = x - 1;",
						"End;",
						"def var x = 7;",
						"call show;",
						"console.type(x);")
				.expectLines("7", "6")
				.runAndAssert();
	}

	@Test
	public void testProcedureWithBlocks() {
		scriptTest("procedure body containing a loop")
				.program(
						"def procedure count:",
						"def var i = 2;",
						"while i > 0:",
						"console.type(i);",
						"def var i = i - 1;",
						"End;",
						"End;",
						"call count;",
						"console.type(\"end\");")
				.expectLines("2", "1", "end")
				.runAndAssert();
	}

	@Test
	public void testUndefinedProcedure() {
		scriptTest("undefined procedure")
				.program("call nope;")
				.expectThrow(ScriptRuntimeException.class, "Procedure 'nope' not defined")
				.runAndAssert();
	}

	@Test
	public void testNestedProcedureDefinition() {
		scriptTest("nested procedure")
				.program("def procedure outer:", "def procedure inner:", "End;", "End;")
				.expectThrow(ScriptRuntimeException.class, "Nested procedure definitions are not supported")
				.runAndAssert();
	}

	@Test
	public void testRecursionLimit() {
		scriptTest("unbounded recursion")
				.program("def procedure again:", "call again;", "End;", "call again;")
				.maxCallDepth(50)
				.expectThrow(ScriptRuntimeException.class, "Maximum recursion depth exceeded")
				.runAndAssert();
	}

	@Test
	public void testBreakInsideProcedureCalledFromLoop() {
		scriptTest("break does not cross a procedure call")
				.program("def procedure stop:", "break;", "End;", "while 1:", "call stop;", "End;")
				.expectThrow(ScriptRuntimeException.class, "break; used outside of a loop")
				.runAndAssert();
	}

	@Test
	public void testListLength() {
		scriptTest("list length")
				.program(
						"create list(\"nums\");",
						"List nums length();",
						"append(\"nums\", 1);",
						"append(\"nums\", \"two\");",
						"append(\"nums\", 3.0);",
						"List nums length();")
				.expectLines("0", "3")
				.runAndAssert();
	}

	@Test
	public void testRemove() {
		scriptTest("remove")
				.program(
						"create list(\"nums\");",
						"append(\"nums\", 1);",
						"append(\"nums\", 2);",
						"append(\"nums\", 1);",
						"remove(\"nums\", 5);",
						"List nums length();",
						"remove(\"nums\", 1);",
						"List nums length();")
				.expectLines("3", "2")
				.runAndAssert();
	}

	@Test
	public void testRemoveKeepsLaterDuplicates() {
		Interpreter interpreter = interpret(
				program(
						"create list(\"l\");",
						"append(\"l\", 1);",
						"append(\"l\", 2);",
						"append(\"l\", 1);",
						"remove(\"l\", 1.0);"));
		assertEquals(Arrays.asList(Value.of(2), Value.of(1)), interpreter.getLists().get("l"));
	}

	@Test
	public void testFilter() {
		Interpreter interpreter = interpret(
				program(
						"create list(\"nums\");",
						"append(\"nums\", 1);",
						"append(\"nums\", 2);",
						"filter(\"nums\", $$ > 1);"));
		assertEquals(Arrays.asList(Value.of(2)), interpreter.getLists().get("nums"));
	}

	@Test
	public void testFilterWithVariable() {
		scriptTest("filter against a variable")
				.program(
						"def var limit = 2;",
						"create list(\"nums\");",
						"append(\"nums\", 1);",
						"append(\"nums\", 2);",
						"append(\"nums\", 3);",
						"filter(\"nums\", not $$ < limit);",
						"List nums length();")
				.expectLines("2")
				.runAndAssert();
	}

	@Test
	public void testFilterFailureLeavesListUntouched() {
		ScriptSettings settings = new ScriptSettings();
		settings.setOutputStream(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
		Interpreter interpreter = new Interpreter(settings);
		assertThrows(
				ScriptRuntimeException.class,
				() -> interpreter
						.interpret(
								Preprocessor
										.preprocess(
												program(
														"create list(\"l\");",
														"append(\"l\", 1);",
														"append(\"l\", \"x\");",
														"filter(\"l\", $$ > 0);"))));
		assertEquals(Arrays.asList(Value.of(1), Value.of("x")), interpreter.getLists().get("l"));
	}

	@Test
	public void testPlaceholderOutsideFilter() {
		scriptTest("placeholder outside of a filter")
				.program("console.type($$);")
				.expectThrow(ScriptRuntimeException.class)
				.runAndAssert();
	}

	@Test
	public void testUndefinedList() {
		scriptTest("undefined list")
				.program("append(\"missing\", 1);")
				.expectThrow(ScriptRuntimeException.class, "List 'missing' not defined")
				.runAndAssert();
	}

	@Test
	public void testListAndVariableNamespacesAreSeparate() {
		Interpreter interpreter = interpret(
				program("def var items = 5;", "create list(\"items\");", "append(\"items\", items);"));
		assertEquals(Value.of(5), interpreter.getVariables().get("items"));
		assertEquals(Arrays.asList(Value.of(5)), interpreter.getLists().get("items"));
	}

	@Test
	public void testRunStateIsExposed() {
		Interpreter interpreter = interpret(
				program("def const answer = 42;", "def procedure p:", "console.type(1);", "End;"));
		assertTrue(interpreter.getVariables().isConstant("answer"));
		assertTrue(interpreter.getProcedures().contains("p"));
		assertEquals(2, interpreter.getSteps());
	}
}
