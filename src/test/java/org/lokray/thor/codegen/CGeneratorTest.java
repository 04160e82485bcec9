package org.lokray.thor.codegen;

import org.junit.jupiter.api.Test;
import org.lokray.thor.ast.ModuleSegment;
import org.lokray.thor.ast.Program;
import org.lokray.thor.parser.SourceFileParser;
import org.lokray.thor.util.CompilationException;
import org.lokray.thor.util.CompilerConfig;
import org.lokray.thor.util.ErrorKind;
import org.lokray.thor.util.ErrorReporter;

import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CGeneratorTest
{
	private static Program parse(String... lines)
	{
		return new SourceFileParser(new ErrorReporter()).parse(String.join("\n", lines), "test.thor");
	}

	private static ModuleSegment module(String name, String qualifier, boolean main, String... lines)
	{
		return new ModuleSegment(name, qualifier, null, false, main, parse(lines).getStatements());
	}

	private static String generate(String... lines)
	{
		return new CGenerator().generate(parse(lines)).getSource();
	}

	private static void assertBalanced(String c)
	{
		int depth = 0;
		boolean inString = false;
		for (int i = 0; i < c.length(); i++)
		{
			char ch = c.charAt(i);
			if (inString)
			{
				if (ch == '\\')
				{
					i++;
				}
				else if (ch == '"')
				{
					inString = false;
				}
			}
			else if (ch == '"')
			{
				inString = true;
			}
			else if (ch == '{')
			{
				depth++;
			}
			else if (ch == '}')
			{
				depth--;
				assertTrue(depth >= 0, c);
			}
		}
		assertEquals(0, depth, c);
	}

	@Test
	public void testReferenceParametersLowerToPointers()
	{
		String c = generate(
				"func bump(ref int value) { value = value + 1; }",
				"func twice(ref int value) { bump(value); bump(value); }",
				"func main() { int x = 1; bump(x); bump(2); }");

		assertTrue(c.contains("void bump(int* value);"), c);
		assertTrue(c.contains("    (*value) = (*value) + 1;"), c);
		assertTrue(c.contains("    bump(value);"), c);
		assertTrue(c.contains("    bump(&x);"), c);
		assertTrue(c.contains("    bump(&(int){2});"), c);
	}

	@Test
	public void testFormatStringLowering()
	{
		String c = generate(
				"func main() {",
				"    bool ok = true;",
				"    string s = \"%s and %s (%s) 100%\" % [\"a\", 5, ok];",
				"}");

		assertTrue(c.contains("char* s = thor_format(\"%s and %g (%s) 100%%\", \"a\", (double)(5), (ok ? \"true\" : \"false\"));"), c);
		assertTrue(c.contains("char* thor_format(const char* format, ...) {"), c);
		assertTrue(c.contains("vsnprintf(buffer, 1024, format, args);"), c);
	}

	@Test
	public void testFormatArityMismatch()
	{
		CompilationException e = assertThrows(CompilationException.class,
				() -> generate("func main() { string s = \"%s %s\" % [1]; }"));

		assertEquals(ErrorKind.FORMAT_ARITY_MISMATCH, e.getKind());
		assertEquals(1, e.getLine());
	}

	@Test
	public void testModulesWithTheSameFunctionNameGetDistinctPrefixes()
	{
		Program merged = Program.merged(null, List.of(
				module("math", "math", false, "func add(int a, int b) -> int { return a + b; }"),
				module("vec", "vec", false, "func add(int a, int b) -> int { return a - b; }", "func twice(int a) -> int { return add(a, a); }"),
				module("main", null, true, "func main() { int x = math.add(1, 2); int y = vec::add(3, 4); }")));

		CTranslationUnit unit = new CGenerator().generate(merged);
		String c = unit.getSource();

		assertTrue(c.contains("int math_add(int a, int b);"), c);
		assertTrue(c.contains("int vec_add(int a, int b);"), c);
		assertTrue(c.contains("int x = math_add(1, 2);"), c);
		assertTrue(c.contains("int y = vec_add(3, 4);"), c);
		// A bare call resolves within its own module first
		assertTrue(c.contains("return vec_add(a, a);"), c);
		assertTrue(unit.getFunctionNames().containsAll(List.of("math_add", "vec_add", "vec_twice", "main")));
	}

	@Test
	public void testStringEquality()
	{
		String c = generate(
				"func same(string a, string b) -> bool { return a == b; }",
				"func differ(string a, string b) -> bool { return a != b; }",
				"func numbers(int a, int b) -> bool { return a == b; }");

		assertTrue(c.contains("return thor_string_equals(a, b);"), c);
		assertTrue(c.contains("return !thor_string_equals(a, b);"), c);
		assertTrue(c.contains("return a == b;"), c);
		assertTrue(c.contains("bool thor_string_equals(const char* a, const char* b) {"), c);
	}

	@Test
	public void testOnlyUsedHelpersAreEmitted()
	{
		CTranslationUnit plain = new CGenerator().generate(parse("func main() { int x = 1; }"));
		assertTrue(plain.getHelpers().isEmpty());
		assertFalse(plain.getSource().contains("thor_"), plain.getSource());

		CTranslationUnit printing = new CGenerator().generate(parse("func main() { println(\"hi\"); std.print(\"x\"); }"));
		String c = printing.getSource();
		assertEquals(Set.of(RuntimeHelper.PRINTLN, RuntimeHelper.PRINT), printing.getHelpers());
		assertTrue(c.contains("void thor_println(const char* message) {"), c);
		assertTrue(c.contains("    thor_println(\"hi\");"), c);
		assertTrue(c.contains("    thor_print(\"x\");"), c);
		assertFalse(c.contains("thor_input"), c);
	}

	@Test
	public void testPreambleAndLayoutOrder()
	{
		String c = generate(
				"int counter = 0;",
				"func tick() { counter = counter + 1; }",
				"func main() { tick(); println(\"%s\" % [counter]); }");

		assertTrue(c.startsWith("#include <stdio.h>\n#include <stdlib.h>\n#include <string.h>\n#include <stdbool.h>\n#include <stdarg.h>\n"), c);
		int helper = c.indexOf("void thor_println(");
		int prototype = c.indexOf("void tick(void);");
		int global = c.indexOf("int counter = 0;");
		int body = c.indexOf("void tick(void) {");
		int main = c.indexOf("int main(void) {");
		assertTrue(helper > 0 && helper < prototype && prototype < global && global < body && body < main, c);
		assertBalanced(c);
	}

	@Test
	public void testControlFlowAndBraceBalance()
	{
		String c = generate(
				"func classify(int x) -> int {",
				"    if (x == 1) { return 10; } else if (x > 1) { return 20; } else { return 30; }",
				"}",
				"func main() {",
				"    int i = 0;",
				"    while (i < 3) { i = i + 1; if (i == 2) println(\"two\"); }",
				"    { int inner = i; }",
				"}");

		assertTrue(c.contains("    if (x == 1) {\n        return 10;\n    } else if (x > 1) {\n        return 20;\n    } else {\n        return 30;\n    }"), c);
		assertTrue(c.contains("    while (i < 3) {\n        i = i + 1;\n        if (i == 2) {\n            thor_println(\"two\");\n        }\n    }"), c);
		assertTrue(c.contains("    {\n        int inner = i;\n    }"), c);
		assertBalanced(c);
	}

	@Test
	public void testVoidMainReturnsZero()
	{
		String c = generate("func main() { println(\"x\"); if (true) { return; } }");

		assertTrue(c.contains("int main(void) {"), c);
		assertTrue(c.contains("        return 0;"), c);
		assertTrue(c.trim().endsWith("    return 0;\n}"), c);
		assertFalse(c.contains("return;"), c);
	}

	@Test
	public void testIntMainKeepsItsReturn()
	{
		String c = generate("int main() { return 3; }");

		assertTrue(c.contains("int main(void) {\n    return 3;\n}"), c);
	}

	@Test
	public void testTopLevelStatementsRunInModuleInit()
	{
		CTranslationUnit unit = new CGenerator().generate(parse(
				"import_me();",
				"string name = input(\"? \");",
				"const int LIMIT = 10;",
				"int[] primes = [2, 3, LIMIT];",
				"println(name);",
				"func import_me() { }",
				"func main() { println(\"main\"); }"));
		String c = unit.getSource();

		assertTrue(unit.hasModuleInit());
		assertTrue(c.contains("const int LIMIT = 10;"), c);
		assertTrue(c.contains("char* name;"), c);
		assertTrue(c.contains("static int thor_primes_data[3];\nint* primes = thor_primes_data;"), c);
		assertTrue(c.contains("static void thor_module_init(void) {\n    import_me();\n    name = thor_input(\"? \");\n    primes[0] = 2;\n    primes[1] = 3;\n    primes[2] = LIMIT;\n    thor_println(name);\n}"), c);
		assertTrue(c.contains("int main(void) {\n    thor_module_init();\n    thor_println(\"main\");\n    return 0;\n}"), c);
	}

	@Test
	public void testMainIsSynthesizedWhenMissing()
	{
		String c = generate("println(\"script\");");

		assertTrue(c.contains("int main(void) {\n    thor_module_init();\n    return 0;\n}"), c);
	}

	@Test
	public void testConstantArrayGlobalsAndLocals()
	{
		String c = generate(
				"const float[] weights = [0.5, 1.5];",
				"func main() { int[] xs = [1, 2]; int[] none = []; string[] names = [\"a\"]; }");

		assertTrue(c.contains("static float thor_weights_data[] = {0.5, 1.5};\nfloat* const weights = thor_weights_data;"), c);
		assertTrue(c.contains("int* xs = (int[]){1, 2};"), c);
		assertTrue(c.contains("int* none = NULL;"), c);
		assertTrue(c.contains("char** names = (char*[]){\"a\"};"), c);
	}

	@Test
	public void testArrayVariablesCanBeReassigned()
	{
		String c = generate(
				"int[] shared = [7];",
				"func main() { int[] xs = [1, 2]; int[] ys = [3]; xs = ys; shared = xs; const int[] fixed = [4]; }");

		assertTrue(c.contains("int* xs = (int[]){1, 2};"), c);
		assertTrue(c.contains("int* ys = (int[]){3};"), c);
		assertTrue(c.contains("    xs = ys;"), c);
		assertTrue(c.contains("static int thor_shared_data[] = {7};\nint* shared = thor_shared_data;"), c);
		assertTrue(c.contains("    shared = xs;"), c);
		assertTrue(c.contains("int* const fixed = (int[]){4};"), c);
		assertFalse(c.contains("xs[]"), c);
	}

	@Test
	public void testArrayVariablePassedByReference()
	{
		String c = generate(
				"int[] pool = [9, 9];",
				"func grow(ref int[] a) { a = pool; }",
				"func main() { int[] xs = [1]; grow(xs); }");

		assertTrue(c.contains("void grow(int** a);"), c);
		assertTrue(c.contains("    (*a) = pool;"), c);
		assertTrue(c.contains("    int* xs = (int[]){1};"), c);
		assertTrue(c.contains("    grow(&xs);"), c);
	}

	@Test
	public void testArrayArgumentBecomesCompoundLiteral()
	{
		String c = generate(
				"func sum(int[] xs, int n) -> int { return n; }",
				"func main() { sum([1, 2, 3], 3); }");

		assertTrue(c.contains("int sum(int* xs, int n);"), c);
		assertTrue(c.contains("sum((int[]){1, 2, 3}, 3);"), c);
	}

	@Test
	public void testExternsAndForwardDeclarations()
	{
		String c = generate(
				"extern int puts(string s);",
				"extern func abs(int x) -> int;",
				"func later(int a) -> int;",
				"func main() { puts(\"x\"); later(abs(-1)); }",
				"func later(int a) -> int { return a; }");

		assertTrue(c.contains("extern int puts(char* s);"), c);
		assertTrue(c.contains("extern int abs(int x);"), c);
		assertEquals(c.indexOf("int later(int a);"), c.lastIndexOf("int later(int a);"), c);
		assertTrue(c.contains("later(abs(-1));"), c);
	}

	@Test
	public void testForwardDeclarationWithOtherParameterNames()
	{
		CTranslationUnit unit = new CGenerator().generate(parse(
				"func later(int x) -> int;",
				"func main() { later(1); }",
				"func later(int a) -> int { return a; }"));
		String c = unit.getSource();

		assertTrue(c.contains("int later(int x);"), c);
		assertFalse(c.contains("int later(int a);"), c);
		assertTrue(c.contains("int later(int a) {"), c);
		assertEquals(List.of("later"), unit.getFunctionNames());
	}

	@Test
	public void testStringEscapes()
	{
		String c = generate("func main() { println(\"tab\\tquote\\\"slash\\\\\"); }");

		assertTrue(c.contains("thor_println(\"tab\\tquote\\\"slash\\\\\");"), c);
	}

	@Test
	public void testConfiguredHelperPrefixAndIndent()
	{
		Properties props = new Properties();
		props.setProperty("codegen.helper_prefix", "rt_");
		props.setProperty("codegen.indent", "2");
		String c = new CGenerator(new CompilerConfig(props)).generate(parse("func main() { println(\"x\"); }")).getSource();

		assertTrue(c.contains("void rt_println(const char* message) {"), c);
		assertTrue(c.contains("\n  rt_println(\"x\");"), c);
	}

	@Test
	public void testUnresolvedImportIsAnInternalError()
	{
		CompilationException e = assertThrows(CompilationException.class,
				() -> generate("import \"std.io\";", "func main() { }"));

		assertEquals(ErrorKind.INTERNAL_INVARIANT_VIOLATION, e.getKind());
	}

	@Test
	public void testEmptyArrayWithoutContextIsUnknownType()
	{
		CompilationException e = assertThrows(CompilationException.class,
				() -> generate("func main() { mystery([]); }"));

		assertEquals(ErrorKind.UNKNOWN_TYPE, e.getKind());
	}

	@Test
	public void testGeneratorIsReusable()
	{
		CGenerator generator = new CGenerator();
		Program program = parse("func main() { println(\"x\"); }");

		assertEquals(generator.generate(program).getSource(), generator.generate(program).getSource());
	}

	@Test
	public void testStripOuterParens()
	{
		assertEquals("a + b", CGenerator.stripOuterParens("(a + b)"));
		assertEquals("(a) + (b)", CGenerator.stripOuterParens("(a) + (b)"));
		assertEquals("(double)(x)", CGenerator.stripOuterParens("(double)(x)"));
		assertEquals("\")\" == x", CGenerator.stripOuterParens("(\")\" == x)"));
	}
}
