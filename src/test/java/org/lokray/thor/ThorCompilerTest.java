package org.lokray.thor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.thor.codegen.CTranslationUnit;
import org.lokray.thor.util.CompilationException;
import org.lokray.thor.util.CompilerConfig;
import org.lokray.thor.util.ErrorKind;
import org.lokray.thor.util.ErrorReporter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ThorCompilerTest
{
	@TempDir
	Path dir;

	private ErrorReporter reporter;
	private ThorCompiler compiler;

	@BeforeEach
	public void setUp()
	{
		reporter = new ErrorReporter();
		compiler = new ThorCompiler(new CompilerConfig(), reporter);
	}

	private Path write(String relative, String... lines) throws IOException
	{
		Path file = dir.resolve(relative);
		Files.createDirectories(file.getParent());
		Files.writeString(file, String.join("\n", lines), StandardCharsets.UTF_8);
		return file;
	}

	@Test
	public void testCompilesAProjectWithModules() throws IOException
	{
		write("math.thor",
				"package math;",
				"func add(int a, int b) -> int { return a + b; }");
		write("geometry/vec.thor",
				"package vec;",
				"import \"std.io\";",
				"func add(int a, int b) -> int { return a * b; }",
				"func show(int v) { println(\"%s\" % [v]); }");
		Path main = write("main.thor",
				"import \"std.io\";",
				"import math;",
				"import geometry.vec;",
				"func main() {",
				"    int total = math.add(1, 2);",
				"    vec::show(vec.add(total, 2));",
				"}");

		CTranslationUnit unit = compiler.compile(main);
		String c = unit.getSource();

		assertTrue(c.contains("int math_add(int a, int b) {"), c);
		assertTrue(c.contains("int vec_add(int a, int b) {"), c);
		assertTrue(c.contains("void vec_show(int v) {"), c);
		assertTrue(c.contains("vec_show(vec_add(total, 2));"), c);
		assertTrue(c.contains("thor_println(thor_format(\"%g\", (double)(v)));"), c);
		// std.io imported twice: once by main, once by vec
		assertEquals(1, reporter.getWarnings().size());
		assertEquals(ErrorKind.DUPLICATE_IMPORT, reporter.getWarnings().get(0).kind());
		assertFalse(reporter.hasErrors());
	}

	@Test
	public void testModulesSharingAPackageDoNotCollide() throws IOException
	{
		write("left.thor", "package util;", "func add(int a, int b) -> int { return a + b; }");
		write("right.thor", "package util;", "func add(int a, int b) -> int { return a * b; }");
		Path main = write("main.thor",
				"import left;",
				"import right;",
				"int main() { return left.add(1, 2) + right.add(3, 4); }");

		String c = compiler.compile(main).getSource();

		assertTrue(c.contains("int util_add(int a, int b) {"), c);
		assertTrue(c.contains("int right_add(int a, int b) {"), c);
		assertTrue(c.contains("return util_add(1, 2) + right_add(3, 4);"), c);
	}

	@Test
	public void testGeneratorErrorsReachTheReporter() throws IOException
	{
		Path main = write("main.thor", "func main() { string s = \"%s\" % []; }");

		CompilationException e = assertThrows(CompilationException.class, () -> compiler.compile(main));

		assertEquals(ErrorKind.FORMAT_ARITY_MISMATCH, e.getKind());
		assertEquals(1, reporter.errorCount());
		assertTrue(reporter.getErrors().get(0).source().endsWith("main.thor"));
	}

	@Test
	public void testParseErrorsAreAllReported() throws IOException
	{
		Path main = write("main.thor", "int a = ;", "int b = ;", "func main() { }");

		assertThrows(CompilationException.class, () -> compiler.compile(main));

		assertEquals(2, reporter.errorCount());
	}

	@Test
	public void testMissingSourceFile()
	{
		CompilationException e = assertThrows(CompilationException.class, () -> compiler.compile(dir.resolve("absent.thor")));

		assertEquals(ErrorKind.IO_ERROR, e.getKind());
		assertTrue(reporter.hasErrors());
	}

	@Test
	public void testCompileInMemorySource() throws IOException
	{
		write("lib.thor", "func helper() -> int { return 7; }");

		CTranslationUnit unit = compiler.compile("import \"lib\";\nint main() { return helper(); }", dir.resolve("virtual.thor"));

		assertTrue(unit.getSource().contains("int lib_helper(void);"), unit.getSource());
		assertTrue(unit.getSource().contains("return lib_helper();"), unit.getSource());
	}
}
