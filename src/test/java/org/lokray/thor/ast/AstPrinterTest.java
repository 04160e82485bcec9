package org.lokray.thor.ast;

import org.junit.jupiter.api.Test;
import org.lokray.thor.parser.SourceFileParser;
import org.lokray.thor.util.ErrorReporter;

import static org.junit.jupiter.api.Assertions.*;

public class AstPrinterTest
{
	private static final String SAMPLE = String.join("\n",
			"package demo;",
			"import \"std.io\";",
			"const float RATIO = 0.5;",
			"string[] names = [\"a\\n\", \"b\\\"q\"];",
			"extern int puts(string s);",
			"func bump(ref int value) { value = value + 1; }",
			"int twice(int a) { return a * 2; }",
			"func main() {",
			"    int i = 0;",
			"    while (i < 3) { i = i + 1; }",
			"    if (i == 3) println(\"done\"); else { std::print(\"%s\" % [i]); }",
			"    return;",
			"}");

	private static Program parse(String source)
	{
		return new SourceFileParser(new ErrorReporter()).parse(source, "sample.thor");
	}

	@Test
	public void testPrintedProgramReparsesToTheSameText()
	{
		AstPrinter printer = new AstPrinter();
		String first = printer.print(parse(SAMPLE));
		String second = printer.print(parse(first));

		assertEquals(first, second);
	}

	@Test
	public void testCanonicalForms()
	{
		String printed = new AstPrinter().print(parse(SAMPLE));

		assertTrue(printed.startsWith("package demo;\nimport \"std.io\";\n"), printed);
		assertTrue(printed.contains("extern func puts(string s) -> int;"), printed);
		assertTrue(printed.contains("func bump(ref int value) -> void {"), printed);
		assertTrue(printed.contains("    (value = (value + 1));"), printed);
		assertTrue(printed.contains("string[] names = [\"a\\n\", \"b\\\"q\"];"), printed);
		assertTrue(printed.contains("std::print(\"%s\" % [i]);"), printed);
	}
}
