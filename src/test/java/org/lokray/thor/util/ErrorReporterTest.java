package org.lokray.thor.util;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorReporterTest
{
	@Test
	public void testErrorsAndWarningsAreSeparated()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.enterSource("a.thor");
		reporter.warn(ErrorKind.DUPLICATE_IMPORT, 2, 1, "again", List.of("module: x"));
		assertFalse(reporter.hasErrors());

		reporter.report(ErrorKind.SYNTAX_ERROR, 3, 5, "broken");

		assertTrue(reporter.hasErrors());
		assertEquals(1, reporter.errorCount());
		assertEquals(1, reporter.getWarnings().size());
		assertEquals(2, reporter.size());
		assertEquals(1, reporter.errorsSince(1).size());
		assertTrue(reporter.errorsSince(2).isEmpty());
	}

	@Test
	public void testEnterSourceRestoresPrevious()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.enterSource("outer.thor");
		String previous = reporter.enterSource("inner.thor");
		reporter.report(ErrorKind.LEX_ERROR, 1, 1, "bad");
		reporter.enterSource(previous);

		assertEquals("outer.thor", reporter.getCurrentSource());
		assertEquals("inner.thor", reporter.getErrors().get(0).source());
	}

	@Test
	public void testRenderedFormat()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.enterSource("main.thor");
		reporter.report(ErrorKind.SYNTAX_ERROR, 4, 9, "Expected ';'.");
		reporter.warn(ErrorKind.DUPLICATE_IMPORT, 2, 1, "Module 'm' was already imported.", List.of("module: m", "re-imported by: main.thor"));

		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		reporter.printTo(new PrintStream(bytes, true, StandardCharsets.UTF_8));
		String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");

		assertEquals("[Error] main.thor Line 4, Column 9: [Syntax Error] Expected ';'.", lines[0]);
		assertEquals("[Warning] main.thor Line 2, Column 1: [Duplicate Import] Module 'm' was already imported.", lines[1]);
		assertEquals("[Warning]   module: m", lines[2]);
		assertEquals("[Warning]   re-imported by: main.thor", lines[3]);
	}

	@Test
	public void testResetClearsEverything()
	{
		ErrorReporter reporter = new ErrorReporter();
		reporter.enterSource("x.thor");
		reporter.report(ErrorKind.IO_ERROR, 0, 0, "gone");
		reporter.reset();

		assertFalse(reporter.hasErrors());
		assertEquals(0, reporter.size());
		assertNull(reporter.getCurrentSource());
	}

	@Test
	public void testCompilationExceptionSummary()
	{
		CompilationException e = new CompilationException(ErrorKind.MODULE_NOT_FOUND, "main.thor", 3, "Cannot find module 'x'.");

		assertEquals(ErrorKind.MODULE_NOT_FOUND, e.getKind());
		assertEquals(3, e.getLine());
		assertEquals(1, e.getDiagnostics().size());
		assertTrue(e.getMessage().contains("Cannot find module 'x'."));
	}
}
