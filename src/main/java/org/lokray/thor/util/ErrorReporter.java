package org.lokray.thor.util;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics for one compilation.
 * Nothing is printed while a stage runs; the driver calls {@link #printTo(PrintStream)} once the stage is over
 * so that every error of a stage is reported together.
 */
public class ErrorReporter
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private String currentSource;

	/**
	 * Sets the file that subsequent reports are attributed to.
	 *
	 * @param source The file name or path, may be null.
	 * @return The previously current source, so nested callers can restore it.
	 */
	public String enterSource(String source)
	{
		String previous = currentSource;
		currentSource = source;
		return previous;
	}

	public String getCurrentSource()
	{
		return currentSource;
	}

	/**
	 * Reports a fatal error.
	 *
	 * @param kind    The kind of error.
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(ErrorKind kind, int line, int column, String message)
	{
		diagnostics.add(Diagnostic.error(kind, currentSource, line, column, message));
	}

	/**
	 * Reports a non-fatal warning with optional detail lines.
	 */
	public void warn(ErrorKind kind, int line, int column, String message, List<String> details)
	{
		diagnostics.add(new Diagnostic(kind, Diagnostic.Severity.WARNING, currentSource, line, column, message, details));
	}

	public void add(Diagnostic diagnostic)
	{
		diagnostics.add(diagnostic);
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public int errorCount()
	{
		return (int) diagnostics.stream().filter(Diagnostic::isError).count();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public List<Diagnostic> getErrors()
	{
		return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
	}

	public List<Diagnostic> getWarnings()
	{
		return diagnostics.stream().filter(d -> !d.isError()).collect(Collectors.toList());
	}

	/**
	 * Errors recorded after the first {@code fromIndex} diagnostics.
	 * Used by a stage to fail with only what it produced itself.
	 */
	public List<Diagnostic> errorsSince(int fromIndex)
	{
		return diagnostics.subList(fromIndex, diagnostics.size()).stream()
				.filter(Diagnostic::isError)
				.collect(Collectors.toList());
	}

	public int size()
	{
		return diagnostics.size();
	}

	/**
	 * Writes every collected diagnostic, in reporting order.
	 */
	public void printTo(PrintStream out)
	{
		for (Diagnostic diagnostic : diagnostics)
		{
			diagnostic.render().forEach(out::println);
		}
	}

	/**
	 * Discards everything collected so far.
	 */
	public void reset()
	{
		diagnostics.clear();
		currentSource = null;
	}
}
