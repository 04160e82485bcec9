package org.lokray.thor.util;

import java.util.List;

/**
 * Raised when a pipeline stage fails.
 * Carries every error diagnostic the stage collected, so callers can report them together.
 */
public class CompilationException extends RuntimeException
{
	private final ErrorKind kind;
	private final List<Diagnostic> diagnostics;

	public CompilationException(ErrorKind kind, List<Diagnostic> diagnostics)
	{
		super(summarize(kind, diagnostics));
		this.kind = kind;
		this.diagnostics = List.copyOf(diagnostics);
	}

	public CompilationException(Diagnostic diagnostic)
	{
		this(diagnostic.kind(), List.of(diagnostic));
	}

	public CompilationException(ErrorKind kind, String source, int line, String message)
	{
		this(Diagnostic.error(kind, source, line, 0, message));
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	/**
	 * @return The line of the first diagnostic, or 0 if unknown.
	 */
	public int getLine()
	{
		return diagnostics.isEmpty() ? 0 : diagnostics.get(0).line();
	}

	private static String summarize(ErrorKind kind, List<Diagnostic> diagnostics)
	{
		if (diagnostics.isEmpty())
		{
			return kind.getLabel();
		}
		Diagnostic first = diagnostics.get(0);
		String summary = kind.getLabel() + " at line " + first.line() + ": " + first.message();
		if (diagnostics.size() > 1)
		{
			summary += " (and " + (diagnostics.size() - 1) + " more)";
		}
		return summary;
	}
}
