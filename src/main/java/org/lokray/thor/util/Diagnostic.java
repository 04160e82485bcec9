package org.lokray.thor.util;

import java.util.ArrayList;
import java.util.List;

/**
 * A single message collected by the {@link ErrorReporter}.
 *
 * @param kind     What went wrong.
 * @param severity Whether the message is fatal.
 * @param source   The file (or virtual module) the message refers to, may be null.
 * @param line     1-based line number, 0 when unknown.
 * @param column   1-based column number, 0 when unknown.
 * @param message  The headline message.
 * @param details  Extra lines printed under the headline, each on its own line.
 */
public record Diagnostic(ErrorKind kind, Severity severity, String source, int line, int column, String message,
						 List<String> details)
{
	public enum Severity
	{
		ERROR("[Error]"),
		WARNING("[Warning]");

		private final String prefix;

		Severity(String prefix)
		{
			this.prefix = prefix;
		}

		public String getPrefix()
		{
			return prefix;
		}
	}

	public Diagnostic
	{
		details = List.copyOf(details);
	}

	public static Diagnostic error(ErrorKind kind, String source, int line, int column, String message)
	{
		return new Diagnostic(kind, Severity.ERROR, source, line, column, message, List.of());
	}

	public boolean isError()
	{
		return severity == Severity.ERROR;
	}

	/**
	 * Renders this diagnostic the way it is printed to the user.
	 * The headline comes first, followed by one line per detail, all carrying the severity prefix.
	 *
	 * @return The rendered lines, never empty.
	 */
	public List<String> render()
	{
		List<String> lines = new ArrayList<>();
		StringBuilder headline = new StringBuilder(severity.getPrefix()).append(' ');
		if (source != null)
		{
			headline.append(source).append(' ');
		}
		if (line > 0)
		{
			headline.append("Line ").append(line).append(", Column ").append(column).append(": ");
		}
		headline.append('[').append(kind.getLabel()).append("] ").append(message);
		lines.add(headline.toString());

		for (String detail : details)
		{
			lines.add(severity.getPrefix() + "   " + detail);
		}
		return lines;
	}

	@Override
	public String toString()
	{
		return String.join(System.lineSeparator(), render());
	}
}
