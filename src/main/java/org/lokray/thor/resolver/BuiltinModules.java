package org.lokray.thor.resolver;

import org.lokray.thor.ast.Program;
import org.lokray.thor.parser.SourceFileParser;
import org.lokray.thor.util.ErrorReporter;

import java.util.Map;
import java.util.Optional;

/**
 * Modules that exist only inside the compiler. Their functions are bodyless signatures;
 * the code generator backs each one with a runtime helper.
 */
public final class BuiltinModules
{
	public static final String STD_IO = "std.io";

	private static final Map<String, String> ALIASES = Map.of(
			"std.io", STD_IO,
			"std", STD_IO);

	private static final Map<String, String> SOURCES = Map.of(
			STD_IO, String.join("\n",
					"package std;",
					"func println(string message);",
					"func print(string message);",
					"func input(string prompt) -> string;"));

	private BuiltinModules()
	{
	}

	/**
	 * @return The canonical name of the built-in module an import refers to, or empty for file modules.
	 */
	public static Optional<String> canonicalName(String moduleName)
	{
		return Optional.ofNullable(ALIASES.get(moduleName));
	}

	/**
	 * Builds a fresh AST for a built-in module. Each call returns new nodes.
	 *
	 * @param canonicalName A name returned by {@link #canonicalName(String)}.
	 */
	public static Program load(String canonicalName)
	{
		String source = SOURCES.get(canonicalName);
		if (source == null)
		{
			throw new IllegalArgumentException("Not a built-in module: " + canonicalName);
		}
		return new SourceFileParser(new ErrorReporter()).parse(source, "<builtin " + canonicalName + ">");
	}
}
