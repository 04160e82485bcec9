package org.lokray.thor.ast;

import org.lokray.thor.ast.statements.Statement;

import java.nio.file.Path;
import java.util.List;

/**
 * The statements one module contributes to a merged {@link Program}, with where they came from.
 *
 * @param moduleName The name the module was imported by (e.g. {@code util.math}), or the main file's name.
 * @param qualifier  The C name prefix for this module's functions, or null when its functions stay unqualified.
 * @param sourcePath The canonical path of the source file, null for built-in modules.
 * @param builtin    True for modules that exist only inside the compiler.
 * @param main       True for the file compilation started from.
 * @param statements The module's statements, in source order.
 */
public record ModuleSegment(String moduleName, String qualifier, Path sourcePath, boolean builtin, boolean main,
							List<Statement> statements)
{
	public ModuleSegment
	{
		statements = List.copyOf(statements);
	}

	public boolean isQualified()
	{
		return qualifier != null;
	}

	/**
	 * @return A printable location for diagnostics.
	 */
	public String describeSource()
	{
		return builtin ? "<builtin " + moduleName + ">" : String.valueOf(sourcePath);
	}
}
