// File: src/main/java/org/lokray/thor/ast/Program.java

package org.lokray.thor.ast;

import org.lokray.thor.ast.declarations.ImportDirective;
import org.lokray.thor.ast.declarations.PackageDeclaration;
import org.lokray.thor.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The root AST node representing a Thor program.
 * A parsed program holds one file's package, imports and statements. A merged program, built by the
 * import resolver, holds no imports; it keeps the module segments its statements were spliced from.
 */
public class Program implements ASTNode
{
	private final PackageDeclaration packageDeclaration; // May be null
	private final List<ImportDirective> imports;
	private final List<Statement> statements;
	private final List<ModuleSegment> segments;

	public Program(PackageDeclaration packageDeclaration, List<ImportDirective> imports, List<Statement> statements)
	{
		this.packageDeclaration = packageDeclaration;
		this.imports = List.copyOf(imports);
		this.statements = List.copyOf(statements);
		this.segments = List.of();
	}

	private Program(PackageDeclaration packageDeclaration, List<ModuleSegment> segments)
	{
		this.packageDeclaration = packageDeclaration;
		this.imports = List.of();
		this.segments = List.copyOf(segments);

		List<Statement> merged = new ArrayList<>();
		for (ModuleSegment segment : segments)
		{
			for (Statement statement : segment.statements())
			{
				merged.add(statement);
			}
		}
		this.statements = Collections.unmodifiableList(merged);
	}

	/**
	 * Builds a merged program from module segments in dependency order.
	 *
	 * @param packageDeclaration The main file's package, may be null.
	 * @param segments           Dependencies first, the main file's segment last.
	 */
	public static Program merged(PackageDeclaration packageDeclaration, List<ModuleSegment> segments)
	{
		return new Program(packageDeclaration, segments);
	}

	public PackageDeclaration getPackageDeclaration()
	{
		return packageDeclaration;
	}

	public Optional<String> getPackageName()
	{
		return Optional.ofNullable(packageDeclaration).map(PackageDeclaration::getName);
	}

	public List<ImportDirective> getImports()
	{
		return imports;
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	public List<ModuleSegment> getSegments()
	{
		return segments;
	}

	public boolean isMerged()
	{
		return !segments.isEmpty();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		if (packageDeclaration != null)
		{
			sb.append(packageDeclaration).append("\n");
		}
		for (ImportDirective directive : imports)
		{
			sb.append(directive).append("\n");
		}
		for (Statement statement : statements)
		{
			sb.append(statement).append("\n");
		}
		return sb.toString();
	}
}
