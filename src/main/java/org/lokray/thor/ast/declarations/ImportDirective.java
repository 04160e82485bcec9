// File: src/main/java/org/lokray/thor/ast/declarations/ImportDirective.java

package org.lokray.thor.ast.declarations;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.statements.Statement;
import org.lokray.thor.lexer.Token;

/**
 * Represents an 'import' directive in Thor source code.
 * Examples:
 * import "std.io";
 * import util.math;
 */
public class ImportDirective implements Statement
{
	private final Token importKeyword;
	private final String moduleName;

	public ImportDirective(Token importKeyword, String moduleName)
	{
		this.importKeyword = importKeyword;
		this.moduleName = moduleName;
	}

	public Token getImportKeyword()
	{
		return importKeyword;
	}

	public String getModuleName()
	{
		return moduleName;
	}

	@Override
	public int getLine()
	{
		return importKeyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitImportDirective(this);
	}

	@Override
	public String toString()
	{
		return "import \"" + moduleName + "\";";
	}
}
