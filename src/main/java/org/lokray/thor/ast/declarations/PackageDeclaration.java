package org.lokray.thor.ast.declarations;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.statements.Statement;
import org.lokray.thor.lexer.Token;

/**
 * Represents {@code package name;}. The package name becomes the C prefix of the file's functions when imported.
 */
public class PackageDeclaration implements Statement
{
	private final Token packageKeyword;
	private final String name;

	public PackageDeclaration(Token packageKeyword, String name)
	{
		this.packageKeyword = packageKeyword;
		this.name = name;
	}

	public Token getPackageKeyword()
	{
		return packageKeyword;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public int getLine()
	{
		return packageKeyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPackageDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "package " + name + ";";
	}
}
