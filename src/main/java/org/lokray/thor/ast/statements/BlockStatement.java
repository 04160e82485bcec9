package org.lokray.thor.ast.statements;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;

import java.util.List;

/**
 * AST node representing a brace-delimited list of statements.
 */
public class BlockStatement implements Statement
{
	private final Token leftBrace;
	private final List<Statement> statements;

	public BlockStatement(Token leftBrace, List<Statement> statements)
	{
		this.leftBrace = leftBrace;
		this.statements = List.copyOf(statements);
	}

	public Token getLeftBrace()
	{
		return leftBrace;
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public int getLine()
	{
		return leftBrace.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("{\n");
		for (Statement stmt : statements)
		{
			sb.append("  ").append(stmt.toString().replace("\n", "\n  ")).append("\n");
		}
		return sb.append("}").toString();
	}
}
