package org.lokray.thor.ast.statements;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.expressions.Expression;
import org.lokray.thor.lexer.Token;

/**
 * AST node representing a 'return' statement, with an optional value.
 */
public class ReturnStatement implements Statement
{
	private final Token keyword;
	private final Expression value; // May be null

	public ReturnStatement(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public int getLine()
	{
		return keyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public String toString()
	{
		return value == null ? "return;" : "return " + value + ";";
	}
}
