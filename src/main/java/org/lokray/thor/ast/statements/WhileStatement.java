package org.lokray.thor.ast.statements;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.expressions.Expression;
import org.lokray.thor.lexer.Token;

/**
 * AST node representing a 'while' loop.
 */
public class WhileStatement implements Statement
{
	private final Token whileKeyword;
	private final Expression condition;
	private final Statement body;

	public WhileStatement(Token whileKeyword, Expression condition, Statement body)
	{
		this.whileKeyword = whileKeyword;
		this.condition = condition;
		this.body = body;
	}

	public Token getWhileKeyword()
	{
		return whileKeyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public int getLine()
	{
		return whileKeyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}

	@Override
	public String toString()
	{
		return "while (" + condition + ") " + body;
	}
}
