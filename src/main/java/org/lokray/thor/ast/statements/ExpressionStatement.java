package org.lokray.thor.ast.statements;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.expressions.Expression;

/**
 * AST node representing a statement that consists solely of an expression,
 * followed by a semicolon (e.g., `counter = counter + 1;`).
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public int getLine()
	{
		return expression.getFirstToken().getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public String toString()
	{
		return expression + ";";
	}
}
