package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.lexer.TokenType;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

/**
 * AST node representing a prefix operation: {@code -x} or {@code !x}.
 */
public class UnaryExpression implements Expression
{
	private final Token operator;
	private final Expression right;

	public UnaryExpression(Token operator, Expression right)
	{
		this.operator = operator;
		this.right = right;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public Token getFirstToken()
	{
		return operator;
	}

	/**
	 * A negated numeric literal keeps its literal shape.
	 */
	@Override
	public Type getType()
	{
		if (operator.getType() == TokenType.MINUS && right.getType().isNumeric())
		{
			return right.getType();
		}
		return UnknownType.INSTANCE;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + operator.getLexeme() + right + ")";
	}
}
