// File: src/main/java/org/lokray/thor/ast/expressions/BinaryExpression.java

package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.lexer.TokenType;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, c && d).
 * Assignment is a binary expression too, with {@link TokenType#ASSIGN} as its operator.
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator;
	private final Expression right;

	public BinaryExpression(Expression left, Token operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	public boolean isAssignment()
	{
		return operator.getType() == TokenType.ASSIGN;
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken();
	}

	@Override
	public Type getType()
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getLexeme() + " " + right + ")";
	}
}
