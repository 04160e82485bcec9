package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

/**
 * AST node representing member access ({@code object.name}). Thor has no objects, so member chains
 * only ever name functions inside modules ({@code std.println}, {@code util.math.add}).
 */
public class DotExpression implements Expression
{
	private final Expression object;
	private final Token memberName;

	public DotExpression(Expression object, Token memberName)
	{
		this.object = object;
		this.memberName = memberName;
	}

	public Expression getObject()
	{
		return object;
	}

	public Token getMemberName()
	{
		return memberName;
	}

	@Override
	public Token getFirstToken()
	{
		return object.getFirstToken();
	}

	@Override
	public Type getType()
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDotExpression(this);
	}

	@Override
	public String toString()
	{
		return object + "." + memberName.getLexeme();
	}
}
