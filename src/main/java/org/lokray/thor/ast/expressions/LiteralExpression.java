package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.PrimitiveType;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

/**
 * AST node representing a literal value: an integer, float, string or boolean.
 */
public class LiteralExpression implements Expression
{
	private final Token literalToken;
	private final Object value; // Integer, Double, String or Boolean

	public LiteralExpression(Token literalToken, Object value)
	{
		this.literalToken = literalToken;
		this.value = value;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	public Object getValue()
	{
		return value;
	}

	@Override
	public Token getFirstToken()
	{
		return literalToken;
	}

	@Override
	public Type getType()
	{
		if (value instanceof Integer)
		{
			return PrimitiveType.INT;
		}
		if (value instanceof Double)
		{
			return PrimitiveType.FLOAT;
		}
		if (value instanceof String)
		{
			return PrimitiveType.STRING;
		}
		if (value instanceof Boolean)
		{
			return PrimitiveType.BOOL;
		}
		return UnknownType.INSTANCE;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public String toString()
	{
		if (value instanceof String)
		{
			return "\"" + value + "\"";
		}
		return String.valueOf(value);
	}
}
