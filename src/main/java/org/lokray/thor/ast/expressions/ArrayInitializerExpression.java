package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.ArrayType;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing an array literal, e.g. {@code [1, 2, 3]}.
 */
public class ArrayInitializerExpression implements Expression
{
	private final Token leftBracket;
	private final List<Expression> elements;

	public ArrayInitializerExpression(Token leftBracket, List<Expression> elements)
	{
		this.leftBracket = leftBracket;
		this.elements = List.copyOf(elements);
	}

	public List<Expression> getElements()
	{
		return elements;
	}

	@Override
	public Token getFirstToken()
	{
		return leftBracket;
	}

	/**
	 * An array of T when every element has the same known literal shape T.
	 */
	@Override
	public Type getType()
	{
		if (elements.isEmpty())
		{
			return UnknownType.INSTANCE;
		}
		Type first = elements.get(0).getType();
		if (first.isUnknown() || elements.stream().anyMatch(e -> !e.getType().equals(first)))
		{
			return UnknownType.INSTANCE;
		}
		return new ArrayType(first);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayInitializerExpression(this);
	}

	@Override
	public String toString()
	{
		return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
	}
}
