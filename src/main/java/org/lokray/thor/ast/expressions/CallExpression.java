package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a function call: a callee followed by its ordered arguments.
 */
public class CallExpression implements Expression
{
	private final Expression callee;
	private final Token paren; // The '(' token, for error positions
	private final List<Expression> arguments;

	public CallExpression(Expression callee, Token paren, List<Expression> arguments)
	{
		this.callee = callee;
		this.paren = paren;
		this.arguments = List.copyOf(arguments);
	}

	public Expression getCallee()
	{
		return callee;
	}

	public Token getParen()
	{
		return paren;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public Token getFirstToken()
	{
		return callee.getFirstToken();
	}

	@Override
	public Type getType()
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String toString()
	{
		return callee + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
