package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.PrimitiveType;
import org.lokray.thor.semantics.Type;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing {@code "template" % [args]}. Each {@code %s} in the template consumes one argument.
 */
public class FormatStringExpression implements Expression
{
	private final Token templateToken;
	private final List<Expression> arguments;

	public FormatStringExpression(Token templateToken, List<Expression> arguments)
	{
		this.templateToken = templateToken;
		this.arguments = List.copyOf(arguments);
	}

	public Token getTemplateToken()
	{
		return templateToken;
	}

	/**
	 * @return The template with escapes already resolved.
	 */
	public String getTemplate()
	{
		return (String) templateToken.getLiteral();
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public Token getFirstToken()
	{
		return templateToken;
	}

	@Override
	public Type getType()
	{
		return PrimitiveType.STRING;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFormatStringExpression(this);
	}

	@Override
	public String toString()
	{
		return "\"" + getTemplate() + "\" % " + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"));
	}
}
