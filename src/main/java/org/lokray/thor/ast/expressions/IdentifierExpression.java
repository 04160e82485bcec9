package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a name, either plain ({@code x}) or {@code ::}-qualified ({@code std::println}).
 */
public class IdentifierExpression implements Expression
{
	private final List<Token> segments; // Never empty; the last segment is the simple name

	public IdentifierExpression(Token name)
	{
		this(List.of(name));
	}

	public IdentifierExpression(List<Token> segments)
	{
		if (segments.isEmpty())
		{
			throw new IllegalArgumentException("An identifier needs at least one name segment.");
		}
		this.segments = List.copyOf(segments);
	}

	public List<Token> getSegments()
	{
		return segments;
	}

	public Token getNameToken()
	{
		return segments.get(segments.size() - 1);
	}

	/**
	 * @return The simple name, i.e. the part after the last {@code ::}.
	 */
	public String getName()
	{
		return getNameToken().getLexeme();
	}

	public boolean isQualified()
	{
		return segments.size() > 1;
	}

	/**
	 * @return The module part of a qualified name in dotted form ({@code a::b::f} gives {@code a.b}), or null.
	 */
	public String getQualifier()
	{
		if (!isQualified())
		{
			return null;
		}
		return segments.subList(0, segments.size() - 1).stream()
				.map(Token::getLexeme)
				.collect(Collectors.joining("."));
	}

	public String getQualifiedName()
	{
		return segments.stream().map(Token::getLexeme).collect(Collectors.joining("::"));
	}

	@Override
	public Token getFirstToken()
	{
		return segments.get(0);
	}

	@Override
	public Type getType()
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public String toString()
	{
		return getQualifiedName();
	}
}
