package org.lokray.thor.ast;

import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;

/**
 * A function parameter. A {@link org.lokray.thor.semantics.ReferenceType} marks an in/out parameter.
 */
public class Parameter
{
	private final Token name;
	private final Type type;

	public Parameter(Token name, Type type)
	{
		this.name = name;
		this.type = type;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Type getType()
	{
		return type;
	}

	public boolean isReference()
	{
		return type.isReference();
	}

	@Override
	public String toString()
	{
		return type.getName() + " " + getName();
	}
}
