package org.lokray.thor.ast.declarations;

import org.lokray.thor.ast.Parameter;
import org.lokray.thor.ast.statements.Statement;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.FunctionType;
import org.lokray.thor.semantics.Type;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Common shape of everything that declares a callable signature: user functions and externs.
 */
public abstract class CallableDeclaration implements Statement
{
	private final Token startToken; // 'func', 'extern' or the leading return type
	private final Token name;
	private final List<Parameter> parameters;
	private final Type returnType;

	protected CallableDeclaration(Token startToken, Token name, List<Parameter> parameters, Type returnType)
	{
		this.startToken = startToken;
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.returnType = returnType;
	}

	public Token getStartToken()
	{
		return startToken;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	public FunctionType getFunctionType()
	{
		return new FunctionType(parameters.stream().map(Parameter::getType).collect(Collectors.toList()), returnType);
	}

	public boolean hasReferenceParameters()
	{
		return parameters.stream().anyMatch(Parameter::isReference);
	}

	@Override
	public int getLine()
	{
		return startToken.getLine();
	}

	protected String signature()
	{
		return getName() + "(" + parameters.stream().map(Parameter::toString).collect(Collectors.joining(", ")) + ") -> " + returnType.getName();
	}
}
