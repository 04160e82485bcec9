package org.lokray.thor.semantics;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The signature of a function: ordered parameter types and a return type.
 */
public final class FunctionType extends Type
{
	private final List<Type> parameterTypes;
	private final Type returnType;

	public FunctionType(List<Type> parameterTypes, Type returnType)
	{
		super("func(" + parameterTypes.stream().map(Type::getName).collect(Collectors.joining(", ")) + ") -> " + returnType.getName());
		this.parameterTypes = List.copyOf(parameterTypes);
		this.returnType = returnType;
	}

	public List<Type> getParameterTypes()
	{
		return parameterTypes;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof FunctionType))
		{
			return false;
		}
		FunctionType other = (FunctionType) o;
		return parameterTypes.equals(other.parameterTypes) && returnType.equals(other.returnType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(parameterTypes, returnType);
	}
}
