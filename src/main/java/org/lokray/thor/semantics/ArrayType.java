package org.lokray.thor.semantics;

import java.util.Objects;

/**
 * {@code T[]}. Lowered to a pointer to its element type.
 */
public final class ArrayType extends Type
{
	private final Type elementType;

	public ArrayType(Type elementType)
	{
		super(elementType.getName() + "[]");
		this.elementType = elementType;
	}

	public Type getElementType()
	{
		return elementType;
	}

	@Override
	public boolean isArray()
	{
		return true;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof ArrayType && ((ArrayType) o).elementType.equals(elementType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("array", elementType);
	}
}
