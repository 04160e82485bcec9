package org.lokray.thor.semantics;

import java.util.Objects;

/**
 * An in/out parameter type, written {@code ref T} in source.
 */
public final class ReferenceType extends Type
{
	private final Type referent;

	public ReferenceType(Type referent)
	{
		super("ref " + referent.getName());
		this.referent = referent;
	}

	public Type getReferent()
	{
		return referent;
	}

	@Override
	public boolean isReference()
	{
		return true;
	}

	@Override
	public Type dereference()
	{
		return referent;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof ReferenceType && ((ReferenceType) o).referent.equals(referent);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("ref", referent);
	}
}
