// File: src/main/java/org/lokray/thor/semantics/Type.java

package org.lokray.thor.semantics;

/**
 * Abstract base class for all types in the Thor language.
 * Types are values: two types are equal when they have the same structure.
 */
public abstract class Type
{
	protected final String name;

	protected Type(String name)
	{
		this.name = name;
	}

	/**
	 * @return The name of this type as written in Thor source (e.g. {@code int[]}, {@code ref string}).
	 */
	public String getName()
	{
		return name;
	}

	public boolean isNumeric()
	{
		return false;
	}

	public boolean isString()
	{
		return false;
	}

	public boolean isBool()
	{
		return false;
	}

	public boolean isVoid()
	{
		return false;
	}

	public boolean isArray()
	{
		return false;
	}

	public boolean isReference()
	{
		return false;
	}

	public boolean isUnknown()
	{
		return false;
	}

	/**
	 * The type values of this type are read as: the referent for {@code ref T}, otherwise itself.
	 */
	public Type dereference()
	{
		return this;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
