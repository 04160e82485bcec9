package org.lokray.thor.semantics;

/**
 * The type of anything whose type cannot be read off its literal shape or a declaration.
 */
public final class UnknownType extends Type
{
	public static final UnknownType INSTANCE = new UnknownType();

	private UnknownType()
	{
		super("<unknown>");
	}

	@Override
	public boolean isUnknown()
	{
		return true;
	}
}
