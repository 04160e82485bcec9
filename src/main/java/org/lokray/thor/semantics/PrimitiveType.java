// File: src/main/java/org/lokray/thor/semantics/PrimitiveType.java

package org.lokray.thor.semantics;

import java.util.Map;
import java.util.Optional;

/**
 * The built-in scalar types of Thor. Only the shared instances below exist.
 */
public final class PrimitiveType extends Type
{
	public static final PrimitiveType VOID = new PrimitiveType("void");
	public static final PrimitiveType INT = new PrimitiveType("int");
	public static final PrimitiveType FLOAT = new PrimitiveType("float");
	public static final PrimitiveType STRING = new PrimitiveType("string");
	public static final PrimitiveType BOOL = new PrimitiveType("bool");

	private static final Map<String, PrimitiveType> BY_NAME = Map.of(
			"void", VOID,
			"int", INT,
			"float", FLOAT,
			"string", STRING,
			"bool", BOOL);

	private PrimitiveType(String name)
	{
		super(name);
	}

	/**
	 * Looks up a primitive type by its keyword.
	 *
	 * @param keyword The type keyword as written in source.
	 * @return The matching type, or empty if the keyword names no primitive.
	 */
	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(BY_NAME.get(keyword));
	}

	@Override
	public boolean isNumeric()
	{
		return this == INT || this == FLOAT;
	}

	@Override
	public boolean isString()
	{
		return this == STRING;
	}

	@Override
	public boolean isBool()
	{
		return this == BOOL;
	}

	@Override
	public boolean isVoid()
	{
		return this == VOID;
	}
}
