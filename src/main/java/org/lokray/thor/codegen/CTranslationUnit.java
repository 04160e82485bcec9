package org.lokray.thor.codegen;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The result of generating C for one merged program.
 */
public class CTranslationUnit
{
	private final String source;
	private final Set<RuntimeHelper> helpers;
	private final List<String> functionNames;
	private final boolean hasModuleInit;

	CTranslationUnit(String source, Set<RuntimeHelper> helpers, List<String> functionNames, boolean hasModuleInit)
	{
		this.source = source;
		this.helpers = helpers.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(helpers));
		this.functionNames = List.copyOf(functionNames);
		this.hasModuleInit = hasModuleInit;
	}

	/**
	 * @return The complete C source text.
	 */
	public String getSource()
	{
		return source;
	}

	/**
	 * @return The runtime helpers emitted, i.e. the ones the program references.
	 */
	public Set<RuntimeHelper> getHelpers()
	{
		return helpers;
	}

	/**
	 * @return The C names of all user functions and externs that were declared, in emission order.
	 */
	public List<String> getFunctionNames()
	{
		return functionNames;
	}

	public boolean hasModuleInit()
	{
		return hasModuleInit;
	}

	@Override
	public String toString()
	{
		return source;
	}
}
