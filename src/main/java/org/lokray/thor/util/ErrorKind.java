package org.lokray.thor.util;

/**
 * Classifies every diagnostic the compiler can produce.
 * Only {@link #DUPLICATE_IMPORT} is reported as a warning; every other kind is fatal to the stage that raised it.
 */
public enum ErrorKind
{
	LEX_ERROR("Lexical Error"),
	SYNTAX_ERROR("Syntax Error"),
	UNKNOWN_TYPE("Unknown Type"),
	MODULE_NOT_FOUND("Module Not Found"),
	DUPLICATE_IMPORT("Duplicate Import"),
	FORMAT_ARITY_MISMATCH("Format Arity Mismatch"),
	INTERNAL_INVARIANT_VIOLATION("Internal Error"),
	IO_ERROR("I/O Error");

	private final String label;

	ErrorKind(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}
}
