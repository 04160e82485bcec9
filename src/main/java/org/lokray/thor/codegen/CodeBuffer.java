package org.lokray.thor.codegen;

/**
 * Line-oriented text buffer with an indentation level.
 */
class CodeBuffer
{
	private final StringBuilder builder = new StringBuilder();
	private final String indentUnit;
	private int indentLevel = 0;

	CodeBuffer(int indentWidth)
	{
		this.indentUnit = " ".repeat(indentWidth);
	}

	void appendLine(String line)
	{
		for (int i = 0; i < indentLevel; i++)
		{
			builder.append(indentUnit);
		}
		builder.append(line).append("\n");
	}

	void appendLine()
	{
		builder.append("\n");
	}

	void append(CodeBuffer other)
	{
		builder.append(other.builder);
	}

	void indent()
	{
		indentLevel++;
	}

	void dedent()
	{
		if (indentLevel == 0)
		{
			throw new IllegalStateException("Unbalanced dedent in generated code.");
		}
		indentLevel--;
	}

	@Override
	public String toString()
	{
		return builder.toString();
	}
}
