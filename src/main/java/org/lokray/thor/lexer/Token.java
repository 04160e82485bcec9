package org.lokray.thor.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the Thor Lexer.
 * Each token carries its type, the raw text (lexeme), the parsed literal value,
 * and its position in the source file for error reporting.
 */
public class Token
{
	private final TokenType type;
	private final String lexeme;
	private final Object literal;    // Integer, Double, String or Boolean for literal tokens, otherwise null
	private final int line;
	private final int column;

	public Token(TokenType type, String lexeme, Object literal, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Compares type, lexeme and literal. Positions are ignored so tokens scanned
	 * from different places can be compared in tests.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;
		return type == token.type && lexeme.equals(token.lexeme) && Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, lexeme, literal);
	}
}
