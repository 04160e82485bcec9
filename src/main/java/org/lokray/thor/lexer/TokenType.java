// File: src/main/java/org/lokray/thor/lexer/TokenType.java

package org.lokray.thor.lexer;

/**
 * Enumerates all possible types of tokens in the Thor language.
 */
public enum TokenType
{
	// Literals
	INTEGER_LITERAL,
	FLOAT_LITERAL,
	STRING_LITERAL,
	BOOLEAN_LITERAL,

	IDENTIFIER,

	// Keywords
	IF,
	ELSE,
	WHILE,
	RETURN,
	IMPORT,
	EXTERN,
	FUNC,
	PACKAGE,
	CONST,
	REF,

	// Type keywords
	INT,
	FLOAT,
	STRING_KEYWORD,
	BOOL,
	VOID,

	// Operators
	PLUS,
	MINUS,
	STAR,
	SLASH,
	MODULO,
	ASSIGN,
	EQUAL_EQUAL,
	BANG_EQUAL,
	LESS,
	LESS_EQUAL,
	GREATER,
	GREATER_EQUAL,
	AMPERSAND_AMPERSAND,
	PIPE_PIPE,
	BANG,
	ARROW,            // ->

	// Punctuation
	LEFT_PAREN,
	RIGHT_PAREN,
	LEFT_BRACE,
	RIGHT_BRACE,
	LEFT_BRACKET,
	RIGHT_BRACKET,
	SEMICOLON,
	COMMA,
	DOT,
	COLON,
	DOUBLE_COLON,     // ::

	EOF,
	INVALID;

	/**
	 * @return True for the keywords that name a built-in type.
	 */
	public boolean isTypeKeyword()
	{
		switch (this)
		{
			case INT:
			case FLOAT:
			case STRING_KEYWORD:
			case BOOL:
			case VOID:
				return true;
			default:
				return false;
		}
	}
}
