// File: src/main/java/org/lokray/thor/lexer/Lexer.java

package org.lokray.thor.lexer;

import org.lokray.thor.util.ErrorKind;
import org.lokray.thor.util.ErrorReporter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer performs lexical analysis.
 * It reads raw Thor source code and converts it into a list of Tokens, always terminated by {@link TokenType#EOF}.
 * Lexical problems are reported through the {@link ErrorReporter}; the offending characters never reach the parser.
 */
public class Lexer
{
	private final String source;
	private final List<Token> tokens = new ArrayList<>();
	private final ErrorReporter errorReporter;

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1;
	private int column = 1;

	private int startLine = 1;
	private int startColumn = 1;

	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("int", TokenType.INT);
		keywords.put("float", TokenType.FLOAT);
		keywords.put("string", TokenType.STRING_KEYWORD);
		keywords.put("bool", TokenType.BOOL);
		keywords.put("void", TokenType.VOID);
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("while", TokenType.WHILE);
		keywords.put("return", TokenType.RETURN);
		keywords.put("import", TokenType.IMPORT);
		keywords.put("extern", TokenType.EXTERN);
		keywords.put("func", TokenType.FUNC);
		keywords.put("package", TokenType.PACKAGE);
		keywords.put("const", TokenType.CONST);
		keywords.put("ref", TokenType.REF);
		keywords.put("true", TokenType.BOOLEAN_LITERAL);
		keywords.put("false", TokenType.BOOLEAN_LITERAL);
	}

	/**
	 * @param source        Thor source text of one file.
	 * @param errorReporter Receives LEX_ERROR diagnostics.
	 */
	public Lexer(String source, ErrorReporter errorReporter)
	{
		this.source = source;
		this.errorReporter = errorReporter;
	}

	/**
	 * Tokenizes the whole input. The returned list always ends with EOF.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd())
		{
			start = current;
			startLine = line;
			startColumn = column;

			scanToken();
		}

		tokens.add(new Token(TokenType.EOF, "", null, line, column));
		return tokens;
	}

	private void scanToken()
	{
		char c = advance();

		switch (c)
		{
			case '(':
				addToken(TokenType.LEFT_PAREN);
				break;
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case '{':
				addToken(TokenType.LEFT_BRACE);
				break;
			case '}':
				addToken(TokenType.RIGHT_BRACE);
				break;
			case '[':
				addToken(TokenType.LEFT_BRACKET);
				break;
			case ']':
				addToken(TokenType.RIGHT_BRACKET);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case '.':
				addToken(TokenType.DOT);
				break;
			case '+':
				addToken(TokenType.PLUS);
				break;
			case '*':
				addToken(TokenType.STAR);
				break;
			case '%':
				addToken(TokenType.MODULO);
				break;
			case ':':
				addToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);
				break;
			case '-':
				addToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
				break;
			case '=':
				addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.ASSIGN);
				break;
			case '!':
				addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
				break;
			case '<':
				addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
				break;
			case '>':
				addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
				break;
			case '&':
				if (match('&'))
				{
					addToken(TokenType.AMPERSAND_AMPERSAND);
				}
				else
				{
					invalid("Unexpected character '&'. Did you mean '&&'?");
				}
				break;
			case '|':
				if (match('|'))
				{
					addToken(TokenType.PIPE_PIPE);
				}
				else
				{
					invalid("Unexpected character '|'. Did you mean '||'?");
				}
				break;
			case '/':
				if (match('/'))
				{
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
				}
				else if (match('*'))
				{
					blockComment();
				}
				else
				{
					addToken(TokenType.SLASH);
				}
				break;

			case '"':
				scanStringLiteral();
				break;

			case ' ':
			case '\r':
			case '\t':
				break;
			case '\n':
				newLine();
				break;

			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (isAlpha(c))
				{
					scanIdentifier();
				}
				else
				{
					invalid("Unexpected character '" + c + "'.");
				}
				break;
		}
	}

	private void blockComment()
	{
		while (!(peek() == '*' && peekNext() == '/') && !isAtEnd())
		{
			if (advance() == '\n')
			{
				newLine();
			}
		}
		if (isAtEnd())
		{
			errorAt(startLine, startColumn, "Unterminated block comment.");
			return;
		}
		advance();
		advance();
	}

	/**
	 * Scans a number literal. A single '.' makes it a float, digits after the '.' are optional.
	 */
	private void scanNumber()
	{
		while (isDigit(peek()))
		{
			advance();
		}

		boolean isFloatingPoint = false;
		if (peek() == '.')
		{
			isFloatingPoint = true;
			advance(); // Consume the '.'
			while (isDigit(peek()))
			{
				advance();
			}
		}

		String numberStr = source.substring(start, current);
		if (isFloatingPoint)
		{
			addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(numberStr));
			return;
		}

		try
		{
			addToken(TokenType.INTEGER_LITERAL, Integer.parseInt(numberStr));
		}
		catch (NumberFormatException e)
		{
			errorAt(startLine, startColumn, "Integer literal out of range: " + numberStr);
		}
	}

	/**
	 * Reads a double-quoted literal, decoding the supported escapes.
	 * An unterminated literal is reported at its opening position and the scanned prefix is still emitted.
	 */
	private void scanStringLiteral()
	{
		StringBuilder value = new StringBuilder();
		while (peek() != '"' && !isAtEnd())
		{
			char c = advance();
			if (c == '\\')
			{
				if (isAtEnd())
				{
					break;
				}
				char escapeChar = advance();
				switch (escapeChar)
				{
					case 'n':
						value.append('\n');
						break;
					case 't':
						value.append('\t');
						break;
					case 'r':
						value.append('\r');
						break;
					case '"':
						value.append('"');
						break;
					case '\\':
						value.append('\\');
						break;
					default:
						// Unknown escapes keep the escaped character
						value.append(escapeChar);
						if (escapeChar == '\n')
						{
							newLine();
						}
						break;
				}
			}
			else if (c == '\n')
			{
				value.append('\n');
				newLine();
			}
			else
			{
				value.append(c);
			}
		}

		if (isAtEnd())
		{
			errorAt(startLine, startColumn, "Unterminated string literal.");
			addToken(TokenType.STRING_LITERAL, value.toString());
			return;
		}

		advance(); // The closing "
		addToken(TokenType.STRING_LITERAL, value.toString());
	}

	private void scanIdentifier()
	{
		while (isAlphaNumeric(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);
		TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
		if (type == TokenType.BOOLEAN_LITERAL)
		{
			addToken(type, Boolean.parseBoolean(text));
		}
		else
		{
			addToken(type);
		}
	}

	private char advance()
	{
		char c = source.charAt(current++);
		column++;
		return c;
	}

	private void newLine()
	{
		line++;
		column = 1;
	}

	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, startLine, startColumn));
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		current++;
		column++;
		return true;
	}

	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isAlpha(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isAlphaNumeric(char c)
	{
		return isAlpha(c) || isDigit(c);
	}

	/**
	 * Reports an {@link TokenType#INVALID} lexeme. It is not added to the token list.
	 */
	private void invalid(String message)
	{
		errorAt(startLine, startColumn, message);
	}

	private void errorAt(int errorLine, int errorColumn, String message)
	{
		errorReporter.report(ErrorKind.LEX_ERROR, errorLine, errorColumn, message);
	}
}
