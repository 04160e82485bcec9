package org.lokray.thor.lexer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.lokray.thor.util.Diagnostic;
import org.lokray.thor.util.ErrorKind;
import org.lokray.thor.util.ErrorReporter;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest
{
	private ErrorReporter reporter;

	@BeforeEach
	public void setUp()
	{
		reporter = new ErrorReporter();
	}

	private List<Token> scan(String source)
	{
		return new Lexer(source, reporter).scanTokens();
	}

	private static List<TokenType> types(List<Token> tokens)
	{
		return tokens.stream().map(Token::getType).collect(Collectors.toList());
	}

	@Test
	public void testSimpleExpression()
	{
		List<Token> tokens = scan("a + b * c");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.PLUS, TokenType.IDENTIFIER, TokenType.STAR,
				TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
		assertEquals("a", tokens.get(0).getLexeme());
		assertEquals(5, tokens.get(2).getColumn());
		assertEquals(7, tokens.get(3).getColumn());
		assertFalse(reporter.hasErrors());
	}

	@Test
	public void testKeywordsAndOperators()
	{
		List<Token> tokens = scan("extern func f(ref int x) -> float; a::b != c && !d || e <= 1");

		assertEquals(List.of(
				TokenType.EXTERN, TokenType.FUNC, TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.REF,
				TokenType.INT, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN, TokenType.ARROW, TokenType.FLOAT,
				TokenType.SEMICOLON, TokenType.IDENTIFIER, TokenType.DOUBLE_COLON, TokenType.IDENTIFIER,
				TokenType.BANG_EQUAL, TokenType.IDENTIFIER, TokenType.AMPERSAND_AMPERSAND, TokenType.BANG,
				TokenType.IDENTIFIER, TokenType.PIPE_PIPE, TokenType.IDENTIFIER, TokenType.LESS_EQUAL,
				TokenType.INTEGER_LITERAL, TokenType.EOF), types(tokens));
	}

	@ParameterizedTest
	@CsvSource({
			"42, INTEGER_LITERAL",
			"3.25, FLOAT_LITERAL",
			"1., FLOAT_LITERAL",
			"true, BOOLEAN_LITERAL",
			"string, STRING_KEYWORD",
			"strings, IDENTIFIER",
			"_tmp1, IDENTIFIER"
	})
	public void testSingleTokenClassification(String source, TokenType expected)
	{
		List<Token> tokens = scan(source);

		assertEquals(2, tokens.size());
		assertEquals(expected, tokens.get(0).getType());
	}

	@Test
	public void testLiteralValues()
	{
		List<Token> tokens = scan("7 2.5 false \"a\\tb\\\"c\\q\"");

		assertEquals(7, tokens.get(0).getLiteral());
		assertEquals(2.5, tokens.get(1).getLiteral());
		assertEquals(Boolean.FALSE, tokens.get(2).getLiteral());
		assertEquals("a\tb\"cq", tokens.get(3).getLiteral());
	}

	@Test
	public void testTrailingDotFloat()
	{
		List<Token> tokens = scan("float x = 1.;");

		assertEquals(List.of(TokenType.FLOAT, TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.FLOAT_LITERAL, TokenType.SEMICOLON, TokenType.EOF), types(tokens));
		assertEquals("1.", tokens.get(3).getLexeme());
		assertEquals(1.0, tokens.get(3).getLiteral());
		assertFalse(reporter.hasErrors());
	}

	@Test
	public void testLineAndColumnTracking()
	{
		List<Token> tokens = scan("int x;\n  // comment\n    y = 1;");

		Token y = tokens.get(3);
		assertEquals("y", y.getLexeme());
		assertEquals(3, y.getLine());
		assertEquals(5, y.getColumn());
	}

	@Test
	public void testBlockCommentSpanningLines()
	{
		List<Token> tokens = scan("a /* one\ntwo */ b");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
		assertEquals(2, tokens.get(1).getLine());
	}

	@Test
	public void testUnterminatedStringReportsOpeningPosition()
	{
		List<Token> tokens = scan("int x;\n  \"abc");

		assertEquals(1, reporter.errorCount());
		Diagnostic error = reporter.getErrors().get(0);
		assertEquals(ErrorKind.LEX_ERROR, error.kind());
		assertEquals(2, error.line());
		assertEquals(3, error.column());

		Token string = tokens.get(tokens.size() - 2);
		assertEquals(TokenType.STRING_LITERAL, string.getType());
		assertEquals("abc", string.getLiteral());
	}

	@Test
	public void testUnterminatedBlockComment()
	{
		scan("a /* never closed");

		assertEquals(1, reporter.errorCount());
		assertEquals(ErrorKind.LEX_ERROR, reporter.getErrors().get(0).kind());
	}

	@Test
	public void testSingleAmpersandIsDropped()
	{
		List<Token> tokens = scan("a & b");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
		assertEquals(1, reporter.errorCount());
		assertEquals(3, reporter.getErrors().get(0).column());
	}

	@Test
	public void testUnknownCharacterAndIntegerOverflow()
	{
		List<Token> tokens = scan("x @ 99999999999");

		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
		assertEquals(2, reporter.errorCount());
		assertTrue(reporter.getErrors().stream().allMatch(d -> d.kind() == ErrorKind.LEX_ERROR));
	}

	@Test
	public void testEmptySourceYieldsOnlyEof()
	{
		List<Token> tokens = scan("");

		assertEquals(List.of(TokenType.EOF), types(tokens));
		assertEquals(1, tokens.get(0).getLine());
	}
}
