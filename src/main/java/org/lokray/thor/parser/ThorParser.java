// File: src/main/java/org/lokray/thor/parser/ThorParser.java

package org.lokray.thor.parser;

import org.lokray.thor.ast.Parameter;
import org.lokray.thor.ast.Program;
import org.lokray.thor.ast.declarations.ExternDeclaration;
import org.lokray.thor.ast.declarations.FunctionDeclaration;
import org.lokray.thor.ast.declarations.ImportDirective;
import org.lokray.thor.ast.declarations.PackageDeclaration;
import org.lokray.thor.ast.expressions.*;
import org.lokray.thor.ast.statements.*;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.lexer.TokenType;
import org.lokray.thor.semantics.ArrayType;
import org.lokray.thor.semantics.PrimitiveType;
import org.lokray.thor.semantics.ReferenceType;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.util.ErrorKind;
import org.lokray.thor.util.ErrorReporter;

import java.util.ArrayList;
import java.util.List;

/**
 * The ThorParser performs syntactic analysis.
 * It takes the token list produced by the lexer and builds a {@link Program} using recursive descent.
 * <p>
 * Errors are reported to the {@link ErrorReporter}; the statement being parsed is abandoned and parsing
 * resumes at the next statement boundary, so one pass reports every syntax error in the file.
 * Callers must check the reporter before using the returned program.
 */
public class ThorParser
{
	private final List<Token> tokens;
	private final ErrorReporter errorReporter;
	private int current = 0;
	private int blockDepth = 0; // Functions, externs and imports are only allowed at depth 0

	/**
	 * Constructs a ThorParser.
	 *
	 * @param tokens        The tokens produced by the lexer, terminated by EOF.
	 * @param errorReporter Collects syntax errors.
	 */
	public ThorParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this.tokens = tokens;
		this.errorReporter = errorReporter;
	}

	/**
	 * Parses the whole token list.
	 * Grammar: `PACKAGE_DECL? IMPORT* STATEMENT*`
	 *
	 * @return The parsed program. Only meaningful if no errors were reported.
	 */
	public Program parse()
	{
		PackageDeclaration packageDeclaration = null;
		List<ImportDirective> imports = new ArrayList<>();
		List<Statement> statements = new ArrayList<>();

		if (match(TokenType.PACKAGE))
		{
			try
			{
				packageDeclaration = packageDeclaration();
			}
			catch (SyntaxError e)
			{
				synchronize(false);
			}
		}

		while (match(TokenType.IMPORT))
		{
			try
			{
				imports.add(importDirective());
			}
			catch (SyntaxError e)
			{
				synchronize(false);
			}
		}

		while (!isAtEnd())
		{
			try
			{
				statements.add(statement());
			}
			catch (SyntaxError e)
			{
				synchronize(false);
			}
		}

		return new Program(packageDeclaration, imports, statements);
	}

	/**
	 * Grammar: `PACKAGE QUALIFIED_NAME ;`
	 */
	private PackageDeclaration packageDeclaration() throws SyntaxError
	{
		Token packageKeyword = previous();
		String name = qualifiedName("Expected package name after 'package'.");
		consume(TokenType.SEMICOLON, "Expected ';' after package declaration.");
		return new PackageDeclaration(packageKeyword, name);
	}

	/**
	 * Grammar: `IMPORT (STRING_LITERAL | QUALIFIED_NAME) ;`
	 */
	private ImportDirective importDirective() throws SyntaxError
	{
		Token importKeyword = previous();
		String moduleName;
		if (match(TokenType.STRING_LITERAL))
		{
			moduleName = ((String) previous().getLiteral()).trim();
			if (moduleName.isEmpty())
			{
				throw error(previous(), "Import path cannot be empty.");
			}
		}
		else
		{
			moduleName = qualifiedName("Expected module name or string after 'import'.");
		}
		consume(TokenType.SEMICOLON, "Expected ';' after import.");
		return new ImportDirective(importKeyword, moduleName);
	}

	private String qualifiedName(String message) throws SyntaxError
	{
		StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, message).getLexeme());
		while (match(TokenType.DOT))
		{
			name.append('.').append(consume(TokenType.IDENTIFIER, "Expected identifier after '.'.").getLexeme());
		}
		return name.toString();
	}

	// --- Statements ---

	private Statement statement() throws SyntaxError
	{
		if (blockDepth > 0 && (check(TokenType.FUNC) || check(TokenType.EXTERN) || check(TokenType.IMPORT) || check(TokenType.PACKAGE)))
		{
			throw error(peek(), "'" + peek().getLexeme() + "' is only allowed at top level.");
		}
		if (match(TokenType.FUNC))
		{
			return functionDeclaration(previous());
		}
		if (match(TokenType.EXTERN))
		{
			return externDeclaration();
		}
		if (match(TokenType.CONST))
		{
			return constDeclaration();
		}
		if (peek().getType().isTypeKeyword() || (check(TokenType.IDENTIFIER) && checkNext(TokenType.IDENTIFIER)))
		{
			return typedDeclaration();
		}
		if (match(TokenType.IF))
		{
			return ifStatement();
		}
		if (match(TokenType.WHILE))
		{
			return whileStatement();
		}
		if (match(TokenType.RETURN))
		{
			return returnStatement();
		}
		if (match(TokenType.LEFT_BRACE))
		{
			return block();
		}
		if (match(TokenType.IMPORT))
		{
			return importDirective();
		}
		if (match(TokenType.PACKAGE))
		{
			return packageDeclaration();
		}
		return expressionStatement();
	}

	/**
	 * A declaration that starts with its type: a variable or a C-style function.
	 * Grammar: `TYPE IDENTIFIER ( '(' PARAMS ')' (BLOCK | ;) | ([])* (= EXPRESSION)? ; )`
	 */
	private Statement typedDeclaration() throws SyntaxError
	{
		Token typeToken = peek();
		Type type = type();
		Token name = consume(TokenType.IDENTIFIER, "Expected a name after type '" + type.getName() + "'.");

		if (match(TokenType.LEFT_PAREN))
		{
			if (blockDepth > 0)
			{
				throw error(name, "Function '" + name.getLexeme() + "' can only be declared at top level.");
			}
			List<Parameter> parameters = parameters();
			return new FunctionDeclaration(typeToken, name, parameters, type, functionBody());
		}

		type = arraySuffix(type);
		if (type.isVoid())
		{
			throw error(name, "Variable '" + name.getLexeme() + "' cannot have type void.");
		}

		Expression initializer = null;
		if (match(TokenType.ASSIGN))
		{
			initializer = expression();
		}
		consume(TokenType.SEMICOLON, "Expected ';' after variable declaration.");
		return new VariableDeclarationStatement(typeToken, type, name, initializer);
	}

	/**
	 * Grammar: `FUNC IDENTIFIER '(' PARAMS ')' RETURN_TYPE? (BLOCK | ;)`
	 */
	private FunctionDeclaration functionDeclaration(Token funcKeyword) throws SyntaxError
	{
		Token name = consume(TokenType.IDENTIFIER, "Expected function name after 'func'.");
		consume(TokenType.LEFT_PAREN, "Expected '(' after function name.");
		List<Parameter> parameters = parameters();
		Type returnType = returnType();
		return new FunctionDeclaration(funcKeyword, name, parameters, returnType, functionBody());
	}

	/**
	 * Grammar: `EXTERN (FUNC IDENTIFIER '(' PARAMS ')' RETURN_TYPE? | TYPE IDENTIFIER '(' PARAMS ')') ;`
	 */
	private ExternDeclaration externDeclaration() throws SyntaxError
	{
		Token externKeyword = previous();
		Token name;
		List<Parameter> parameters;
		Type returnType;

		if (match(TokenType.FUNC))
		{
			name = consume(TokenType.IDENTIFIER, "Expected function name after 'extern func'.");
			consume(TokenType.LEFT_PAREN, "Expected '(' after extern function name.");
			parameters = parameters();
			returnType = returnType();
		}
		else
		{
			returnType = type();
			name = consume(TokenType.IDENTIFIER, "Expected function name in extern declaration.");
			consume(TokenType.LEFT_PAREN, "Expected '(' after extern function name.");
			parameters = parameters();
		}

		if (check(TokenType.LEFT_BRACE))
		{
			throw error(peek(), "Extern function '" + name.getLexeme() + "' cannot have a body.");
		}
		consume(TokenType.SEMICOLON, "Expected ';' after extern declaration.");
		return new ExternDeclaration(externKeyword, name, parameters, returnType);
	}

	/**
	 * Parses the parameter list after its '(' up to and including ')'.
	 * Grammar: `(REF? TYPE IDENTIFIER ([])* (, REF? TYPE IDENTIFIER ([])*)*)? ')'`
	 */
	private List<Parameter> parameters() throws SyntaxError
	{
		List<Parameter> parameters = new ArrayList<>();
		if (check(TokenType.VOID) && checkNext(TokenType.RIGHT_PAREN))
		{
			advance(); // C-style (void)
		}
		else if (!check(TokenType.RIGHT_PAREN))
		{
			do
			{
				boolean isReference = match(TokenType.REF);
				Type type = type();
				Token name = consume(TokenType.IDENTIFIER, "Expected parameter name.");
				type = arraySuffix(type);
				if (type.isVoid())
				{
					throw error(name, "Parameter '" + name.getLexeme() + "' cannot have type void.");
				}
				parameters.add(new Parameter(name, isReference ? new ReferenceType(type) : type));
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters.");
		return parameters;
	}

	/**
	 * The return type after a parameter list: `-> TYPE`, a bare type, or nothing for void.
	 */
	private Type returnType() throws SyntaxError
	{
		if (match(TokenType.ARROW))
		{
			return type();
		}
		if (peek().getType().isTypeKeyword() || check(TokenType.IDENTIFIER))
		{
			return type();
		}
		return PrimitiveType.VOID;
	}

	private BlockStatement functionBody() throws SyntaxError
	{
		if (match(TokenType.LEFT_BRACE))
		{
			return block();
		}
		consume(TokenType.SEMICOLON, "Expected '{' or ';' after function signature.");
		return null;
	}

	/**
	 * Grammar: `CONST TYPE IDENTIFIER ([])* = EXPRESSION ;`
	 */
	private ConstDeclarationStatement constDeclaration() throws SyntaxError
	{
		Token constKeyword = previous();
		Type type = type();
		Token name = consume(TokenType.IDENTIFIER, "Expected constant name.");
		type = arraySuffix(type);
		consume(TokenType.ASSIGN, "Constant '" + name.getLexeme() + "' must be initialized.");
		Expression initializer = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after constant declaration.");
		return new ConstDeclarationStatement(constKeyword, type, name, initializer);
	}

	private IfStatement ifStatement() throws SyntaxError
	{
		Token ifKeyword = previous();
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'.");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after if condition.");

		Statement thenBranch = statement();
		Statement elseBranch = null;
		if (match(TokenType.ELSE))
		{
			elseBranch = statement();
		}
		return new IfStatement(ifKeyword, condition, thenBranch, elseBranch);
	}

	private WhileStatement whileStatement() throws SyntaxError
	{
		Token whileKeyword = previous();
		consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'.");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expected ')' after while condition.");
		return new WhileStatement(whileKeyword, condition, statement());
	}

	private ReturnStatement returnStatement() throws SyntaxError
	{
		Token keyword = previous();
		Expression value = null;
		if (!check(TokenType.SEMICOLON))
		{
			value = expression();
		}
		consume(TokenType.SEMICOLON, "Expected ';' after return value.");
		return new ReturnStatement(keyword, value);
	}

	/**
	 * Parses statements after a '{' up to and including the matching '}'.
	 * A broken statement is skipped without leaving the block.
	 */
	private BlockStatement block() throws SyntaxError
	{
		Token leftBrace = previous();
		List<Statement> statements = new ArrayList<>();

		blockDepth++;
		try
		{
			while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
			{
				try
				{
					statements.add(statement());
				}
				catch (SyntaxError e)
				{
					synchronize(true);
				}
			}
		}
		finally
		{
			blockDepth--;
		}

		consume(TokenType.RIGHT_BRACE, "Expected '}' after block.");
		return new BlockStatement(leftBrace, statements);
	}

	private ExpressionStatement expressionStatement() throws SyntaxError
	{
		Expression expr = expression();
		consume(TokenType.SEMICOLON, "Expected ';' after expression.");
		return new ExpressionStatement(expr);
	}

	// --- Types ---

	/**
	 * Grammar: `(INT | FLOAT | STRING | BOOL | VOID) ([])*`
	 */
	private Type type() throws SyntaxError
	{
		Token typeToken = peek();
		if (typeToken.getType().isTypeKeyword())
		{
			advance();
			Type base = PrimitiveType.fromKeyword(typeToken.getLexeme())
					.orElseThrow(() -> error(typeToken, "Unsupported type keyword '" + typeToken.getLexeme() + "'."));
			return arraySuffix(base);
		}
		if (typeToken.getType() == TokenType.IDENTIFIER)
		{
			throw error(typeToken, ErrorKind.UNKNOWN_TYPE, "Unknown type '" + typeToken.getLexeme() + "'.");
		}
		throw error(typeToken, "Expected a type.");
	}

	private Type arraySuffix(Type type) throws SyntaxError
	{
		while (check(TokenType.LEFT_BRACKET) && checkNext(TokenType.RIGHT_BRACKET))
		{
			advance();
			advance();
			type = new ArrayType(type);
		}
		return type;
	}

	// --- Expressions ---

	private Expression expression() throws SyntaxError
	{
		return assignment();
	}

	/**
	 * Right-associative. Grammar: `OR (= ASSIGNMENT)?`
	 */
	private Expression assignment() throws SyntaxError
	{
		Expression expr = or();

		if (match(TokenType.ASSIGN))
		{
			Token equals = previous();
			Expression value = assignment();

			if (expr instanceof IdentifierExpression && !((IdentifierExpression) expr).isQualified())
			{
				return new BinaryExpression(expr, equals, value);
			}
			throw error(equals, "Invalid assignment target.");
		}

		return expr;
	}

	private Expression or() throws SyntaxError
	{
		Expression expr = and();
		while (match(TokenType.PIPE_PIPE))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, and());
		}
		return expr;
	}

	private Expression and() throws SyntaxError
	{
		Expression expr = equality();
		while (match(TokenType.AMPERSAND_AMPERSAND))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, equality());
		}
		return expr;
	}

	private Expression equality() throws SyntaxError
	{
		Expression expr = comparison();
		while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, comparison());
		}
		return expr;
	}

	private Expression comparison() throws SyntaxError
	{
		Expression expr = term();
		while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, term());
		}
		return expr;
	}

	private Expression term() throws SyntaxError
	{
		Expression expr = factor();
		while (match(TokenType.PLUS, TokenType.MINUS))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, factor());
		}
		return expr;
	}

	private Expression factor() throws SyntaxError
	{
		Expression expr = unary();
		while (match(TokenType.STAR, TokenType.SLASH, TokenType.MODULO))
		{
			Token operator = previous();
			expr = new BinaryExpression(expr, operator, unary());
		}
		return expr;
	}

	private Expression unary() throws SyntaxError
	{
		if (match(TokenType.BANG, TokenType.MINUS))
		{
			Token operator = previous();
			return new UnaryExpression(operator, unary());
		}
		return call();
	}

	/**
	 * Postfix calls and member accesses, chainable: `a.b.c(x)(y)`.
	 */
	private Expression call() throws SyntaxError
	{
		Expression expr = primary();

		while (true)
		{
			if (match(TokenType.LEFT_PAREN))
			{
				expr = finishCall(expr);
			}
			else if (match(TokenType.DOT))
			{
				Token name = consume(TokenType.IDENTIFIER, "Expected member name after '.'.");
				expr = new DotExpression(expr, name);
			}
			else
			{
				break;
			}
		}

		return expr;
	}

	private CallExpression finishCall(Expression callee) throws SyntaxError
	{
		Token paren = previous();
		List<Expression> arguments = expressionList(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
		return new CallExpression(callee, paren, arguments);
	}

	private Expression primary() throws SyntaxError
	{
		if (match(TokenType.INTEGER_LITERAL, TokenType.FLOAT_LITERAL, TokenType.BOOLEAN_LITERAL))
		{
			return new LiteralExpression(previous(), previous().getLiteral());
		}

		if (match(TokenType.STRING_LITERAL))
		{
			Token literal = previous();
			if (check(TokenType.MODULO) && checkNext(TokenType.LEFT_BRACKET))
			{
				advance(); // '%'
				advance(); // '['
				List<Expression> arguments = expressionList(TokenType.RIGHT_BRACKET, "Expected ']' after format arguments.");
				return new FormatStringExpression(literal, arguments);
			}
			return new LiteralExpression(literal, literal.getLiteral());
		}

		if (match(TokenType.IDENTIFIER))
		{
			List<Token> segments = new ArrayList<>();
			segments.add(previous());
			while (match(TokenType.DOUBLE_COLON))
			{
				segments.add(consume(TokenType.IDENTIFIER, "Expected identifier after '::'."));
			}
			return new IdentifierExpression(segments);
		}

		if (match(TokenType.LEFT_PAREN))
		{
			Expression expr = expression();
			consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
			return expr;
		}

		if (match(TokenType.LEFT_BRACKET))
		{
			Token leftBracket = previous();
			List<Expression> elements = expressionList(TokenType.RIGHT_BRACKET, "Expected ']' after array elements.");
			return new ArrayInitializerExpression(leftBracket, elements);
		}

		throw error(peek(), "Expected expression.");
	}

	/**
	 * Comma-separated expressions up to and including the closing token.
	 */
	private List<Expression> expressionList(TokenType closing, String message) throws SyntaxError
	{
		List<Expression> expressions = new ArrayList<>();
		if (!check(closing))
		{
			do
			{
				expressions.add(expression());
			}
			while (match(TokenType.COMMA));
		}
		consume(closing, message);
		return expressions;
	}

	// --- Token helpers ---

	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	private Token consume(TokenType type, String message) throws SyntaxError
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private boolean check(TokenType type)
	{
		return peek().getType() == type;
	}

	private boolean checkNext(TokenType type)
	{
		if (current + 1 >= tokens.size())
		{
			return false;
		}
		return tokens.get(current + 1).getType() == type;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	private SyntaxError error(Token token, String message)
	{
		return error(token, ErrorKind.SYNTAX_ERROR, message);
	}

	/**
	 * Reports an error at the given token and creates the exception that abandons the current statement.
	 */
	private SyntaxError error(Token token, ErrorKind kind, String message)
	{
		String found = token.getType() == TokenType.EOF ? " Found end of file." : " Found '" + token.getLexeme() + "'.";
		errorReporter.report(kind, token.getLine(), token.getColumn(), message + found);
		return new SyntaxError();
	}

	/**
	 * Skips tokens up to and including the next ';', or up to the next '}'.
	 * Inside a block the '}' is left for the block to close; at top level a stray '}' is skipped.
	 */
	private void synchronize(boolean insideBlock)
	{
		while (!isAtEnd())
		{
			if (match(TokenType.SEMICOLON))
			{
				return;
			}
			if (check(TokenType.RIGHT_BRACE))
			{
				if (!insideBlock)
				{
					advance();
				}
				return;
			}
			advance();
		}
	}

	/**
	 * Unchecked exception used internally to unwind the stack when a syntax error is found.
	 */
	private static class SyntaxError extends RuntimeException
	{
	}
}
