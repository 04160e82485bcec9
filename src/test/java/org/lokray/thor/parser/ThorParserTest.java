package org.lokray.thor.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.thor.ast.AstPrinter;
import org.lokray.thor.ast.Program;
import org.lokray.thor.ast.declarations.ExternDeclaration;
import org.lokray.thor.ast.declarations.FunctionDeclaration;
import org.lokray.thor.ast.declarations.ImportDirective;
import org.lokray.thor.ast.expressions.CallExpression;
import org.lokray.thor.ast.expressions.DotExpression;
import org.lokray.thor.ast.expressions.FormatStringExpression;
import org.lokray.thor.ast.expressions.IdentifierExpression;
import org.lokray.thor.ast.statements.ConstDeclarationStatement;
import org.lokray.thor.ast.statements.ExpressionStatement;
import org.lokray.thor.ast.statements.IfStatement;
import org.lokray.thor.ast.statements.VariableDeclarationStatement;
import org.lokray.thor.lexer.Lexer;
import org.lokray.thor.semantics.ArrayType;
import org.lokray.thor.semantics.PrimitiveType;
import org.lokray.thor.semantics.ReferenceType;
import org.lokray.thor.util.CompilationException;
import org.lokray.thor.util.Diagnostic;
import org.lokray.thor.util.ErrorKind;
import org.lokray.thor.util.ErrorReporter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ThorParserTest
{
	private ErrorReporter reporter;

	@BeforeEach
	public void setUp()
	{
		reporter = new ErrorReporter();
	}

	private Program parse(String source)
	{
		return new ThorParser(new Lexer(source, reporter).scanTokens(), reporter).parse();
	}

	private String printFirst(String source)
	{
		Program program = parse(source);
		assertFalse(reporter.hasErrors(), () -> "Unexpected errors: " + reporter.getErrors());
		return new AstPrinter().print(program.getStatements().get(0));
	}

	@Test
	public void testArithmeticPrecedence()
	{
		assertEquals("(a + (b * c));", printFirst("a + b * c;"));
		assertEquals("((a - b) - c);", printFirst("a - b - c;"));
		assertEquals("((-a) * (!b));", printFirst("-a * !b;"));
	}

	@Test
	public void testLogicalAndComparisonPrecedence()
	{
		assertEquals("((a < b) || ((c == d) && e));", printFirst("a < b || c == d && e;"));
	}

	@Test
	public void testAssignmentIsRightAssociative()
	{
		assertEquals("(a = (b = (c + 1)));", printFirst("a = b = c + 1;"));
	}

	@Test
	public void testInvalidAssignmentTarget()
	{
		parse("f() = 3;");

		assertEquals(1, reporter.errorCount());
		assertTrue(reporter.getErrors().get(0).message().startsWith("Invalid assignment target."));
	}

	@Test
	public void testHeaderAndDeclarations()
	{
		Program program = parse(String.join("\n",
				"package geometry;",
				"import \"std.io\";",
				"import util.math;",
				"const int LIMIT = 10;",
				"int[] primes = [2, 3, 5];",
				"extern int puts(string s);",
				"extern func abs(int x) -> int;",
				"func bump(ref int value) { value = value + 1; }",
				"int twice(int a) { return a * 2; }",
				"func forward(int a) -> int;",
				"func sum(int[] xs, int n) int { return 0; }"));

		assertFalse(reporter.hasErrors(), () -> reporter.getErrors().toString());
		assertEquals("geometry", program.getPackageName().orElseThrow());
		assertEquals(List.of("std.io", "util.math"),
				program.getImports().stream().map(ImportDirective::getModuleName).collect(java.util.stream.Collectors.toList()));
		assertEquals(8, program.getStatements().size());

		assertInstanceOf(ConstDeclarationStatement.class, program.getStatements().get(0));
		VariableDeclarationStatement primes = (VariableDeclarationStatement) program.getStatements().get(1);
		assertEquals(new ArrayType(PrimitiveType.INT), primes.getType());

		ExternDeclaration puts = (ExternDeclaration) program.getStatements().get(2);
		assertEquals(PrimitiveType.INT, puts.getReturnType());
		assertEquals(PrimitiveType.STRING, puts.getParameters().get(0).getType());

		FunctionDeclaration bump = (FunctionDeclaration) program.getStatements().get(4);
		assertEquals(PrimitiveType.VOID, bump.getReturnType());
		assertEquals(new ReferenceType(PrimitiveType.INT), bump.getParameters().get(0).getType());
		assertTrue(bump.hasReferenceParameters());

		FunctionDeclaration twice = (FunctionDeclaration) program.getStatements().get(5);
		assertEquals("twice", twice.getName());
		assertTrue(twice.hasBody());

		assertFalse(((FunctionDeclaration) program.getStatements().get(6)).hasBody());
		assertEquals(PrimitiveType.INT, ((FunctionDeclaration) program.getStatements().get(7)).getReturnType());
	}

	@Test
	public void testQualifiedCallForms()
	{
		Program program = parse("std.println(\"a\"); std::println(\"b\"); println(\"c\");");

		assertFalse(reporter.hasErrors());
		CallExpression dotted = (CallExpression) ((ExpressionStatement) program.getStatements().get(0)).getExpression();
		assertInstanceOf(DotExpression.class, dotted.getCallee());

		CallExpression scoped = (CallExpression) ((ExpressionStatement) program.getStatements().get(1)).getExpression();
		IdentifierExpression callee = (IdentifierExpression) scoped.getCallee();
		assertTrue(callee.isQualified());
		assertEquals("std", callee.getQualifier());
		assertEquals("println", callee.getName());
	}

	@Test
	public void testFormatStringExpression()
	{
		Program program = parse("string s = \"%s scored %s\" % [name, 42];");

		assertFalse(reporter.hasErrors());
		VariableDeclarationStatement s = (VariableDeclarationStatement) program.getStatements().get(0);
		FormatStringExpression format = (FormatStringExpression) s.getInitializer();
		assertEquals("%s scored %s", format.getTemplate());
		assertEquals(2, format.getArguments().size());
	}

	@Test
	public void testDanglingElseBindsToNearestIf()
	{
		Program program = parse("if (a) if (b) x = 1; else x = 2;");

		IfStatement outer = (IfStatement) program.getStatements().get(0);
		assertNull(outer.getElseBranch());
		assertNotNull(((IfStatement) outer.getThenBranch()).getElseBranch());
	}

	@Test
	public void testRecoveryCollectsSeveralErrors()
	{
		Program program = parse(String.join("\n",
				"int a = ;",
				"int b = 2;",
				"func f() {",
				"    int c = 1 +;",
				"    c = 3;",
				"}",
				"int d = 4"));

		List<Diagnostic> errors = reporter.getErrors();
		assertEquals(3, errors.size(), errors::toString);
		assertEquals(1, errors.get(0).line());
		assertEquals(4, errors.get(1).line());
		assertTrue(errors.get(2).message().endsWith("Found end of file."));

		// The statements around the broken ones survive
		assertEquals(2, program.getStatements().size());
		FunctionDeclaration f = (FunctionDeclaration) program.getStatements().get(1);
		assertEquals(1, f.getBody().getStatements().size());
	}

	@Test
	public void testFunctionInsideBlockIsRejected()
	{
		parse("func outer() { func inner() { } }");

		assertTrue(reporter.hasErrors());
		assertTrue(reporter.getErrors().get(0).message().contains("only allowed at top level"));
	}

	@Test
	public void testExternWithBodyIsRejected()
	{
		parse("extern func f() -> int { return 1; }");

		assertTrue(reporter.hasErrors());
		assertTrue(reporter.getErrors().get(0).message().contains("cannot have a body"));
	}

	@Test
	public void testUnknownTypeIsReported()
	{
		parse("Vector v;");

		assertEquals(1, reporter.errorCount());
		assertEquals(ErrorKind.UNKNOWN_TYPE, reporter.getErrors().get(0).kind());
	}

	@Test
	public void testSourceFileParserFailsWithStageErrors()
	{
		SourceFileParser parser = new SourceFileParser(reporter);

		CompilationException e = assertThrows(CompilationException.class,
				() -> parser.parse("int x = ;\nint y = ;", "broken.thor"));

		assertEquals(ErrorKind.SYNTAX_ERROR, e.getKind());
		assertEquals(2, e.getDiagnostics().size());
		assertEquals("broken.thor", e.getDiagnostics().get(0).source());
	}

	@Test
	public void testSourceFileParserStopsAfterLexErrors()
	{
		SourceFileParser parser = new SourceFileParser(reporter);

		CompilationException e = assertThrows(CompilationException.class,
				() -> parser.parse("int x = 1 # 2;", "lex.thor"));

		assertEquals(ErrorKind.LEX_ERROR, e.getKind());
		assertEquals(1, reporter.errorCount());
	}
}
