package org.lokray.thor.ast;

import org.lokray.thor.ast.declarations.CallableDeclaration;
import org.lokray.thor.ast.declarations.ExternDeclaration;
import org.lokray.thor.ast.declarations.FunctionDeclaration;
import org.lokray.thor.ast.declarations.ImportDirective;
import org.lokray.thor.ast.declarations.PackageDeclaration;
import org.lokray.thor.ast.expressions.*;
import org.lokray.thor.ast.statements.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints an AST back as Thor source in one canonical layout.
 * Every binary and unary expression is parenthesised, so the printed text parses back to the same tree.
 */
public class AstPrinter implements ASTVisitor<String>
{
	private static final String INDENT = "    ";

	public String print(ASTNode node)
	{
		return node.accept(this);
	}

	@Override
	public String visitProgram(Program program)
	{
		StringBuilder sb = new StringBuilder();
		if (program.getPackageDeclaration() != null)
		{
			sb.append(program.getPackageDeclaration().accept(this)).append("\n");
		}
		for (ImportDirective directive : program.getImports())
		{
			sb.append(directive.accept(this)).append("\n");
		}
		for (Statement statement : program.getStatements())
		{
			sb.append(statement.accept(this)).append("\n");
		}
		return sb.toString();
	}

	@Override
	public String visitPackageDeclaration(PackageDeclaration declaration)
	{
		return "package " + declaration.getName() + ";";
	}

	@Override
	public String visitImportDirective(ImportDirective directive)
	{
		return "import " + quote(directive.getModuleName()) + ";";
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		String header = "func " + signature(declaration);
		return declaration.hasBody() ? header + " " + declaration.getBody().accept(this) : header + ";";
	}

	@Override
	public String visitExternDeclaration(ExternDeclaration declaration)
	{
		return "extern func " + signature(declaration) + ";";
	}

	private String signature(CallableDeclaration declaration)
	{
		String params = declaration.getParameters().stream()
				.map(p -> p.getType().getName() + " " + p.getName())
				.collect(Collectors.joining(", "));
		return declaration.getName() + "(" + params + ") -> " + declaration.getReturnType().getName();
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		return statement.getExpression().accept(this) + ";";
	}

	@Override
	public String visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		String text = statement.getType().getName() + " " + statement.getName();
		if (statement.hasInitializer())
		{
			text += " = " + statement.getInitializer().accept(this);
		}
		return text + ";";
	}

	@Override
	public String visitConstDeclarationStatement(ConstDeclarationStatement statement)
	{
		return "const " + statement.getType().getName() + " " + statement.getName() + " = " + statement.getInitializer().accept(this) + ";";
	}

	@Override
	public String visitBlockStatement(BlockStatement statement)
	{
		if (statement.getStatements().isEmpty())
		{
			return "{\n}";
		}
		StringBuilder sb = new StringBuilder("{\n");
		for (Statement inner : statement.getStatements())
		{
			for (String line : inner.accept(this).split("\n"))
			{
				sb.append(INDENT).append(line).append("\n");
			}
		}
		return sb.append("}").toString();
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		String text = "if (" + statement.getCondition().accept(this) + ") " + statement.getThenBranch().accept(this);
		if (statement.getElseBranch() != null)
		{
			text += " else " + statement.getElseBranch().accept(this);
		}
		return text;
	}

	@Override
	public String visitWhileStatement(WhileStatement statement)
	{
		return "while (" + statement.getCondition().accept(this) + ") " + statement.getBody().accept(this);
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		return statement.getValue() == null ? "return;" : "return " + statement.getValue().accept(this) + ";";
	}

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		if (expression.getValue() instanceof String)
		{
			return quote((String) expression.getValue());
		}
		return expression.getLiteralToken().getLexeme();
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return expression.getQualifiedName();
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		return "(" + expression.getOperator().getLexeme() + expression.getRight().accept(this) + ")";
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		return "(" + expression.getLeft().accept(this) + " " + expression.getOperator().getLexeme() + " " + expression.getRight().accept(this) + ")";
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		return expression.getCallee().accept(this) + "(" + join(expression.getArguments()) + ")";
	}

	@Override
	public String visitDotExpression(DotExpression expression)
	{
		return expression.getObject().accept(this) + "." + expression.getMemberName().getLexeme();
	}

	@Override
	public String visitArrayInitializerExpression(ArrayInitializerExpression expression)
	{
		return "[" + join(expression.getElements()) + "]";
	}

	@Override
	public String visitFormatStringExpression(FormatStringExpression expression)
	{
		return quote(expression.getTemplate()) + " % [" + join(expression.getArguments()) + "]";
	}

	private String join(List<Expression> expressions)
	{
		return expressions.stream().map(e -> e.accept(this)).collect(Collectors.joining(", "));
	}

	private static String quote(String value)
	{
		StringBuilder sb = new StringBuilder("\"");
		for (char c : value.toCharArray())
		{
			switch (c)
			{
				case '\\':
					sb.append("\\\\");
					break;
				case '"':
					sb.append("\\\"");
					break;
				case '\n':
					sb.append("\\n");
					break;
				case '\t':
					sb.append("\\t");
					break;
				case '\r':
					sb.append("\\r");
					break;
				default:
					sb.append(c);
			}
		}
		return sb.append('"').toString();
	}
}
