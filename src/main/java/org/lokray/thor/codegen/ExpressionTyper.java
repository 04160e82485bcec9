package org.lokray.thor.codegen;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.Program;
import org.lokray.thor.ast.declarations.ExternDeclaration;
import org.lokray.thor.ast.declarations.FunctionDeclaration;
import org.lokray.thor.ast.declarations.ImportDirective;
import org.lokray.thor.ast.declarations.PackageDeclaration;
import org.lokray.thor.ast.expressions.*;
import org.lokray.thor.ast.statements.*;
import org.lokray.thor.semantics.ArrayType;
import org.lokray.thor.semantics.FunctionType;
import org.lokray.thor.semantics.PrimitiveType;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

/**
 * Works out the type of an expression from literal shapes, declared variable types and function return types.
 * This is all the typing the generator needs: picking format conversions, string comparisons and
 * compound literal element types. Anything else is {@link UnknownType}.
 */
class ExpressionTyper implements ASTVisitor<Type>
{
	private final GenerationContext context;
	private final CallResolver calls;

	ExpressionTyper(GenerationContext context, CallResolver calls)
	{
		this.context = context;
		this.calls = calls;
	}

	Type typeOf(Expression expression)
	{
		return expression.accept(this);
	}

	@Override
	public Type visitLiteralExpression(LiteralExpression expression)
	{
		return expression.getType();
	}

	@Override
	public Type visitIdentifierExpression(IdentifierExpression expression)
	{
		if (!expression.isQualified())
		{
			Type declared = context.getScope().lookup(expression.getName());
			if (!declared.isUnknown())
			{
				return declared.dereference();
			}
		}
		// Not a variable: a function named as a value
		return functionType(expression);
	}

	private Type functionType(Expression callee)
	{
		return calls.resolve(callee)
				.<Type>map(entry -> entry.declaration().getFunctionType())
				.orElse(UnknownType.INSTANCE);
	}

	@Override
	public Type visitUnaryExpression(UnaryExpression expression)
	{
		switch (expression.getOperator().getType())
		{
			case BANG:
				return PrimitiveType.BOOL;
			case MINUS:
				return typeOf(expression.getRight());
			default:
				return UnknownType.INSTANCE;
		}
	}

	@Override
	public Type visitBinaryExpression(BinaryExpression expression)
	{
		switch (expression.getOperator().getType())
		{
			case ASSIGN:
				return typeOf(expression.getLeft());
			case EQUAL_EQUAL:
			case BANG_EQUAL:
			case LESS:
			case LESS_EQUAL:
			case GREATER:
			case GREATER_EQUAL:
			case AMPERSAND_AMPERSAND:
			case PIPE_PIPE:
				return PrimitiveType.BOOL;
			default:
				Type left = typeOf(expression.getLeft());
				Type right = typeOf(expression.getRight());
				if (!left.isNumeric() || !right.isNumeric())
				{
					return UnknownType.INSTANCE;
				}
				return left.equals(PrimitiveType.FLOAT) || right.equals(PrimitiveType.FLOAT) ? PrimitiveType.FLOAT : PrimitiveType.INT;
		}
	}

	@Override
	public Type visitCallExpression(CallExpression expression)
	{
		Type callee = functionType(expression.getCallee());
		return callee instanceof FunctionType ? ((FunctionType) callee).getReturnType() : UnknownType.INSTANCE;
	}

	@Override
	public Type visitDotExpression(DotExpression expression)
	{
		return functionType(expression);
	}

	@Override
	public Type visitArrayInitializerExpression(ArrayInitializerExpression expression)
	{
		if (expression.getElements().isEmpty())
		{
			return UnknownType.INSTANCE;
		}
		Type element = typeOf(expression.getElements().get(0));
		return element.isUnknown() ? UnknownType.INSTANCE : new ArrayType(element);
	}

	@Override
	public Type visitFormatStringExpression(FormatStringExpression expression)
	{
		return PrimitiveType.STRING;
	}

	// Statements and declarations have no value

	@Override
	public Type visitProgram(Program program)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitPackageDeclaration(PackageDeclaration declaration)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitImportDirective(ImportDirective directive)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitExternDeclaration(ExternDeclaration declaration)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitExpressionStatement(ExpressionStatement statement)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitConstDeclarationStatement(ConstDeclarationStatement statement)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitBlockStatement(BlockStatement statement)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitIfStatement(IfStatement statement)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitWhileStatement(WhileStatement statement)
	{
		return UnknownType.INSTANCE;
	}

	@Override
	public Type visitReturnStatement(ReturnStatement statement)
	{
		return UnknownType.INSTANCE;
	}
}
