package org.lokray.thor.codegen;

import org.lokray.thor.ast.expressions.DotExpression;
import org.lokray.thor.ast.expressions.Expression;
import org.lokray.thor.ast.expressions.IdentifierExpression;

import java.util.Optional;

/**
 * Maps the callee of a call to the function it names.
 * Callees come in three shapes: {@code f}, {@code m::f} and member chains such as {@code m.f} or {@code a.b.f}.
 */
class CallResolver
{
	private final GenerationContext context;

	CallResolver(GenerationContext context)
	{
		this.context = context;
	}

	Optional<FunctionTable.Entry> resolve(Expression callee)
	{
		FunctionTable functions = context.getFunctions();
		if (callee instanceof IdentifierExpression)
		{
			IdentifierExpression identifier = (IdentifierExpression) callee;
			if (identifier.isQualified())
			{
				return functions.resolveQualified(identifier.getQualifier(), identifier.getName());
			}
			return functions.resolveBare(identifier.getName(), context.getCurrentSegment());
		}
		if (callee instanceof DotExpression)
		{
			DotExpression dot = (DotExpression) callee;
			String qualifier = qualifiedName(dot.getObject());
			if (qualifier != null)
			{
				return functions.resolveQualified(qualifier, dot.getMemberName().getLexeme());
			}
		}
		return Optional.empty();
	}

	/**
	 * The name an unresolved callee is emitted with: its simple name, or its qualified name with every
	 * separator turned into '_'. Returns null for callees that are not names at all.
	 */
	String fallbackName(Expression callee)
	{
		String qualified = qualifiedName(callee);
		return qualified == null ? null : qualified.replaceAll("[^A-Za-z0-9_]", "_");
	}

	/**
	 * Flattens a name expression into dotted form, e.g. {@code util.math.add} or {@code std::io} to {@code std.io}.
	 *
	 * @return The dotted name, or null if the expression contains anything but names.
	 */
	static String qualifiedName(Expression expression)
	{
		if (expression instanceof IdentifierExpression)
		{
			IdentifierExpression identifier = (IdentifierExpression) expression;
			return identifier.isQualified() ? identifier.getQualifier() + "." + identifier.getName() : identifier.getName();
		}
		if (expression instanceof DotExpression)
		{
			DotExpression dot = (DotExpression) expression;
			String object = qualifiedName(dot.getObject());
			return object == null ? null : object + "." + dot.getMemberName().getLexeme();
		}
		return null;
	}
}
