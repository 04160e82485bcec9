// File: src/main/java/org/lokray/thor/ast/statements/VariableDeclarationStatement.java

package org.lokray.thor.ast.statements;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.expressions.Expression;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;

/**
 * AST node representing a variable declaration, e.g. {@code int[] primes = [2, 3, 5];}.
 * The initializer is optional.
 */
public class VariableDeclarationStatement implements Statement
{
	private final Token typeToken; // First token of the declared type
	private final Type type;
	private final Token name;
	private final Expression initializer; // May be null

	public VariableDeclarationStatement(Token typeToken, Type type, Token name, Expression initializer)
	{
		this.typeToken = typeToken;
		this.type = type;
		this.name = name;
		this.initializer = initializer;
	}

	public Token getTypeToken()
	{
		return typeToken;
	}

	public Type getType()
	{
		return type;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	public boolean hasInitializer()
	{
		return initializer != null;
	}

	@Override
	public int getLine()
	{
		return typeToken.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclarationStatement(this);
	}

	@Override
	public String toString()
	{
		return type.getName() + " " + getName() + (initializer != null ? " = " + initializer : "") + ";";
	}
}
