package org.lokray.thor.ast.statements;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.expressions.Expression;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;

/**
 * AST node representing {@code const T NAME = value;}. The initializer is mandatory.
 */
public class ConstDeclarationStatement implements Statement
{
	private final Token constKeyword;
	private final Type type;
	private final Token name;
	private final Expression initializer;

	public ConstDeclarationStatement(Token constKeyword, Type type, Token name, Expression initializer)
	{
		this.constKeyword = constKeyword;
		this.type = type;
		this.name = name;
		this.initializer = initializer;
	}

	public Token getConstKeyword()
	{
		return constKeyword;
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

	@Override
	public int getLine()
	{
		return constKeyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitConstDeclarationStatement(this);
	}

	@Override
	public String toString()
	{
		return "const " + type.getName() + " " + getName() + " = " + initializer + ";";
	}
}
