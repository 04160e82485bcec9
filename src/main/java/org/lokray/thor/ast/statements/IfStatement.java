// File: src/main/java/org/lokray/thor/ast/statements/IfStatement.java

package org.lokray.thor.ast.statements;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.expressions.Expression;
import org.lokray.thor.lexer.Token;

/**
 * AST node representing an 'if-else' statement.
 * Both branches may be a single statement or a block; the else branch is optional.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;
	private final Expression condition;
	private final Statement thenBranch;
	private final Statement elseBranch; // May be null

	public IfStatement(Token ifKeyword, Expression condition, Statement thenBranch, Statement elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Token getIfKeyword()
	{
		return ifKeyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getThenBranch()
	{
		return thenBranch;
	}

	public Statement getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public int getLine()
	{
		return ifKeyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("if (").append(condition).append(") ").append(thenBranch);
		if (elseBranch != null)
		{
			sb.append(" else ").append(elseBranch);
		}
		return sb.toString();
	}
}
