// File: src/main/java/org/lokray/thor/ast/declarations/FunctionDeclaration.java

package org.lokray.thor.ast.declarations;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.Parameter;
import org.lokray.thor.ast.statements.BlockStatement;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;

import java.util.List;

/**
 * AST node representing a user function.
 * Without a body it is a forward declaration (or, inside a built-in module, a signature the runtime provides).
 */
public class FunctionDeclaration extends CallableDeclaration
{
	private final BlockStatement body; // May be null

	public FunctionDeclaration(Token startToken, Token name, List<Parameter> parameters, Type returnType, BlockStatement body)
	{
		super(startToken, name, parameters, returnType);
		this.body = body;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	public boolean hasBody()
	{
		return body != null;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "func " + signature() + (body != null ? " " + body : ";");
	}
}
