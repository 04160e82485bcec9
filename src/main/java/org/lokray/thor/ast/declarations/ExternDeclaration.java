package org.lokray.thor.ast.declarations;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.Parameter;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;

import java.util.List;

/**
 * AST node representing a C function made visible to Thor code. Never has a body; its name is never qualified.
 */
public class ExternDeclaration extends CallableDeclaration
{
	public ExternDeclaration(Token externKeyword, Token name, List<Parameter> parameters, Type returnType)
	{
		super(externKeyword, name, parameters, returnType);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExternDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "extern func " + signature() + ";";
	}
}
