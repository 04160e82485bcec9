package org.lokray.thor.ast.statements;

import org.lokray.thor.ast.ASTNode;

/**
 * Base interface for all statement nodes in the Abstract Syntax Tree.
 * Declarations are statements too, so they can appear anywhere a statement list is parsed.
 */
public interface Statement extends ASTNode
{
	/**
	 * @return The 1-based source line the statement starts on.
	 */
	int getLine();
}
