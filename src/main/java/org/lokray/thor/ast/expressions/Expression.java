// File: src/main/java/org/lokray/thor/ast/expressions/Expression.java

package org.lokray.thor.ast.expressions;

import org.lokray.thor.ast.ASTNode;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.semantics.Type;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 */
public interface Expression extends ASTNode
{
	/**
	 * Returns the first token that constitutes this expression, for error positions.
	 */
	Token getFirstToken();

	/**
	 * The type this expression has by its literal shape alone.
	 * Anything that would need declarations or inference answers {@link org.lokray.thor.semantics.UnknownType}.
	 */
	Type getType();
}
