package org.lokray.thor.ast;

/**
 * Common supertype of every Thor syntax tree node.
 */
public interface ASTNode
{
	/**
	 * Dispatches to the matching {@code visit} method of the visitor.
	 *
	 * @param visitor The pass walking the tree.
	 * @param <R>     Result type of the pass.
	 * @return Whatever the visitor produced for this node.
	 */
	<R> R accept(ASTVisitor<R> visitor);
}
