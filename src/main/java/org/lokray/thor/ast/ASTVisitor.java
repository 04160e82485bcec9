// File: src/main/java/org/lokray/thor/ast/ASTVisitor.java

package org.lokray.thor.ast;

import org.lokray.thor.ast.declarations.ExternDeclaration;
import org.lokray.thor.ast.declarations.FunctionDeclaration;
import org.lokray.thor.ast.declarations.ImportDirective;
import org.lokray.thor.ast.declarations.PackageDeclaration;
import org.lokray.thor.ast.expressions.*;
import org.lokray.thor.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type, so every consumer handles every node kind.
 *
 * @param <R> The result type of the visit methods.
 */
public interface ASTVisitor<R>
{
	R visitProgram(Program program);

	// --- Declarations ---
	R visitPackageDeclaration(PackageDeclaration declaration);

	R visitImportDirective(ImportDirective directive);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitExternDeclaration(ExternDeclaration declaration);

	// --- Statements ---
	R visitExpressionStatement(ExpressionStatement statement);

	R visitVariableDeclarationStatement(VariableDeclarationStatement statement);

	R visitConstDeclarationStatement(ConstDeclarationStatement statement);

	R visitBlockStatement(BlockStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	// --- Expressions ---
	R visitLiteralExpression(LiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitBinaryExpression(BinaryExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitDotExpression(DotExpression expression);

	R visitArrayInitializerExpression(ArrayInitializerExpression expression);

	R visitFormatStringExpression(FormatStringExpression expression);
}
