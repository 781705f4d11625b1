package org.pragmatica.grol.ast;

/**
 * Dispatch over the closed set of {@link Node} variants. Adding a variant means adding a method
 * here, which every visitor then has to implement.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {
    R visitIdentifier(Node.Identifier node);

    R visitIntegerLiteral(Node.IntegerLiteral node);

    R visitFloatLiteral(Node.FloatLiteral node);

    R visitStringLiteral(Node.StringLiteral node);

    R visitBooleanLiteral(Node.BooleanLiteral node);

    R visitComment(Node.Comment node);

    R visitControlExpression(Node.ControlExpression node);

    R visitReturnStatement(Node.ReturnStatement node);

    R visitPrefixExpression(Node.PrefixExpression node);

    R visitPostfixExpression(Node.PostfixExpression node);

    R visitInfixExpression(Node.InfixExpression node);

    R visitIndexExpression(Node.IndexExpression node);

    R visitCallExpression(Node.CallExpression node);

    R visitBuiltin(Node.Builtin node);

    R visitArrayLiteral(Node.ArrayLiteral node);

    R visitMapLiteral(Node.MapLiteral node);

    R visitIfExpression(Node.IfExpression node);

    R visitForExpression(Node.ForExpression node);

    R visitFunctionLiteral(Node.FunctionLiteral node);

    R visitMacroLiteral(Node.MacroLiteral node);

    R visitStatements(Node.Statements node);
}
