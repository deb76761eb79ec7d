package com.jsemit.ast;

/**
 * One method per node variant. Adding a variant breaks every implementation at compile time,
 * which is how the printer and the traversal engine stay exhaustive.
 *
 * @param <R> result of visiting a node
 */
public interface NodeVisitor<R> {

    // Literals
    R visitNullLiteral(NullLiteral node);

    R visitNumericLiteral(NumericLiteral node);

    R visitStringLiteral(StringLiteral node);

    R visitTemplateLiteral(TemplateLiteral node);

    R visitBooleanLiteral(BooleanLiteral node);

    // Expressions
    R visitUnaryExpression(UnaryExpression node);

    R visitBinaryExpression(BinaryExpression node);

    R visitArrayLiteral(ArrayLiteral node);

    R visitIndexExpression(IndexExpression node);

    R visitObjectLiteral(ObjectLiteral node);

    R visitPropertyAccess(PropertyAccess node);

    R visitFunctionExpression(FunctionExpression node);

    R visitCallExpression(CallExpression node);

    R visitIdentifier(Identifier node);

    R visitConditionalExpression(ConditionalExpression node);

    R visitTypeofExpression(TypeofExpression node);

    // Statements
    R visitBlockStatement(BlockStatement node);

    R visitVariableDeclaration(VariableDeclaration node);

    R visitAssignmentStatement(AssignmentStatement node);

    R visitWhileStatement(WhileStatement node);

    R visitForStatement(ForStatement node);

    R visitForInStatement(ForInStatement node);

    R visitIfStatement(IfStatement node);

    R visitReturnStatement(ReturnStatement node);

    R visitThrowStatement(ThrowStatement node);

    R visitLabeledStatement(LabeledStatement node);

    R visitBreakStatement(BreakStatement node);

    R visitContinueStatement(ContinueStatement node);
}
