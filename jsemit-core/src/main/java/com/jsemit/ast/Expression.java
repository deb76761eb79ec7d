package com.jsemit.ast;

public sealed interface Expression extends Node permits
    NullLiteral,
    NumericLiteral,
    StringLiteral,
    TemplateLiteral,
    BooleanLiteral,
    UnaryExpression,
    BinaryExpression,
    ArrayLiteral,
    IndexExpression,
    ObjectLiteral,
    PropertyAccess,
    FunctionExpression,
    CallExpression,
    Identifier,
    ConditionalExpression,
    TypeofExpression {
}
