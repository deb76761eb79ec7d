package com.jsemit.ast;

public sealed interface Statement extends Node permits
    BlockStatement,
    VariableDeclaration,
    AssignmentStatement,
    WhileStatement,
    ForStatement,
    ForInStatement,
    IfStatement,
    ReturnStatement,
    ThrowStatement,
    LabeledStatement,
    BreakStatement,
    ContinueStatement {
}
