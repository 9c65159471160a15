package com.jslowering.ast;

public sealed interface Statement extends Node permits
    BlockStatement,
    ExpressionStatement,
    VariableDeclaration,
    IfStatement,
    WhileStatement,
    DoWhileStatement,
    ForStatement,
    ForInStatement,
    ForEachStatement,
    ReturnStatement,
    ThrowStatement,
    BreakStatement,
    ContinueStatement,
    TryStatement,
    EmptyStatement,
    YieldStatement,
    AwaitStatement,
    FunctionDeclaration,
    ClassDeclaration {
}
