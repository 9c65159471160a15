package com.jslowering.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Literal,
    ThisExpression,
    ArrayExpression,
    ObjectExpression,
    MemberExpression,
    CallExpression,
    AssignmentExpression,
    BinaryExpression,
    UnaryExpression,
    UpdateExpression,
    FunctionDeclaration {
}
