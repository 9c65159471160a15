package com.jslowering.ast;

public record AssignmentExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,
    Expression left,
    Expression right
) implements Expression {
    public AssignmentExpression(String operator, Expression left, Expression right) {
        this(0, 0, 0, 0, 0, 0, operator, left, right);
    }

    public AssignmentExpression(
        int start,
        int end,
        SourceLocation loc,
        String operator,
        Expression left,
        Expression right
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             operator,
             left,
             right);
    }
}
