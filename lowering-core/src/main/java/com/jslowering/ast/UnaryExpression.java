package com.jslowering.ast;

public record UnaryExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String operator,
    Expression argument
) implements Expression {
    public UnaryExpression(String operator, Expression argument) {
        this(0, 0, 0, 0, 0, 0, operator, argument);
    }

    public UnaryExpression(
        int start,
        int end,
        SourceLocation loc,
        String operator,
        Expression argument
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             operator,
             argument);
    }
}
