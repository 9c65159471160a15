package com.jslowering.ast;

public record ExpressionStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression expression
) implements Statement {
    public ExpressionStatement(Expression expression) {
        this(0, 0, 0, 0, 0, 0, expression);
    }

    public ExpressionStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression expression
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             expression);
    }
}
