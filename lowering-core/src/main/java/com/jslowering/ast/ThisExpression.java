package com.jslowering.ast;

public record ThisExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol
) implements Expression {
    public ThisExpression() {
        this(0, 0, 0, 0, 0, 0);
    }

    public ThisExpression(
        int start,
        int end,
        SourceLocation loc
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0);
    }
}
