package com.jslowering.ast;

public record DoWhileStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Statement body,
    Expression test
) implements Statement {
    public DoWhileStatement(Statement body, Expression test) {
        this(0, 0, 0, 0, 0, 0, body, test);
    }

    public DoWhileStatement(
        int start,
        int end,
        SourceLocation loc,
        Statement body,
        Expression test
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             body,
             test);
    }
}
