package com.jslowering.ast;

import java.util.List;

public record BlockStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<Statement> body
) implements Statement {
    public BlockStatement(List<Statement> body) {
        this(0, 0, 0, 0, 0, 0, body);
    }

    public BlockStatement(
        int start,
        int end,
        SourceLocation loc,
        List<Statement> body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             body);
    }
}
