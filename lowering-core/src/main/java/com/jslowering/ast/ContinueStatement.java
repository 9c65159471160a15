package com.jslowering.ast;

public record ContinueStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier label  // Can be null
) implements Statement {
    public ContinueStatement(Identifier label) {
        this(0, 0, 0, 0, 0, 0, label);
    }

    public ContinueStatement(
        int start,
        int end,
        SourceLocation loc,
        Identifier label
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             label);
    }
}
