package com.jslowering.ast;

public record CatchClause(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier param,
    BlockStatement body
) implements Node {
    public CatchClause(Identifier param, BlockStatement body) {
        this(0, 0, 0, 0, 0, 0, param, body);
    }

    public CatchClause(
        int start,
        int end,
        SourceLocation loc,
        Identifier param,
        BlockStatement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             param,
             body);
    }
}
