package com.jslowering.ast;

public record VariableDeclarator(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,
    Expression init  // Can be null
) implements Node {
    public VariableDeclarator(Identifier id, Expression init) {
        this(0, 0, 0, 0, 0, 0, id, init);
    }

    public VariableDeclarator(
        int start,
        int end,
        SourceLocation loc,
        Identifier id,
        Expression init
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             id,
             init);
    }
}
