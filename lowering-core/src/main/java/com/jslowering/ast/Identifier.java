package com.jslowering.ast;

public record Identifier(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    String name
) implements Expression {
    public Identifier(String name) {
        this(0, 0, 0, 0, 0, 0, name);
    }

    public Identifier(
        int start,
        int end,
        SourceLocation loc,
        String name
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             name);
    }
}
