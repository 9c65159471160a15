package com.jslowering.ast;

public record Literal(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Object value,  // String, Number, Boolean or null
    String raw
) implements Expression {
    public Literal(Object value, String raw) {
        this(0, 0, 0, 0, 0, 0, value, raw);
    }

    public Literal(
        int start,
        int end,
        SourceLocation loc,
        Object value,
        String raw
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             value,
             raw);
    }
}
