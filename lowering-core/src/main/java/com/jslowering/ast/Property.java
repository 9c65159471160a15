package com.jslowering.ast;

public record Property(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression key,  // Identifier or Literal
    Expression value
) implements ObjectMember {
    public Property(Expression key, Expression value) {
        this(0, 0, 0, 0, 0, 0, key, value);
    }

    public Property(
        int start,
        int end,
        SourceLocation loc,
        Expression key,
        Expression value
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             key,
             value);
    }
}
