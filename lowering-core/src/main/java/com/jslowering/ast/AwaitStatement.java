package com.jslowering.ast;

/**
 * {@code await x = E;} suspends until {@code E} settles and binds the result to {@code x}.
 */
public record AwaitStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier identifier,  // Receives the settled value, can be null
    Expression expression
) implements Statement {
    public AwaitStatement(Identifier identifier, Expression expression) {
        this(0, 0, 0, 0, 0, 0, identifier, expression);
    }

    public AwaitStatement(
        int start,
        int end,
        SourceLocation loc,
        Identifier identifier,
        Expression expression
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             identifier,
             expression);
    }
}
