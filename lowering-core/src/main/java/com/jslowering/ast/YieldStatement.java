package com.jslowering.ast;

/**
 * {@code yield E;} or, when {@code isYieldFor} is set, {@code yield for E;} which yields
 * every element produced by iterating {@code E}.
 */
public record YieldStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression argument,  // Can be null for a bare yield
    boolean isYieldFor  // true for 'yield for E'
) implements Statement {
    public YieldStatement(Expression argument, boolean isYieldFor) {
        this(0, 0, 0, 0, 0, 0, argument, isYieldFor);
    }

    public YieldStatement(
        int start,
        int end,
        SourceLocation loc,
        Expression argument,
        boolean isYieldFor
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             argument,
             isYieldFor);
    }
}
