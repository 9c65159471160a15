package com.jslowering.ast;

public record MemberExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression object,
    Expression property,  // Identifier unless computed
    boolean computed  // true for obj[expr]
) implements Expression {
    public MemberExpression(Expression object, Expression property, boolean computed) {
        this(0, 0, 0, 0, 0, 0, object, property, computed);
    }

    public MemberExpression(
        int start,
        int end,
        SourceLocation loc,
        Expression object,
        Expression property,
        boolean computed
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             object,
             property,
             computed);
    }
}
