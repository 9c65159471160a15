package com.jslowering.ast;

/**
 * {@code for (var x of E) S} driven by the iteration protocol of {@code E}.
 */
public record ForEachStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Node left,  // VariableDeclaration or Expression
    Expression right,  // Iterated once through its iterator
    Statement body
) implements Statement {
    public ForEachStatement(Node left, Expression right, Statement body) {
        this(0, 0, 0, 0, 0, 0, left, right, body);
    }

    public ForEachStatement(
        int start,
        int end,
        SourceLocation loc,
        Node left,
        Expression right,
        Statement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             left,
             right,
             body);
    }
}
