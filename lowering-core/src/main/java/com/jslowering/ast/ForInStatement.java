package com.jslowering.ast;

public record ForInStatement(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Node left,  // VariableDeclaration or Expression
    Expression right,
    Statement body
) implements Statement {
    public ForInStatement(Node left, Expression right, Statement body) {
        this(0, 0, 0, 0, 0, 0, left, right, body);
    }

    public ForInStatement(
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
