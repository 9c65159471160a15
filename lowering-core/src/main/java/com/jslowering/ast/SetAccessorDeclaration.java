package com.jslowering.ast;

public record SetAccessorDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression key,  // Identifier or Literal
    boolean isStatic,
    Identifier parameter,
    BlockStatement body
) implements ObjectMember, ClassElement {
    public SetAccessorDeclaration(Expression key, boolean isStatic, Identifier parameter, BlockStatement body) {
        this(0, 0, 0, 0, 0, 0, key, isStatic, parameter, body);
    }

    public SetAccessorDeclaration(
        int start,
        int end,
        SourceLocation loc,
        Expression key,
        boolean isStatic,
        Identifier parameter,
        BlockStatement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             key,
             isStatic,
             parameter,
             body);
    }
}
