package com.jslowering.ast;

/**
 * {@code get key() { ... }} in an object literal or a class body.
 */
public record GetAccessorDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression key,  // Identifier or Literal
    boolean isStatic,
    BlockStatement body
) implements ObjectMember, ClassElement {
    public GetAccessorDeclaration(Expression key, boolean isStatic, BlockStatement body) {
        this(0, 0, 0, 0, 0, 0, key, isStatic, body);
    }

    public GetAccessorDeclaration(
        int start,
        int end,
        SourceLocation loc,
        Expression key,
        boolean isStatic,
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
             body);
    }
}
