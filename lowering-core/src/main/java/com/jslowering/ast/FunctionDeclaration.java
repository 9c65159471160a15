package com.jslowering.ast;

import java.util.List;

public record FunctionDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,  // null for an anonymous function expression
    boolean isStatic,
    List<Identifier> params,
    BlockStatement body
) implements Statement, Expression, ClassElement {
    public FunctionDeclaration(Identifier id, boolean isStatic, List<Identifier> params, BlockStatement body) {
        this(0, 0, 0, 0, 0, 0, id, isStatic, params, body);
    }

    public FunctionDeclaration(
        int start,
        int end,
        SourceLocation loc,
        Identifier id,
        boolean isStatic,
        List<Identifier> params,
        BlockStatement body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             id,
             isStatic,
             params,
             body);
    }
}
