package com.jslowering.ast;

import java.util.List;

public record ClassDeclaration(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Identifier id,
    Expression superClass,  // Can be null
    List<ClassElement> body
) implements Statement {
    public ClassDeclaration(Identifier id, Expression superClass, List<ClassElement> body) {
        this(0, 0, 0, 0, 0, 0, id, superClass, body);
    }

    public ClassDeclaration(
        int start,
        int end,
        SourceLocation loc,
        Identifier id,
        Expression superClass,
        List<ClassElement> body
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             id,
             superClass,
             body);
    }
}
