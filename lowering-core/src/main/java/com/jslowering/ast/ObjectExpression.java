package com.jslowering.ast;

import java.util.List;

public record ObjectExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    List<ObjectMember> properties
) implements Expression {
    public ObjectExpression(List<ObjectMember> properties) {
        this(0, 0, 0, 0, 0, 0, properties);
    }

    public ObjectExpression(
        int start,
        int end,
        SourceLocation loc,
        List<ObjectMember> properties
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             properties);
    }
}
