package com.jslowering.ast;

import java.util.List;

public record CallExpression(
    int start,
    int end,
    int startLine,
    int startCol,
    int endLine,
    int endCol,
    Expression callee,
    List<Expression> arguments
) implements Expression {
    public CallExpression(Expression callee, List<Expression> arguments) {
        this(0, 0, 0, 0, 0, 0, callee, arguments);
    }

    public CallExpression(
        int start,
        int end,
        SourceLocation loc,
        Expression callee,
        List<Expression> arguments
    ) {
        this(start,
             end,
             loc != null ? loc.start().line() : 0,
             loc != null ? loc.start().column() : 0,
             loc != null ? loc.end().line() : 0,
             loc != null ? loc.end().column() : 0,
             callee,
             arguments);
    }
}
