package com.jslowering.ast;

/**
 * Base interface for all syntax tree nodes.
 *
 * <p>Nodes are immutable. A transformation either hands back the very same
 * reference or builds a new node, so {@code ==} tells whether a subtree changed.</p>
 *
 * <p>Synthesized nodes carry zero positions.</p>
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    ObjectMember,
    ClassElement,
    VariableDeclarator,
    CatchClause {

    int start();
    int end();
    int startLine();
    int startCol();
    int endLine();
    int endCol();

    /**
     * The node kind, also used as the JSON type name.
     */
    default String type() {
        return getClass().getSimpleName();
    }

    default SourceLocation loc() {
        return new SourceLocation(
            new SourceLocation.Position(startLine(), startCol()),
            new SourceLocation.Position(endLine(), endCol()));
    }
}
