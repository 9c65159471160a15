package com.jslowering.ast.visitor;

import com.jslowering.ast.*;

import java.util.List;

/**
 * Read-only walk over a syntax tree.
 *
 * <p>{@link #visitAny(Node)} dispatches to one {@code visitXxx} method per node kind. The
 * defaults visit every child in source order, so a subclass only overrides the kinds it
 * cares about. An override that does not call {@code super} stops the walk at that node.</p>
 */
public abstract class AstVisitor {

    /**
     * Visits {@code tree} and, through the defaults, all of its descendants.
     * Null children are skipped.
     */
    public void visitAny(Node tree) {
        if (tree == null) {
            return;
        }
        if (tree instanceof Program t) {
            visitProgram(t);
        } else if (tree instanceof BlockStatement t) {
            visitBlockStatement(t);
        } else if (tree instanceof ExpressionStatement t) {
            visitExpressionStatement(t);
        } else if (tree instanceof VariableDeclaration t) {
            visitVariableDeclaration(t);
        } else if (tree instanceof VariableDeclarator t) {
            visitVariableDeclarator(t);
        } else if (tree instanceof IfStatement t) {
            visitIfStatement(t);
        } else if (tree instanceof WhileStatement t) {
            visitWhileStatement(t);
        } else if (tree instanceof DoWhileStatement t) {
            visitDoWhileStatement(t);
        } else if (tree instanceof ForStatement t) {
            visitForStatement(t);
        } else if (tree instanceof ForInStatement t) {
            visitForInStatement(t);
        } else if (tree instanceof ForEachStatement t) {
            visitForEachStatement(t);
        } else if (tree instanceof ReturnStatement t) {
            visitReturnStatement(t);
        } else if (tree instanceof ThrowStatement t) {
            visitThrowStatement(t);
        } else if (tree instanceof BreakStatement t) {
            visitBreakStatement(t);
        } else if (tree instanceof ContinueStatement t) {
            visitContinueStatement(t);
        } else if (tree instanceof TryStatement t) {
            visitTryStatement(t);
        } else if (tree instanceof CatchClause t) {
            visitCatchClause(t);
        } else if (tree instanceof EmptyStatement t) {
            visitEmptyStatement(t);
        } else if (tree instanceof YieldStatement t) {
            visitYieldStatement(t);
        } else if (tree instanceof AwaitStatement t) {
            visitAwaitStatement(t);
        } else if (tree instanceof FunctionDeclaration t) {
            visitFunctionDeclaration(t);
        } else if (tree instanceof ClassDeclaration t) {
            visitClassDeclaration(t);
        } else if (tree instanceof GetAccessorDeclaration t) {
            visitGetAccessorDeclaration(t);
        } else if (tree instanceof SetAccessorDeclaration t) {
            visitSetAccessorDeclaration(t);
        } else if (tree instanceof Property t) {
            visitProperty(t);
        } else if (tree instanceof Identifier t) {
            visitIdentifier(t);
        } else if (tree instanceof Literal t) {
            visitLiteral(t);
        } else if (tree instanceof ThisExpression t) {
            visitThisExpression(t);
        } else if (tree instanceof ArrayExpression t) {
            visitArrayExpression(t);
        } else if (tree instanceof ObjectExpression t) {
            visitObjectExpression(t);
        } else if (tree instanceof MemberExpression t) {
            visitMemberExpression(t);
        } else if (tree instanceof CallExpression t) {
            visitCallExpression(t);
        } else if (tree instanceof AssignmentExpression t) {
            visitAssignmentExpression(t);
        } else if (tree instanceof BinaryExpression t) {
            visitBinaryExpression(t);
        } else if (tree instanceof UnaryExpression t) {
            visitUnaryExpression(t);
        } else if (tree instanceof UpdateExpression t) {
            visitUpdateExpression(t);
        } else {
            throw new IllegalArgumentException("Unknown node type: " + tree.type());
        }
    }

    protected void visitList(List<? extends Node> list) {
        for (Node node : list) {
            visitAny(node);
        }
    }

    protected void visitProgram(Program tree) {
        visitList(tree.body());
    }

    protected void visitBlockStatement(BlockStatement tree) {
        visitList(tree.body());
    }

    protected void visitExpressionStatement(ExpressionStatement tree) {
        visitAny(tree.expression());
    }

    protected void visitVariableDeclaration(VariableDeclaration tree) {
        visitList(tree.declarations());
    }

    protected void visitVariableDeclarator(VariableDeclarator tree) {
        visitAny(tree.id());
        visitAny(tree.init());
    }

    protected void visitIfStatement(IfStatement tree) {
        visitAny(tree.test());
        visitAny(tree.consequent());
        visitAny(tree.alternate());
    }

    protected void visitWhileStatement(WhileStatement tree) {
        visitAny(tree.test());
        visitAny(tree.body());
    }

    protected void visitDoWhileStatement(DoWhileStatement tree) {
        visitAny(tree.body());
        visitAny(tree.test());
    }

    protected void visitForStatement(ForStatement tree) {
        visitAny(tree.init());
        visitAny(tree.test());
        visitAny(tree.update());
        visitAny(tree.body());
    }

    protected void visitForInStatement(ForInStatement tree) {
        visitAny(tree.left());
        visitAny(tree.right());
        visitAny(tree.body());
    }

    protected void visitForEachStatement(ForEachStatement tree) {
        visitAny(tree.left());
        visitAny(tree.right());
        visitAny(tree.body());
    }

    protected void visitReturnStatement(ReturnStatement tree) {
        visitAny(tree.argument());
    }

    protected void visitThrowStatement(ThrowStatement tree) {
        visitAny(tree.argument());
    }

    protected void visitBreakStatement(BreakStatement tree) {
        visitAny(tree.label());
    }

    protected void visitContinueStatement(ContinueStatement tree) {
        visitAny(tree.label());
    }

    protected void visitTryStatement(TryStatement tree) {
        visitAny(tree.block());
        visitAny(tree.handler());
        visitAny(tree.finalizer());
    }

    protected void visitCatchClause(CatchClause tree) {
        visitAny(tree.param());
        visitAny(tree.body());
    }

    protected void visitEmptyStatement(EmptyStatement tree) {
    }

    protected void visitYieldStatement(YieldStatement tree) {
        visitAny(tree.argument());
    }

    protected void visitAwaitStatement(AwaitStatement tree) {
        visitAny(tree.identifier());
        visitAny(tree.expression());
    }

    protected void visitFunctionDeclaration(FunctionDeclaration tree) {
        visitAny(tree.id());
        visitList(tree.params());
        visitAny(tree.body());
    }

    protected void visitClassDeclaration(ClassDeclaration tree) {
        visitAny(tree.id());
        visitAny(tree.superClass());
        visitList(tree.body());
    }

    protected void visitGetAccessorDeclaration(GetAccessorDeclaration tree) {
        visitAny(tree.key());
        visitAny(tree.body());
    }

    protected void visitSetAccessorDeclaration(SetAccessorDeclaration tree) {
        visitAny(tree.key());
        visitAny(tree.parameter());
        visitAny(tree.body());
    }

    protected void visitProperty(Property tree) {
        visitAny(tree.key());
        visitAny(tree.value());
    }

    protected void visitIdentifier(Identifier tree) {
    }

    protected void visitLiteral(Literal tree) {
    }

    protected void visitThisExpression(ThisExpression tree) {
    }

    protected void visitArrayExpression(ArrayExpression tree) {
        visitList(tree.elements());
    }

    protected void visitObjectExpression(ObjectExpression tree) {
        visitList(tree.properties());
    }

    protected void visitMemberExpression(MemberExpression tree) {
        visitAny(tree.object());
        visitAny(tree.property());
    }

    protected void visitCallExpression(CallExpression tree) {
        visitAny(tree.callee());
        visitList(tree.arguments());
    }

    protected void visitAssignmentExpression(AssignmentExpression tree) {
        visitAny(tree.left());
        visitAny(tree.right());
    }

    protected void visitBinaryExpression(BinaryExpression tree) {
        visitAny(tree.left());
        visitAny(tree.right());
    }

    protected void visitUnaryExpression(UnaryExpression tree) {
        visitAny(tree.argument());
    }

    protected void visitUpdateExpression(UpdateExpression tree) {
        visitAny(tree.argument());
    }
}
