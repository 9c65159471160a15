package com.jslowering.ast.visitor;

import com.jslowering.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a syntax tree bottom-up.
 *
 * <p>{@link #transformAny(Node)} dispatches to one {@code transformXxx} method per node kind.
 * The defaults transform every child and build a new node only when a child reference
 * changed; otherwise the original node is returned. Unaffected subtrees are therefore shared
 * between the input and the output tree, and callers may test for change with {@code ==}.</p>
 */
public abstract class AstTransformer {

    /**
     * Transforms {@code tree}; returns null for a null tree.
     */
    public Node transformAny(Node tree) {
        if (tree == null) {
            return null;
        }
        if (tree instanceof Program t) {
            return transformProgram(t);
        } else if (tree instanceof BlockStatement t) {
            return transformBlockStatement(t);
        } else if (tree instanceof ExpressionStatement t) {
            return transformExpressionStatement(t);
        } else if (tree instanceof VariableDeclaration t) {
            return transformVariableDeclaration(t);
        } else if (tree instanceof VariableDeclarator t) {
            return transformVariableDeclarator(t);
        } else if (tree instanceof IfStatement t) {
            return transformIfStatement(t);
        } else if (tree instanceof WhileStatement t) {
            return transformWhileStatement(t);
        } else if (tree instanceof DoWhileStatement t) {
            return transformDoWhileStatement(t);
        } else if (tree instanceof ForStatement t) {
            return transformForStatement(t);
        } else if (tree instanceof ForInStatement t) {
            return transformForInStatement(t);
        } else if (tree instanceof ForEachStatement t) {
            return transformForEachStatement(t);
        } else if (tree instanceof ReturnStatement t) {
            return transformReturnStatement(t);
        } else if (tree instanceof ThrowStatement t) {
            return transformThrowStatement(t);
        } else if (tree instanceof BreakStatement t) {
            return transformBreakStatement(t);
        } else if (tree instanceof ContinueStatement t) {
            return transformContinueStatement(t);
        } else if (tree instanceof TryStatement t) {
            return transformTryStatement(t);
        } else if (tree instanceof CatchClause t) {
            return transformCatchClause(t);
        } else if (tree instanceof EmptyStatement t) {
            return transformEmptyStatement(t);
        } else if (tree instanceof YieldStatement t) {
            return transformYieldStatement(t);
        } else if (tree instanceof AwaitStatement t) {
            return transformAwaitStatement(t);
        } else if (tree instanceof FunctionDeclaration t) {
            return transformFunctionDeclaration(t);
        } else if (tree instanceof ClassDeclaration t) {
            return transformClassDeclaration(t);
        } else if (tree instanceof GetAccessorDeclaration t) {
            return transformGetAccessorDeclaration(t);
        } else if (tree instanceof SetAccessorDeclaration t) {
            return transformSetAccessorDeclaration(t);
        } else if (tree instanceof Property t) {
            return transformProperty(t);
        } else if (tree instanceof Identifier t) {
            return transformIdentifier(t);
        } else if (tree instanceof Literal t) {
            return transformLiteral(t);
        } else if (tree instanceof ThisExpression t) {
            return transformThisExpression(t);
        } else if (tree instanceof ArrayExpression t) {
            return transformArrayExpression(t);
        } else if (tree instanceof ObjectExpression t) {
            return transformObjectExpression(t);
        } else if (tree instanceof MemberExpression t) {
            return transformMemberExpression(t);
        } else if (tree instanceof CallExpression t) {
            return transformCallExpression(t);
        } else if (tree instanceof AssignmentExpression t) {
            return transformAssignmentExpression(t);
        } else if (tree instanceof BinaryExpression t) {
            return transformBinaryExpression(t);
        } else if (tree instanceof UnaryExpression t) {
            return transformUnaryExpression(t);
        } else if (tree instanceof UpdateExpression t) {
            return transformUpdateExpression(t);
        }
        throw new IllegalArgumentException("Unknown node type: " + tree.type());
    }

    protected Statement transformStatement(Statement tree) {
        return (Statement) transformAny(tree);
    }

    protected Expression transformExpression(Expression tree) {
        return (Expression) transformAny(tree);
    }

    protected Identifier transformIdentifierSlot(Identifier tree) {
        return (Identifier) transformAny(tree);
    }

    /**
     * Transforms a statement that must stay a block, wrapping a replacement statement
     * into a block when needed.
     */
    protected BlockStatement transformBlockSlot(BlockStatement tree) {
        if (tree == null) {
            return null;
        }
        return asBlock(transformAny(tree));
    }

    // on change the whole list is replaced; an unchanged list is returned as is
    protected <T extends Node> List<T> transformList(List<T> list) {
        int size = list.size();
        List<T> newList = null;

        for (int i = 0; i < size; i++) {
            T node = list.get(i);
            @SuppressWarnings("unchecked")
            T newNode = node == null ? null : (T) transformAny(node);
            if (newNode != node) {
                if (newList == null) {
                    newList = new ArrayList<>(size);
                    for (int j = 0; j < i; j++) {
                        newList.add(list.get(j));
                    }
                }
                newList.add(newNode);
            } else if (newList != null) {
                newList.add(node);
            }
        }

        return newList == null ? list : newList;
    }

    protected static BlockStatement asBlock(Node tree) {
        if (tree instanceof BlockStatement block) {
            return block;
        }
        return new BlockStatement(tree.start(), tree.end(), tree.loc(), List.of((Statement) tree));
    }

    protected Node transformProgram(Program tree) {
        List<Statement> body = transformList(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new Program(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            body);
    }

    protected Node transformBlockStatement(BlockStatement tree) {
        List<Statement> body = transformList(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new BlockStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            body);
    }

    protected Node transformExpressionStatement(ExpressionStatement tree) {
        Expression expression = transformExpression(tree.expression());
        if (expression == tree.expression()) {
            return tree;
        }
        return new ExpressionStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            expression);
    }

    protected Node transformVariableDeclaration(VariableDeclaration tree) {
        List<VariableDeclarator> declarations = transformList(tree.declarations());
        if (declarations == tree.declarations()) {
            return tree;
        }
        return new VariableDeclaration(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            declarations, tree.kind());
    }

    protected Node transformVariableDeclarator(VariableDeclarator tree) {
        Identifier id = transformIdentifierSlot(tree.id());
        Expression init = transformExpression(tree.init());
        if (id == tree.id() && init == tree.init()) {
            return tree;
        }
        return new VariableDeclarator(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            id, init);
    }

    protected Node transformIfStatement(IfStatement tree) {
        Expression test = transformExpression(tree.test());
        Statement consequent = transformStatement(tree.consequent());
        Statement alternate = transformStatement(tree.alternate());
        if (test == tree.test() && consequent == tree.consequent() && alternate == tree.alternate()) {
            return tree;
        }
        return new IfStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            test, consequent, alternate);
    }

    protected Node transformWhileStatement(WhileStatement tree) {
        Expression test = transformExpression(tree.test());
        Statement body = transformStatement(tree.body());
        if (test == tree.test() && body == tree.body()) {
            return tree;
        }
        return new WhileStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            test, body);
    }

    protected Node transformDoWhileStatement(DoWhileStatement tree) {
        Statement body = transformStatement(tree.body());
        Expression test = transformExpression(tree.test());
        if (body == tree.body() && test == tree.test()) {
            return tree;
        }
        return new DoWhileStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            body, test);
    }

    protected Node transformForStatement(ForStatement tree) {
        Node init = transformAny(tree.init());
        Expression test = transformExpression(tree.test());
        Expression update = transformExpression(tree.update());
        Statement body = transformStatement(tree.body());
        if (init == tree.init() && test == tree.test() && update == tree.update() && body == tree.body()) {
            return tree;
        }
        return new ForStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            init, test, update, body);
    }

    protected Node transformForInStatement(ForInStatement tree) {
        Node left = transformAny(tree.left());
        Expression right = transformExpression(tree.right());
        Statement body = transformStatement(tree.body());
        if (left == tree.left() && right == tree.right() && body == tree.body()) {
            return tree;
        }
        return new ForInStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            left, right, body);
    }

    protected Node transformForEachStatement(ForEachStatement tree) {
        Node left = transformAny(tree.left());
        Expression right = transformExpression(tree.right());
        Statement body = transformStatement(tree.body());
        if (left == tree.left() && right == tree.right() && body == tree.body()) {
            return tree;
        }
        return new ForEachStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            left, right, body);
    }

    protected Node transformReturnStatement(ReturnStatement tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new ReturnStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            argument);
    }

    protected Node transformThrowStatement(ThrowStatement tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new ThrowStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            argument);
    }

    protected Node transformBreakStatement(BreakStatement tree) {
        return tree;
    }

    protected Node transformContinueStatement(ContinueStatement tree) {
        return tree;
    }

    protected Node transformTryStatement(TryStatement tree) {
        BlockStatement block = transformBlockSlot(tree.block());
        CatchClause handler = (CatchClause) transformAny(tree.handler());
        BlockStatement finalizer = transformBlockSlot(tree.finalizer());
        if (block == tree.block() && handler == tree.handler() && finalizer == tree.finalizer()) {
            return tree;
        }
        return new TryStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            block, handler, finalizer);
    }

    protected Node transformCatchClause(CatchClause tree) {
        Identifier param = transformIdentifierSlot(tree.param());
        BlockStatement body = transformBlockSlot(tree.body());
        if (param == tree.param() && body == tree.body()) {
            return tree;
        }
        return new CatchClause(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            param, body);
    }

    protected Node transformEmptyStatement(EmptyStatement tree) {
        return tree;
    }

    protected Node transformYieldStatement(YieldStatement tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new YieldStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            argument, tree.isYieldFor());
    }

    protected Node transformAwaitStatement(AwaitStatement tree) {
        Expression expression = transformExpression(tree.expression());
        if (expression == tree.expression()) {
            return tree;
        }
        return new AwaitStatement(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.identifier(), expression);
    }

    protected Node transformFunctionDeclaration(FunctionDeclaration tree) {
        BlockStatement body = transformBlockSlot(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new FunctionDeclaration(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.id(), tree.isStatic(), tree.params(), body);
    }

    protected Node transformClassDeclaration(ClassDeclaration tree) {
        Expression superClass = transformExpression(tree.superClass());
        List<ClassElement> body = transformList(tree.body());
        if (superClass == tree.superClass() && body == tree.body()) {
            return tree;
        }
        return new ClassDeclaration(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.id(), superClass, body);
    }

    protected Node transformGetAccessorDeclaration(GetAccessorDeclaration tree) {
        BlockStatement body = transformBlockSlot(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new GetAccessorDeclaration(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.key(), tree.isStatic(), body);
    }

    protected Node transformSetAccessorDeclaration(SetAccessorDeclaration tree) {
        BlockStatement body = transformBlockSlot(tree.body());
        if (body == tree.body()) {
            return tree;
        }
        return new SetAccessorDeclaration(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.key(), tree.isStatic(), tree.parameter(), body);
    }

    protected Node transformProperty(Property tree) {
        Expression key = transformExpression(tree.key());
        Expression value = transformExpression(tree.value());
        if (key == tree.key() && value == tree.value()) {
            return tree;
        }
        return new Property(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            key, value);
    }

    protected Node transformIdentifier(Identifier tree) {
        return tree;
    }

    protected Node transformLiteral(Literal tree) {
        return tree;
    }

    protected Node transformThisExpression(ThisExpression tree) {
        return tree;
    }

    protected Node transformArrayExpression(ArrayExpression tree) {
        List<Expression> elements = transformList(tree.elements());
        if (elements == tree.elements()) {
            return tree;
        }
        return new ArrayExpression(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            elements);
    }

    protected Node transformObjectExpression(ObjectExpression tree) {
        List<ObjectMember> properties = transformList(tree.properties());
        if (properties == tree.properties()) {
            return tree;
        }
        return new ObjectExpression(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            properties);
    }

    protected Node transformMemberExpression(MemberExpression tree) {
        Expression object = transformExpression(tree.object());
        Expression property = transformExpression(tree.property());
        if (object == tree.object() && property == tree.property()) {
            return tree;
        }
        return new MemberExpression(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            object, property, tree.computed());
    }

    protected Node transformCallExpression(CallExpression tree) {
        Expression callee = transformExpression(tree.callee());
        List<Expression> arguments = transformList(tree.arguments());
        if (callee == tree.callee() && arguments == tree.arguments()) {
            return tree;
        }
        return new CallExpression(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            callee, arguments);
    }

    protected Node transformAssignmentExpression(AssignmentExpression tree) {
        Expression left = transformExpression(tree.left());
        Expression right = transformExpression(tree.right());
        if (left == tree.left() && right == tree.right()) {
            return tree;
        }
        return new AssignmentExpression(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.operator(), left, right);
    }

    protected Node transformBinaryExpression(BinaryExpression tree) {
        Expression left = transformExpression(tree.left());
        Expression right = transformExpression(tree.right());
        if (left == tree.left() && right == tree.right()) {
            return tree;
        }
        return new BinaryExpression(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.operator(), left, right);
    }

    protected Node transformUnaryExpression(UnaryExpression tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new UnaryExpression(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.operator(), argument);
    }

    protected Node transformUpdateExpression(UpdateExpression tree) {
        Expression argument = transformExpression(tree.argument());
        if (argument == tree.argument()) {
            return tree;
        }
        return new UpdateExpression(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.operator(), tree.prefix(), argument);
    }
}
