package com.jslowering.codegen;

import com.jslowering.ast.*;
import com.jslowering.ast.visitor.AstTransformer;

import java.util.ArrayList;
import java.util.List;

import static com.jslowering.codegen.AstFactory.*;

/**
 * Rewrites for-in loops so that the loop can be interrupted between iterations.
 *
 * <p>The keys are collected up front and then walked with an index, so a suspension inside
 * the loop body never has to pause a native key enumeration:</p>
 * <pre>
 * for (var k in o) S
 *   becomes
 * {
 *   var $keys = [];
 *   var $collection = o;
 *   for (var $p in $collection) $keys.push($p);
 *   for (var $i = 0; $i &lt; $keys.length; $i++) {
 *     var k = $keys[$i];
 *     if (!(k in $collection)) continue;
 *     S
 *   }
 * }
 * </pre>
 * Nested function-like bodies are left alone.
 */
public class ForInTransformPass extends AstTransformer {

    private final UniqueIdentifierGenerator identifierGenerator;

    public ForInTransformPass(UniqueIdentifierGenerator identifierGenerator) {
        this.identifierGenerator = identifierGenerator;
    }

    public static BlockStatement transformTree(UniqueIdentifierGenerator identifierGenerator, BlockStatement tree) {
        return asBlock(new ForInTransformPass(identifierGenerator).transformAny(tree));
    }

    @Override
    protected Node transformForInStatement(ForInStatement tree) {
        // inner for-in loops first
        Statement body = transformStatement(tree.body());
        List<Statement> elements = new ArrayList<>();

        // var $keys = [];
        String keys = identifierGenerator.generateUniqueIdentifier();
        elements.add(createVariableStatement("var", keys, createEmptyArrayLiteral()));

        // var $collection = object;
        String collection = identifierGenerator.generateUniqueIdentifier();
        elements.add(createVariableStatement("var", collection, tree.right()));

        // for (var $p in $collection) $keys.push($p);
        String p = identifierGenerator.generateUniqueIdentifier();
        elements.add(createForInStatement(
            createVariableStatement("var", p, null),
            createIdentifier(collection),
            createCallStatement(createMemberExpression(keys, "push"), createIdentifier(p))));

        String i = identifierGenerator.generateUniqueIdentifier();

        // $keys[$i]
        Expression lookup = createMemberLookupExpression(createIdentifier(keys), createIdentifier(i));

        Expression originalKey;
        Statement assignOriginalKey;
        if (tree.left() instanceof VariableDeclaration declaration && declaration.declarations().size() == 1) {
            Identifier id = declaration.declarations().get(0).id();
            originalKey = createIdentifier(id.name());
            // var key = $keys[$i];
            assignOriginalKey = createVariableDeclaration(declaration.kind(), id, lookup);
        } else if (tree.left() instanceof Expression expression) {
            originalKey = expression;
            // key = $keys[$i];
            assignOriginalKey = createAssignmentStatement(expression, lookup);
        } else {
            throw new IllegalStateException("Invalid left hand side of for in loop: " + tree.left().type());
        }

        List<Statement> innerBlock = new ArrayList<>();
        innerBlock.add(assignOriginalKey);

        // if (!(key in $collection)) continue;
        innerBlock.add(createIfStatement(
            createUnaryExpression("!", createBinaryExpression(originalKey, "in", createIdentifier(collection))),
            createContinueStatement(),
            null));

        innerBlock.addAll(statementsOf(body));

        // for (var $i = 0; $i < $keys.length; $i++) { ... }
        elements.add(createForStatement(
            createVariableStatement("var", i, createNumberLiteral(0)),
            createBinaryExpression(createIdentifier(i), "<", createMemberExpression(keys, "length")),
            createPostfixExpression(createIdentifier(i), "++"),
            createBlock(innerBlock)));

        return createBlock(elements);
    }

    // don't recurse into nested function-like bodies
    @Override
    protected Node transformFunctionDeclaration(FunctionDeclaration tree) {
        return tree;
    }

    @Override
    protected Node transformGetAccessorDeclaration(GetAccessorDeclaration tree) {
        return tree;
    }

    @Override
    protected Node transformSetAccessorDeclaration(SetAccessorDeclaration tree) {
        return tree;
    }
}
