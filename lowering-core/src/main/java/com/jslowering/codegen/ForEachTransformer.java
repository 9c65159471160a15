package com.jslowering.codegen;

import com.jslowering.ast.*;
import com.jslowering.ast.visitor.AstTransformer;

import java.util.ArrayList;
import java.util.List;

import static com.jslowering.codegen.AstFactory.*;

/**
 * Lowers for-each loops into explicit iteration protocol calls.
 * <pre>
 * for (var x of E) S
 *   becomes
 * {
 *   var $iterator = E[Symbol.iterator]();
 *   for (var $result = $iterator.next(); !$result.done; $result = $iterator.next()) {
 *     var x = $result.value;
 *     S
 *   }
 * }
 * </pre>
 * {@code E} is evaluated exactly once and {@code S} runs once per produced element, in order.
 * For-each loops nested in {@code S} are lowered too; nested function-like bodies are not.
 */
public class ForEachTransformer extends AstTransformer {

    private final UniqueIdentifierGenerator identifierGenerator;

    public ForEachTransformer(UniqueIdentifierGenerator identifierGenerator) {
        this.identifierGenerator = identifierGenerator;
    }

    public static Statement transformTree(UniqueIdentifierGenerator identifierGenerator, ForEachStatement tree) {
        return (Statement) new ForEachTransformer(identifierGenerator).transformAny(tree);
    }

    @Override
    protected Node transformForEachStatement(ForEachStatement tree) {
        Statement body = transformStatement(tree.body());

        String iterator = identifierGenerator.generateUniqueIdentifier();
        String result = identifierGenerator.generateUniqueIdentifier();

        // var $iterator = E[Symbol.iterator]();
        Statement initIterator = createVariableStatement("var", iterator,
            createCallExpression(createMemberLookupExpression(
                tree.right(),
                createMemberExpression("Symbol", "iterator"))));

        // $result.value
        Expression value = createMemberExpression(result, "value");
        Statement assignElement;
        if (tree.left() instanceof VariableDeclaration declaration && declaration.declarations().size() == 1) {
            assignElement = createVariableDeclaration(declaration.kind(), declaration.declarations().get(0).id(), value);
        } else if (tree.left() instanceof Expression expression) {
            assignElement = createAssignmentStatement(expression, value);
        } else {
            throw new IllegalStateException("Invalid left hand side of for each loop: " + tree.left().type());
        }

        List<Statement> loopBody = new ArrayList<>();
        loopBody.add(assignElement);
        loopBody.addAll(statementsOf(body));

        Statement loop = createForStatement(
            // var $result = $iterator.next()
            createVariableStatement("var", result, nextResult(iterator)),
            // !$result.done
            createUnaryExpression("!", createMemberExpression(result, "done")),
            // $result = $iterator.next()
            createAssignment(createIdentifier(result), nextResult(iterator)),
            createBlock(loopBody));

        return createBlock(initIterator, loop);
    }

    private static Expression nextResult(String iterator) {
        return createCallExpression(createMemberExpression(iterator, "next"));
    }

    // loops in nested function-like bodies belong to their own scope
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
