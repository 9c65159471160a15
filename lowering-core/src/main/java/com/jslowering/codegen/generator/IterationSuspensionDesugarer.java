package com.jslowering.codegen.generator;

import com.jslowering.ast.BlockStatement;
import com.jslowering.ast.ForEachStatement;
import com.jslowering.ast.FunctionDeclaration;
import com.jslowering.ast.GetAccessorDeclaration;
import com.jslowering.ast.Identifier;
import com.jslowering.ast.Node;
import com.jslowering.ast.SetAccessorDeclaration;
import com.jslowering.ast.YieldStatement;
import com.jslowering.ast.visitor.AstTransformer;
import com.jslowering.codegen.UniqueIdentifierGenerator;

import static com.jslowering.codegen.AstFactory.createBlock;
import static com.jslowering.codegen.AstFactory.createForEachStatement;
import static com.jslowering.codegen.AstFactory.createIdentifier;
import static com.jslowering.codegen.AstFactory.createVariableDeclaration;
import static com.jslowering.codegen.AstFactory.createYieldStatement;

/**
 * Turns {@code yield for E} into a for-each loop containing a plain {@code yield}, and
 * lowers that loop right away.
 * <pre>
 * yield for E;
 *   becomes the lowering of
 * for (var $tmp of E) { yield $tmp; }
 * </pre>
 */
public class IterationSuspensionDesugarer extends AstTransformer {

    private final UniqueIdentifierGenerator identifierGenerator;
    private final ForEachLowering forEachLowering;

    public IterationSuspensionDesugarer(UniqueIdentifierGenerator identifierGenerator, ForEachLowering forEachLowering) {
        this.identifierGenerator = identifierGenerator;
        this.forEachLowering = forEachLowering;
    }

    public static BlockStatement transformTree(UniqueIdentifierGenerator identifierGenerator,
                                               ForEachLowering forEachLowering,
                                               BlockStatement tree) {
        return asBlock(new IterationSuspensionDesugarer(identifierGenerator, forEachLowering).transformAny(tree));
    }

    @Override
    protected Node transformYieldStatement(YieldStatement tree) {
        if (!tree.isYieldFor()) {
            return tree;
        }

        // one fresh name per statement
        Identifier id = createIdentifier(identifierGenerator.generateUniqueIdentifier());
        ForEachStatement forEach = createForEachStatement(
            createVariableDeclaration("var", id, null),
            tree.argument(),
            createBlock(createYieldStatement(id, false)));

        return forEachLowering.lower(identifierGenerator, forEach);
    }

    // yield for inside nested functions belongs to their own scope
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
