package com.jslowering.codegen.generator;

import com.jslowering.ast.BlockStatement;
import com.jslowering.ast.Expression;
import com.jslowering.ast.FunctionDeclaration;
import com.jslowering.ast.GetAccessorDeclaration;
import com.jslowering.ast.Identifier;
import com.jslowering.ast.Literal;
import com.jslowering.ast.Node;
import com.jslowering.ast.SetAccessorDeclaration;
import com.jslowering.ast.visitor.AstTransformer;
import com.jslowering.codegen.UniqueIdentifierGenerator;
import com.jslowering.util.ErrorReporter;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the function, getter and setter bodies that contain {@code yield} or {@code await}
 * and hands them to the generator or async engine for the heavy lifting.
 *
 * <p>Per body, in order: nested functions are lowered first, the body is classified with
 * {@link SuspensionAnalyzer}, for-in loops are rewritten, {@code yield for} is desugared,
 * and finally exactly one engine is invoked. A body without suspension, and the declaration
 * around it, are returned as the same references.</p>
 *
 * <p>The pass itself reports nothing and never fails; engines report through the shared
 * {@link ErrorReporter}, which callers should check afterwards.</p>
 */
public class LoweringOrchestrator extends AstTransformer {

    private static final Logger LOG = Logger.getLogger(LoweringOrchestrator.class.getName());

    private final UniqueIdentifierGenerator identifierGenerator;
    private final ErrorReporter reporter;
    private final LoweringEngines engines;

    public LoweringOrchestrator(UniqueIdentifierGenerator identifierGenerator,
                                ErrorReporter reporter,
                                LoweringEngines engines) {
        this.identifierGenerator = identifierGenerator;
        this.reporter = reporter;
        this.engines = engines;
    }

    /**
     * Lowers every suspending function-like body in {@code tree}.
     *
     * @param identifierGenerator shared by every transformation of the run
     * @param reporter receives the errors the engines find
     * @param engines the transformations to delegate to
     * @param tree any tree, typically a {@code Program}
     * @return the lowered tree, or {@code tree} itself when nothing needed lowering
     */
    public static Node lower(UniqueIdentifierGenerator identifierGenerator,
                             ErrorReporter reporter,
                             LoweringEngines engines,
                             Node tree) {
        return new LoweringOrchestrator(identifierGenerator, reporter, engines).transformAny(tree);
    }

    @Override
    protected Node transformFunctionDeclaration(FunctionDeclaration tree) {
        BlockStatement body = transformBody(tree.body(), functionName(tree));
        if (body == tree.body()) {
            return tree;
        }
        return new FunctionDeclaration(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.id(), tree.isStatic(), tree.params(), body);
    }

    @Override
    protected Node transformGetAccessorDeclaration(GetAccessorDeclaration tree) {
        BlockStatement body = transformBody(tree.body(), "get " + keyName(tree.key()));
        if (body == tree.body()) {
            return tree;
        }
        return new GetAccessorDeclaration(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.key(), tree.isStatic(), body);
    }

    @Override
    protected Node transformSetAccessorDeclaration(SetAccessorDeclaration tree) {
        BlockStatement body = transformBody(tree.body(), "set " + keyName(tree.key()));
        if (body == tree.body()) {
            return tree;
        }
        return new SetAccessorDeclaration(tree.start(), tree.end(), tree.startLine(), tree.startCol(), tree.endLine(), tree.endCol(),
            tree.key(), tree.isStatic(), tree.parameter(), body);
    }

    private BlockStatement transformBody(BlockStatement tree, String name) {
        // transform nested functions
        BlockStatement body = asBlock(transformBlockStatement(tree));

        SuspensionKinds kinds = SuspensionAnalyzer.analyze(body);
        if (!kinds.hasAnySuspension()) {
            return body;
        }

        // for-in key enumeration cannot be interrupted, so it is rewritten first
        if (kinds.hasForIn()) {
            body = engines.forIn().lower(identifierGenerator, body);
        }

        if (kinds.hasYieldFor()) {
            body = IterationSuspensionDesugarer.transformTree(identifierGenerator, engines.forEach(), body);
        }

        BodyKind bodyKind = kinds.bodyKind();
        LOG.log(Level.FINE, "Lowering {0} as {1}", new Object[] {name, bodyKind});
        switch (bodyKind) {
            case GENERATOR:
                return engines.generator().lower(reporter, body);
            case ASYNC:
                return engines.async().lower(reporter, body);
            default:
                throw new AssertionError("Unexpected body kind " + bodyKind + " for " + name);
        }
    }

    private static String functionName(FunctionDeclaration tree) {
        return tree.id() != null ? tree.id().name() : "<anonymous>";
    }

    private static String keyName(Expression key) {
        if (key instanceof Identifier identifier) {
            return identifier.name();
        }
        if (key instanceof Literal literal) {
            return String.valueOf(literal.value());
        }
        return key.type();
    }
}
