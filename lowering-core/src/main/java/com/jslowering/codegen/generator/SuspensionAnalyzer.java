package com.jslowering.codegen.generator;

import com.jslowering.ast.AwaitStatement;
import com.jslowering.ast.BlockStatement;
import com.jslowering.ast.ForInStatement;
import com.jslowering.ast.FunctionDeclaration;
import com.jslowering.ast.GetAccessorDeclaration;
import com.jslowering.ast.SetAccessorDeclaration;
import com.jslowering.ast.YieldStatement;
import com.jslowering.ast.visitor.AstVisitor;

/**
 * Finds the suspension forms of a function body. Does not search into nested functions
 * or accessors.
 */
public final class SuspensionAnalyzer extends AstVisitor {

    private boolean hasYield;
    private boolean hasYieldFor;
    private boolean hasForIn;
    private boolean hasAwait;

    private SuspensionAnalyzer() {
    }

    public static SuspensionKinds analyze(BlockStatement body) {
        SuspensionAnalyzer analyzer = new SuspensionAnalyzer();
        analyzer.visitAny(body);
        return new SuspensionKinds(analyzer.hasYield, analyzer.hasYieldFor, analyzer.hasForIn, analyzer.hasAwait);
    }

    @Override
    protected void visitYieldStatement(YieldStatement tree) {
        hasYield = true;
        hasYieldFor = tree.isYieldFor();
    }

    @Override
    protected void visitAwaitStatement(AwaitStatement tree) {
        hasAwait = true;
    }

    @Override
    protected void visitForInStatement(ForInStatement tree) {
        hasForIn = true;
        super.visitForInStatement(tree);
    }

    // don't visit function children or bodies
    @Override
    protected void visitFunctionDeclaration(FunctionDeclaration tree) {
    }

    @Override
    protected void visitGetAccessorDeclaration(GetAccessorDeclaration tree) {
    }

    @Override
    protected void visitSetAccessorDeclaration(SetAccessorDeclaration tree) {
    }
}
