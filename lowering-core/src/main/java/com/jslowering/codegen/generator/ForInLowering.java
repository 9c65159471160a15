package com.jslowering.codegen.generator;

import com.jslowering.ast.BlockStatement;
import com.jslowering.codegen.UniqueIdentifierGenerator;

/**
 * Rewrites the for-in loops of a function body into an interruptible form. Returns the same
 * body when it contains no for-in loop.
 */
@FunctionalInterface
public interface ForInLowering {
    BlockStatement lower(UniqueIdentifierGenerator identifierGenerator, BlockStatement body);
}
