package com.jslowering.codegen.generator;

import com.jslowering.ast.BlockStatement;
import com.jslowering.util.ErrorReporter;

/**
 * Turns a function body that suspends into one that does not, for instance by building a
 * state machine. Problems with the body are reported to the {@link ErrorReporter}; the
 * engine still returns a body.
 */
@FunctionalInterface
public interface BodyLowering {
    BlockStatement lower(ErrorReporter reporter, BlockStatement body);
}
