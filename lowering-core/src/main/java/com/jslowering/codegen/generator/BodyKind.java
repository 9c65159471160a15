package com.jslowering.codegen.generator;

/**
 * Outcome of classifying a function-like body.
 */
public enum BodyKind {
    /** No suspension; the body is left as is. */
    PLAIN,
    /** Lowered by the generator engine. */
    GENERATOR,
    /** Lowered by the async engine. */
    ASYNC
}
