package com.jslowering.codegen.generator;

/**
 * Suspension forms found at the top level of one function-like body.
 *
 * @param hasYield a {@code yield} statement occurs
 * @param hasYieldFor the last {@code yield} statement seen was a {@code yield for}
 * @param hasForIn a for-in loop occurs
 * @param hasAwait an {@code await} statement occurs
 */
public record SuspensionKinds(boolean hasYield, boolean hasYieldFor, boolean hasForIn, boolean hasAwait) {

    public static final SuspensionKinds NONE = new SuspensionKinds(false, false, false, false);

    /**
     * Returns true if the body needs lowering at all.
     */
    public boolean hasAnySuspension() {
        return hasYield || hasAwait;
    }

    /**
     * How the body is lowered. A body with both {@code yield} and {@code await} is treated as a
     * generator.
     */
    public BodyKind bodyKind() {
        if (hasYield) {
            return BodyKind.GENERATOR;
        }
        if (hasAwait) {
            return BodyKind.ASYNC;
        }
        return BodyKind.PLAIN;
    }
}
