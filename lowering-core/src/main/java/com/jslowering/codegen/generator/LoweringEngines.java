package com.jslowering.codegen.generator;

import com.jslowering.codegen.ForEachTransformer;
import com.jslowering.codegen.ForInTransformPass;

import java.util.Objects;

/**
 * The transformations {@link LoweringOrchestrator} delegates to.
 *
 * @param forIn rewrites for-in loops before a body is lowered
 * @param forEach lowers the loop a {@code yield for} is desugared into
 * @param generator lowers bodies containing {@code yield}
 * @param async lowers bodies containing only {@code await}
 */
public record LoweringEngines(
    ForInLowering forIn,
    ForEachLowering forEach,
    BodyLowering generator,
    BodyLowering async
) {
    public LoweringEngines {
        Objects.requireNonNull(forIn, "forIn");
        Objects.requireNonNull(forEach, "forEach");
        Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(async, "async");
    }

    /**
     * Uses {@link ForInTransformPass} and {@link ForEachTransformer} for the loops.
     */
    public static LoweringEngines withDefaultLoops(BodyLowering generator, BodyLowering async) {
        return new LoweringEngines(ForInTransformPass::transformTree, ForEachTransformer::transformTree, generator, async);
    }
}
