package com.jslowering.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = LoweringJackson.createObjectMapper();
 * Program program = mapper.readValue(json, Program.class);
 * String lowered = mapper.writeValueAsString(LoweringOrchestrator.lower(ids, reporter, engines, program));
 * </pre>
 */
public final class LoweringJackson {

    private LoweringJackson() {
    }

    /**
     * Creates a new ObjectMapper configured for trees.
     *
     * The returned mapper:
     * - writes a "type" discriminator on every node and resolves it when reading
     * - writes positions as a loc object instead of startLine/startCol/endLine/endCol
     * - omits null children, except the ones AstModule keeps explicitly
     * - ignores properties it does not know, so richer parser output can be read
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // constructor parameter names let Jackson bind the canonical record constructors
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new AstModule());
        return mapper;
    }
}
