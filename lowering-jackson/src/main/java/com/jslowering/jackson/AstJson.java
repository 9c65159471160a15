package com.jslowering.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jslowering.ast.Node;
import com.jslowering.ast.Program;

/**
 * Reads and writes trees as JSON. Instances are thread-safe.
 */
public class AstJson {

    private final ObjectMapper mapper;

    public AstJson() {
        this(LoweringJackson.createObjectMapper());
    }

    public AstJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String serialize(Node node) throws AstJsonException {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Failed to serialize " + node.type(), e);
        }
    }

    public String serializePretty(Node node) throws AstJsonException {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Failed to serialize " + node.type(), e);
        }
    }

    public Program deserializeProgram(String json) throws AstJsonException {
        return deserialize(json, Program.class);
    }

    public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }
}
