package com.jslowering.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.jslowering.ast.*;
import com.jslowering.codegen.UniqueIdentifierGenerator;
import com.jslowering.codegen.generator.LoweringEngines;
import com.jslowering.codegen.generator.LoweringOrchestrator;
import com.jslowering.util.CollectingErrorReporter;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LowerFromJsonTest {

    private final AstJson json = new AstJson();

    private static String fixture(String name) throws IOException {
        try (InputStream in = LowerFromJsonTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testLowerGeneratorFromJson() throws Exception {
        Program program = json.deserializeProgram(fixture("yield-for.json"));
        List<BlockStatement> generatorInputs = new ArrayList<>();
        LoweringEngines engines = LoweringEngines.withDefaultLoops(
            (reporter, body) -> {
                generatorInputs.add(body);
                return body;
            },
            (reporter, body) -> fail("no async body in the fixture"));
        CollectingErrorReporter reporter = new CollectingErrorReporter();

        Program lowered = (Program) LoweringOrchestrator.lower(
            UniqueIdentifierGenerator.forTree(program), reporter, engines, program);

        assertFalse(reporter.hadError());
        assertEquals(1, generatorInputs.size());
        assertNotSame(program, lowered);

        FunctionDeclaration function = (FunctionDeclaration) lowered.body().get(0);
        assertEquals(new SourceLocation(new SourceLocation.Position(1, 0), new SourceLocation.Position(5, 1)), function.loc());
        assertEquals(93, function.end());
        assertEquals("source", function.params().get(0).name());

        JsonNode output = json.getObjectMapper().readTree(json.serialize(lowered));
        List<String> types = new ArrayList<>();
        List<Boolean> delegating = new ArrayList<>();
        output.findParents("type").forEach(node -> {
            types.add(node.get("type").asText());
            if (node.has("isYieldFor")) {
                delegating.add(node.get("isYieldFor").asBoolean());
            }
        });
        assertFalse(types.contains("ForEachStatement"));
        assertTrue(types.contains("ForStatement"));
        assertEquals(List.of(false, false), delegating);
    }

    @Test
    void testLoweredTreeReadsBack() throws Exception {
        Program program = json.deserializeProgram(fixture("yield-for.json"));
        LoweringEngines engines = LoweringEngines.withDefaultLoops((reporter, body) -> body, (reporter, body) -> body);

        Node lowered = LoweringOrchestrator.lower(
            UniqueIdentifierGenerator.forTree(program), new CollectingErrorReporter(), engines, program);

        assertEquals(lowered, json.deserializeProgram(json.serializePretty(lowered)));
    }
}
