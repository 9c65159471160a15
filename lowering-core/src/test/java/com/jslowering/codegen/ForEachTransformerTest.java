package com.jslowering.codegen;

import com.jslowering.ast.*;
import com.jslowering.testing.TreeInterpreter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jslowering.testing.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class ForEachTransformerTest {

    @Test
    void testLoopIsLoweredToIteratorCalls() {
        ForEachStatement loop = forOf("x", id("items"), yieldValue(id("x")));

        Statement result = ForEachTransformer.transformTree(new UniqueIdentifierGenerator(), loop);

        assertTrue(findAll(result, ForEachStatement.class).isEmpty());
        assertEquals(1, findAll(result, ForStatement.class).size());
        List<MemberExpression> members = findAll(result, MemberExpression.class);
        assertTrue(members.stream().anyMatch(m -> !m.computed() && ((Identifier) m.property()).name().equals("next")));
        assertTrue(members.stream().anyMatch(m -> !m.computed() && ((Identifier) m.property()).name().equals("done")));
        assertTrue(members.stream().anyMatch(m -> !m.computed() && ((Identifier) m.property()).name().equals("value")));
    }

    @Test
    void testBodyRunsOncePerElementInOrder() {
        int[] evaluations = {0};
        ForEachStatement loop = forOf("x", call("source"), yieldValue(id("x")));

        Statement result = ForEachTransformer.transformTree(new UniqueIdentifierGenerator(), loop);

        TreeInterpreter interpreter = new TreeInterpreter()
            .defineFunction("source", arguments -> {
                evaluations[0]++;
                return List.of("a", "b", "c");
            })
            .run(result);
        assertEquals(List.of("a", "b", "c"), interpreter.yielded());
        assertEquals(1, evaluations[0]);
    }

    @Test
    void testEmptySequenceNeverRunsBody() {
        ForEachStatement loop = forOf("x", array(), yieldValue(id("x")));

        Statement result = ForEachTransformer.transformTree(new UniqueIdentifierGenerator(), loop);

        assertTrue(new TreeInterpreter().run(result).yielded().isEmpty());
    }

    @Test
    void testAssignmentTargetReceivesEachElement() {
        ForEachStatement loop = new ForEachStatement(id("last"), array(num(1), num(2)), block());

        Statement result = ForEachTransformer.transformTree(new UniqueIdentifierGenerator(), loop);

        assertEquals(2, new TreeInterpreter().run(result).variable("last"));
    }

    @Test
    void testFreshNamesPerLoop() {
        UniqueIdentifierGenerator generator = new UniqueIdentifierGenerator();

        ForEachTransformer.transformTree(generator, forOf("x", id("a"), block()));
        Statement second = ForEachTransformer.transformTree(generator, forOf("y", id("b"), block()));

        List<String> declared = findAll(second, VariableDeclarator.class).stream()
            .map(declarator -> declarator.id().name())
            .toList();
        assertFalse(declared.contains("$__0"));
        assertFalse(declared.contains("$__1"));
    }

    @Test
    void testNestedFunctionKeepsItsLoop() {
        FunctionDeclaration nested = function("nested", forOf("y", id("ys"), stmt(id("y"))));
        ForEachStatement loop = forOf("x", id("xs"), nested, forOf("z", id("x"), yieldValue(id("z"))));

        Statement result = ForEachTransformer.transformTree(new UniqueIdentifierGenerator(), loop);

        assertTrue(contains(result, nested));
        assertEquals(1, findAll(result, ForEachStatement.class).size());
        assertSame(nested.body().body().get(0), findAll(result, ForEachStatement.class).get(0));
        assertEquals(2, findAll(result, ForStatement.class).size());
    }
}
