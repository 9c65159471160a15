package com.jslowering.codegen.generator;

import com.jslowering.ast.*;
import com.jslowering.codegen.ForEachTransformer;
import com.jslowering.codegen.UniqueIdentifierGenerator;
import com.jslowering.testing.TreeInterpreter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.jslowering.testing.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class IterationSuspensionDesugarerTest {

    private final UniqueIdentifierGenerator generator = new UniqueIdentifierGenerator();

    @Test
    void testPlainYieldIsLeftAlone() {
        BlockStatement body = block(yieldValue(num(1)), whileLoop(id("x"), yieldValue(id("x"))));

        BlockStatement result = IterationSuspensionDesugarer.transformTree(generator, ForEachTransformer::transformTree, body);

        assertSame(body, result);
    }

    @Test
    void testYieldForBecomesLoweredLoop() {
        List<ForEachStatement> handed = new ArrayList<>();
        BlockStatement body = block(yieldFor(id("xs")));

        BlockStatement result = IterationSuspensionDesugarer.transformTree(generator, (ids, loop) -> {
            handed.add(loop);
            return ForEachTransformer.transformTree(ids, loop);
        }, body);

        assertEquals(1, handed.size());
        ForEachStatement loop = handed.get(0);
        Identifier tmp = ((VariableDeclaration) loop.left()).declarations().get(0).id();
        assertSame(((YieldStatement) body.body().get(0)).argument(), loop.right());
        YieldStatement inner = (YieldStatement) ((BlockStatement) loop.body()).body().get(0);
        assertFalse(inner.isYieldFor());
        assertEquals(tmp.name(), ((Identifier) inner.argument()).name());

        assertTrue(findAll(result, ForEachStatement.class).isEmpty());
        assertTrue(findAll(result, YieldStatement.class).stream().noneMatch(YieldStatement::isYieldFor));
    }

    @Test
    void testEachStatementGetsItsOwnTemporary() {
        List<String> temporaries = new ArrayList<>();
        BlockStatement body = block(yieldFor(id("a")), ifThen(id("c"), block(yieldFor(id("b")))));

        IterationSuspensionDesugarer.transformTree(generator, (ids, loop) -> {
            temporaries.add(((VariableDeclaration) loop.left()).declarations().get(0).id().name());
            return loop;
        }, body);

        assertEquals(2, temporaries.size());
        assertNotEquals(temporaries.get(0), temporaries.get(1));
    }

    @Test
    void testNestedFunctionsKeepTheirYieldFor() {
        FunctionDeclaration inner = function("inner", yieldFor(id("xs")));
        BlockStatement body = block(inner, stmt(object(getter("g", false, yieldFor(id("ys"))))));

        BlockStatement result = IterationSuspensionDesugarer.transformTree(generator, (ids, loop) -> {
            fail("nested yield for must not be desugared");
            return loop;
        }, body);

        assertSame(body, result);
    }

    @Test
    void testSuspendsOncePerElementInOrder() {
        int[] evaluations = {0};
        BlockStatement body = block(yieldFor(call("source")));

        BlockStatement result = IterationSuspensionDesugarer.transformTree(generator, ForEachTransformer::transformTree, body);

        TreeInterpreter interpreter = new TreeInterpreter()
            .defineFunction("source", arguments -> {
                evaluations[0]++;
                return List.of("a", "b");
            })
            .run(result);
        assertEquals(List.of("a", "b"), interpreter.yielded());
        assertEquals(1, evaluations[0]);
    }
}
