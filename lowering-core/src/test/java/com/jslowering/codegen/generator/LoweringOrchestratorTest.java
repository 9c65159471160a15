package com.jslowering.codegen.generator;

import com.jslowering.ast.*;
import com.jslowering.codegen.UniqueIdentifierGenerator;
import com.jslowering.testing.TreeInterpreter;
import com.jslowering.util.CollectingErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.jslowering.testing.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class LoweringOrchestratorTest {

    private final UniqueIdentifierGenerator generator = new UniqueIdentifierGenerator();
    private final CollectingErrorReporter reporter = new CollectingErrorReporter();
    private final RecordingEngines recording = new RecordingEngines();

    private Node lower(Node tree) {
        return LoweringOrchestrator.lower(generator, reporter, recording.engines(), tree);
    }

    private static String marker(BlockStatement body) {
        if (!body.body().isEmpty()
            && body.body().get(0) instanceof ExpressionStatement statement
            && statement.expression() instanceof Literal literal) {
            return String.valueOf(literal.value());
        }
        return null;
    }

    @Test
    void testProgramWithoutSuspensionIsReturnedAsIs() {
        Program program = program(
            var("x", num(1)),
            function("f", stmt(call("g")), forIn("k", id("o"), stmt(id("k")))),
            classDecl("C", function("m", var("y", num(2))), getter("size", false)),
            stmt(object(prop("a", num(1)), setter("s", "v", stmt(id("v"))))));

        assertSame(program, lower(program));
        assertTrue(recording.calls.isEmpty());
        assertFalse(reporter.hadError());
    }

    @Test
    void testGeneratorBodyIsHandedToGeneratorEngine() {
        Identifier name = id("gen");
        List<Identifier> params = List.of(id("a"), id("b"));
        BlockStatement body = block(yieldValue(id("a")), yieldValue(id("b")));
        FunctionDeclaration function = new FunctionDeclaration(name, true, params, body);

        FunctionDeclaration result = (FunctionDeclaration) lower(function);

        assertEquals(List.of("generator"), recording.calls);
        assertSame(body, recording.generatorInputs.get(0));
        assertEquals("generator", marker(result.body()));
        assertSame(name, result.id());
        assertTrue(result.isStatic());
        assertSame(params, result.params());
    }

    @Test
    void testAwaitBodyIsHandedToAsyncEngine() {
        FunctionDeclaration function = function("load", awaitValue("x", call("fetch")), stmt(id("x")));

        FunctionDeclaration result = (FunctionDeclaration) lower(function);

        assertEquals(List.of("async"), recording.calls);
        assertEquals("async", marker(result.body()));
        assertTrue(recording.generatorInputs.isEmpty());
    }

    @Test
    void testYieldWinsOverAwait() {
        lower(function("mixed", awaitValue(null, id("p")), yieldValue(num(1))));

        assertEquals(List.of("generator"), recording.calls);
        assertTrue(recording.asyncInputs.isEmpty());
    }

    @Test
    void testForInIsRewrittenBeforeDispatch() {
        lower(function("keys", forIn("k", id("o"), yieldValue(id("k")))));

        assertEquals(List.of("forIn", "generator"), recording.calls);
        BlockStatement input = recording.generatorInputs.get(0);
        assertFalse(findAll(input, YieldStatement.class).isEmpty());
        for (ForInStatement loop : findAll(input, ForInStatement.class)) {
            assertTrue(findAll(loop, YieldStatement.class).isEmpty());
        }
    }

    @Test
    void testForInAloneIsNotRewritten() {
        FunctionDeclaration function = function("plain", forIn("k", id("o"), stmt(call("use", id("k")))));

        assertSame(function, lower(function));
        assertTrue(recording.calls.isEmpty());
    }

    @Test
    void testYieldForIsDesugaredBeforeDispatch() {
        int[] evaluations = {0};
        lower(function("delegate", yieldValue(num(0)), yieldFor(call("source"))));

        assertEquals(List.of("forEach", "generator"), recording.calls);
        BlockStatement input = recording.generatorInputs.get(0);
        assertTrue(findAll(input, YieldStatement.class).stream().noneMatch(YieldStatement::isYieldFor));
        assertTrue(findAll(input, ForEachStatement.class).isEmpty());

        TreeInterpreter interpreter = new TreeInterpreter()
            .defineFunction("source", arguments -> {
                evaluations[0]++;
                return List.of(1, 2);
            })
            .run(input);
        assertEquals(List.of(0, 1, 2), interpreter.yielded());
        assertEquals(1, evaluations[0]);
    }

    @Test
    void testEarlierYieldForIsKeptWhenLaterYieldIsPlain() {
        lower(function("delegate", yieldFor(id("xs")), yieldValue(num(1))));

        assertEquals(List.of("generator"), recording.calls);
        assertTrue(findAll(recording.generatorInputs.get(0), YieldStatement.class).get(0).isYieldFor());
    }

    @Test
    void testNestedFunctionsAreLoweredOnTheirOwn() {
        FunctionDeclaration inner = function("inner", yieldValue(num(1)));
        FunctionDeclaration outer = function("outer", inner, awaitValue(null, call("inner")));

        FunctionDeclaration result = (FunctionDeclaration) lower(outer);

        assertEquals(List.of("generator", "async"), recording.calls);
        assertEquals("async", marker(result.body()));
        FunctionDeclaration loweredInner = findAll(recording.asyncInputs.get(0), FunctionDeclaration.class).get(0);
        assertEquals("generator", marker(loweredInner.body()));
        assertSame(recording.generatorInputs.get(0), loweredInner.body().body().get(1));
    }

    @Test
    void testOuterFunctionIsRebuiltWhenOnlyInnerChanges() {
        Identifier name = id("outer");
        List<Identifier> params = List.of(id("p"));
        FunctionDeclaration outer = new FunctionDeclaration(12, 80, new SourceLocation(
            new SourceLocation.Position(2, 0), new SourceLocation.Position(6, 1)),
            name, false, params, block(var("x", num(1)), function("inner", yieldValue(id("x")))));

        FunctionDeclaration result = (FunctionDeclaration) lower(outer);

        assertEquals(List.of("generator"), recording.calls);
        assertNotSame(outer, result);
        assertSame(name, result.id());
        assertSame(params, result.params());
        assertFalse(result.isStatic());
        assertSame(outer.body().body().get(0), result.body().body().get(0));
        assertEquals(12, result.start());
        assertEquals(80, result.end());
        assertEquals(outer.loc(), result.loc());
    }

    @Test
    void testAccessorsAreLowered() {
        SetAccessorDeclaration staticSetter = new SetAccessorDeclaration(id("value"), true, id("v"),
            block(awaitValue(null, id("v"))));
        ClassDeclaration clazz = classDecl("C", getter("items", true, yieldValue(num(1))), staticSetter);
        ObjectExpression literal = object(getter("g", false, yieldValue(num(2))), setter("s", "w", awaitValue(null, id("w"))));

        Program result = (Program) lower(program(clazz, stmt(literal)));

        assertEquals(List.of("generator", "async", "generator", "async"), recording.calls);
        ClassDeclaration loweredClass = (ClassDeclaration) result.body().get(0);
        GetAccessorDeclaration getter = (GetAccessorDeclaration) loweredClass.body().get(0);
        SetAccessorDeclaration setter = (SetAccessorDeclaration) loweredClass.body().get(1);
        assertTrue(getter.isStatic());
        assertEquals("generator", marker(getter.body()));
        assertTrue(setter.isStatic());
        assertSame(staticSetter.parameter(), setter.parameter());
        assertSame(staticSetter.key(), setter.key());
        assertEquals("async", marker(setter.body()));

        ObjectExpression loweredLiteral = (ObjectExpression) ((ExpressionStatement) result.body().get(1)).expression();
        assertEquals("generator", marker(((GetAccessorDeclaration) loweredLiteral.properties().get(0)).body()));
        SetAccessorDeclaration literalSetter = (SetAccessorDeclaration) loweredLiteral.properties().get(1);
        assertEquals("w", literalSetter.parameter().name());
        assertEquals("async", marker(literalSetter.body()));
    }

    @Test
    void testTemporariesAreUniqueAcrossFunctions() {
        lower(program(
            function("a", yieldFor(id("xs")), forIn("k", id("o"), yieldValue(id("k")))),
            function("b", yieldFor(id("ys")), forIn("k", id("p"), yieldValue(id("k"))))));

        List<String> temporaries = recording.generatorInputs.stream()
            .flatMap(input -> findAll(input, VariableDeclarator.class).stream())
            .map(declarator -> declarator.id().name())
            .filter(name -> name.startsWith(UniqueIdentifierGenerator.DEFAULT_PREFIX))
            .collect(Collectors.toList());
        Set<String> distinct = new HashSet<>(temporaries);
        assertFalse(temporaries.isEmpty());
        assertEquals(temporaries.size(), distinct.size());
    }

    @Test
    void testEngineErrorsDoNotStopLowering() {
        LoweringEngines failing = LoweringEngines.withDefaultLoops(
            (errors, body) -> {
                errors.reportError(null, "cannot lower %s", "yield");
                return body;
            },
            (errors, body) -> RecordingEngines.lowered("async", body));

        Program result = (Program) LoweringOrchestrator.lower(generator, reporter, failing, program(
            function("first", yieldValue(num(1))),
            function("second", awaitValue(null, id("p")))));

        assertTrue(reporter.hadError());
        assertEquals(1, reporter.getDiagnostics().size());
        assertEquals("cannot lower yield", reporter.getDiagnostics().get(0).message());
        assertEquals("async", marker(((FunctionDeclaration) result.body().get(1)).body()));
    }

    @Test
    void testMalformedReportDoesNotStopLowering() {
        List<BlockStatement> lowered = new ArrayList<>();
        LoweringEngines engines = LoweringEngines.withDefaultLoops(
            (errors, body) -> {
                errors.reportError(null, "bad %s at %d", "yield", "x");
                lowered.add(body);
                return RecordingEngines.lowered("generator", body);
            },
            (errors, body) -> body);

        Program result = (Program) LoweringOrchestrator.lower(generator, reporter, engines, program(
            function("f", yieldValue(num(1))),
            function("g", yieldValue(num(2)))));

        assertEquals(2, lowered.size());
        assertEquals(2, reporter.getDiagnostics().size());
        assertEquals("bad %s at %d", reporter.getDiagnostics().get(1).message());
        assertEquals("generator", marker(((FunctionDeclaration) result.body().get(0)).body()));
        assertEquals("generator", marker(((FunctionDeclaration) result.body().get(1)).body()));
    }

    @Test
    void testTopLevelSuspensionIsIgnored() {
        Program program = program(yieldValue(num(1)), awaitValue(null, id("p")));

        assertSame(program, lower(program));
        assertTrue(recording.calls.isEmpty());
    }

    @Test
    void testFunctionExpressionArgumentIsLowered() {
        Program result = (Program) lower(program(stmt(call("run", function(null, awaitValue(null, id("p")))))));

        assertEquals(List.of("async"), recording.calls);
        CallExpression call = (CallExpression) ((ExpressionStatement) result.body().get(0)).expression();
        FunctionDeclaration argument = (FunctionDeclaration) call.arguments().get(0);
        assertNull(argument.id());
        assertEquals("async", marker(argument.body()));
    }
}
