package com.nodeflow.scriptlet;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptletEvaluatorTest {

    private static final ScriptletOptions SYNC = ScriptletOptions.sync(Duration.ofSeconds(5));
    private static final ScriptletOptions ASYNC = ScriptletOptions.async(Duration.ofSeconds(5));

    private final ScriptletEvaluator evaluator = new ScriptletEvaluator(16, 2);

    @AfterEach
    void tearDown() {
        evaluator.close();
    }

    @Test
    void evaluate_sync_bindsDataAndInputs() {
        CompiledScriptlet scriptlet = evaluator.compile("return { sum: data.a + data.b, port: inputs.data };");

        CompletableFuture<ScriptletResult> future = evaluator.evaluate(scriptlet,
                ScriptletBindings.ofData(Map.of("a", 1, "b", 2), Map.of("data", "x")), SYNC);

        assertTrue(future.isDone());
        ScriptletResult result = future.join();
        assertEquals(Map.of("sum", 3, "port", "x"), result.value());
        assertFalse(result.cached());
    }

    @Test
    void evaluate_async_runsOffCallerThreadWithSameResult() throws Exception {
        CompiledScriptlet scriptlet = evaluator.compile("return data.map(function (x) { return x * 2; });");

        ScriptletResult result = evaluator.evaluate(scriptlet, ScriptletBindings.ofData(List.of(1, 2, 3)), ASYNC)
                .get(5, TimeUnit.SECONDS);

        assertEquals(List.of(2, 4, 6), result.value());
    }

    @Test
    void evaluate_noReturn_yieldsNull() {
        CompiledScriptlet scriptlet = evaluator.compile("var x = 1;");

        assertNull(evaluator.evaluate(scriptlet, ScriptletBindings.ofData(null), SYNC).join().value());
    }

    @Test
    void compile_syntaxError_throwsCompilationException() {
        assertThrows(ScriptletCompilationException.class, () -> evaluator.compile("return (1 + ;"));
        assertThrows(ScriptletCompilationException.class, () -> evaluator.compile("   "));
        assertThrows(ScriptletCompilationException.class, () -> evaluator.compileCondition("value >"));
    }

    @Test
    void evaluate_thrownError_failsWithScriptMessage() {
        CompiledScriptlet scriptlet = evaluator.compile("throw new Error('x');");

        CompletionException e = assertThrows(CompletionException.class,
                () -> evaluator.evaluate(scriptlet, ScriptletBindings.ofData(1), SYNC).join());

        assertInstanceOf(ScriptletExecutionException.class, e.getCause());
        assertEquals("Error: x", e.getCause().getMessage());
    }

    @Test
    void evaluate_runawayLoop_isAbortedAtDeadlineEvenInsideTryCatch() {
        CompiledScriptlet scriptlet = evaluator.compile("while (true) { try { data++; } catch (e) { } }");

        CompletionException e = assertThrows(CompletionException.class, () -> evaluator.evaluate(scriptlet,
                ScriptletBindings.ofData(0), ScriptletOptions.sync(Duration.ofMillis(100))).join());

        assertInstanceOf(ScriptletTimeoutException.class, e.getCause());
    }

    @Test
    void evaluate_cancelledAsyncScript_freesWorkerThread() throws Exception {
        try (ScriptletEvaluator single = new ScriptletEvaluator(4, 1)) {
            CompletableFuture<ScriptletResult> runaway = single.evaluate(single.compile("while (true) { }"),
                    ScriptletBindings.ofData(null), ScriptletOptions.async(Duration.ZERO));
            Thread.sleep(50);
            runaway.cancel(true);

            ScriptletResult next = single.evaluate(single.compile("return 7;"), ScriptletBindings.ofData(null),
                    ScriptletOptions.async(Duration.ZERO)).get(5, TimeUnit.SECONDS);

            assertEquals(7, next.value());
        }
    }

    @Test
    void evaluate_javaIsNotReachable() {
        CompiledScriptlet scriptlet = evaluator.compile(
                "return typeof java === 'undefined' && typeof Packages === 'undefined';");

        assertEquals(Boolean.TRUE, evaluator.evaluate(scriptlet, ScriptletBindings.ofData(null), SYNC).join().value());
    }

    @Test
    void evaluate_withCache_reusesResultForIdenticalCodeAndInput() {
        CompiledScriptlet scriptlet = evaluator.compile("return { doubled: data * 2 };");
        ScriptletOptions cached = SYNC.withCache(true);

        ScriptletResult first = evaluator.evaluate(scriptlet, ScriptletBindings.ofData(21), cached).join();
        ScriptletResult second = evaluator.evaluate(scriptlet, ScriptletBindings.ofData(21), cached).join();
        ScriptletResult other = evaluator.evaluate(scriptlet, ScriptletBindings.ofData(5), cached).join();

        assertFalse(first.cached());
        assertTrue(second.cached());
        assertEquals(first.value(), second.value());
        assertEquals(Map.of("doubled", 42), second.value());
        assertFalse(other.cached());
        assertEquals(2, evaluator.cachedResultCount());
    }

    @Test
    void evaluateCondition_coercesToBoolean() {
        CompiledScriptlet condition = evaluator.compileCondition("value > 3");
        CompiledScriptlet truthy = evaluator.compileCondition("data.name");

        assertTrue(evaluator.evaluateCondition(condition, 5, SYNC).join());
        assertFalse(evaluator.evaluateCondition(condition, 2, SYNC).join());
        assertTrue(evaluator.evaluateCondition(truthy, Map.of("name", "Ada"), SYNC).join());
        assertFalse(evaluator.evaluateCondition(truthy, Map.of("name", ""), SYNC).join());
    }

    @Test
    void evaluate_returnedPromise_isSettledBeforeConversion() {
        CompiledScriptlet scriptlet = evaluator.compile("return Promise.resolve(data + 1);");

        assertEquals(2, evaluator.evaluate(scriptlet, ScriptletBindings.ofData(1), SYNC).join().value());
        assertEquals(2, evaluator.evaluate(scriptlet, ScriptletBindings.ofData(1), ASYNC).join().value());
    }

    @Test
    void compileAsync_awaitResolvesPromisedValues() {
        CompiledScriptlet scriptlet = evaluator.compileAsync(
                "const r = await Promise.resolve(data);\n"
                        + "const more = await new Promise(function (resolve) { resolve({ n: r + 1 }); });\n"
                        + "return [r, more.n, await 3];");

        assertEquals(List.of(1, 2, 3), evaluator.evaluate(scriptlet, ScriptletBindings.ofData(1), SYNC).join().value());
    }

    @Test
    void compileAsync_rejectionFailsWithScriptMessage() {
        CompiledScriptlet awaited = evaluator.compileAsync("await Promise.reject(new Error('x')); return 1;");
        CompiledScriptlet returned = evaluator.compile("return Promise.reject(new Error('y'));");

        CompletionException first = assertThrows(CompletionException.class,
                () -> evaluator.evaluate(awaited, ScriptletBindings.ofData(null), SYNC).join());
        CompletionException second = assertThrows(CompletionException.class,
                () -> evaluator.evaluate(returned, ScriptletBindings.ofData(null), SYNC).join());

        assertInstanceOf(ScriptletExecutionException.class, first.getCause());
        assertEquals("Error: x", first.getCause().getMessage());
        assertEquals("Error: y", second.getCause().getMessage());
    }

    @Test
    void compileAsync_awaitedRejectionCanBeCaught() {
        CompiledScriptlet scriptlet = evaluator.compileAsync(
                "try { await Promise.reject(new Error('nope')); } catch (e) { return 'caught ' + e.message; }");

        assertEquals("caught nope", evaluator.evaluate(scriptlet, ScriptletBindings.ofData(null), SYNC).join().value());
    }

    @Test
    void compileAsync_runawayLoopStillTimesOut() {
        CompiledScriptlet scriptlet = evaluator.compileAsync("await null; while (true) {}");

        CompletionException e = assertThrows(CompletionException.class, () -> evaluator.evaluate(scriptlet,
                ScriptletBindings.ofData(null), ScriptletOptions.sync(Duration.ofMillis(100))).join());

        assertInstanceOf(ScriptletTimeoutException.class, e.getCause());
    }

    @Test
    void compileAsync_syntaxErrorIsReported() {
        assertThrows(ScriptletCompilationException.class, () -> evaluator.compileAsync("return (1 + ;"));
    }

    @Test
    void evaluate_withCache_reusesNullResults() {
        CompiledScriptlet scriptlet = evaluator.compile("return null;");
        ScriptletOptions cached = SYNC.withCache(true);

        ScriptletResult first = evaluator.evaluate(scriptlet, ScriptletBindings.ofData(1), cached).join();
        ScriptletResult second = evaluator.evaluate(scriptlet, ScriptletBindings.ofData(1), cached).join();

        assertNull(first.value());
        assertFalse(first.cached());
        assertNull(second.value());
        assertTrue(second.cached());
        assertEquals(1, evaluator.cachedResultCount());
    }
}
