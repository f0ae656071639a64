package com.nodeflow.scriptlet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mozilla.javascript.BaseFunction;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Function;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.Script;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.ScriptableObject;
import org.mozilla.javascript.Undefined;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles and runs scriptlets.
 * <p>
 * A scriptlet body is compiled as {@code function (data, inputs, value) { body }}; conditions are compiled
 * as {@code return !!(condition);}. {@link #compileAsync(String)} accepts {@code await} in the body: the body
 * runs as a generator stepped through promises. A result that is a promise (or any thenable) is settled before
 * it is returned, so {@code return Promise.resolve(x)} yields {@code x} and a rejection fails the evaluation.
 * <p>
 * Every evaluation returns a future: synchronous evaluations run on the calling thread and return a completed
 * future, asynchronous ones run on a pool of daemon threads and can be cancelled (the script is interrupted at
 * its next instruction check).
 * <p>
 * Two bounded caches are shared across invocations and safe for concurrent use: compiled scripts keyed by
 * source, and results keyed by a fingerprint of source and serialized bindings.
 */
public final class ScriptletEvaluator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScriptletEvaluator.class);

    private static final String SOURCE_NAME = "scriptlet";
    private static final String NULL_JSON = "null";

    /** Single line, so compiler line numbers stay one off from the body like the plain wrapper. */
    private static final String ASYNC_PREFIX = "(function (data, inputs, value) { "
            + "var __drive = function (gen) { return new Promise(function (resolve, reject) { "
            + "function step(method, arg) { var r; "
            + "try { r = gen[method](arg); } catch (e) { reject(e); return; } "
            + "if (r.done) { resolve(r.value); return; } "
            + "Promise.resolve(r.value).then(function (v) { step('next', v); }, function (e) { step('throw', e); }); } "
            + "step('next', undefined); }); }; "
            + "return __drive((function* (data, inputs, value) {\n";
    private static final String ASYNC_SUFFIX = "\n}).call(this, data, inputs, value)); })";
    private static final int DEFAULT_CACHE_SIZE = 256;
    private static final int DEFAULT_THREADS = 4;

    private final SandboxContextFactory contextFactory = new SandboxContextFactory();
    private final JsonBridge bridge;
    private final BoundedCache<String, Script> compiledCache;
    private final BoundedCache<String, String> resultCache;
    private final ExecutorService workers;

    public ScriptletEvaluator() {
        this(DEFAULT_CACHE_SIZE, DEFAULT_THREADS);
    }

    public ScriptletEvaluator(int cacheSize, int threads) {
        this.bridge = new JsonBridge(new ObjectMapper());
        this.compiledCache = new BoundedCache<>(cacheSize);
        this.resultCache = new BoundedCache<>(cacheSize);
        this.workers = Executors.newFixedThreadPool(threads, daemonThreads());
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "nodeflow-scriptlet-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Compiles a function body.
     *
     * @throws ScriptletCompilationException if the body is blank or does not parse
     */
    public CompiledScriptlet compile(String body) {
        if (body == null || body.isBlank()) {
            throw new ScriptletCompilationException("Scriptlet body is empty", null);
        }
        return compileWrapped(body, "(function (data, inputs, value) {\n" + body + "\n})");
    }

    /**
     * Compiles an async function body: {@code await} may be used at the top level of the body.
     *
     * @throws ScriptletCompilationException if the body is blank or does not parse
     */
    public CompiledScriptlet compileAsync(String body) {
        if (body == null || body.isBlank()) {
            throw new ScriptletCompilationException("Scriptlet body is empty", null);
        }
        return compileWrapped(body, ASYNC_PREFIX + AwaitRewriter.rewrite(body) + ASYNC_SUFFIX);
    }

    private CompiledScriptlet compileWrapped(String body, String source) {
        Script script = compiledCache.get(source);
        if (script == null) {
            script = compileSource(source);
            compiledCache.put(source, script);
        }
        return new CompiledScriptlet(body, source, script);
    }

    /**
     * Compiles a boolean condition; the result of evaluating it is always a {@link Boolean}.
     *
     * @throws ScriptletCompilationException if the expression is blank or does not parse
     */
    public CompiledScriptlet compileCondition(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScriptletCompilationException("Condition is empty", null);
        }
        CompiledScriptlet wrapped = compile("return !!(" + expression + "\n);");
        return new CompiledScriptlet(expression, wrapped.source(), wrapped.script());
    }

    private Script compileSource(String source) {
        Context cx = contextFactory.enterContext();
        try {
            return cx.compileString(source, SOURCE_NAME, 1, null);
        } catch (EvaluatorException e) {
            throw new ScriptletCompilationException("Compilation error: " + e.details()
                    + " (line " + Math.max(1, e.lineNumber() - 1) + ")", e);
        } finally {
            Context.exit();
        }
    }

    /**
     * Runs a compiled scriptlet. The future completes exceptionally with {@link ScriptletExecutionException}
     * or {@link ScriptletTimeoutException}; it never throws directly.
     */
    public CompletableFuture<ScriptletResult> evaluate(CompiledScriptlet scriptlet,
                                                       ScriptletBindings bindings,
                                                       ScriptletOptions options) {
        long startNanos = System.nanoTime();
        String cacheKey = options.useCache() ? cacheKey(scriptlet, bindings) : null;
        if (cacheKey != null) {
            String hit = resultCache.get(cacheKey);
            if (hit != null) {
                if (log.isDebugEnabled()) {
                    log.debug("Scriptlet cache hit | key={}", cacheKey.substring(0, 12));
                }
                try {
                    return CompletableFuture.completedFuture(new ScriptletResult(bridge.readJson(hit), true, 0L));
                } catch (ScriptletExecutionException e) {
                    return CompletableFuture.failedFuture(e);
                }
            }
        }
        if (!options.async()) {
            try {
                return CompletableFuture.completedFuture(run(scriptlet, bindings, options, cacheKey, startNanos));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        CompletableFuture<ScriptletResult> result = new CompletableFuture<>();
        Future<?> task = workers.submit(() -> {
            try {
                result.complete(run(scriptlet, bindings, options, cacheKey, startNanos));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((v, e) -> {
            if (result.isCancelled()) {
                task.cancel(true);
            }
        });
        return result;
    }

    /** Evaluates a condition compiled with {@link #compileCondition(String)} against {@code value}. */
    public CompletableFuture<Boolean> evaluateCondition(CompiledScriptlet condition, Object value, ScriptletOptions options) {
        return evaluate(condition, ScriptletBindings.ofValue(value), options)
                .thenApply(r -> Boolean.TRUE.equals(r.value()));
    }

    private ScriptletResult run(CompiledScriptlet scriptlet, ScriptletBindings bindings, ScriptletOptions options,
                                String cacheKey, long startNanos) {
        Context cx = contextFactory.enterContext();
        try {
            if (options.hasDeadline()) {
                cx.putThreadLocal(SandboxContextFactory.DEADLINE_KEY, System.nanoTime() + options.timeout().toNanos());
            }
            ScriptableObject scope = cx.initSafeStandardObjects();
            Function fn = (Function) scriptlet.script().exec(cx, scope);
            Object[] args = {
                    bridge.toScript(cx, scope, bindings.data()),
                    bridge.toScript(cx, scope, bindings.inputs()),
                    bridge.toScript(cx, scope, bindings.value())
            };
            Object raw = settle(cx, scope, fn.call(cx, scope, scope, args));
            String json = bridge.fromScriptToJson(cx, scope, raw);
            if (cacheKey != null) {
                resultCache.put(cacheKey, json != null ? json : NULL_JSON);
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            return new ScriptletResult(bridge.readJson(json), false, elapsedMs);
        } catch (SandboxContextFactory.ScriptAbort e) {
            throw new ScriptletTimeoutException(options.timeout().toMillis());
        } catch (RhinoException e) {
            throw new ScriptletExecutionException(e.details(), e);
        } finally {
            cx.removeThreadLocal(SandboxContextFactory.DEADLINE_KEY);
            Context.exit();
        }
    }

    /** Waits out a thenable result by draining the microtask queue; other values pass through. */
    private static Object settle(Context cx, Scriptable scope, Object raw) {
        if (!(raw instanceof Scriptable)) {
            return raw;
        }
        Object then = ScriptableObject.getProperty((Scriptable) raw, "then");
        if (!(then instanceof Function)) {
            return raw;
        }
        Settlement settlement = new Settlement();
        ((Function) then).call(cx, scope, (Scriptable) raw,
                new Object[] {settlement.callback(true), settlement.callback(false)});
        cx.processMicrotasks();
        if (!settlement.done) {
            throw new ScriptletExecutionException("Scriptlet promise never settled", null);
        }
        if (!settlement.fulfilled) {
            throw new ScriptletExecutionException(Context.toString(settlement.value), null);
        }
        return settlement.value;
    }

    /** Outcome of a thenable, recorded by the two callbacks handed to its {@code then}. */
    private static final class Settlement {
        private boolean done;
        private boolean fulfilled;
        private Object value;

        BaseFunction callback(boolean fulfil) {
            return new BaseFunction() {
                @Override
                public Object call(Context cx, Scriptable scope, Scriptable thisObj, Object[] args) {
                    if (!done) {
                        done = true;
                        fulfilled = fulfil;
                        value = args.length > 0 ? args[0] : Undefined.instance;
                    }
                    return Undefined.instance;
                }
            };
        }
    }

    private String cacheKey(CompiledScriptlet scriptlet, ScriptletBindings bindings) {
        try {
            String input = bridge.serialize(Arrays.asList(bindings.data(), bindings.inputs(), bindings.value()));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(scriptlet.source().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (JsonProcessingException e) {
            log.warn("Scriptlet result not cacheable | reason={}", e.getOriginalMessage());
            return null;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Number of cached results (for diagnostics). */
    public int cachedResultCount() {
        return resultCache.size();
    }

    public void clearCaches() {
        resultCache.clear();
        compiledCache.clear();
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
