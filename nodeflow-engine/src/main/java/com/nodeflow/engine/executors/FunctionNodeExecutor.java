package com.nodeflow.engine.executors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeflow.engine.TimeoutGuard;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.EnvelopeMeta;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.node.NodeConfig;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.NodeExecutor;
import com.nodeflow.node.PortDefinition;
import com.nodeflow.node.PortNames;
import com.nodeflow.node.ValidationResult;
import com.nodeflow.scriptlet.CompiledScriptlet;
import com.nodeflow.scriptlet.ScriptletBindings;
import com.nodeflow.scriptlet.ScriptletCompilationException;
import com.nodeflow.scriptlet.ScriptletEvaluator;
import com.nodeflow.scriptlet.ScriptletOptions;
import com.nodeflow.scriptlet.ScriptletResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a user scriptlet once per input item.
 * <p>
 * Config keys: {@code code} (alias {@code functionBody}), {@code timeout} in milliseconds,
 * {@code errorHandling} ({@code throw}, {@code return} or {@code null}), {@code cacheResults},
 * {@code useAsyncFunction}. The body sees {@code data} (the item json) and {@code inputs} (port to first
 * item json). With {@code useAsyncFunction} the body may {@code await} and may return a promise. Items run one
 * after another; with {@code errorHandling=throw} the first failure ends the node. Each output item carries the
 * result's text form: strings as is, objects and arrays as JSON.
 */
public final class FunctionNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(FunctionNodeExecutor.class);

    public static final String TYPE = "function";

    static final String THROW = "throw";
    static final String RETURN = "return";
    static final String NULL = "null";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final NodeDefinition DEFINITION = NodeDefinition.builder(TYPE)
            .displayName("Function")
            .category("Code")
            .description("Runs a script for every input item")
            .input(PortDefinition.optional(PortNames.DATA))
            .output(PortNames.OUTPUT)
            .output(PortNames.ERROR)
            .defaultConfig("timeout", 5000)
            .defaultConfig("errorHandling", THROW)
            .defaultConfig("cacheResults", false)
            .defaultConfig("useAsyncFunction", true)
            .build();

    private final ScriptletEvaluator evaluator;
    private final TimeoutGuard timeoutGuard;

    public FunctionNodeExecutor(ScriptletEvaluator evaluator, TimeoutGuard timeoutGuard) {
        this.evaluator = evaluator;
        this.timeoutGuard = timeoutGuard;
    }

    @Override
    public NodeDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(Map<String, Object> config) {
        List<String> errors = new ArrayList<>();
        if (NodeConfig.firstString(config, "code", "functionBody") == null) {
            errors.add("code is required");
        }
        String handling = errorHandling(config);
        if (!THROW.equals(handling) && !RETURN.equals(handling) && !NULL.equals(handling)) {
            errors.add("errorHandling must be one of throw, return, null (was " + handling + ")");
        }
        return ValidationResult.of(errors);
    }

    @Override
    public CompletableFuture<DataEnvelope> execute(Map<String, Object> config,
                                                   Map<String, DataEnvelope> inputsByPort,
                                                   NodeExecutionContext context) {
        Instant start = Instant.now();
        String code = NodeConfig.firstString(config, "code", "functionBody");
        if (code == null) {
            return CompletableFuture.completedFuture(
                    DataEnvelope.error(ErrorKind.CONFIGURATION, "No function code provided", start));
        }
        CompiledScriptlet compiled;
        try {
            compiled = NodeConfig.bool(config, "useAsyncFunction", true)
                    ? evaluator.compileAsync(code) : evaluator.compile(code);
        } catch (ScriptletCompilationException e) {
            log.warn("Function does not compile | nodeId={} | reason={}", context.nodeId(), e.getMessage());
            return CompletableFuture.completedFuture(DataEnvelope.error(ErrorKind.COMPILATION, e.getMessage(), start));
        }

        DataEnvelope primary = NodeInputs.primary(DEFINITION, inputsByPort);
        List<WorkflowItem> items = primary != null && !primary.isEmpty()
                ? primary.getItems() : List.of(WorkflowItem.of(null));
        Invocation invocation = new Invocation(compiled, config, NodeInputs.firstValues(inputsByPort), items, start);
        return invocation.runFrom(0);
    }

    private static String errorHandling(Map<String, Object> config) {
        String handling = NodeConfig.string(config, "errorHandling");
        return handling != null ? handling.toLowerCase(Locale.ROOT) : THROW;
    }

    /** Item json produced when an item's script runs past its deadline. */
    static Map<String, Object> timeoutItem(long timeoutMs) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("error", true);
        json.put("timedOut", true);
        json.put("message", timeoutMessage(timeoutMs));
        return json;
    }

    private static String timeoutMessage(long timeoutMs) {
        return "Function execution timed out after " + timeoutMs + "ms";
    }

    /** Text form of a script result; null stays null. */
    static String textOf(Object value) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        if (value instanceof Map || value instanceof List) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Function result is not serializable", e);
            }
        }
        return String.valueOf(value);
    }

    private static WorkflowItem resultItem(WorkflowItem input, Object json, String text) {
        return new WorkflowItem(json, text, input.getBinary());
    }

    /** State of one execution: runs the items in order and builds the output envelope. */
    private final class Invocation {
        private final CompiledScriptlet compiled;
        private final Map<String, Object> portValues;
        private final List<WorkflowItem> items;
        private final Instant start;
        private final long timeoutMs;
        private final String errorHandling;
        private final boolean cacheResults;
        private final ScriptletOptions options;
        private final List<WorkflowItem> output = new ArrayList<>();
        private boolean allCached = true;
        private int itemErrors;

        Invocation(CompiledScriptlet compiled, Map<String, Object> config, Map<String, Object> portValues,
                   List<WorkflowItem> items, Instant start) {
            this.compiled = compiled;
            this.portValues = portValues;
            this.items = items;
            this.start = start;
            this.timeoutMs = NodeConfig.longValue(config, "timeout", 5000);
            this.errorHandling = errorHandling(config);
            this.cacheResults = NodeConfig.bool(config, "cacheResults", false);
            this.options = new ScriptletOptions(Duration.ofMillis(timeoutMs),
                    NodeConfig.bool(config, "useAsyncFunction", true), cacheResults);
        }

        /**
         * Runs items from {@code index} on. Items whose evaluation is already complete are handled in this loop;
         * only a pending evaluation continues in a callback, so synchronous runs use constant stack depth.
         */
        CompletableFuture<DataEnvelope> runFrom(int index) {
            for (int i = index; i < items.size(); i++) {
                WorkflowItem item = items.get(i);
                CompletableFuture<DataEnvelope> step = timeoutGuard.withTimeout(
                                () -> evaluator.evaluate(compiled, ScriptletBindings.ofData(item.getJson(), portValues), options),
                                timeoutMs, "Function execution")
                        .handle((result, error) -> onResult(item, result, error));
                if (!step.isDone()) {
                    int next = i + 1;
                    return step.thenCompose(stop -> stop != null ? CompletableFuture.completedFuture(stop) : runFrom(next));
                }
                DataEnvelope stop = step.join();
                if (stop != null) {
                    return CompletableFuture.completedFuture(stop);
                }
            }
            return CompletableFuture.completedFuture(success());
        }

        private DataEnvelope onResult(WorkflowItem item, ScriptletResult result, Throwable error) {
            if (error != null) {
                return onFailure(item, error);
            }
            allCached &= result.cached();
            output.add(resultItem(item, result.value(), textOf(result.value())));
            return null;
        }

        /** Records a failed item; returns the node's final envelope when processing must stop, else null. */
        private DataEnvelope onFailure(WorkflowItem item, Throwable error) {
            allCached = false;
            itemErrors++;
            if (ScriptletFailures.isTimeout(error)) {
                output.add(resultItem(item, timeoutItem(timeoutMs), timeoutMessage(timeoutMs)));
                if (THROW.equals(errorHandling)) {
                    return failure(ErrorKind.TIMEOUT, timeoutMessage(timeoutMs));
                }
                return null;
            }
            ErrorKind kind = ScriptletFailures.kindOf(error);
            String message = ScriptletFailures.messageOf(error);
            switch (errorHandling) {
                case RETURN:
                    Map<String, Object> json = new LinkedHashMap<>();
                    json.put("error", true);
                    json.put("message", message);
                    json.put("errorKind", kind.toValue());
                    output.add(resultItem(item, json, message.startsWith("Error") ? message : "Error: " + message));
                    return null;
                case NULL:
                    output.add(resultItem(item, null, null));
                    return null;
                default:
                    return failure(kind, message);
            }
        }

        private DataEnvelope failure(ErrorKind kind, String message) {
            return new DataEnvelope(output, meta().error(kind, message).build());
        }

        private DataEnvelope success() {
            EnvelopeMeta.Builder meta = meta();
            if (itemErrors > 0) {
                meta.attribute("itemErrors", itemErrors);
            }
            return new DataEnvelope(output, meta.build());
        }

        private EnvelopeMeta.Builder meta() {
            Instant end = Instant.now();
            return EnvelopeMeta.builder()
                    .startTime(start)
                    .endTime(end)
                    .cached(cacheResults ? allCached : null)
                    .executionTimeMs(Duration.between(start, end).toMillis());
        }
    }
}
