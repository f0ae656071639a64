package com.nodeflow.engine.subworkflow;

import com.nodeflow.engine.NodeTimeoutException;
import com.nodeflow.engine.TimeoutGuard;
import com.nodeflow.engine.executors.NodeInputs;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.EnvelopeMeta;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.node.CallStack;
import com.nodeflow.node.NodeConfig;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.NodeExecutor;
import com.nodeflow.node.PortDefinition;
import com.nodeflow.node.PortNames;
import com.nodeflow.node.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The {@code workflow_trigger} node: runs another workflow through a {@link WorkflowLauncher}.
 * <p>
 * Before delegating, the call stack of the current run is checked: a target already on the stack is a
 * circular dependency and the launcher is never called. Otherwise the launcher receives the stack with the
 * target appended, and the call is raced against {@code timeoutMs}.
 * <p>
 * Config: {@code workflowId}, {@code inputField} (default {@code json}), {@code timeoutMs} (alias {@code timeout}).
 */
public final class SubworkflowInvoker implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(SubworkflowInvoker.class);

    public static final String TYPE = "workflow_trigger";

    static final String WHOLE_PAYLOAD = "json";
    private static final List<String> FALLBACK_FIELDS = List.of("text", "content", "input");

    private final WorkflowLauncher launcher;
    private final TimeoutGuard timeoutGuard;
    private final Duration defaultTimeout;
    private final int maxNestingDepth;
    private final NodeDefinition definition;

    public SubworkflowInvoker(WorkflowLauncher launcher, TimeoutGuard timeoutGuard, Duration defaultTimeout,
                              int maxNestingDepth) {
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.timeoutGuard = Objects.requireNonNull(timeoutGuard, "timeoutGuard");
        this.defaultTimeout = defaultTimeout;
        this.maxNestingDepth = maxNestingDepth;
        this.definition = NodeDefinition.builder(TYPE)
                .displayName("Workflow Trigger")
                .category("Flow")
                .description("Runs another workflow and emits its result")
                .input(PortDefinition.optional(PortNames.INPUT))
                .output(PortNames.OUTPUT)
                .output(PortNames.ERROR)
                .defaultConfig("inputField", WHOLE_PAYLOAD)
                .build();
    }

    @Override
    public NodeDefinition definition() {
        return definition;
    }

    @Override
    public ValidationResult validate(Map<String, Object> config) {
        return NodeConfig.string(config, "workflowId") != null
                ? ValidationResult.success() : ValidationResult.failure("workflowId is required");
    }

    @Override
    public CompletableFuture<DataEnvelope> execute(Map<String, Object> config,
                                                   Map<String, DataEnvelope> inputsByPort,
                                                   NodeExecutionContext context) {
        Instant start = Instant.now();
        String workflowId = NodeConfig.string(config, "workflowId");
        if (workflowId == null) {
            return done(DataEnvelope.error(ErrorKind.CONFIGURATION, "Missing workflow ID in settings", start));
        }
        CallStack callStack = context.callStack();
        if (callStack.contains(workflowId)) {
            String message = "Circular workflow dependency detected: " + callStack.describeCycle(workflowId);
            log.warn("Sub-workflow refused | nodeId={} | workflowId={} | callStack={}",
                    context.nodeId(), workflowId, callStack);
            return done(DataEnvelope.error(ErrorKind.CIRCULAR_DEPENDENCY, message, start));
        }
        if (callStack.depth() >= maxNestingDepth) {
            return done(DataEnvelope.error(ErrorKind.CONFIGURATION,
                    "Maximum workflow nesting depth " + maxNestingDepth + " exceeded: "
                            + String.join(" -> ", callStack.asList()) + " -> " + workflowId, start));
        }

        String inputField = NodeConfig.string(config, "inputField");
        DataEnvelope input = NodeInputs.primary(definition, inputsByPort);
        Object prompt = extractInput(input, inputField != null ? inputField : WHOLE_PAYLOAD);
        CallStack nested = callStack.append(workflowId);
        SubworkflowRequest request = new SubworkflowRequest(workflowId, prompt, nested,
                new SubworkflowRequest.Metadata(SubworkflowRequest.SOURCE_TRIGGER_NODE, context.nodeId(),
                        context.workflowId()));
        long timeoutMs = NodeConfig.longValue(config, "timeoutMs",
                NodeConfig.longValue(config, "timeout", defaultTimeout.toMillis()));
        if (log.isDebugEnabled()) {
            log.debug("Sub-workflow launch | nodeId={} | workflowId={} | callStack={} | timeoutMs={}",
                    context.nodeId(), workflowId, nested, timeoutMs);
        }
        return timeoutGuard.withTimeout(() -> launcher.launch(request), timeoutMs, "Workflow " + workflowId)
                .handle((result, error) -> error != null
                        ? failure(workflowId, error, timeoutMs, start)
                        : success(workflowId, result, nested, start));
    }

    /**
     * Picks the value sent to the nested workflow: the whole first payload for {@code json}, else the named
     * field, else the first of {@code text}, {@code content}, {@code input}, else the whole payload.
     */
    static Object extractInput(DataEnvelope input, String inputField) {
        if (input == null || input.isEmpty()) return null;
        WorkflowItem first = input.getItems().get(0);
        Object payload = first.getJson();
        if (payload == null) return first.getText();
        if (WHOLE_PAYLOAD.equals(inputField) || !(payload instanceof Map)) return payload;
        Map<?, ?> fields = (Map<?, ?>) payload;
        if (fields.get(inputField) != null) return fields.get(inputField);
        for (String fallback : FALLBACK_FIELDS) {
            if (fields.get(fallback) != null) return fields.get(fallback);
        }
        return payload;
    }

    private static DataEnvelope success(String workflowId, Map<String, Object> result, CallStack nested, Instant start) {
        Map<String, Object> response = result != null ? result : Map.of();
        Object output = response.get("output");
        if (output == null) output = response.get("result");
        if (output == null) output = response;
        Object status = response.get("status") != null ? response.get("status") : "completed";
        long elapsedMs = Duration.between(start, Instant.now()).toMillis();

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("result", response);
        json.put("output", output);
        json.put("status", status);
        json.put("workflowId", workflowId);
        json.put("executionTimeMs", elapsedMs);
        json.put("callStack", nested.asList());
        WorkflowItem item = output instanceof String ? WorkflowItem.ofText(json, (String) output) : WorkflowItem.of(json);
        return new DataEnvelope(List.of(item), EnvelopeMeta.builder()
                .startTime(start)
                .endTime(Instant.now())
                .executionTimeMs(elapsedMs)
                .build());
    }

    private static DataEnvelope failure(String workflowId, Throwable error, long timeoutMs, Instant start) {
        Throwable cause = NodeTimeoutException.unwrap(error);
        ErrorKind kind;
        String message;
        if (cause instanceof NodeTimeoutException) {
            kind = ErrorKind.TIMEOUT;
            message = "Workflow " + workflowId + " timed out after " + timeoutMs + "ms";
        } else {
            boolean circular = cause instanceof WorkflowLaunchException && ((WorkflowLaunchException) cause).isCircular();
            kind = circular ? ErrorKind.CIRCULAR_DEPENDENCY : ErrorKind.EXECUTION;
            message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        log.warn("Sub-workflow failed | workflowId={} | kind={} | reason={}", workflowId, kind.toValue(), message);
        return new DataEnvelope(List.of(), EnvelopeMeta.builder()
                .startTime(start)
                .endTime(Instant.now())
                .error(kind, message)
                .executionTimeMs(Duration.between(start, Instant.now()).toMillis())
                .build());
    }

    private static CompletableFuture<DataEnvelope> done(DataEnvelope envelope) {
        return CompletableFuture.completedFuture(envelope);
    }
}
