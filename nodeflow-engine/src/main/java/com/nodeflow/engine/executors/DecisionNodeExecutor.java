package com.nodeflow.engine.executors;

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
import com.nodeflow.scriptlet.ScriptletCompilationException;
import com.nodeflow.scriptlet.ScriptletEvaluator;
import com.nodeflow.scriptlet.ScriptletOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates a boolean condition against the first input item and emits the input on exactly one of the
 * {@code true} / {@code false} ports; evaluation failures go to the {@code error} port.
 * <p>
 * Config: {@code condition} (expression over {@code value}), optional {@code trueData} / {@code falseData}
 * maps merged into map items on the matching branch, optional {@code timeout} in milliseconds.
 */
public final class DecisionNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(DecisionNodeExecutor.class);

    public static final String TYPE = "decision";
    public static final String CONDITION_RESULT_ATTRIBUTE = "conditionResult";

    private static final NodeDefinition DEFINITION = NodeDefinition.builder(TYPE)
            .displayName("Decision")
            .category("Logic")
            .description("Routes its input to the true or false port based on a condition")
            .input(PortDefinition.required(PortNames.DATA))
            .output(PortNames.TRUE)
            .output(PortNames.FALSE)
            .output(PortNames.ERROR)
            .defaultConfig("condition", "false")
            .build();

    private final ScriptletEvaluator evaluator;
    private final TimeoutGuard timeoutGuard;
    private final Duration defaultTimeout;

    public DecisionNodeExecutor(ScriptletEvaluator evaluator, TimeoutGuard timeoutGuard, Duration defaultTimeout) {
        this.evaluator = evaluator;
        this.timeoutGuard = timeoutGuard;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public NodeDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(Map<String, Object> config) {
        String condition = NodeConfig.string(config, "condition");
        if (condition == null) {
            return ValidationResult.failure("condition is required");
        }
        try {
            evaluator.compileCondition(condition);
            return ValidationResult.success();
        } catch (ScriptletCompilationException e) {
            return ValidationResult.failure("condition does not parse: " + e.getMessage());
        }
    }

    @Override
    public CompletableFuture<DataEnvelope> execute(Map<String, Object> config,
                                                   Map<String, DataEnvelope> inputsByPort,
                                                   NodeExecutionContext context) {
        Instant start = Instant.now();
        String condition = NodeConfig.string(config, "condition");
        if (condition == null) {
            return CompletableFuture.completedFuture(failure(ErrorKind.CONFIGURATION, "No condition configured", start));
        }
        DataEnvelope input = NodeInputs.primary(DEFINITION, inputsByPort);
        if (input == null) {
            return CompletableFuture.completedFuture(
                    failure(ErrorKind.EXECUTION, "No data provided for condition evaluation", start));
        }
        CompiledScriptlet compiled;
        try {
            compiled = evaluator.compileCondition(condition);
        } catch (ScriptletCompilationException e) {
            return CompletableFuture.completedFuture(failure(ErrorKind.COMPILATION, describe(condition, e), start));
        }
        long timeoutMs = NodeConfig.longValue(config, "timeout", defaultTimeout.toMillis());
        Object value = input.firstJson();
        return timeoutGuard.withTimeout(
                        () -> evaluator.evaluateCondition(compiled, value, ScriptletOptions.sync(Duration.ofMillis(timeoutMs))),
                        timeoutMs, "Condition evaluation")
                .handle((result, error) -> {
                    if (error != null) {
                        log.warn("Condition failed | nodeId={} | condition={} | reason={}",
                                context.nodeId(), condition, ScriptletFailures.messageOf(error));
                        return failure(ScriptletFailures.kindOf(error), describe(condition, error), start);
                    }
                    return routed(input, result, config, start);
                });
    }

    private static DataEnvelope routed(DataEnvelope input, boolean result, Map<String, Object> config, Instant start) {
        String port = result ? PortNames.TRUE : PortNames.FALSE;
        Map<String, Object> extra = NodeConfig.map(config, port + "Data");
        List<WorkflowItem> items = input.getItems();
        if (extra != null && !extra.isEmpty()) {
            items = new ArrayList<>(items.size());
            for (WorkflowItem item : input.getItems()) {
                items.add(merge(item, extra));
            }
        }
        return new DataEnvelope(items, EnvelopeMeta.builder()
                .startTime(start)
                .endTime(Instant.now())
                .outputPort(port)
                .attribute(CONDITION_RESULT_ATTRIBUTE, result)
                .build());
    }

    private static WorkflowItem merge(WorkflowItem item, Map<String, Object> extra) {
        if (!(item.getJson() instanceof Map)) return item;
        Map<String, Object> merged = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) item.getJson()).entrySet()) {
            merged.put(String.valueOf(e.getKey()), e.getValue());
        }
        merged.putAll(extra);
        return item.withJson(merged);
    }

    private static DataEnvelope failure(ErrorKind kind, String message, Instant start) {
        return DataEnvelope.error(kind, message, start).withOutputPort(PortNames.ERROR);
    }

    private static String describe(String condition, Throwable error) {
        return "Error evaluating condition \"" + condition + "\": " + ScriptletFailures.messageOf(error);
    }
}
