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
import com.nodeflow.scriptlet.ScriptletBindings;
import com.nodeflow.scriptlet.ScriptletCompilationException;
import com.nodeflow.scriptlet.ScriptletEvaluator;
import com.nodeflow.scriptlet.ScriptletOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Applies an ordered chain of scriptlet transformations to the first input value.
 * <p>
 * Each entry of {@code transformations} is {@code {name, expression, enabled}} ({@code expr} and {@code code}
 * are accepted for {@code expression}). Disabled entries are ignored; each enabled entry receives the previous
 * output as {@code data}. The first failure ends the chain.
 */
public final class DataTransformNodeExecutor implements NodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(DataTransformNodeExecutor.class);

    public static final String TYPE = "data_transform";
    public static final String FAILED_TRANSFORMATION_ATTRIBUTE = "failedTransformation";

    private static final NodeDefinition DEFINITION = NodeDefinition.builder(TYPE)
            .displayName("Data Transform")
            .category("Data")
            .description("Applies a chain of transformations to its input")
            .input(PortDefinition.required(PortNames.DATA))
            .output(PortNames.OUTPUT)
            .output(PortNames.ERROR)
            .defaultConfig("transformations", List.of())
            .build();

    private final ScriptletEvaluator evaluator;
    private final TimeoutGuard timeoutGuard;
    private final Duration defaultTimeout;

    public DataTransformNodeExecutor(ScriptletEvaluator evaluator, TimeoutGuard timeoutGuard, Duration defaultTimeout) {
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
        List<String> errors = new ArrayList<>();
        List<Map<String, Object>> all = NodeConfig.mapList(config, "transformations");
        for (int i = 0; i < all.size(); i++) {
            if (isEnabled(all.get(i)) && expression(all.get(i)) == null) {
                errors.add("transformation \"" + name(all.get(i), i) + "\" has no expression");
            }
        }
        return ValidationResult.of(errors);
    }

    @Override
    public CompletableFuture<DataEnvelope> execute(Map<String, Object> config,
                                                   Map<String, DataEnvelope> inputsByPort,
                                                   NodeExecutionContext context) {
        Instant start = Instant.now();
        DataEnvelope input = NodeInputs.primary(DEFINITION, inputsByPort);
        if (input == null || input.isEmpty()) {
            return CompletableFuture.completedFuture(
                    DataEnvelope.error(ErrorKind.EXECUTION, "No input data provided", start));
        }
        List<Step> steps = new ArrayList<>();
        List<Map<String, Object>> all = NodeConfig.mapList(config, "transformations");
        for (int i = 0; i < all.size(); i++) {
            if (isEnabled(all.get(i))) {
                steps.add(new Step(name(all.get(i), i), expression(all.get(i))));
            }
        }
        if (steps.isEmpty()) {
            return CompletableFuture.completedFuture(DataEnvelope.success(input.getItems(), start));
        }
        long timeoutMs = NodeConfig.longValue(config, "timeout", defaultTimeout.toMillis());
        return apply(steps, 0, input.firstJson(), timeoutMs, start, context);
    }

    private CompletableFuture<DataEnvelope> apply(List<Step> steps, int index, Object data, long timeoutMs,
                                                  Instant start, NodeExecutionContext context) {
        if (index >= steps.size()) {
            return CompletableFuture.completedFuture(new DataEnvelope(List.of(WorkflowItem.of(data)),
                    EnvelopeMeta.builder()
                            .startTime(start)
                            .endTime(Instant.now())
                            .attribute("appliedTransformations", steps.size())
                            .build()));
        }
        Step step = steps.get(index);
        CompiledScriptlet compiled;
        try {
            compiled = evaluator.compile(step.expression);
        } catch (ScriptletCompilationException e) {
            return CompletableFuture.completedFuture(failure(step, e, start, context));
        }
        return timeoutGuard.withTimeout(
                        () -> evaluator.evaluate(compiled, ScriptletBindings.ofData(data),
                                ScriptletOptions.sync(Duration.ofMillis(timeoutMs))),
                        timeoutMs, "Transformation " + step.name)
                .handle((result, error) -> error != null
                        ? CompletableFuture.completedFuture(failure(step, error, start, context))
                        : apply(steps, index + 1, result.value(), timeoutMs, start, context))
                .thenCompose(next -> next);
    }

    private DataEnvelope failure(Step step, Throwable error, Instant start, NodeExecutionContext context) {
        String message = "Error in transformation \"" + step.name + "\": " + ScriptletFailures.messageOf(error);
        log.warn("Transformation failed | nodeId={} | transformation={} | reason={}",
                context.nodeId(), step.name, ScriptletFailures.messageOf(error));
        return new DataEnvelope(List.of(), EnvelopeMeta.builder()
                .startTime(start)
                .endTime(Instant.now())
                .error(ScriptletFailures.kindOf(error), message)
                .attribute(FAILED_TRANSFORMATION_ATTRIBUTE, step.name)
                .build());
    }

    private static boolean isEnabled(Map<String, Object> transformation) {
        return NodeConfig.bool(transformation, "enabled", true);
    }

    private static String expression(Map<String, Object> transformation) {
        return NodeConfig.firstString(transformation, "expression", "expr", "code");
    }

    private static String name(Map<String, Object> transformation, int index) {
        String name = NodeConfig.string(transformation, "name");
        return name != null ? name : "Transformation " + (index + 1);
    }

    private static final class Step {
        final String name;
        final String expression;

        Step(String name, String expression) {
            this.name = name;
            this.expression = expression;
        }
    }
}
