package com.nodeflow.engine.executors;

import com.nodeflow.config.NodeflowConfig;
import com.nodeflow.engine.TimeoutGuard;
import com.nodeflow.engine.subworkflow.SubworkflowInvoker;
import com.nodeflow.engine.subworkflow.WorkflowLauncher;
import com.nodeflow.node.NodeExecutorRegistry;
import com.nodeflow.scriptlet.ScriptletEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the built-in node types.
 */
public final class BuiltinNodeExecutors {

    private static final Logger log = LoggerFactory.getLogger(BuiltinNodeExecutors.class);

    /** Camel-case type name used by older graphs for {@code workflow_trigger}. */
    public static final String WORKFLOW_TRIGGER_ALIAS = "workflowTrigger";

    private BuiltinNodeExecutors() {
    }

    /**
     * Registers {@code decision}, {@code function}, {@code data_transform}, {@code workflow_trigger}
     * (also as {@value #WORKFLOW_TRIGGER_ALIAS}), {@code trigger}, {@code output}, {@code text_template} and {@code json_path}.
     *
     * @throws IllegalArgumentException if one of these types is already registered
     */
    public static NodeExecutorRegistry registerAll(NodeExecutorRegistry registry,
                                                   ScriptletEvaluator evaluator,
                                                   TimeoutGuard timeoutGuard,
                                                   WorkflowLauncher launcher,
                                                   NodeflowConfig config) {
        SubworkflowInvoker invoker = new SubworkflowInvoker(launcher, timeoutGuard, config.getSubworkflowTimeout(),
                config.getMaxNestingDepth());
        registry.register(new DecisionNodeExecutor(evaluator, timeoutGuard, config.getScriptletTimeout()))
                .register(new FunctionNodeExecutor(evaluator, timeoutGuard))
                .register(new DataTransformNodeExecutor(evaluator, timeoutGuard, config.getScriptletTimeout()))
                .register(invoker)
                .register(WORKFLOW_TRIGGER_ALIAS, invoker)
                .register(new TriggerNodeExecutor())
                .register(new OutputNodeExecutor())
                .register(new TextTemplateNodeExecutor())
                .register(new JsonPathNodeExecutor());
        log.info("Built-in node executors registered | types={}", registry.types());
        return registry;
    }
}
