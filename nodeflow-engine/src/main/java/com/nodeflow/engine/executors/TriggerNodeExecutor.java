package com.nodeflow.engine.executors;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.NodeExecutor;
import com.nodeflow.node.PortDefinition;
import com.nodeflow.node.PortNames;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Entry node: forwards the run's input items, or emits the configured {@code value} when it received none. */
public final class TriggerNodeExecutor implements NodeExecutor {

    public static final String TYPE = "trigger";

    private static final NodeDefinition DEFINITION = NodeDefinition.builder(TYPE)
            .displayName("Trigger")
            .category("Flow")
            .input(PortDefinition.optional(PortNames.DATA))
            .output(PortNames.OUTPUT)
            .build();

    @Override
    public NodeDefinition definition() {
        return DEFINITION;
    }

    @Override
    public CompletableFuture<DataEnvelope> execute(Map<String, Object> config,
                                                   Map<String, DataEnvelope> inputsByPort,
                                                   NodeExecutionContext context) {
        Instant start = Instant.now();
        DataEnvelope input = NodeInputs.primary(DEFINITION, inputsByPort);
        List<WorkflowItem> items = input != null && !input.isEmpty()
                ? input.getItems()
                : List.of(WorkflowItem.of(config.get("value")));
        return CompletableFuture.completedFuture(DataEnvelope.success(items, start));
    }
}
