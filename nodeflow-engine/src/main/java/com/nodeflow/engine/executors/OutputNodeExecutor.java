package com.nodeflow.engine.executors;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.NodeExecutor;
import com.nodeflow.node.PortDefinition;
import com.nodeflow.node.PortNames;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Terminal collector: emits the items of every input port, ports in arrival order. */
public final class OutputNodeExecutor implements NodeExecutor {

    public static final String TYPE = "output";

    private static final NodeDefinition DEFINITION = NodeDefinition.builder(TYPE)
            .displayName("Output")
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
        List<WorkflowItem> items = new ArrayList<>();
        for (DataEnvelope envelope : inputsByPort.values()) {
            items.addAll(envelope.getItems());
        }
        return CompletableFuture.completedFuture(DataEnvelope.success(items, start));
    }
}
