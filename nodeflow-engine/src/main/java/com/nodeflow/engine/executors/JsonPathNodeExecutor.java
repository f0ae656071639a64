package com.nodeflow.engine.executors;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.node.NodeConfig;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.NodeExecutor;
import com.nodeflow.node.PortDefinition;
import com.nodeflow.node.PortNames;
import com.nodeflow.node.ValidationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** Extracts {@code path} from each input item and emits {@code {result}}; missing paths yield {@code defaultValue}. */
public final class JsonPathNodeExecutor implements NodeExecutor {

    public static final String TYPE = "json_path";

    private static final NodeDefinition DEFINITION = NodeDefinition.builder(TYPE)
            .displayName("JSON Path")
            .category("Data")
            .input(PortDefinition.required(PortNames.DATA))
            .output(PortNames.OUTPUT)
            .output(PortNames.ERROR)
            .build();

    @Override
    public NodeDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(Map<String, Object> config) {
        return NodeConfig.string(config, "path") != null
                ? ValidationResult.success() : ValidationResult.failure("path is required");
    }

    @Override
    public CompletableFuture<DataEnvelope> execute(Map<String, Object> config,
                                                   Map<String, DataEnvelope> inputsByPort,
                                                   NodeExecutionContext context) {
        Instant start = Instant.now();
        String path = NodeConfig.string(config, "path");
        Object defaultValue = config.get("defaultValue");
        DataEnvelope input = NodeInputs.primary(DEFINITION, inputsByPort);
        List<WorkflowItem> items = new ArrayList<>();
        for (WorkflowItem item : input != null ? input.getItems() : List.<WorkflowItem>of()) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("result", JsonPaths.read(item.getJson(), path).orElse(defaultValue));
            items.add(WorkflowItem.of(json));
        }
        return CompletableFuture.completedFuture(DataEnvelope.success(items, start));
    }
}
