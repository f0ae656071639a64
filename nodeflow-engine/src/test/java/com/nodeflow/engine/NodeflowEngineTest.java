package com.nodeflow.engine;

import com.nodeflow.config.NodeflowConfig;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.graph.WorkflowGraph;
import com.nodeflow.graph.WorkflowGraphConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeflowEngineTest {

    private final NodeflowEngine engine = NodeflowEngine.builder().config(NodeflowConfig.defaults()).build();

    @AfterEach
    void close() {
        engine.close();
    }

    private static WorkflowGraph load(String name) throws IOException {
        try (InputStream in = NodeflowEngineTest.class.getResourceAsStream("/graphs/" + name)) {
            return WorkflowGraphConfig.fromJson(in);
        }
    }

    @Test
    void run_decisionGraph_takesOneBranchAndRecordsThreeEnvelopes() throws IOException {
        RunTrace trace = engine.run(load("approval.json"), 5);

        assertEquals(RunStatus.COMPLETED, trace.getStatus());
        assertEquals(List.of("entry", "decide", "A"), trace.getExecutionOrder());
        assertEquals(3, trace.getEnvelopes().size());
        assertEquals(List.of("B"), trace.getSkippedNodeIds());
        assertEquals(List.of(5), trace.getEnvelope("A").jsonValues());
    }

    @Test
    void run_decisionGraph_otherBranch() throws IOException {
        RunTrace trace = engine.run(load("approval.json"), 2);

        assertEquals(List.of("entry", "decide", "B"), trace.getExecutionOrder());
    }

    @Test
    void run_functionTransformTemplatePipeline() {
        WorkflowGraph graph = WorkflowGraphConfig.fromJson("""
                {
                  "id": "pipeline",
                  "nodes": [
                    { "id": "in", "type": "trigger" },
                    { "id": "fn", "type": "function", "config": { "code": "return { name: data.name.toUpperCase(), n: data.n };" } },
                    { "id": "tx", "type": "data_transform", "config": { "transformations": [
                        { "name": "double", "expression": "data.n = data.n * 2; return data;" }
                    ] } },
                    { "id": "tpl", "type": "text_template", "config": { "template": "{{name}} x{{n}}" } }
                  ],
                  "edges": [
                    { "source": "in", "target": "fn" },
                    { "source": "fn", "target": "tx" },
                    { "source": "tx", "target": "tpl" }
                  ]
                }
                """);

        RunTrace trace = engine.run(graph, Map.of("name", "ada", "n", 21));

        assertEquals(RunStatus.COMPLETED, trace.getStatus());
        assertEquals("ADA x42", trace.getFinalOutput().getItems().get(0).getText());
    }

    @Test
    void run_unhandledFunctionError_failsRunWithItsMessage() {
        WorkflowGraph graph = WorkflowGraphConfig.fromJson("""
                {
                  "nodes": [
                    { "id": "fn", "type": "function", "config": { "code": "throw new Error('no way');" } },
                    { "id": "out", "type": "output" }
                  ],
                  "edges": [ { "source": "fn", "target": "out" } ]
                }
                """);

        RunTrace trace = engine.run(graph, DataEnvelope.input(1), RunOptions.defaults());

        assertEquals(RunStatus.ERROR, trace.getStatus());
        assertEquals("Error: no way", trace.getErrorMessage());
        assertTrue(trace.getSkippedNodeIds().contains("out"));
    }

    @Test
    void registry_containsEveryBuiltinType() {
        assertTrue(engine.registry().types().containsAll(List.of("decision", "function", "data_transform",
                "workflow_trigger", "workflowTrigger", "trigger", "output", "text_template", "json_path")));
    }
}
