package com.nodeflow.trigger.http;

import com.nodeflow.config.NodeflowConfig;
import com.nodeflow.engine.NodeflowEngine;
import com.nodeflow.engine.RunStatus;
import com.nodeflow.engine.RunTrace;
import com.nodeflow.engine.subworkflow.InMemoryWorkflowCatalog;
import com.nodeflow.engine.subworkflow.InProcessWorkflowLauncher;
import com.nodeflow.engine.subworkflow.SubworkflowRequest;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.graph.WorkflowGraph;
import com.nodeflow.graph.WorkflowGraphConfig;
import com.nodeflow.node.CallStack;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowTriggerServerTest {

    private final InMemoryWorkflowCatalog serverCatalog = new InMemoryWorkflowCatalog();
    private NodeflowEngine serverEngine;
    private WorkflowTriggerServer server;
    private NodeflowEngine clientEngine;

    @BeforeEach
    void start() throws IOException {
        serverEngine = NodeflowEngine.builder()
                .config(NodeflowConfig.defaults())
                .catalog(serverCatalog)
                .build();
        server = WorkflowTriggerServer.start(
                new InProcessWorkflowLauncher(serverCatalog, serverEngine::scheduler, Runnable::run), 0);
        NodeflowConfig clientConfig = NodeflowConfig.builder().triggerBaseUrl(server.getBaseUrl()).build();
        clientEngine = NodeflowEngine.builder()
                .config(clientConfig)
                .launcher(new HttpWorkflowLauncher(clientConfig))
                .build();
    }

    @AfterEach
    void stop() {
        server.close();
        clientEngine.close();
        serverEngine.close();
    }

    private static WorkflowGraph caller(String id, String target) {
        return WorkflowGraphConfig.fromJson("""
                {
                  "id": "%s",
                  "nodes": [
                    { "id": "start", "type": "trigger" },
                    { "id": "call", "type": "workflow_trigger", "config": { "workflowId": "%s", "inputField": "text" } }
                  ],
                  "edges": [ { "source": "start", "target": "call" } ]
                }
                """.formatted(id, target));
    }

    private static WorkflowGraph shout(String id) {
        return WorkflowGraphConfig.fromJson("""
                {
                  "id": "%s",
                  "nodes": [
                    { "id": "start", "type": "trigger" },
                    { "id": "fn", "type": "function", "config": { "code": "return data + '!';" } }
                  ],
                  "edges": [ { "source": "start", "target": "fn" } ]
                }
                """.formatted(id));
    }

    @Test
    void nestedRunOverHttp_returnsChildOutput() {
        serverCatalog.register(shout("child"));

        RunTrace trace = clientEngine.run(caller("parent", "child"), Map.of("text", "hey"));

        assertEquals(RunStatus.COMPLETED, trace.getStatus());
        @SuppressWarnings("unchecked")
        Map<String, Object> json = (Map<String, Object>) trace.getEnvelope("call").firstJson();
        assertEquals("hey!", json.get("output"));
        assertEquals("completed", json.get("status"));
        assertEquals(List.of("parent", "child"), json.get("callStack"));
    }

    @Test
    void cycleAcrossTheBoundary_failsAsCircular() {
        serverCatalog.register(caller("W2", "W1"));

        RunTrace trace = clientEngine.run(caller("W1", "W2"), Map.of("text", "go"));

        assertEquals(RunStatus.ERROR, trace.getStatus());
        DataEnvelope failure = trace.getEnvelope("call");
        assertEquals(ErrorKind.CIRCULAR_DEPENDENCY, failure.getMeta().getErrorKind());
        assertTrue(failure.getMeta().getErrorMessage().contains("W1 -> W2 -> W1"), failure.getMeta().getErrorMessage());
    }

    @Test
    void targetAlreadyOnStack_isRefusedWith409() {
        serverCatalog.register(shout("W1"));
        HttpWorkflowLauncher launcher = new HttpWorkflowLauncher(
                NodeflowConfig.builder().triggerBaseUrl(server.getBaseUrl()).build());

        CompletionException e = assertThrows(CompletionException.class, () -> launcher.launch(
                new SubworkflowRequest("W1", "x", CallStack.of("W1", "W2", "W1"), null)).join());

        WorkflowTriggerException refused = assertInstanceOf(WorkflowTriggerException.class, e.getCause());
        assertEquals(409, refused.getStatus());
        assertTrue(refused.isCircular());
        assertEquals("Circular workflow dependency detected: W1 -> W2 -> W1", refused.getErrorText());
    }

    @Test
    void unknownWorkflow_is404() {
        HttpWorkflowLauncher launcher = new HttpWorkflowLauncher(
                NodeflowConfig.builder().triggerBaseUrl(server.getBaseUrl()).build());

        CompletionException e = assertThrows(CompletionException.class,
                () -> launcher.launch(new SubworkflowRequest("ghost", null, null, null)).join());

        assertEquals(404, assertInstanceOf(WorkflowTriggerException.class, e.getCause()).getStatus());
    }

    @Test
    void malformedBody_is400_andGetIs405() throws Exception {
        HttpClient client = HttpClient.newHttpClient();
        URI uri = URI.create(server.getBaseUrl() + "/api/workflows/W1/trigger");

        HttpResponse<String> bad = client.send(HttpRequest.newBuilder(uri)
                        .POST(HttpRequest.BodyPublishers.ofString("{not json"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> get = client.send(HttpRequest.newBuilder(uri).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(400, bad.statusCode());
        assertTrue(bad.body().contains("Invalid JSON body"), bad.body());
        assertEquals(405, get.statusCode());
    }

    @Test
    void parse_pushesTargetUnlessAlreadyOnTop() throws IOException {
        SubworkflowRequest fresh = WorkflowTriggerServer.parse("W2", body("{\"prompt\":\"p\",\"_callStack\":[\"W1\"]}"));
        SubworkflowRequest forwarded = WorkflowTriggerServer.parse("W2",
                body("{\"_callStack\":[\"W1\",\"W2\"],\"metadata\":{\"source\":\"workflowTriggerNode\",\"sourceNodeId\":\"call\"}}"));

        assertEquals(List.of("W1", "W2"), fresh.callStack().asList());
        assertEquals("p", fresh.prompt());
        assertNull(fresh.metadata());
        assertEquals(List.of("W1", "W2"), forwarded.callStack().asList());
        assertEquals("call", forwarded.metadata().sourceNodeId());
        assertNull(forwarded.metadata().parentWorkflowId());
    }

    @Test
    void workflowId_readsOnlyTriggerPaths() {
        assertEquals("my flow", WorkflowTriggerServer.workflowId("/api/workflows/my%20flow/trigger"));
        assertNull(WorkflowTriggerServer.workflowId("/api/workflows/a/b/trigger"));
        assertNull(WorkflowTriggerServer.workflowId("/api/workflows/W1"));
    }

    private static ByteArrayInputStream body(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
