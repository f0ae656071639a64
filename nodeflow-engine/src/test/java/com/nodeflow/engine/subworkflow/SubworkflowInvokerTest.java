package com.nodeflow.engine.subworkflow;

import com.nodeflow.engine.TimeoutGuard;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.node.CallStack;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.PortNames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubworkflowInvokerTest {

    private final TimeoutGuard guard = new TimeoutGuard();
    private final RecordingLauncher launcher = new RecordingLauncher();
    private final SubworkflowInvoker invoker = new SubworkflowInvoker(launcher, guard, Duration.ofSeconds(30), 4);

    @AfterEach
    void close() {
        guard.close();
    }

    private static NodeExecutionContext context(String... callStack) {
        return new NodeExecutionContext("run-1", callStack.length > 0 ? callStack[callStack.length - 1] : null,
                "trigger-node", CallStack.of(callStack));
    }

    private DataEnvelope invoke(Map<String, Object> config, Object payload, NodeExecutionContext context) {
        Map<String, DataEnvelope> inputs = payload == null ? Map.of() : Map.of(PortNames.INPUT, DataEnvelope.input(payload));
        return invoker.execute(invoker.definition().effectiveConfig(config), inputs, context).join();
    }

    @Test
    void execute_targetAlreadyOnCallStack_isCircularAndNeverDelegates() {
        DataEnvelope out = invoke(Map.of("workflowId", "W1"), "hi", context("W1", "W2"));

        assertTrue(out.isError());
        assertEquals(ErrorKind.CIRCULAR_DEPENDENCY, out.getMeta().getErrorKind());
        assertTrue(out.getMeta().getErrorMessage().contains("W1 -> W2 -> W1"), out.getMeta().getErrorMessage());
        assertEquals(0, launcher.requests.size());
    }

    @Test
    void execute_delegatesWithExtendedCallStackAndMetadata() {
        launcher.respond = request -> CompletableFuture.completedFuture(Map.of("output", "done", "status", "completed"));

        DataEnvelope out = invoke(Map.of("workflowId", "W2"), Map.of("prompt", "p"), context("W1"));

        assertFalse(out.isError());
        SubworkflowRequest request = launcher.requests.get(0);
        assertEquals("W2", request.workflowId());
        assertEquals(CallStack.of("W1", "W2"), request.callStack());
        assertEquals(Map.of("prompt", "p"), request.prompt());
        assertEquals(new SubworkflowRequest.Metadata("workflowTriggerNode", "trigger-node", "W1"), request.metadata());

        @SuppressWarnings("unchecked")
        Map<String, Object> json = (Map<String, Object>) out.firstJson();
        assertEquals("done", json.get("output"));
        assertEquals("completed", json.get("status"));
        assertEquals("W2", json.get("workflowId"));
        assertEquals(List.of("W1", "W2"), json.get("callStack"));
        assertEquals(Map.of("output", "done", "status", "completed"), json.get("result"));
        assertEquals("done", out.getItems().get(0).getText());
        assertTrue(out.getMeta().getExecutionTimeMs() >= 0);
    }

    @Test
    void execute_outputFallsBackToResultThenWholeResponse() {
        launcher.respond = request -> CompletableFuture.completedFuture(Map.of("result", 42));
        @SuppressWarnings("unchecked")
        Map<String, Object> json = (Map<String, Object>) invoke(Map.of("workflowId", "W2"), "x", context("W1")).firstJson();
        assertEquals(42, json.get("output"));
        assertEquals("completed", json.get("status"));

        launcher.respond = request -> CompletableFuture.completedFuture(Map.of("answer", "y"));
        @SuppressWarnings("unchecked")
        Map<String, Object> whole = (Map<String, Object>) invoke(Map.of("workflowId", "W2"), "x", context("W1")).firstJson();
        assertEquals(Map.of("answer", "y"), whole.get("output"));
    }

    @Test
    void execute_inputField_selectsFieldWithFallbacks() {
        invoke(Map.of("workflowId", "W2", "inputField", "question"), Map.of("question", "q?", "text", "t"), context("W1"));
        invoke(Map.of("workflowId", "W2", "inputField", "question"), Map.of("content", "c"), context("W1"));
        invoke(Map.of("workflowId", "W2", "inputField", "question"), Map.of("other", 1), context("W1"));
        invoke(Map.of("workflowId", "W2"), Map.of("text", "t"), context("W1"));

        assertEquals("q?", launcher.requests.get(0).prompt());
        assertEquals("c", launcher.requests.get(1).prompt());
        assertEquals(Map.of("other", 1), launcher.requests.get(2).prompt());
        assertEquals(Map.of("text", "t"), launcher.requests.get(3).prompt());
    }

    @Test
    void execute_missingWorkflowId_isConfigurationError() {
        DataEnvelope out = invoke(Map.of(), "x", context("W1"));

        assertEquals(ErrorKind.CONFIGURATION, out.getMeta().getErrorKind());
        assertEquals("Missing workflow ID in settings", out.getMeta().getErrorMessage());
        assertFalse(invoker.validate(Map.of()).isValid());
    }

    @Test
    void execute_slowLauncher_timesOut() {
        launcher.respond = request -> new CompletableFuture<>();

        DataEnvelope out = invoke(Map.of("workflowId", "W2", "timeout", 50), "x", context("W1"));

        assertEquals(ErrorKind.TIMEOUT, out.getMeta().getErrorKind());
        assertEquals("Workflow W2 timed out after 50ms", out.getMeta().getErrorMessage());
    }

    @Test
    void execute_launcherFailure_keepsCircularFlag() {
        launcher.respond = request -> CompletableFuture.failedFuture(
                new WorkflowLaunchException("W2", "Circular workflow dependency detected: W1 -> W2 -> W1", 409, true));
        DataEnvelope circular = invoke(Map.of("workflowId", "W2"), "x", context("W1"));

        launcher.respond = request -> {
            throw new IllegalStateException("connection refused");
        };
        DataEnvelope broken = invoke(Map.of("workflowId", "W2"), "x", context("W1"));

        assertEquals(ErrorKind.CIRCULAR_DEPENDENCY, circular.getMeta().getErrorKind());
        assertEquals(ErrorKind.EXECUTION, broken.getMeta().getErrorKind());
        assertEquals("connection refused", broken.getMeta().getErrorMessage());
    }

    @Test
    void execute_nestingDepthLimit_isConfigurationError() {
        DataEnvelope out = invoke(Map.of("workflowId", "W5"), "x", context("W1", "W2", "W3", "W4"));

        assertEquals(ErrorKind.CONFIGURATION, out.getMeta().getErrorKind());
        assertEquals(0, launcher.requests.size());
    }

    /** Launcher that records requests and answers with {@link #respond}. */
    private static final class RecordingLauncher implements WorkflowLauncher {
        final List<SubworkflowRequest> requests = new ArrayList<>();
        Function<SubworkflowRequest, CompletableFuture<Map<String, Object>>> respond =
                request -> CompletableFuture.completedFuture(new HashMap<>());

        @Override
        public CompletableFuture<Map<String, Object>> launch(SubworkflowRequest request) {
            requests.add(request);
            return respond.apply(request);
        }
    }
}
