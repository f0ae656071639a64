package com.nodeflow.trigger.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeflow.engine.NodeTimeoutException;
import com.nodeflow.engine.subworkflow.SubworkflowRequest;
import com.nodeflow.engine.subworkflow.WorkflowLaunchException;
import com.nodeflow.engine.subworkflow.WorkflowLauncher;
import com.nodeflow.node.CallStack;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves {@code POST /api/workflows/{id}/trigger} on top of a {@link WorkflowLauncher}.
 * <p>
 * The body is {@code {prompt, _callStack, metadata}}. The target id is pushed onto {@code _callStack} unless it is
 * already the last entry; the launcher decides the rest (409 for a target already above, 404 for an unknown id).
 * Responses are JSON: the launcher result on 200, {@code {error}} otherwise.
 */
public final class WorkflowTriggerServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTriggerServer.class);

    static final String CONTEXT = "/api/workflows/";
    private static final String TRIGGER_SUFFIX = "/trigger";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AtomicInteger THREADS = new AtomicInteger();

    private final WorkflowLauncher launcher;
    private final HttpServer server;
    private final ExecutorService handlers;

    private WorkflowTriggerServer(WorkflowLauncher launcher, HttpServer server) {
        this.launcher = launcher;
        this.server = server;
        this.handlers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "nodeflow-trigger-" + THREADS.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.createContext(CONTEXT, this::handle);
        server.setExecutor(handlers);
    }

    /** Binds {@code port} (0 picks a free one) on all interfaces and starts serving. */
    public static WorkflowTriggerServer start(WorkflowLauncher launcher, int port) throws IOException {
        Objects.requireNonNull(launcher, "launcher");
        WorkflowTriggerServer trigger = new WorkflowTriggerServer(launcher,
                HttpServer.create(new InetSocketAddress(port), 0));
        trigger.server.start();
        log.info("Trigger endpoint started | port={}", trigger.getPort());
        return trigger;
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    public String getBaseUrl() {
        return "http://localhost:" + getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        handlers.shutdownNow();
        log.info("Trigger endpoint stopped");
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String workflowId = workflowId(exchange.getRequestURI().getRawPath());
            if (workflowId == null) {
                respond(exchange, 404, error("Unknown path: " + exchange.getRequestURI().getPath()));
                return;
            }
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().add("Allow", "POST");
                respond(exchange, 405, error("Method not allowed: " + exchange.getRequestMethod()));
                return;
            }
            SubworkflowRequest request;
            try {
                request = parse(workflowId, exchange.getRequestBody());
            } catch (IllegalArgumentException e) {
                respond(exchange, 400, error(e.getMessage()));
                return;
            }
            if (log.isDebugEnabled()) {
                log.debug("Trigger received | workflowId={} | callStack={}", workflowId, request.callStack());
            }
            trigger(exchange, request);
        } finally {
            exchange.close();
        }
    }

    private void trigger(HttpExchange exchange, SubworkflowRequest request) throws IOException {
        Map<String, Object> result;
        try {
            result = launcher.launch(request).join();
        } catch (RuntimeException e) {
            Throwable cause = NodeTimeoutException.unwrap(e);
            int status = cause instanceof WorkflowLaunchException && ((WorkflowLaunchException) cause).getStatus() > 0
                    ? ((WorkflowLaunchException) cause).getStatus() : 500;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.warn("Trigger failed | workflowId={} | status={} | error={}", request.workflowId(), status, message);
            respond(exchange, status, error(message));
            return;
        }
        respond(exchange, 200, result != null ? result : Map.of());
    }

    /** Extracts {@code id} from {@code /api/workflows/{id}/trigger}; null for any other path. */
    static String workflowId(String rawPath) {
        if (rawPath == null || !rawPath.startsWith(CONTEXT) || !rawPath.endsWith(TRIGGER_SUFFIX)) {
            return null;
        }
        String id = rawPath.substring(CONTEXT.length(), rawPath.length() - TRIGGER_SUFFIX.length());
        if (id.isEmpty() || id.contains("/")) {
            return null;
        }
        return URLDecoder.decode(id, StandardCharsets.UTF_8);
    }

    static SubworkflowRequest parse(String workflowId, InputStream body) throws IOException {
        byte[] bytes = body.readAllBytes();
        JsonNode root;
        try {
            root = bytes.length == 0 ? MAPPER.createObjectNode() : MAPPER.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON body: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        Object prompt = root.has("prompt") ? MAPPER.convertValue(root.get("prompt"), Object.class) : null;

        List<String> callers = new ArrayList<>();
        JsonNode stack = root.get(HttpWorkflowLauncher.CALL_STACK_FIELD);
        if (stack != null && !stack.isNull()) {
            if (!stack.isArray()) {
                throw new IllegalArgumentException(HttpWorkflowLauncher.CALL_STACK_FIELD + " must be an array");
            }
            stack.forEach(id -> callers.add(id.asText()));
        }
        CallStack callStack = CallStack.of(callers);
        if (callers.isEmpty() || !workflowId.equals(callers.get(callers.size() - 1))) {
            callStack = callStack.append(workflowId);
        }

        SubworkflowRequest.Metadata metadata = null;
        JsonNode meta = root.get("metadata");
        if (meta != null && meta.isObject()) {
            metadata = new SubworkflowRequest.Metadata(text(meta, "source"), text(meta, "sourceNodeId"),
                    text(meta, "parentWorkflowId"));
        }
        return new SubworkflowRequest(workflowId, prompt, callStack, metadata);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }

    private static void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
