package com.nodeflow.trigger.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeflow.config.NodeflowConfig;
import com.nodeflow.engine.NodeTimeoutException;
import com.nodeflow.engine.subworkflow.SubworkflowRequest;
import com.nodeflow.engine.subworkflow.WorkflowLaunchException;
import com.nodeflow.engine.subworkflow.WorkflowLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Launches nested workflows through the trigger endpoint: {@code POST {baseUrl}/api/workflows/{id}/trigger} with body
 * {@code {prompt, _callStack, metadata}}.
 * <p>
 * A 2xx response yields its JSON object (other JSON values are wrapped as {@code {result: value}}). A 4xx/5xx
 * response fails the future with {@link WorkflowTriggerException}; transport errors fail it with
 * {@link WorkflowLaunchException}.
 */
public final class HttpWorkflowLauncher implements WorkflowLauncher {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkflowLauncher.class);

    static final String CALL_STACK_FIELD = "_callStack";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() { };

    private final String baseUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public HttpWorkflowLauncher(String baseUrl, Duration requestTimeout, HttpClient httpClient) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : "http://localhost:5000";
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.requestTimeout = requestTimeout;
        this.httpClient = httpClient;
    }

    public HttpWorkflowLauncher(NodeflowConfig config) {
        this(config.getTriggerBaseUrl(), config.getSubworkflowTimeout(), HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build());
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public CompletableFuture<Map<String, Object>> launch(SubworkflowRequest request) {
        String workflowId = request.workflowId();
        HttpRequest httpRequest;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(triggerUri(workflowId))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body(request)), StandardCharsets.UTF_8));
            if (requestTimeout != null && !requestTimeout.isZero()) {
                builder.timeout(requestTimeout);
            }
            httpRequest = builder.build();
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new WorkflowLaunchException(workflowId, "Cannot serialize trigger request: " + e.getOriginalMessage(), e));
        }
        if (log.isDebugEnabled()) {
            log.debug("Trigger request | workflowId={} | uri={} | callStack={}", workflowId, httpRequest.uri(),
                    request.callStack());
        }
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((response, error) -> {
                    if (error != null) {
                        throw new WorkflowLaunchException(workflowId,
                                "Workflow " + workflowId + " trigger request failed: " + describe(error), error);
                    }
                    return toResult(workflowId, response);
                });
    }

    URI triggerUri(String workflowId) {
        return URI.create(baseUrl + "/api/workflows/"
                + URLEncoder.encode(workflowId, StandardCharsets.UTF_8).replace("+", "%20") + "/trigger");
    }

    static Map<String, Object> body(SubworkflowRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", request.prompt());
        body.put(CALL_STACK_FIELD, request.callStack().asList());
        SubworkflowRequest.Metadata metadata = request.metadata();
        if (metadata != null) {
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("source", metadata.source());
            meta.put("sourceNodeId", metadata.sourceNodeId());
            meta.put("parentWorkflowId", metadata.parentWorkflowId());
            body.put("metadata", meta);
        }
        return body;
    }

    private static Map<String, Object> toResult(String workflowId, HttpResponse<String> response) {
        int status = response.statusCode();
        String text = response.body() != null ? response.body() : "";
        if (status >= 400) {
            String errorText = errorText(text);
            log.warn("Trigger rejected | workflowId={} | status={} | error={}", workflowId, status, errorText);
            throw new WorkflowTriggerException(workflowId, status, errorText);
        }
        if (text.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode root = MAPPER.readTree(text);
            if (root.isObject()) {
                return MAPPER.convertValue(root, OBJECT);
            }
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("result", MAPPER.convertValue(root, Object.class));
            return wrapped;
        } catch (JsonProcessingException e) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("result", text);
            return wrapped;
        }
    }

    private static String errorText(String body) {
        try {
            JsonNode root = MAPPER.readTree(body);
            if (root != null && root.hasNonNull("error")) {
                return root.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            // not JSON: fall through to the raw body
        }
        return body;
    }

    private static String describe(Throwable error) {
        Throwable cause = NodeTimeoutException.unwrap(error);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
