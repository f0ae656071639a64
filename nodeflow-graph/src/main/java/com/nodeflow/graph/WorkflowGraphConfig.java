package com.nodeflow.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serialization and deserialization of workflow graphs. JSON excludes null values when serializing;
 * unknown properties (canvas positions, styling) are ignored when reading.
 */
public final class WorkflowGraphConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private WorkflowGraphConfig() {
    }

    /**
     * Deserializes a workflow graph from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static WorkflowGraph fromJson(String json) {
        try {
            return MAPPER.readValue(json, WorkflowGraph.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Deserializes a workflow graph from a stream (e.g. a classpath resource). The stream is not closed. */
    public static WorkflowGraph fromJson(InputStream in) {
        try {
            return MAPPER.readValue(in, WorkflowGraph.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static WorkflowGraph fromFile(Path path) {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read workflow graph: " + path, e);
        }
    }

    /**
     * Serializes a workflow graph to a JSON string (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(WorkflowGraph graph) {
        try {
            return MAPPER.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(WorkflowGraph graph) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
