package com.nodeflow.graph;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Node in a workflow graph: unique id, a type string referencing a registered node definition,
 * and type-specific configuration. {@code data} is accepted as an alias of {@code config}
 * for graphs exported from the canvas.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphNode {

    private final String id;
    private final String type;
    private final String label;
    private final Map<String, Object> config;

    @JsonCreator
    public GraphNode(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("label") String label,
            @JsonProperty("config") @JsonAlias("data") Map<String, Object> config) {
        this.id = id;
        this.type = type;
        this.label = label;
        // LinkedHashMap keeps null values, which Map.copyOf rejects
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static GraphNode of(String id, String type, Map<String, Object> config) {
        return new GraphNode(id, type, null, config);
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    /** Human-readable name for the canvas (optional). */
    public String getLabel() {
        return label;
    }

    /** Type-specific configuration. Never null. */
    public Map<String, Object> getConfig() {
        return config;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return Objects.equals(id, that.id)
                && Objects.equals(type, that.type)
                && Objects.equals(label, that.label)
                && config.equals(that.config);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, label, config);
    }

    @Override
    public String toString() {
        return "GraphNode{id=" + id + ", type=" + type + "}";
    }
}
