package com.nodeflow.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static, type-level description of a node: its ports and default configuration. Immutable.
 */
public record NodeDefinition(
        String type,
        String displayName,
        String category,
        String description,
        String version,
        List<PortDefinition> inputs,
        List<PortDefinition> outputs,
        Map<String, Object> defaultConfig
) {
    public NodeDefinition {
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) throw new IllegalArgumentException("node type is blank");
        displayName = displayName != null ? displayName : type;
        category = category != null ? category : "General";
        description = description != null ? description : "";
        version = version != null ? version : "1.0";
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
        defaultConfig = defaultConfig != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(defaultConfig)) : Map.of();
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    /** First declared input port, or {@value PortNames#DATA}. Receives the initial input and unlabeled edges. */
    public String primaryInputPort() {
        return inputs.isEmpty() ? PortNames.DATA : inputs.get(0).name();
    }

    /** First declared output port other than {@value PortNames#ERROR}, or {@value PortNames#OUTPUT}. */
    public String defaultOutputPort() {
        for (PortDefinition port : outputs) {
            if (!PortNames.ERROR.equals(port.name())) return port.name();
        }
        return PortNames.OUTPUT;
    }

    public boolean hasOutput(String portName) {
        return outputs.stream().anyMatch(p -> p.name().equals(portName));
    }

    public List<String> requiredInputPorts() {
        List<String> names = new ArrayList<>();
        for (PortDefinition port : inputs) {
            if (port.required()) names.add(port.name());
        }
        return names;
    }

    /** Default configuration overlaid by the node's own configuration. */
    public Map<String, Object> effectiveConfig(Map<String, Object> nodeConfig) {
        Map<String, Object> merged = new LinkedHashMap<>(defaultConfig);
        if (nodeConfig != null) merged.putAll(nodeConfig);
        return Collections.unmodifiableMap(merged);
    }

    public static final class Builder {
        private final String type;
        private String displayName;
        private String category;
        private String description;
        private String version;
        private final List<PortDefinition> inputs = new ArrayList<>();
        private final List<PortDefinition> outputs = new ArrayList<>();
        private final Map<String, Object> defaultConfig = new LinkedHashMap<>();

        private Builder(String type) {
            this.type = type;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder input(PortDefinition port) {
            this.inputs.add(port);
            return this;
        }

        public Builder output(String name) {
            this.outputs.add(new PortDefinition(name, false, null));
            return this;
        }

        public Builder defaultConfig(String key, Object value) {
            this.defaultConfig.put(key, value);
            return this;
        }

        public NodeDefinition build() {
            return new NodeDefinition(type, displayName, category, description, version, inputs, outputs, defaultConfig);
        }
    }
}
