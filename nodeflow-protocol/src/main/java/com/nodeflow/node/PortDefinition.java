package com.nodeflow.node;

import java.util.Objects;

/**
 * Named input or output port of a node type. Output ports are never required.
 */
public record PortDefinition(String name, boolean required, String description) {

    public PortDefinition {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("port name is blank");
        description = description != null ? description : "";
    }

    public static PortDefinition required(String name) {
        return new PortDefinition(name, true, null);
    }

    public static PortDefinition optional(String name) {
        return new PortDefinition(name, false, null);
    }
}
