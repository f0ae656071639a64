package com.nodeflow.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Node-local error kinds carried in {@link EnvelopeMeta#getErrorKind()}.
 * Graph-level failures (cycles, malformed graphs) never reach an envelope; they abort the run.
 */
public enum ErrorKind {
    /** Missing or invalid node configuration. */
    CONFIGURATION("ConfigurationError"),
    /** Scriptlet failed to parse. */
    COMPILATION("CompilationError"),
    /** Scriptlet or executor failed at runtime. */
    EXECUTION("ExecutionError"),
    /** Deadline exceeded. */
    TIMEOUT("TimeoutError"),
    /** Sub-workflow call stack already contains the target workflow. */
    CIRCULAR_DEPENDENCY("CircularDependencyError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String toValue() {
        return wireName;
    }

    /** Unknown values read as {@link #EXECUTION}. */
    @JsonCreator
    public static ErrorKind fromValue(String value) {
        if (value == null || value.isBlank()) return EXECUTION;
        String v = value.trim();
        for (ErrorKind k : values()) {
            if (k.wireName.equalsIgnoreCase(v) || k.name().equalsIgnoreCase(v)) return k;
        }
        return EXECUTION;
    }
}
