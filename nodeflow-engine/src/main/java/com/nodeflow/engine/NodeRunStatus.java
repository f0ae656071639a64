package com.nodeflow.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Per-node lifecycle reported to {@link RunListener#onNodeStateChange}. */
public enum NodeRunStatus {
    RUNNING,
    COMPLETED,
    ERROR,
    SKIPPED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
