package com.nodeflow.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Final status of a run. */
public enum RunStatus {
    COMPLETED,
    ERROR,
    TIMEOUT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus fromValue(String value) {
        if (value == null) return ERROR;
        for (RunStatus s : values()) {
            if (s.name().equalsIgnoreCase(value.trim())) return s;
        }
        return ERROR;
    }
}
