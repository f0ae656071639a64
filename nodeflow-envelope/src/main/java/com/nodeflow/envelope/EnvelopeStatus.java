package com.nodeflow.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of one node execution. Serialized lower-case ({@code "success"}, {@code "error"}).
 */
public enum EnvelopeStatus {
    SUCCESS,
    ERROR;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    /** Unknown or blank values read as {@link #ERROR} so a malformed envelope is never routed as success. */
    @JsonCreator
    public static EnvelopeStatus fromValue(String value) {
        if (value != null && "success".equalsIgnoreCase(value.trim())) return SUCCESS;
        return ERROR;
    }
}
