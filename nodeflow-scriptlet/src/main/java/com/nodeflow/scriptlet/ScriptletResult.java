package com.nodeflow.scriptlet;

/**
 * Outcome of a successful evaluation. {@code value} is plain Java (maps, lists, strings, numbers, booleans)
 * or null when the script returned nothing.
 */
public record ScriptletResult(Object value, boolean cached, long executionTimeMs) {
}
