package com.nodeflow.scriptlet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values bound to a scriptlet's parameters: {@code data} (primary input), {@code inputs} (value per input port)
 * and {@code value} (the single value a condition is evaluated against). Any of them may be null.
 */
public record ScriptletBindings(Object data, Map<String, Object> inputs, Object value) {

    public ScriptletBindings {
        inputs = inputs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(inputs)) : Map.of();
    }

    public static ScriptletBindings ofData(Object data) {
        return new ScriptletBindings(data, Map.of(), null);
    }

    public static ScriptletBindings ofData(Object data, Map<String, Object> inputs) {
        return new ScriptletBindings(data, inputs, null);
    }

    /** Condition bindings: the value is visible as both {@code value} and {@code data}. */
    public static ScriptletBindings ofValue(Object value) {
        return new ScriptletBindings(value, Map.of(), value);
    }
}
