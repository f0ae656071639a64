package com.nodeflow.scriptlet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.NativeJSON;
import org.mozilla.javascript.Scriptable;
import org.mozilla.javascript.Undefined;
import org.mozilla.javascript.json.JsonParser;

/**
 * Single responsibility: move values between Java and script scope as JSON text.
 * Java values are written with Jackson and parsed by the engine's JSON parser; script values are
 * stringified by the engine and read back with Jackson, so no Java object is ever exposed to a script.
 */
final class JsonBridge {

    private final ObjectMapper mapper;

    JsonBridge(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Serialized form used for cache fingerprints. */
    String serialize(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    Object toScript(Context cx, Scriptable scope, Object value) {
        if (value == null) return null;
        try {
            return new JsonParser(cx, scope).parseValue(mapper.writeValueAsString(value));
        } catch (JsonProcessingException | JsonParser.ParseException e) {
            throw new ScriptletExecutionException("Input is not representable as JSON: " + e.getMessage(), e);
        }
    }

    /** JSON text of a script value, or null for undefined/null/functions. */
    String fromScriptToJson(Context cx, Scriptable scope, Object value) {
        if (value == null || value instanceof Undefined) return null;
        Object json = NativeJSON.stringify(cx, scope, value, null, null);
        return json instanceof CharSequence ? json.toString() : null;
    }

    Object readJson(String json) {
        if (json == null) return null;
        try {
            return mapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new ScriptletExecutionException("Script result is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
