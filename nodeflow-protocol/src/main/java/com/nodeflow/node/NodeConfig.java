package com.nodeflow.node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Single responsibility: read typed values from a node configuration map.
 */
public final class NodeConfig {

    private NodeConfig() {
    }

    /** Trimmed string value; null when absent or blank. */
    public static String string(Map<String, Object> config, String key) {
        if (config == null) return null;
        Object v = config.get(key);
        if (v == null) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    /** First non-blank string among {@code keys}. */
    public static String firstString(Map<String, Object> config, String... keys) {
        for (String key : keys) {
            String v = string(config, key);
            if (v != null) return v;
        }
        return null;
    }

    public static long longValue(Map<String, Object> config, String key, long defaultValue) {
        if (config == null) return defaultValue;
        Object v = config.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Number) return ((Number) v).longValue();
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean bool(Map<String, Object> config, String key, boolean defaultValue) {
        if (config == null) return defaultValue;
        Object v = config.get(key);
        if (v == null) return defaultValue;
        return isTruthy(v);
    }

    public static boolean isTruthy(Object val) {
        if (val == null) return false;
        if (val instanceof Boolean) return (Boolean) val;
        if (val instanceof Number) return ((Number) val).doubleValue() != 0;
        return !val.toString().trim().isEmpty() && !"false".equalsIgnoreCase(val.toString().trim());
    }

    /** List of maps under {@code key}; non-map entries are dropped. Empty when absent. */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> mapList(Map<String, Object> config, String key) {
        if (config == null) return List.of();
        Object v = config.get(key);
        if (!(v instanceof Collection)) return List.of();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object o : (Collection<?>) v) {
            if (o instanceof Map) out.add((Map<String, Object>) o);
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> config, String key) {
        if (config == null) return null;
        Object v = config.get(key);
        return v instanceof Map ? (Map<String, Object>) v : null;
    }
}
