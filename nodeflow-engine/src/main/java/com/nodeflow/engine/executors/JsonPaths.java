package com.nodeflow.engine.executors;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single responsibility: resolve dotted paths such as {@code $.order.lines[0].sku} against
 * Jackson-shaped values (maps, lists, scalars).
 */
public final class JsonPaths {

    private static final Pattern SEGMENT = Pattern.compile("([^.\\[\\]]+)|\\[(\\d+)]");

    private JsonPaths() {
    }

    /**
     * Value at {@code path}; empty when a segment is missing. A present JSON null is returned as
     * {@code Optional.empty()} as well. {@code $}, {@code $.} and an empty path address the root.
     */
    public static Optional<Object> read(Object root, String path) {
        String p = path == null ? "" : path.trim();
        if (p.startsWith("$")) p = p.substring(1);
        if (p.startsWith(".")) p = p.substring(1);
        Object current = root;
        Matcher m = SEGMENT.matcher(p);
        while (m.find()) {
            if (current == null) return Optional.empty();
            if (m.group(1) != null) {
                if (!(current instanceof Map)) return Optional.empty();
                Map<?, ?> map = (Map<?, ?>) current;
                if (!map.containsKey(m.group(1))) return Optional.empty();
                current = map.get(m.group(1));
            } else {
                if (!(current instanceof List)) return Optional.empty();
                List<?> list = (List<?>) current;
                int index = Integer.parseInt(m.group(2));
                if (index >= list.size()) return Optional.empty();
                current = list.get(index);
            }
        }
        return Optional.ofNullable(current);
    }
}
