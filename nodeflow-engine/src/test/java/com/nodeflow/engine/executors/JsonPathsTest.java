package com.nodeflow.engine.executors;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonPathsTest {

    private static final Map<String, Object> ORDER = Map.of(
            "id", "o-1",
            "lines", List.of(Map.of("sku", "A", "qty", 2), Map.of("sku", "B", "qty", 1)),
            "notes", Arrays.asList("first", null));

    @Test
    void read_followsKeysAndIndexes() {
        assertEquals(Optional.of("B"), JsonPaths.read(ORDER, "$.lines[1].sku"));
        assertEquals(Optional.of(2), JsonPaths.read(ORDER, "lines[0].qty"));
        assertEquals(Optional.of("o-1"), JsonPaths.read(ORDER, "$.id"));
    }

    @Test
    void read_rootPaths_returnTheValue() {
        assertEquals(Optional.of(ORDER), JsonPaths.read(ORDER, "$"));
        assertEquals(Optional.of(7), JsonPaths.read(7, ""));
    }

    @Test
    void read_missingOrMistypedSegments_areEmpty() {
        assertEquals(Optional.empty(), JsonPaths.read(ORDER, "$.customer.name"));
        assertEquals(Optional.empty(), JsonPaths.read(ORDER, "$.lines[5]"));
        assertEquals(Optional.empty(), JsonPaths.read(ORDER, "$.id[0]"));
        assertEquals(Optional.empty(), JsonPaths.read(ORDER, "$.notes[1]"));
        assertEquals(Optional.empty(), JsonPaths.read(null, "$.a"));
    }
}
