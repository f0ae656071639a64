package com.nodeflow.node;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallStackTest {

    @Test
    void append_returnsCopyAndLeavesOriginalUntouched() {
        CallStack root = CallStack.of("W1");
        CallStack left = root.append("W2");
        CallStack right = root.append("W3");

        assertEquals(List.of("W1"), root.asList());
        assertEquals(List.of("W1", "W2"), left.asList());
        assertEquals(List.of("W1", "W3"), right.asList());
        assertFalse(left.contains("W3"));
    }

    @Test
    void describeCycle_joinsStackAndTarget() {
        CallStack stack = CallStack.of("W1", "W2");

        assertTrue(stack.contains("W1"));
        assertEquals("W1 -> W2 -> W1", stack.describeCycle("W1"));
        assertEquals("W9", CallStack.empty().describeCycle("W9"));
    }

    @Test
    void of_dropsBlankIds() {
        assertSame(CallStack.empty(), CallStack.of(List.of(" ", "")));
        assertEquals(2, CallStack.of(java.util.Arrays.asList("A", null, " B ")).depth());
    }

    @Test
    void json_isPlainArray() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("[\"W1\",\"W2\"]", mapper.writeValueAsString(CallStack.of("W1", "W2")));
        assertEquals(CallStack.of("A", "B"), mapper.readValue("[\"A\",\"B\"]", CallStack.class));
    }
}
