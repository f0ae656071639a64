package com.nodeflow.node;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeDefinitionTest {

    @Test
    void defaultPorts_skipErrorAndFallBackToStandardNames() {
        NodeDefinition decision = NodeDefinition.builder("decision")
                .input(PortDefinition.required("data"))
                .output("error")
                .output("true")
                .output("false")
                .build();
        NodeDefinition bare = NodeDefinition.builder("bare").build();

        assertEquals("true", decision.defaultOutputPort());
        assertEquals("data", decision.primaryInputPort());
        assertEquals(List.of("data"), decision.requiredInputPorts());
        assertEquals("output", bare.defaultOutputPort());
        assertEquals("data", bare.primaryInputPort());
        assertTrue(decision.hasOutput("error"));
    }

    @Test
    void effectiveConfig_overlaysNodeConfigOnDefaults() {
        NodeDefinition def = NodeDefinition.builder("function")
                .defaultConfig("timeout", 5000)
                .defaultConfig("errorHandling", "throw")
                .build();

        Map<String, Object> merged = def.effectiveConfig(Map.of("timeout", 50, "code", "return 1;"));

        assertEquals(50, merged.get("timeout"));
        assertEquals("throw", merged.get("errorHandling"));
        assertEquals("return 1;", merged.get("code"));
    }
}
