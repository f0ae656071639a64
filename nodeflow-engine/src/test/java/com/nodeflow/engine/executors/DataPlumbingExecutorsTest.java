package com.nodeflow.engine.executors;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.node.CallStack;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.PortNames;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataPlumbingExecutorsTest {

    private static final NodeExecutionContext CONTEXT = NodeExecutionContext.standalone("n", CallStack.empty());

    @Test
    void textTemplate_rendersNestedPathsAndBlanksMissingOnes() {
        TextTemplateNodeExecutor executor = new TextTemplateNodeExecutor();
        DataEnvelope input = DataEnvelope.input(Map.of("user", Map.of("name", "Ada"), "count", 3));

        DataEnvelope out = executor.execute(Map.of("template", "Hi {{ user.name }}, {{count}} new{{missing}}."),
                Map.of(PortNames.DATA, input), CONTEXT).join();

        assertEquals("Hi Ada, 3 new.", out.getItems().get(0).getText());
        assertEquals(Map.of("text", "Hi Ada, 3 new."), out.firstJson());
    }

    @Test
    void textTemplate_requiresTemplate() {
        TextTemplateNodeExecutor executor = new TextTemplateNodeExecutor();

        assertFalse(executor.validate(Map.of()).isValid());
        assertTrue(executor.execute(Map.of(), Map.of(), CONTEXT).join().isError());
    }

    @Test
    void jsonPath_extractsPerItemWithDefault() {
        JsonPathNodeExecutor executor = new JsonPathNodeExecutor();
        DataEnvelope input = DataEnvelope.success(List.of(
                WorkflowItem.of(Map.of("a", List.of(10, 20))),
                WorkflowItem.of(Map.of("b", 1))), Instant.now());

        DataEnvelope out = executor.execute(Map.of("path", "$.a[1]", "defaultValue", "none"),
                Map.of(PortNames.DATA, input), CONTEXT).join();

        assertEquals(List.of(Map.of("result", 20), Map.of("result", "none")), out.jsonValues());
    }

    @Test
    void jsonPath_missingWithoutDefault_yieldsNull() {
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("result", null);

        DataEnvelope out = new JsonPathNodeExecutor().execute(Map.of("path", "x"),
                Map.of(PortNames.DATA, DataEnvelope.input(Map.of())), CONTEXT).join();

        assertEquals(List.of(expected), out.jsonValues());
    }

    @Test
    void trigger_forwardsInputOrEmitsConfiguredValue() {
        TriggerNodeExecutor executor = new TriggerNodeExecutor();

        assertEquals(List.of("in"), executor.execute(Map.of("value", "cfg"),
                Map.of(PortNames.DATA, DataEnvelope.input("in")), CONTEXT).join().jsonValues());
        assertEquals(List.of("cfg"), executor.execute(Map.of("value", "cfg"), Map.of(), CONTEXT).join().jsonValues());
    }

    @Test
    void output_collectsItemsOfEveryPort() {
        Map<String, DataEnvelope> inputs = new LinkedHashMap<>();
        inputs.put(PortNames.DATA, DataEnvelope.input(1));
        inputs.put("other", DataEnvelope.input(2));

        DataEnvelope out = new OutputNodeExecutor().execute(Map.of(), inputs, CONTEXT).join();

        assertEquals(Arrays.asList(1, 2), out.jsonValues());
    }
}
