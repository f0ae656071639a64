package com.nodeflow.engine.executors;

import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.ErrorKind;
import com.nodeflow.envelope.WorkflowItem;
import com.nodeflow.node.NodeDefinition;
import com.nodeflow.node.NodeExecutionContext;
import com.nodeflow.node.NodeExecutor;
import com.nodeflow.node.PortDefinition;
import com.nodeflow.node.PortNames;
import com.nodeflow.node.ValidationResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{path}}} placeholders in {@code template} from the first input value.
 * Missing values render as empty text; non-string values render with {@code toString()}.
 */
public final class TextTemplateNodeExecutor implements NodeExecutor {

    public static final String TYPE = "text_template";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}\\s]+)\\s*}}");

    private static final NodeDefinition DEFINITION = NodeDefinition.builder(TYPE)
            .displayName("Text Template")
            .category("Data")
            .input(PortDefinition.optional(PortNames.DATA))
            .output(PortNames.OUTPUT)
            .output(PortNames.ERROR)
            .build();

    @Override
    public NodeDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(Map<String, Object> config) {
        return config.get("template") instanceof String
                ? ValidationResult.success() : ValidationResult.failure("template is required");
    }

    @Override
    public CompletableFuture<DataEnvelope> execute(Map<String, Object> config,
                                                   Map<String, DataEnvelope> inputsByPort,
                                                   NodeExecutionContext context) {
        Instant start = Instant.now();
        Object template = config.get("template");
        if (!(template instanceof String)) {
            return CompletableFuture.completedFuture(
                    DataEnvelope.error(ErrorKind.CONFIGURATION, "No template configured", start));
        }
        DataEnvelope input = NodeInputs.primary(DEFINITION, inputsByPort);
        String text = render((String) template, input != null ? input.firstJson() : null);
        return CompletableFuture.completedFuture(
                DataEnvelope.success(List.of(WorkflowItem.ofText(Map.of("text", text), text)), start));
    }

    static String render(String template, Object values) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String replacement = JsonPaths.read(values, m.group(1)).map(String::valueOf).orElse("");
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }
}
