package com.nodeflow.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One unit of payload data. A node's output is always a list of items, even for a single value.
 * {@code json} is any Jackson-mappable value (map, list, string, number, boolean) and may be null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowItem {

    private final Object json;
    private final String text;
    private final BinaryData binary;

    @JsonCreator
    public WorkflowItem(
            @JsonProperty("json") Object json,
            @JsonProperty("text") String text,
            @JsonProperty("binary") BinaryData binary) {
        this.json = json;
        this.text = text;
        this.binary = binary;
    }

    public static WorkflowItem of(Object json) {
        return new WorkflowItem(json, null, null);
    }

    public static WorkflowItem ofText(Object json, String text) {
        return new WorkflowItem(json, text, null);
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Object getJson() {
        return json;
    }

    public String getText() {
        return text;
    }

    public BinaryData getBinary() {
        return binary;
    }

    /** Copy with the json value replaced; text and binary are kept. */
    public WorkflowItem withJson(Object newJson) {
        return new WorkflowItem(newJson, text, binary);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowItem that = (WorkflowItem) o;
        return Objects.equals(json, that.json)
                && Objects.equals(text, that.text)
                && Objects.equals(binary, that.binary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(json, text, binary);
    }

    @Override
    public String toString() {
        return "WorkflowItem{json=" + json + (text != null ? ", text=" + text : "") + "}";
    }
}
