package com.nodeflow.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical unit of data on every edge: an ordered list of {@link WorkflowItem}s plus {@link EnvelopeMeta}.
 * Immutable; the {@code with*} methods return copies.
 */
public final class DataEnvelope {

    private final List<WorkflowItem> items;
    private final EnvelopeMeta meta;

    @JsonCreator
    public DataEnvelope(
            @JsonProperty("items") List<WorkflowItem> items,
            @JsonProperty("meta") EnvelopeMeta meta) {
        this.items = items != null ? Collections.unmodifiableList(new ArrayList<>(items)) : List.of();
        this.meta = meta != null ? meta : EnvelopeMeta.builder().build();
    }

    /** Success envelope with the given items, started at {@code startTime} and ending now. */
    public static DataEnvelope success(List<WorkflowItem> items, Instant startTime) {
        return new DataEnvelope(items, EnvelopeMeta.builder()
                .startTime(startTime)
                .endTime(Instant.now())
                .build());
    }

    /** Success envelope with a single item holding {@code json}. */
    public static DataEnvelope ofJson(Object json, Instant startTime) {
        return success(List.of(WorkflowItem.of(json)), startTime);
    }

    /** Envelope for a value handed to a run from outside (start and end are now). */
    public static DataEnvelope input(Object json) {
        Instant now = Instant.now();
        return new DataEnvelope(List.of(WorkflowItem.of(json)), EnvelopeMeta.builder()
                .startTime(now)
                .endTime(now)
                .build());
    }

    /** Error envelope with no items. */
    public static DataEnvelope error(ErrorKind kind, String message, Instant startTime) {
        return error(kind, message, startTime, List.of());
    }

    public static DataEnvelope error(ErrorKind kind, String message, Instant startTime, List<WorkflowItem> items) {
        return new DataEnvelope(items, EnvelopeMeta.builder()
                .startTime(startTime)
                .endTime(Instant.now())
                .error(kind, message)
                .build());
    }

    public List<WorkflowItem> getItems() {
        return items;
    }

    public EnvelopeMeta getMeta() {
        return meta;
    }

    @JsonIgnore
    public boolean isError() {
        return meta.getStatus() == EnvelopeStatus.ERROR;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items.isEmpty();
    }

    /** Json value of the first item, or null when there are no items. */
    public Object firstJson() {
        return items.isEmpty() ? null : items.get(0).getJson();
    }

    /** Json values of all items, in order. */
    public List<Object> jsonValues() {
        List<Object> values = new ArrayList<>(items.size());
        for (WorkflowItem item : items) {
            values.add(item.getJson());
        }
        return values;
    }

    public DataEnvelope withOutputPort(String outputPort) {
        return new DataEnvelope(items, meta.toBuilder().outputPort(outputPort).build());
    }

    public DataEnvelope withMeta(EnvelopeMeta newMeta) {
        return new DataEnvelope(items, newMeta);
    }

    public DataEnvelope withItems(List<WorkflowItem> newItems) {
        return new DataEnvelope(newItems, meta);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataEnvelope that = (DataEnvelope) o;
        return items.equals(that.items) && meta.equals(that.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, meta);
    }

    @Override
    public String toString() {
        return "DataEnvelope{items=" + items.size() + ", meta=" + meta + "}";
    }
}
