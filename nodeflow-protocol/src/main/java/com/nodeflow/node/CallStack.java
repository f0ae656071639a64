package com.nodeflow.node;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered workflow ids of the current chain of nested sub-workflow invocations.
 * Immutable and append-only: {@link #append(String)} returns a copy, so sibling branches never
 * see each other's nesting. Serialized as a plain JSON array ({@code _callStack}).
 */
public final class CallStack {

    private static final CallStack EMPTY = new CallStack(List.of());

    private final List<String> workflowIds;

    private CallStack(List<String> workflowIds) {
        this.workflowIds = workflowIds;
    }

    public static CallStack empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CallStack of(List<String> workflowIds) {
        if (workflowIds == null || workflowIds.isEmpty()) return EMPTY;
        List<String> ids = new ArrayList<>(workflowIds.size());
        for (String id : workflowIds) {
            if (id != null && !id.isBlank()) ids.add(id.trim());
        }
        return ids.isEmpty() ? EMPTY : new CallStack(List.copyOf(ids));
    }

    public static CallStack of(String... workflowIds) {
        return of(List.of(workflowIds));
    }

    /** Returns a new stack with {@code workflowId} on top; this stack is unchanged. */
    public CallStack append(String workflowId) {
        Objects.requireNonNull(workflowId, "workflowId");
        List<String> ids = new ArrayList<>(workflowIds.size() + 1);
        ids.addAll(workflowIds);
        ids.add(workflowId);
        return new CallStack(List.copyOf(ids));
    }

    public boolean contains(String workflowId) {
        return workflowIds.contains(workflowId);
    }

    public int depth() {
        return workflowIds.size();
    }

    public boolean isEmpty() {
        return workflowIds.isEmpty();
    }

    /** The chain that re-entering {@code workflowId} would form, e.g. {@code W1 -> W2 -> W1}. */
    public String describeCycle(String workflowId) {
        if (workflowIds.isEmpty()) return workflowId;
        return String.join(" -> ", workflowIds) + " -> " + workflowId;
    }

    @JsonValue
    public List<String> asList() {
        return workflowIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return workflowIds.equals(((CallStack) o).workflowIds);
    }

    @Override
    public int hashCode() {
        return workflowIds.hashCode();
    }

    @Override
    public String toString() {
        return workflowIds.toString();
    }
}
