package com.nodeflow.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.nodeflow.envelope.DataEnvelope;
import com.nodeflow.envelope.ErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one run: the envelope of every executed node in execution order, the skipped nodes and the
 * final status. Immutable once built; serializes with Jackson.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RunTrace {

    private final String runId;
    private final String workflowId;
    private final RunStatus status;
    private final Instant startTime;
    private final Instant endTime;
    private final String errorMessage;
    private final String failedNodeId;
    private final Map<String, DataEnvelope> envelopes;
    private final List<String> skippedNodeIds;

    private RunTrace(Builder b, RunStatus status, String errorMessage, String failedNodeId) {
        this.runId = b.runId;
        this.workflowId = b.workflowId;
        this.status = status;
        this.startTime = b.startTime;
        this.endTime = Instant.now();
        this.errorMessage = errorMessage;
        this.failedNodeId = failedNodeId;
        this.envelopes = Collections.unmodifiableMap(new LinkedHashMap<>(b.envelopes));
        this.skippedNodeIds = List.copyOf(b.skipped);
    }

    static Builder builder(String runId, String workflowId) {
        return new Builder(runId, workflowId);
    }

    public String getRunId() {
        return runId;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    @JsonIgnore
    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    /** Message of the error that decided a non-completed status. */
    public String getErrorMessage() {
        return errorMessage;
    }

    /** Node whose unhandled error (or fatal failure) decided a non-completed status. */
    public String getFailedNodeId() {
        return failedNodeId;
    }

    /** Node id to output envelope, in execution order. */
    public Map<String, DataEnvelope> getEnvelopes() {
        return envelopes;
    }

    public List<String> getSkippedNodeIds() {
        return skippedNodeIds;
    }

    @JsonIgnore
    public List<String> getExecutionOrder() {
        return new ArrayList<>(envelopes.keySet());
    }

    public DataEnvelope getEnvelope(String nodeId) {
        return envelopes.get(nodeId);
    }

    public boolean wasExecuted(String nodeId) {
        return envelopes.containsKey(nodeId);
    }

    /** Envelope of the last executed node; null when nothing ran. */
    @JsonIgnore
    public DataEnvelope getFinalOutput() {
        DataEnvelope last = null;
        for (DataEnvelope envelope : envelopes.values()) {
            last = envelope;
        }
        return last;
    }

    /** Envelope of {@link #getFailedNodeId()}; null when the run completed or failed before any node ran. */
    @JsonIgnore
    public DataEnvelope getFailure() {
        return failedNodeId != null ? envelopes.get(failedNodeId) : null;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunTrace that = (RunTrace) o;
        return Objects.equals(runId, that.runId)
                && status == that.status
                && envelopes.equals(that.envelopes)
                && skippedNodeIds.equals(that.skippedNodeIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(runId, status, envelopes, skippedNodeIds);
    }

    @Override
    public String toString() {
        return "RunTrace{runId=" + runId + ", workflowId=" + workflowId + ", status=" + status
                + ", executed=" + envelopes.keySet() + ", skipped=" + skippedNodeIds + "}";
    }

    /** Mutable collector used by the scheduler while a run is in progress. */
    static final class Builder {
        private final String runId;
        private final String workflowId;
        private final Instant startTime = Instant.now();
        private final Map<String, DataEnvelope> envelopes = new LinkedHashMap<>();
        private final List<String> skipped = new ArrayList<>();
        private String firstUnhandledNodeId;

        private Builder(String runId, String workflowId) {
            this.runId = runId;
            this.workflowId = workflowId;
        }

        void executed(String nodeId, DataEnvelope envelope) {
            envelopes.put(nodeId, envelope);
        }

        void skipped(String nodeId) {
            skipped.add(nodeId);
        }

        void unhandled(String nodeId) {
            if (firstUnhandledNodeId == null) firstUnhandledNodeId = nodeId;
        }

        /** Status from the first unhandled error: timeout when it was a timeout, error otherwise, else completed. */
        RunTrace finish() {
            if (firstUnhandledNodeId == null) {
                return new RunTrace(this, RunStatus.COMPLETED, null, null);
            }
            DataEnvelope failure = envelopes.get(firstUnhandledNodeId);
            RunStatus status = failure.getMeta().getErrorKind() == ErrorKind.TIMEOUT
                    ? RunStatus.TIMEOUT : RunStatus.ERROR;
            return new RunTrace(this, status, failure.getMeta().getErrorMessage(), firstUnhandledNodeId);
        }

        RunTrace abort(String nodeId, String message) {
            return new RunTrace(this, RunStatus.ERROR, message, nodeId);
        }

        RunTrace rejected(String message) {
            return new RunTrace(this, RunStatus.ERROR, message, null);
        }
    }
}
