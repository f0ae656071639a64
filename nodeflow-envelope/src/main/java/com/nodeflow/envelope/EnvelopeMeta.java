package com.nodeflow.envelope;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Execution metadata of a {@link DataEnvelope}.
 * <p>
 * Invariants enforced on construction: {@code endTime >= startTime} (an earlier end is clamped to the start)
 * and an error status always carries a message. Properties not modelled here are kept as attributes and
 * written back inline, so the wire shape stays open ({@code meta: {startTime, endTime, status, ...}}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"startTime", "endTime", "status", "errorMessage", "errorKind", "outputPort", "cached", "executionTimeMs"})
public final class EnvelopeMeta {

    static final String UNKNOWN_ERROR = "Unknown error";

    private final Instant startTime;
    private final Instant endTime;
    private final EnvelopeStatus status;
    private final String errorMessage;
    private final ErrorKind errorKind;
    private final String outputPort;
    private final Boolean cached;
    private final Long executionTimeMs;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonCreator
    public EnvelopeMeta(
            @JsonProperty("startTime") Instant startTime,
            @JsonProperty("endTime") Instant endTime,
            @JsonProperty("status") EnvelopeStatus status,
            @JsonProperty("errorMessage") String errorMessage,
            @JsonProperty("errorKind") ErrorKind errorKind,
            @JsonProperty("outputPort") String outputPort,
            @JsonProperty("cached") Boolean cached,
            @JsonProperty("executionTimeMs") Long executionTimeMs) {
        this(startTime, endTime, status, errorMessage, errorKind, outputPort, cached, executionTimeMs, Map.of());
    }

    private EnvelopeMeta(Instant startTime, Instant endTime, EnvelopeStatus status, String errorMessage,
                         ErrorKind errorKind, String outputPort, Boolean cached, Long executionTimeMs,
                         Map<String, Object> attributes) {
        Instant start = startTime != null ? startTime : (endTime != null ? endTime : Instant.now());
        Instant end = endTime != null ? endTime : start;
        this.startTime = start;
        this.endTime = end.isBefore(start) ? start : end;
        this.status = status != null ? status : EnvelopeStatus.SUCCESS;
        if (this.status == EnvelopeStatus.ERROR) {
            this.errorMessage = errorMessage != null && !errorMessage.isBlank() ? errorMessage : UNKNOWN_ERROR;
            this.errorKind = errorKind != null ? errorKind : ErrorKind.EXECUTION;
        } else {
            this.errorMessage = errorMessage;
            this.errorKind = errorKind;
        }
        this.outputPort = outputPort != null && !outputPort.isBlank() ? outputPort : null;
        this.cached = cached;
        this.executionTimeMs = executionTimeMs;
        if (attributes != null) {
            this.attributes.putAll(attributes);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .startTime(startTime)
                .endTime(endTime)
                .status(status)
                .errorMessage(errorMessage)
                .errorKind(errorKind)
                .outputPort(outputPort)
                .cached(cached)
                .executionTimeMs(executionTimeMs)
                .attributes(attributes);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public EnvelopeStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /** Error kind; set whenever status is error. */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    /** Output port the producing node selected (e.g. {@code true}); null means its default port. */
    public String getOutputPort() {
        return outputPort;
    }

    public Boolean getCached() {
        return cached;
    }

    @JsonIgnore
    public boolean isCached() {
        return Boolean.TRUE.equals(cached);
    }

    public Long getExecutionTimeMs() {
        return executionTimeMs;
    }

    /** Wall time between start and end in milliseconds. */
    @JsonIgnore
    public long getDurationMs() {
        return endTime.toEpochMilli() - startTime.toEpochMilli();
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    @JsonAnySetter
    private void readAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnvelopeMeta that = (EnvelopeMeta) o;
        return startTime.equals(that.startTime)
                && endTime.equals(that.endTime)
                && status == that.status
                && Objects.equals(errorMessage, that.errorMessage)
                && errorKind == that.errorKind
                && Objects.equals(outputPort, that.outputPort)
                && Objects.equals(cached, that.cached)
                && Objects.equals(executionTimeMs, that.executionTimeMs)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, endTime, status, errorMessage, errorKind, outputPort, cached, executionTimeMs, attributes);
    }

    @Override
    public String toString() {
        return "EnvelopeMeta{status=" + status.toValue()
                + (errorMessage != null ? ", errorMessage=" + errorMessage : "")
                + (outputPort != null ? ", outputPort=" + outputPort : "")
                + ", durationMs=" + getDurationMs() + "}";
    }

    public static final class Builder {
        private Instant startTime;
        private Instant endTime;
        private EnvelopeStatus status = EnvelopeStatus.SUCCESS;
        private String errorMessage;
        private ErrorKind errorKind;
        private String outputPort;
        private Boolean cached;
        private Long executionTimeMs;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder status(EnvelopeStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder errorKind(ErrorKind errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        /** Marks the meta as an error of the given kind. */
        public Builder error(ErrorKind kind, String message) {
            this.status = EnvelopeStatus.ERROR;
            this.errorKind = kind;
            this.errorMessage = message;
            return this;
        }

        public Builder outputPort(String outputPort) {
            this.outputPort = outputPort;
            return this;
        }

        public Builder cached(Boolean cached) {
            this.cached = cached;
            return this;
        }

        public Builder executionTimeMs(Long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
            return this;
        }

        public EnvelopeMeta build() {
            return new EnvelopeMeta(startTime, endTime, status, errorMessage, errorKind, outputPort, cached,
                    executionTimeMs, attributes);
        }
    }
}
