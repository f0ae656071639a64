package com.nodeflow.envelope;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of {@link DataEnvelope} in the wire shape
 * {@code {items: [{json, text?, binary?}], meta: {startTime, endTime, status, errorMessage?, outputPort?}}}.
 * Instants are ISO-8601 strings; null values are omitted.
 */
public final class EnvelopeJson {

    private static final ObjectMapper MAPPER = newObjectMapper();

    private EnvelopeJson() {
    }

    /**
     * Returns a new mapper configured like the envelope codec. Other modules use it so that envelopes
     * nested in their own payloads (run traces, trigger responses) keep the same wire shape.
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Deserializes an envelope from JSON.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static DataEnvelope fromJson(String json) {
        try {
            return MAPPER.readValue(json, DataEnvelope.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes an envelope to compact JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(DataEnvelope envelope) {
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
