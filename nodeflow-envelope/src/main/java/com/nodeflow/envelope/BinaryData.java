package com.nodeflow.envelope;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Binary attachment of a {@link WorkflowItem}. {@code data} is the encoded payload (usually base64).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class BinaryData {

    private final String mimeType;
    private final String data;
    private final String filename;

    @JsonCreator
    public BinaryData(
            @JsonProperty("mimeType") String mimeType,
            @JsonProperty("data") String data,
            @JsonProperty("filename") String filename) {
        this.mimeType = mimeType;
        this.data = data;
        this.filename = filename;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getData() {
        return data;
    }

    public String getFilename() {
        return filename;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BinaryData that = (BinaryData) o;
        return Objects.equals(mimeType, that.mimeType)
                && Objects.equals(data, that.data)
                && Objects.equals(filename, that.filename);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mimeType, data, filename);
    }
}
