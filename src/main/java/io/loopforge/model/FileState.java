package io.loopforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Pipeline position of one file. Instances are immutable; every change produces a copy.
 *
 * <p>{@code metadata} is the value the input mapping associated with the file and is
 * handed to the executor untouched. {@code result} is whatever the agent reported on its
 * {@code RESULT:} line; neither is interpreted here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileState(
        @JsonProperty("path") String path,
        @JsonProperty("status") FileStatus status,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("metadata") JsonNode metadata,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("result_raw") Boolean resultRaw
) {
    public FileState {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("file path cannot be empty");
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retry_count cannot be negative: " + path);
        }
        status = status == null ? FileStatus.PENDING : status;
        metadata = metadata == null ? NullNode.getInstance() : metadata;
    }

    public static FileState pending(String path, JsonNode metadata) {
        return new FileState(path, FileStatus.PENDING, 0, null, metadata, null, null);
    }

    public FileState withStatus(FileStatus next, int nextRetryCount) {
        requireMutable();
        return new FileState(path, next, nextRetryCount, lastError, metadata, result, resultRaw);
    }

    public FileState withError(String error) {
        requireMutable();
        return new FileState(path, status, retryCount, error, metadata, result, resultRaw);
    }

    public FileState withResult(JsonNode value, boolean raw) {
        requireMutable();
        return new FileState(path, status, retryCount, lastError, metadata, value, raw ? Boolean.TRUE : null);
    }

    private void requireMutable() {
        if (status.isTerminal()) {
            throw new IllegalStateException("file state is terminal: " + path + " (" + status.wireName() + ")");
        }
    }
}
