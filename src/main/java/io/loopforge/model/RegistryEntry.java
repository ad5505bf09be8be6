package io.loopforge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistryEntry(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("state_file") String stateFile,
        @JsonProperty("working_dir") String workingDir,
        @JsonProperty("description") String description,
        @JsonProperty("status") RegistryStatus status
) {
    public RegistryEntry {
        status = status == null ? RegistryStatus.INCOMPLETE : status;
    }

    public boolean isComplete() {
        return status == RegistryStatus.COMPLETED;
    }

    public RegistryEntry withStatus(RegistryStatus next) {
        return new RegistryEntry(taskId, stateFile, workingDir, description, next);
    }
}
