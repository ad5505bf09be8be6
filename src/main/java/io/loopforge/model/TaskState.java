package io.loopforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of one task: its configuration and the state of every file, in input order.
 * This is exactly what the state file holds.
 */
@JsonPropertyOrder({"id", "config", "started_at_ms", "updated_at_ms", "git_state", "files"})
public final class TaskState {
    private final String id;
    private final TaskConfig config;
    private final Map<String, FileState> files;
    private final long startedAtMs;
    private final long updatedAtMs;
    private final GitState gitState;

    public TaskState(
            String id,
            TaskConfig config,
            Map<String, FileState> files,
            long startedAtMs,
            long updatedAtMs,
            GitState gitState
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task id cannot be empty");
        }
        if (config == null) {
            throw new IllegalArgumentException("task config cannot be null: " + id);
        }
        this.id = id;
        this.config = config;
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files == null ? Map.of() : files));
        this.startedAtMs = startedAtMs;
        this.updatedAtMs = updatedAtMs;
        this.gitState = gitState == null ? GitState.disabled() : gitState;
    }

    @JsonCreator
    static TaskState fromJson(
            @JsonProperty("id") String id,
            @JsonProperty("config") TaskConfig config,
            @JsonProperty("files") List<FileState> files,
            @JsonProperty("started_at_ms") long startedAtMs,
            @JsonProperty("updated_at_ms") long updatedAtMs,
            @JsonProperty("git_state") GitState gitState
    ) {
        LinkedHashMap<String, FileState> byPath = new LinkedHashMap<>();
        if (files != null) {
            for (FileState file : files) {
                if (byPath.put(file.path(), file) != null) {
                    throw new IllegalArgumentException("duplicate file entry: " + file.path());
                }
            }
        }
        return new TaskState(id, config, byPath, startedAtMs, updatedAtMs, gitState);
    }

    @JsonProperty("id")
    public String id() {
        return id;
    }

    @JsonProperty("config")
    public TaskConfig config() {
        return config;
    }

    @JsonProperty("files")
    List<FileState> fileList() {
        return new ArrayList<>(files.values());
    }

    @JsonIgnore
    public Map<String, FileState> files() {
        return files;
    }

    @JsonProperty("started_at_ms")
    public long startedAtMs() {
        return startedAtMs;
    }

    @JsonProperty("updated_at_ms")
    public long updatedAtMs() {
        return updatedAtMs;
    }

    @JsonProperty("git_state")
    public GitState gitState() {
        return gitState;
    }

    public Optional<FileState> file(String path) {
        return Optional.ofNullable(files.get(path));
    }

    public TaskState withFile(FileState file, long nowMs) {
        if (!files.containsKey(file.path())) {
            throw new IllegalArgumentException("file is not part of task " + id + ": " + file.path());
        }
        LinkedHashMap<String, FileState> next = new LinkedHashMap<>(files);
        next.put(file.path(), file);
        return new TaskState(id, config, next, startedAtMs, nowMs, gitState);
    }

    public TaskState withGitState(GitState next, long nowMs) {
        return new TaskState(id, config, files, startedAtMs, nowMs, next);
    }

    public TaskState withConfig(TaskConfig next, long nowMs) {
        return new TaskState(id, next, files, startedAtMs, nowMs, gitState);
    }

    /**
     * A task is done iff every file is completed or failed.
     */
    @JsonIgnore
    public boolean isDone() {
        return files.values().stream().allMatch(f -> f.status().isTerminal());
    }

    public StateSummary summary() {
        return StateSummary.of(files.values());
    }
}
