package io.loopforge.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.loopforge.model.RegistryEntry;
import io.loopforge.model.RegistryStatus;
import io.loopforge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only index of every task created in one tasks directory ({@code task_list.json}).
 *
 * <p>Entries keep creation order. Ids and state file names come from a persisted counter, so an
 * id is never reused even if a task was allocated and then abandoned before registration.
 */
public final class TaskRegistry {
    private final Path file;
    private final List<RegistryEntry> entries;
    private int nextId;

    private TaskRegistry(Path file, List<RegistryEntry> entries, int nextId) {
        this.file = file;
        this.entries = new ArrayList<>(entries);
        this.nextId = nextId;
    }

    public static TaskRegistry open(Path file) {
        if (!Files.exists(file)) {
            return new TaskRegistry(file, List.of(), 0);
        }
        RegistryFile loaded;
        try {
            loaded = Jsons.mapper().readValue(file.toFile(), RegistryFile.class);
        } catch (IOException e) {
            throw new ResumeInconsistencyException("Task registry is unreadable: " + file, e);
        }
        if (loaded == null) {
            throw new ResumeInconsistencyException("Task registry is empty: " + file);
        }
        List<RegistryEntry> tasks = loaded.tasks() == null ? List.of() : loaded.tasks();
        int highest = -1;
        for (RegistryEntry entry : tasks) {
            if (entry.taskId() == null || entry.stateFile() == null) {
                throw new ResumeInconsistencyException("Task registry has an entry without id or state file: " + file);
            }
            highest = Math.max(highest, numericSuffix(entry.taskId()));
        }
        return new TaskRegistry(file, tasks, Math.max(loaded.nextId(), highest + 1));
    }

    public Path file() {
        return file;
    }

    /**
     * Reserves the next id without writing anything; call {@link #register} once the task's
     * state file exists.
     */
    public synchronized RegistryEntry allocate(String workingDir, String description) {
        int id = nextId++;
        return new RegistryEntry("task_" + id, "state_" + id + ".json", workingDir, description, RegistryStatus.INCOMPLETE);
    }

    public synchronized void register(RegistryEntry entry) {
        if (find(entry.taskId()).isPresent()) {
            throw new IllegalStateException("Task already registered: " + entry.taskId());
        }
        entries.add(entry);
        persist();
    }

    public synchronized void markCompleted(String taskId) {
        for (int i = 0; i < entries.size(); i++) {
            RegistryEntry entry = entries.get(i);
            if (entry.taskId().equals(taskId)) {
                if (entry.isComplete()) {
                    return;
                }
                entries.set(i, entry.withStatus(RegistryStatus.COMPLETED));
                persist();
                return;
            }
        }
        throw new IllegalArgumentException("Unknown task: " + taskId);
    }

    public synchronized Optional<RegistryEntry> find(String taskId) {
        return entries.stream().filter(e -> e.taskId().equals(taskId)).findFirst();
    }

    public synchronized Optional<RegistryEntry> firstIncomplete() {
        return entries.stream().filter(e -> !e.isComplete()).findFirst();
    }

    public synchronized List<RegistryEntry> entries() {
        return List.copyOf(entries);
    }

    private void persist() {
        try {
            AtomicFiles.writeJson(file, new RegistryFile(nextId, List.copyOf(entries)));
        } catch (IOException e) {
            throw new PersistenceException("Failed to write task registry: " + file, e);
        }
    }

    private static int numericSuffix(String taskId) {
        int underscore = taskId.lastIndexOf('_');
        if (underscore < 0) {
            return -1;
        }
        try {
            return Integer.parseInt(taskId.substring(underscore + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    record RegistryFile(
            @JsonProperty("next_id") int nextId,
            @JsonProperty("tasks") List<RegistryEntry> tasks
    ) {
    }
}
