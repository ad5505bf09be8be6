package io.loopforge.runtime;

import io.loopforge.model.RegistryEntry;
import io.loopforge.model.TaskState;

import java.nio.file.Path;

/**
 * A task ready to run: its registry entry, where its state lives, and the state read from there.
 */
public record LoadedTask(RegistryEntry entry, Path stateFile, TaskState state) {
    public String taskId() {
        return entry.taskId();
    }
}
