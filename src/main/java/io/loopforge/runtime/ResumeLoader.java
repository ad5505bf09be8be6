package io.loopforge.runtime;

import io.loopforge.config.LoopForgeConfig;
import io.loopforge.model.FileState;
import io.loopforge.model.FileStatus;
import io.loopforge.model.RegistryEntry;
import io.loopforge.model.TaskConfig;
import io.loopforge.model.TaskState;
import io.loopforge.storage.ResumeInconsistencyException;
import io.loopforge.storage.TaskRegistry;
import io.loopforge.storage.TaskStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reloads a persisted task exactly as it was written. Everything is validated before a single
 * worker starts.
 */
public final class ResumeLoader {
    private static final Logger log = LoggerFactory.getLogger(ResumeLoader.class);

    private final LoopForgeConfig config;
    private final TaskRegistry registry;

    public ResumeLoader(LoopForgeConfig config, TaskRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    /**
     * @param taskId      task to resume, or {@code null} for the first incomplete one
     * @param concurrency replacement worker count, or {@code null} to keep the persisted one
     */
    public LoadedTask load(String taskId, Integer concurrency) {
        RegistryEntry entry;
        if (taskId == null || taskId.isBlank()) {
            entry = registry.firstIncomplete()
                    .orElseThrow(() -> new IllegalStateException("No incomplete tasks to resume"));
        } else {
            entry = registry.find(taskId.trim())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        }
        Path stateFile = config.stateFile(entry.stateFile());
        TaskState state = readValidated(entry, stateFile);
        if (concurrency != null && concurrency != state.config().concurrency()) {
            TaskConfig adjusted = state.config().withConcurrency(concurrency);
            state = TaskStateStore.attach(stateFile, state, null)
                    .replace(state.withConfig(adjusted, System.currentTimeMillis()));
            log.info("Task {} concurrency set to {}", entry.taskId(), concurrency);
        }
        log.info("Resuming task {}: {}", entry.taskId(), state.summary());
        return new LoadedTask(entry, stateFile, state);
    }

    static TaskState readValidated(RegistryEntry entry, Path stateFile) {
        TaskState state;
        try {
            state = TaskStateStore.read(stateFile);
        } catch (IOException e) {
            throw new ResumeInconsistencyException(
                    "State file of task " + entry.taskId() + " is missing or unreadable: " + stateFile, e);
        }
        if (!state.id().equals(entry.taskId())) {
            throw new ResumeInconsistencyException(
                    "State file " + stateFile + " belongs to " + state.id() + ", not " + entry.taskId());
        }
        if (state.files().isEmpty()) {
            throw new ResumeInconsistencyException("Task " + entry.taskId() + " has no files");
        }
        TaskConfig taskConfig = state.config();
        for (FileState file : state.files().values()) {
            if (file.retryCount() > taskConfig.maxRetries()) {
                throw new ResumeInconsistencyException("File " + file.path() + " has retry_count "
                        + file.retryCount() + " above max_retries " + taskConfig.maxRetries());
            }
            if (!taskConfig.hasVerifyCommand() && needsVerify(file.status())) {
                throw new ResumeInconsistencyException("File " + file.path() + " is "
                        + file.status().wireName() + " but the task has no verify command");
            }
        }
        return state;
    }

    private static boolean needsVerify(FileStatus status) {
        return status == FileStatus.AWAITING_VERIFICATION
                || status == FileStatus.VERIFY_IN_PROGRESS
                || status == FileStatus.FIXUP_IN_PROGRESS;
    }
}
