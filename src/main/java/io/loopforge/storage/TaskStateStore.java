package io.loopforge.storage;

import io.loopforge.model.FileState;
import io.loopforge.model.TaskState;
import io.loopforge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Single writer of one task's state file.
 *
 * <p>Every change is written to disk first and only then becomes the in-memory snapshot, so a
 * failed write leaves both memory and disk at the last state actually reached. Writes are
 * serialized on this store.
 */
public final class TaskStateStore {
    private final Path stateFile;
    private final Consumer<TaskState> afterWrite;
    private TaskState current;

    private TaskStateStore(Path stateFile, TaskState current, Consumer<TaskState> afterWrite) {
        this.stateFile = stateFile;
        this.current = current;
        this.afterWrite = afterWrite == null ? s -> { } : afterWrite;
    }

    /**
     * Writes {@code initial} and returns a store over it.
     */
    public static TaskStateStore create(Path stateFile, TaskState initial) {
        TaskStateStore store = new TaskStateStore(stateFile, initial, null);
        store.write(initial);
        return store;
    }

    /**
     * Wraps a state already on disk without rewriting it.
     */
    public static TaskStateStore attach(Path stateFile, TaskState loaded, Consumer<TaskState> afterWrite) {
        return new TaskStateStore(stateFile, loaded, afterWrite);
    }

    public static TaskState read(Path stateFile) throws IOException {
        if (!Files.exists(stateFile)) {
            throw new IOException("State file does not exist: " + stateFile);
        }
        TaskState state = Jsons.mapper().readValue(stateFile.toFile(), TaskState.class);
        if (state == null) {
            throw new IOException("State file is empty: " + stateFile);
        }
        return state;
    }

    public Path stateFile() {
        return stateFile;
    }

    public synchronized TaskState snapshot() {
        return current;
    }

    public synchronized FileState file(String path) {
        return current.file(path)
                .orElseThrow(() -> new IllegalArgumentException("file is not part of task " + current.id() + ": " + path));
    }

    /**
     * Persists the new state of one file, then publishes it.
     *
     * @throws PersistenceException when the write failed; nothing changed in memory
     */
    public synchronized TaskState apply(FileState next) {
        TaskState candidate = current.withFile(next, System.currentTimeMillis());
        write(candidate);
        current = candidate;
        afterWrite.accept(candidate);
        return candidate;
    }

    public synchronized TaskState replace(TaskState next) {
        if (!next.id().equals(current.id())) {
            throw new IllegalArgumentException("cannot replace task " + current.id() + " with " + next.id());
        }
        write(next);
        current = next;
        afterWrite.accept(next);
        return next;
    }

    /**
     * Rewrites the current snapshot; used as a last attempt after a failed write.
     */
    public synchronized void flush() {
        write(current);
    }

    private void write(TaskState state) {
        try {
            AtomicFiles.writeJson(stateFile, state);
        } catch (IOException e) {
            throw new PersistenceException("Failed to write state file: " + stateFile, e);
        }
    }
}
