package io.loopforge.runtime;

import io.loopforge.config.LoopForgeConfig;
import io.loopforge.model.FileState;
import io.loopforge.model.FileStatus;
import io.loopforge.model.GitSettings;
import io.loopforge.model.RegistryEntry;
import io.loopforge.model.TaskState;
import io.loopforge.storage.AtomicFiles;
import io.loopforge.storage.TaskRegistry;
import io.loopforge.storage.TaskStateStore;
import io.loopforge.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.ToIntFunction;
import java.util.stream.Stream;

final class TestTasks {
    private TestTasks() {
    }

    static Path writeInput(Path root, List<String> files) throws IOException {
        Map<String, Object> mapping = new LinkedHashMap<>();
        for (int i = 0; i < files.size(); i++) {
            mapping.put(files.get(i), Map.of("index", i));
        }
        Path input = root.resolve("input.json");
        Files.writeString(input, Jsons.toJson(mapping));
        return input;
    }

    static TaskRequest request(Path root, Path input, String verify, int maxRetries, int concurrency) {
        return request(root, input, verify, maxRetries, concurrency, null, GitSettings.disabled());
    }

    static TaskRequest request(
            Path root,
            Path input,
            String verify,
            int maxRetries,
            int concurrency,
            Integer maxFiles,
            GitSettings git
    ) {
        return new TaskRequest(input, root.resolve("work"), "Add tests", null, verify, "{file_stem}*",
                maxRetries, concurrency, maxFiles, git);
    }

    static LoopForgeConfig config(Path tasksDir) {
        return LoopForgeConfig.fromRoot(tasksDir.toString());
    }

    static LoopForgeRuntime runtime(Path tasksDir, ScriptedExecutor executor, Consumer<TaskState> listener) {
        return runtime(tasksDir, executor, null, listener);
    }

    static LoopForgeRuntime runtime(
            Path tasksDir,
            ScriptedExecutor executor,
            RecordingChangeTracker tracker,
            Consumer<TaskState> listener
    ) {
        return new LoopForgeRuntime(config(tasksDir), new FakeCollaborators(executor, tracker),
                MemoryGate.disabled(), listener);
    }

    /**
     * Lays out a tasks directory as a process killed right after {@code snapshot} was written
     * would have left it.
     */
    static void restore(Path tasksDir, TaskState snapshot, Path workingDir) throws IOException {
        LoopForgeConfig config = config(tasksDir);
        TaskRegistry registry = TaskRegistry.open(config.registryFile());
        RegistryEntry entry = registry.allocate(workingDir.toString(), "restored");
        if (!entry.taskId().equals(snapshot.id())) {
            throw new IllegalStateException("expected a fresh tasks dir for " + snapshot.id());
        }
        AtomicFiles.writeJson(config.stateFile(entry.stateFile()), snapshot);
        registry.register(entry);
    }

    /**
     * Retry count as persisted on disk, so verify outcomes do not depend on call history.
     */
    static ToIntFunction<String> persistedRetries(Path stateFile) {
        return path -> {
            try {
                return TaskStateStore.read(stateFile).file(path).orElseThrow().retryCount();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    static Map<String, FileStatus> statuses(TaskState state) {
        Map<String, FileStatus> out = new LinkedHashMap<>();
        for (FileState file : state.files().values()) {
            out.put(file.path(), file.status());
        }
        return out;
    }

    static long inFlight(TaskState state) {
        return state.files().values().stream().filter(f -> f.status().isInFlight()).count();
    }

    static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
