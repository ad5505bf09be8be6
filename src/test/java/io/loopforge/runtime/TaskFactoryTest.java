package io.loopforge.runtime;

import io.loopforge.model.FileStatus;
import io.loopforge.model.RegistryEntry;
import io.loopforge.model.TaskState;
import io.loopforge.storage.TaskStateStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class TaskFactoryTest {

    @Test
    void freshTaskIsRecordedAllPendingInInputOrder() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-factory-");
        try {
            LoopForgeRuntime runtime = TestTasks.runtime(root.resolve("tasks"), new ScriptedExecutor(), null);
            Path input = TestTasks.writeInput(root, List.of("z.ts", "a.ts", "m.ts"));

            LoadedTask task = runtime.createTask(TestTasks.request(root, input, "verify {file}", 2, 3));

            Assertions.assertEquals("task_0", task.taskId());
            TaskState onDisk = TaskStateStore.read(task.stateFile());
            Assertions.assertEquals(List.of("z.ts", "a.ts", "m.ts"), new ArrayList<>(onDisk.files().keySet()));
            Assertions.assertTrue(onDisk.files().values().stream().allMatch(f -> f.status() == FileStatus.PENDING));
            Assertions.assertEquals(1, onDisk.file("a.ts").orElseThrow().metadata().path("index").asInt());
            Assertions.assertEquals("{file_stem}*", onDisk.config().allowlistPattern());

            RegistryEntry entry = runtime.tasks().get(0);
            Assertions.assertEquals("state_0.json", entry.stateFile());
            Assertions.assertEquals(root.resolve("work").toAbsolutePath().normalize().toString(), entry.workingDir());
            Assertions.assertEquals("Add tests", entry.description());
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }

    @Test
    void longPromptsAreShortenedForTheRegistry() {
        String description = TaskFactory.describe("Write thorough unit tests covering\nevery exported function of the module");
        Assertions.assertEquals(50, description.length());
        Assertions.assertTrue(description.endsWith("..."));
        Assertions.assertFalse(description.contains("\n"));
    }

    @Test
    void inputMustBeAnObject() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-factory-");
        try {
            Path array = root.resolve("array.json");
            Files.writeString(array, "[\"a.ts\"]");
            Assertions.assertThrows(IllegalArgumentException.class, () -> TaskFactory.readInput(array));

            Path empty = root.resolve("empty.json");
            Files.writeString(empty, "{}");
            Assertions.assertThrows(IllegalArgumentException.class, () -> TaskFactory.readInput(empty));

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> TaskFactory.readInput(root.resolve("missing.json")));
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }

    @Test
    void invalidSettingsCreateNothing() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-factory-");
        try {
            LoopForgeRuntime runtime = TestTasks.runtime(root.resolve("tasks"), new ScriptedExecutor(), null);
            Path input = TestTasks.writeInput(root, List.of("a.ts"));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.createTask(TestTasks.request(root, input, null, -1, 1)));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.createTask(TestTasks.request(root, input, null, 1, 0)));
            Assertions.assertTrue(runtime.tasks().isEmpty());
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }
}
