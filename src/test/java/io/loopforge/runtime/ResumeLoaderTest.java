package io.loopforge.runtime;

import io.loopforge.model.FileState;
import io.loopforge.model.FileStatus;
import io.loopforge.model.TaskState;
import io.loopforge.storage.AtomicFiles;
import io.loopforge.storage.ResumeInconsistencyException;
import io.loopforge.storage.TaskRegistry;
import io.loopforge.storage.TaskStateStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ResumeLoaderTest {

    @Test
    void missingStateFileIsInconsistent() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-resume-");
        try {
            Path tasksDir = root.resolve("tasks");
            LoopForgeRuntime runtime = TestTasks.runtime(tasksDir, new ScriptedExecutor(), null);
            runtime.createTask(TestTasks.request(root, TestTasks.writeInput(root, List.of("a.ts")), null, 1, 1));
            Files.delete(tasksDir.resolve("state_0.json"));

            RunOutcome outcome = TestTasks.runtime(tasksDir, new ScriptedExecutor(), null).resume(null, null);

            Assertions.assertEquals(RunStatus.RESUME_INCONSISTENT, outcome.status());
            Assertions.assertEquals(3, outcome.exitCode());
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }

    @Test
    void corruptStateFileIsInconsistent() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-resume-");
        try {
            Path tasksDir = root.resolve("tasks");
            LoopForgeRuntime runtime = TestTasks.runtime(tasksDir, new ScriptedExecutor(), null);
            runtime.createTask(TestTasks.request(root, TestTasks.writeInput(root, List.of("a.ts")), null, 1, 1));
            Files.writeString(tasksDir.resolve("state_0.json"), "{\"id\": \"task_0\", \"files\": [");

            ResumeLoader loader = new ResumeLoader(TestTasks.config(tasksDir),
                    TaskRegistry.open(tasksDir.resolve("task_list.json")));
            Assertions.assertThrows(ResumeInconsistencyException.class, () -> loader.load("task_0", null));
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }

    @Test
    void retryCountAboveBoundIsInconsistent() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-resume-");
        try {
            Path tasksDir = root.resolve("tasks");
            LoopForgeRuntime runtime = TestTasks.runtime(tasksDir, new ScriptedExecutor(), null);
            LoadedTask task = runtime.createTask(
                    TestTasks.request(root, TestTasks.writeInput(root, List.of("a.ts")), "verify {file}", 1, 1));
            FileState tampered = task.state().file("a.ts").orElseThrow().withStatus(FileStatus.FIXUP_IN_PROGRESS, 2);
            AtomicFiles.writeJson(task.stateFile(), task.state().withFile(tampered, 2L));

            ResumeLoader loader = new ResumeLoader(TestTasks.config(tasksDir),
                    TaskRegistry.open(tasksDir.resolve("task_list.json")));
            Assertions.assertThrows(ResumeInconsistencyException.class, () -> loader.load(null, null));
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }

    @Test
    void verifyStatusWithoutVerifyCommandIsInconsistent() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-resume-");
        try {
            Path tasksDir = root.resolve("tasks");
            LoopForgeRuntime runtime = TestTasks.runtime(tasksDir, new ScriptedExecutor(), null);
            LoadedTask task = runtime.createTask(
                    TestTasks.request(root, TestTasks.writeInput(root, List.of("a.ts")), null, 1, 1));
            FileState tampered = task.state().file("a.ts").orElseThrow().withStatus(FileStatus.AWAITING_VERIFICATION, 0);
            AtomicFiles.writeJson(task.stateFile(), task.state().withFile(tampered, 2L));

            ResumeLoader loader = new ResumeLoader(TestTasks.config(tasksDir),
                    TaskRegistry.open(tasksDir.resolve("task_list.json")));
            Assertions.assertThrows(ResumeInconsistencyException.class, () -> loader.load("task_0", null));
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }

    @Test
    void concurrencyOverrideIsPersistedAndNothingElseChanges() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-resume-");
        try {
            Path tasksDir = root.resolve("tasks");
            LoopForgeRuntime runtime = TestTasks.runtime(tasksDir, new ScriptedExecutor(), null);
            runtime.createTask(TestTasks.request(root, TestTasks.writeInput(root, List.of("a.ts", "b.ts")), null, 2, 4));

            ResumeLoader loader = new ResumeLoader(TestTasks.config(tasksDir),
                    TaskRegistry.open(tasksDir.resolve("task_list.json")));
            LoadedTask loaded = loader.load("task_0", 1);

            Assertions.assertEquals(1, loaded.state().config().concurrency());
            TaskState onDisk = TaskStateStore.read(tasksDir.resolve("state_0.json"));
            Assertions.assertEquals(1, onDisk.config().concurrency());
            Assertions.assertEquals(2, onDisk.config().maxRetries());
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }

    @Test
    void resumeWithoutIncompleteTasksIsAnError() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-resume-");
        try {
            Path tasksDir = root.resolve("tasks");
            ResumeLoader loader = new ResumeLoader(TestTasks.config(tasksDir),
                    TaskRegistry.open(tasksDir.resolve("task_list.json")));
            Assertions.assertThrows(IllegalStateException.class, () -> loader.load(null, null));
            Assertions.assertThrows(IllegalArgumentException.class, () -> loader.load("task_7", null));
        } finally {
            TestTasks.deleteRecursively(root);
        }
    }
}
