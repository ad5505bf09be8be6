package io.loopforge.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.loopforge.changes.ChangeTracker;
import io.loopforge.changes.NoopChangeTracker;
import io.loopforge.executor.ExecutionResult;
import io.loopforge.executor.StepExecutor;
import io.loopforge.model.FileStatus;
import io.loopforge.model.GitSettings;
import io.loopforge.runtime.CollaboratorFactory;
import io.loopforge.storage.TaskStateStore;
import io.loopforge.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class LoopForgeCommandTest {

    @Test
    void dryRunRecordsTaskWithoutRunningAnything() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-cli-");
        try {
            AtomicInteger calls = new AtomicInteger(0);
            Path input = writeInput(root);

            Captured result = execute(calls, "--tasks-dir", root.resolve("tasks").toString(),
                    "run", "--input", input.toString(), "--prompt", "Add tests",
                    "--working-dir", root.toString(), "--dry-run");

            Assertions.assertEquals(0, result.code());
            Assertions.assertEquals(0, calls.get());
            JsonNode out = Jsons.mapper().readTree(result.stdout());
            Assertions.assertEquals("task_0", out.path("task_id").asText());
            Assertions.assertEquals(2, out.path("files").asInt());
            Assertions.assertTrue(TaskStateStore.read(root.resolve("tasks").resolve("state_0.json"))
                    .files().values().stream().allMatch(f -> f.status() == FileStatus.PENDING));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runListsAndReportsTask() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-cli-");
        try {
            AtomicInteger calls = new AtomicInteger(0);
            Path input = writeInput(root);
            String tasksDir = root.resolve("tasks").toString();

            Captured run = execute(calls, "--tasks-dir", tasksDir, "run", "--input", input.toString(),
                    "--prompt", "Add tests", "--verify", "true", "--concurrency", "2",
                    "--working-dir", root.toString(), "--memory-high", "0");
            Assertions.assertEquals(0, run.code());
            Assertions.assertEquals("done", Jsons.mapper().readTree(run.stdout()).path("status").asText());
            Assertions.assertEquals(4, calls.get());

            Captured tasks = execute(calls, "--tasks-dir", tasksDir, "tasks");
            Assertions.assertEquals(0, tasks.code());
            JsonNode entries = Jsons.mapper().readTree(tasks.stdout());
            Assertions.assertEquals("completed", entries.get(0).path("status").asText());
            Assertions.assertEquals("Add tests", entries.get(0).path("description").asText());

            Captured report = execute(calls, "--tasks-dir", tasksDir, "report", "task_0");
            Assertions.assertEquals(0, report.code());
            JsonNode files = Jsons.mapper().readTree(report.stdout()).path("files");
            Assertions.assertEquals("completed", files.get(0).path("status").asText());
            Assertions.assertEquals("a.ts", files.get(0).path("path").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resumeOfBrokenTaskExitsWithInconsistencyCode() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-cli-");
        try {
            AtomicInteger calls = new AtomicInteger(0);
            Path input = writeInput(root);
            String tasksDir = root.resolve("tasks").toString();
            execute(calls, "--tasks-dir", tasksDir, "run", "--input", input.toString(),
                    "--prompt", "Add tests", "--working-dir", root.toString(), "--dry-run");
            Files.delete(root.resolve("tasks").resolve("state_0.json"));

            Captured resume = execute(calls, "--tasks-dir", tasksDir, "resume", "--memory-high", "0");

            Assertions.assertEquals(3, resume.code());
            Assertions.assertEquals(0, calls.get());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownTaskReportIsAnError() throws Exception {
        Path root = Files.createTempDirectory("loopforge-test-cli-");
        try {
            Captured report = execute(new AtomicInteger(0), "--tasks-dir", root.resolve("tasks").toString(),
                    "report", "task_4");
            Assertions.assertEquals(1, report.code());
            Assertions.assertEquals("Unknown task: task_4",
                    Jsons.mapper().readTree(report.stdout()).path("error").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Captured execute(AtomicInteger calls, String... args) {
        LoopForgeCommand command = new LoopForgeCommand();
        command.collaborators = new CountingCollaborators(calls);
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int code;
        try {
            System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
            code = new CommandLine(command).execute(args);
        } finally {
            System.setOut(original);
        }
        return new Captured(code, buffer.toString(StandardCharsets.UTF_8));
    }

    private static Path writeInput(Path root) throws IOException {
        Path input = root.resolve("input.json");
        Files.writeString(input, "{\"a.ts\": {\"coverage\": 10}, \"b.ts\": null}");
        return input;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private record Captured(int code, String stdout) {
    }

    private static final class CountingCollaborators implements CollaboratorFactory {
        private final AtomicInteger calls;

        CountingCollaborators(AtomicInteger calls) {
            this.calls = calls;
        }

        @Override
        public StepExecutor executor(Path workingDir) {
            return new StepExecutor() {
                @Override
                public ExecutionResult run(String prompt, String filePath, JsonNode metadata) {
                    calls.incrementAndGet();
                    return ExecutionResult.ok("RESULT: \"done\"");
                }

                @Override
                public ExecutionResult verify(String command) {
                    calls.incrementAndGet();
                    return ExecutionResult.ok("");
                }
            };
        }

        @Override
        public ChangeTracker changeTracker(Path workingDir, GitSettings settings) {
            return NoopChangeTracker.INSTANCE;
        }
    }
}
