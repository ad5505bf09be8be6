package io.loopforge.cli;

import io.loopforge.config.LoopForgeConfig;
import io.loopforge.model.GitSettings;
import io.loopforge.model.RegistryEntry;
import io.loopforge.model.TaskReport;
import io.loopforge.runtime.CollaboratorFactory;
import io.loopforge.runtime.DefaultCollaborators;
import io.loopforge.runtime.LoadedTask;
import io.loopforge.runtime.LoopForgeRuntime;
import io.loopforge.runtime.RunOutcome;
import io.loopforge.runtime.RunStatus;
import io.loopforge.runtime.TaskRequest;
import io.loopforge.storage.PersistenceException;
import io.loopforge.storage.ResumeInconsistencyException;
import io.loopforge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Command(
        name = "loopforge",
        mixinStandardHelpOptions = true,
        description = "Drive many files through a prompt, verify and fixup loop with resumable state",
        subcommands = {
                LoopForgeCommand.RunCommand.class,
                LoopForgeCommand.ResumeCommand.class,
                LoopForgeCommand.TasksCommand.class,
                LoopForgeCommand.ReportCommand.class
        }
)
public final class LoopForgeCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(LoopForgeCommand.class);

    @Option(names = {"--tasks-dir"}, description = "Directory holding the task registry and state files",
            defaultValue = LoopForgeConfig.DEFAULT_TASKS_DIR)
    String tasksDir;

    /**
     * Replaces the child-process executor and git tracking; null means the defaults.
     */
    CollaboratorFactory collaborators;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | resume | tasks | report");
    }

    LoopForgeRuntime runtime(ExecutionOptions options) {
        LoopForgeConfig config = LoopForgeConfig.fromRoot(tasksDir);
        CollaboratorFactory effective = collaborators != null
                ? collaborators
                : new DefaultCollaborators(options.agentCommandLine(), options.stepTimeoutMs);
        return new LoopForgeRuntime(config, effective, options.memoryGate());
    }

    @Command(name = "run", description = "Create a task from an input mapping and process it")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        LoopForgeCommand parent;

        @Mixin
        ExecutionOptions execution = new ExecutionOptions();

        @Option(names = {"--input"}, required = true, description = "JSON object mapping file paths to metadata")
        Path input;

        @Option(names = {"--prompt"}, required = true, description = "Prompt template for each file")
        String prompt;

        @Option(names = {"--fixup"}, description = "Prompt template used after a failed verification")
        String fixup;

        @Option(names = {"--verify"}, description = "Verify command template; omit to complete files after the prompt")
        String verify;

        @Option(names = {"--allowlist"}, defaultValue = LoopForgeConfig.DEFAULT_ALLOWLIST_PATTERN,
                description = "Pattern of files a worker may change")
        String allowlist;

        @Option(names = {"--concurrency"}, defaultValue = "" + LoopForgeConfig.DEFAULT_CONCURRENCY,
                description = "Number of workers")
        int concurrency;

        @Option(names = {"--max-retries"}, defaultValue = "" + LoopForgeConfig.DEFAULT_MAX_RETRIES,
                description = "Fixup attempts per file after failed verifications")
        int maxRetries;

        @Option(names = {"--max-files"}, description = "Process at most this many files in this run")
        Integer maxFiles;

        @Option(names = {"--working-dir"}, defaultValue = ".", description = "Directory the agent and verify commands run in")
        Path workingDir;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Create the task record and exit")
        boolean dryRun;

        @Option(names = {"--git"}, defaultValue = "false", description = "Track changes with git and reject unauthorized ones")
        boolean git;

        @Option(names = {"--git-branch"}, defaultValue = "false", description = "Work on a new task branch")
        boolean gitBranch;

        @Option(names = {"--git-commit"}, defaultValue = "false", description = "Commit each completed file")
        boolean gitCommit;

        @Option(names = {"--git-commit-message"}, defaultValue = LoopForgeConfig.DEFAULT_COMMIT_MESSAGE,
                description = "Commit message template; supports {file}, {file_stem}, {file_dir}, {task_id}")
        String gitCommitMessage;

        @Override
        public Integer call() {
            return guarded(() -> {
                LoopForgeRuntime runtime = parent.runtime(execution);
                TaskRequest request = new TaskRequest(
                        input,
                        workingDir,
                        prompt,
                        fixup,
                        verify,
                        allowlist,
                        maxRetries,
                        concurrency,
                        maxFiles,
                        new GitSettings(git || gitBranch || gitCommit, gitBranch, gitCommit, gitCommitMessage)
                );
                LoadedTask task = runtime.createTask(request);
                if (dryRun) {
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("task_id", task.taskId());
                    out.put("state_file", task.stateFile().toString());
                    out.put("files", task.state().files().size());
                    out.put("dry_run", true);
                    System.out.println(Jsons.toJson(out));
                    return 0;
                }
                return supervised(runtime, execution.gracefulTimeoutMs, () -> runtime.run(task));
            });
        }
    }

    @Command(name = "resume", description = "Resume a task by id, or the first incomplete task")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        LoopForgeCommand parent;

        @Mixin
        ExecutionOptions execution = new ExecutionOptions();

        @Parameters(index = "0", arity = "0..1", description = "Task id")
        String taskId;

        @Option(names = {"--concurrency"}, description = "Override the persisted number of workers")
        Integer concurrency;

        @Override
        public Integer call() {
            return guarded(() -> {
                LoopForgeRuntime runtime = parent.runtime(execution);
                return supervised(runtime, execution.gracefulTimeoutMs, () -> runtime.resume(taskId, concurrency));
            });
        }
    }

    @Command(name = "tasks", description = "List tasks in the registry")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        LoopForgeCommand parent;

        @Override
        public Integer call() {
            return guarded(() -> {
                List<RegistryEntry> entries = parent.runtime(new ExecutionOptions()).tasks();
                System.out.println(Jsons.toJson(entries));
                return 0;
            });
        }
    }

    @Command(name = "report", description = "Show per-file status and last error of a task")
    static final class ReportCommand implements Callable<Integer> {
        @ParentCommand
        LoopForgeCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            return guarded(() -> {
                TaskReport report = parent.runtime(new ExecutionOptions()).report(taskId);
                System.out.println(Jsons.toJson(report));
                return 0;
            });
        }
    }

    /**
     * Runs a task with a shutdown hook that stops claiming and waits for running steps.
     */
    static int supervised(LoopForgeRuntime runtime, long gracefulTimeoutMs, Supplier<RunOutcome> body) {
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            log.warn("Interrupt received, finishing running steps");
            runtime.requestStop();
            try {
                if (!finished.await(gracefulTimeoutMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Running steps did not finish within {} ms", gracefulTimeoutMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "loopforge-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        RunOutcome outcome;
        try {
            outcome = body.get();
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ignored) {
                // JVM is already shutting down; the hook is running.
            }
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", outcome.status().name().toLowerCase(Locale.ROOT));
        if (outcome.error() != null) {
            out.put("error", outcome.error());
        }
        if (outcome.report() != null) {
            out.put("report", outcome.report());
        }
        System.out.println(Jsons.toJson(out));
        return outcome.exitCode();
    }

    static int guarded(Callable<Integer> body) {
        try {
            return body.call();
        } catch (ResumeInconsistencyException e) {
            return fail(e.getMessage(), RunStatus.RESUME_INCONSISTENT.exitCode());
        } catch (PersistenceException e) {
            return fail(e.getMessage(), RunStatus.PERSISTENCE_FAILED.exitCode());
        } catch (IllegalArgumentException | IllegalStateException e) {
            return fail(e.getMessage(), 1);
        } catch (Exception e) {
            log.error("Command failed", e);
            return fail(e.getMessage(), 1);
        }
    }

    private static int fail(String message, int code) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message == null ? "unknown error" : message);
        System.out.println(Jsons.toJson(out));
        return code;
    }
}
