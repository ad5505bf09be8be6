package io.loopforge.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * On-disk layout of one tasks directory.
 *
 * <p>Every task created from the same working directory shares the registry file;
 * each task owns one state file next to it.
 */
public final class LoopForgeConfig {
    public static final String DEFAULT_TASKS_DIR = "loopforge-tasks";
    public static final String DEFAULT_ALLOWLIST_PATTERN = "{file_stem}*";
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_STEP_TIMEOUT_MS = 30L * 60L * 1_000L;
    public static final long DEFAULT_GRACEFUL_TIMEOUT_MS = 10L * 60L * 1_000L;
    public static final double DEFAULT_MEMORY_HIGH_PERCENT = 85.0d;
    public static final double DEFAULT_MEMORY_LOW_PERCENT = 70.0d;
    public static final long DEFAULT_MEMORY_CHECK_INTERVAL_MS = 2_000L;
    public static final String DEFAULT_FIXUP_PROMPT = "Fix the issues with the file";
    public static final String DEFAULT_COMMIT_MESSAGE = "loopforge: {file} ({task_id})";

    private final Path tasksDir;

    public LoopForgeConfig(Path tasksDir) {
        this.tasksDir = tasksDir;
    }

    public static LoopForgeConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_TASKS_DIR)
                : Paths.get(root);
        return new LoopForgeConfig(resolved.toAbsolutePath().normalize());
    }

    public Path tasksDir() {
        return tasksDir;
    }

    public Path registryFile() {
        return tasksDir.resolve("task_list.json");
    }

    public Path stateFile(String fileName) {
        return tasksDir.resolve(fileName);
    }

    public Path journalRoot() {
        return tasksDir.resolve("journal");
    }

    public Path journalFile() {
        return journalRoot().resolve("transitions.jsonl");
    }

    public Path failuresRoot() {
        return tasksDir.resolve("failures");
    }
}
