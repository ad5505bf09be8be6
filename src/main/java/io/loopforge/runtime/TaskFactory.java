package io.loopforge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.loopforge.config.LoopForgeConfig;
import io.loopforge.model.FileState;
import io.loopforge.model.GitSettings;
import io.loopforge.model.GitState;
import io.loopforge.model.RegistryEntry;
import io.loopforge.model.TaskConfig;
import io.loopforge.model.TaskState;
import io.loopforge.storage.TaskRegistry;
import io.loopforge.storage.TaskStateStore;
import io.loopforge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a fresh task from an input mapping of file path to metadata and records it durably:
 * the all-pending state file first, then the registry entry pointing at it.
 */
public final class TaskFactory {
    private static final Logger log = LoggerFactory.getLogger(TaskFactory.class);
    private static final int DESCRIPTION_LIMIT = 50;

    private final LoopForgeConfig config;
    private final TaskRegistry registry;

    public TaskFactory(LoopForgeConfig config, TaskRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    public LoadedTask create(TaskRequest request) {
        if (request.inputFile() == null) {
            throw new IllegalArgumentException("input file is required");
        }
        Map<String, FileState> files = readInput(request.inputFile());
        String allowlist = request.allowlistPattern() == null || request.allowlistPattern().isBlank()
                ? LoopForgeConfig.DEFAULT_ALLOWLIST_PATTERN
                : request.allowlistPattern();
        TaskConfig taskConfig = new TaskConfig(
                request.inputFile().toString(),
                request.prompt(),
                request.fixupPrompt(),
                request.verifyCommand(),
                allowlist,
                request.maxRetries(),
                request.concurrency(),
                request.maxFiles(),
                request.git() == null ? GitSettings.disabled() : request.git()
        );
        if (taskConfig.fixupPrompt() != null && !taskConfig.hasVerifyCommand()) {
            log.warn("A fixup prompt without a verify command is never used");
        }
        Path workingDir = request.workingDir().toAbsolutePath().normalize();
        RegistryEntry entry = registry.allocate(workingDir.toString(), describe(taskConfig.prompt()));
        long now = System.currentTimeMillis();
        TaskState state = new TaskState(entry.taskId(), taskConfig, files, now, now, GitState.disabled());
        Path stateFile = config.stateFile(entry.stateFile());
        TaskStateStore.create(stateFile, state);
        registry.register(entry);
        log.info("Created task {} with {} files ({})", entry.taskId(), files.size(), stateFile);
        return new LoadedTask(entry, stateFile, state);
    }

    static Map<String, FileState> readInput(Path inputFile) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(Files.readString(inputFile));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read input file: " + inputFile, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Input file must be a JSON object mapping file paths to metadata: " + inputFile);
        }
        Map<String, FileState> files = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String path = field.getKey().trim();
            files.put(path, FileState.pending(path, field.getValue()));
        }
        if (files.isEmpty()) {
            throw new IllegalArgumentException("Input file lists no files: " + inputFile);
        }
        return files;
    }

    static String describe(String prompt) {
        String oneLine = prompt.strip().replaceAll("\\s+", " ");
        if (oneLine.length() <= DESCRIPTION_LIMIT) {
            return oneLine;
        }
        return oneLine.substring(0, DESCRIPTION_LIMIT - 3) + "...";
    }
}
