package io.loopforge.observability;

import io.loopforge.engine.Transition;
import io.loopforge.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSON-lines record of every persisted status change, shared by all tasks of a
 * tasks directory. Informational: the state file stays the source of truth.
 */
public final class TransitionJournal {
    private final Path journalFile;

    public TransitionJournal(Path journalFile) {
        this.journalFile = journalFile;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another run created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize transition journal: " + journalFile, e);
        }
    }

    public Path file() {
        return journalFile;
    }

    public synchronized void record(String taskId, String worker, String filePath, Transition transition, String detail) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("task_id", taskId);
        row.put("worker", worker);
        row.put("file", filePath);
        row.put("from", transition.from().wireName());
        row.put("to", transition.to().wireName());
        row.put("retry_count", transition.retryCount());
        if (detail != null && !detail.isBlank()) {
            row.put("detail", detail);
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write transition journal", e);
        }
    }
}
