package io.loopforge.observability;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Per-file log of failed verifications and terminal errors under {@code failures/}, one file per
 * input file, so a human can see what the agent was asked to fix.
 */
public final class FailureLog {
    private static final String SEPARATOR = "=".repeat(72);

    private final Path root;

    public FailureLog(Path root) {
        this.root = root;
    }

    /**
     * Flat file name with {@code %}, {@code /} and {@code \} percent-escaped, so distinct paths never
     * share a log and no path can leave {@code failures/}.
     */
    public Path fileFor(String filePath) {
        String name = filePath.replace("%", "%25").replace("/", "%2F").replace("\\", "%5C");
        return root.resolve(name + ".log");
    }

    public synchronized void verifyFailed(String filePath, int attempt, String command, String output) {
        append(filePath, "verify attempt " + attempt + " failed\ncommand: " + command + "\n\n"
                + (output == null ? "" : output.strip()));
    }

    public synchronized void failed(String filePath, String error) {
        append(filePath, "file failed: " + error);
    }

    private void append(String filePath, String body) {
        Path target = fileFor(filePath);
        String entry = SEPARATOR + "\n" + Instant.now() + " " + filePath + "\n" + body + "\n";
        try {
            Files.createDirectories(root);
            Files.writeString(target, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write failure log: " + target, e);
        }
    }
}
