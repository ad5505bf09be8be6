package io.loopforge.executor;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the agent and verify commands as child processes in the working directory.
 *
 * <p>The agent command is an argument list in which the token {@code {prompt}} is replaced by the
 * full prompt text. Verify commands go through {@code sh -c}. Output is spooled to a temp file so
 * a chatty child can never block on a full pipe.
 */
public final class CommandStepExecutor implements StepExecutor {
    public static final List<String> DEFAULT_AGENT_COMMAND =
            List.of("claude", "-p", "{prompt}", "--dangerously-skip-permissions");

    private final List<String> agentCommand;
    private final Path workingDir;
    private final long timeoutMs;

    public CommandStepExecutor(List<String> agentCommand, Path workingDir, long timeoutMs) {
        if (agentCommand == null || agentCommand.isEmpty()) {
            throw new IllegalArgumentException("agent command cannot be empty");
        }
        this.agentCommand = List.copyOf(agentCommand);
        this.workingDir = workingDir;
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public ExecutionResult run(String prompt, String filePath, JsonNode metadata) throws ExecutorException {
        List<String> command = new ArrayList<>(agentCommand.size());
        for (String arg : agentCommand) {
            command.add(arg.replace("{prompt}", prompt));
        }
        ExecutionResult result = execute(command);
        if (result == null) {
            throw new ExecutorException("agent timeout after " + Duration.ofMillis(timeoutMs) + " for " + filePath);
        }
        return result;
    }

    @Override
    public ExecutionResult verify(String command) throws ExecutorException {
        ExecutionResult result = execute(List.of("sh", "-c", command));
        if (result == null) {
            return ExecutionResult.fail(-1, "verify timeout after " + Duration.ofMillis(timeoutMs) + ": " + command);
        }
        return result;
    }

    /**
     * @return the result, or {@code null} when the process had to be killed after the timeout
     */
    private ExecutionResult execute(List<String> command) throws ExecutorException {
        Path spool;
        try {
            spool = Files.createTempFile("loopforge-step-", ".out");
        } catch (IOException e) {
            throw new ExecutorException("cannot create output spool file", e);
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDir.toFile());
            pb.redirectErrorStream(true);
            pb.redirectOutput(spool.toFile());
            pb.redirectInput(ProcessBuilder.Redirect.from(new File(nullDevice())));
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new ExecutorException("spawn failed for " + command.get(0) + ": " + e.getMessage(), e);
            }
            try {
                boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                    return null;
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new ExecutorException("interrupted while waiting for " + command.get(0), e);
            }
            String output = Files.readString(spool, StandardCharsets.UTF_8);
            int exit = process.exitValue();
            return exit == 0 ? ExecutionResult.ok(output) : ExecutionResult.fail(exit, output);
        } catch (IOException e) {
            throw new ExecutorException("cannot read output of " + command.get(0), e);
        } finally {
            try {
                Files.deleteIfExists(spool);
            } catch (IOException ignored) {
                // Temp spool; the OS cleans the temp dir eventually.
            }
        }
    }

    private static String nullDevice() {
        return System.getProperty("os.name", "").toLowerCase().contains("win") ? "NUL" : "/dev/null";
    }
}
