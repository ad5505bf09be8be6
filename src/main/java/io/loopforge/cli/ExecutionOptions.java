package io.loopforge.cli;

import io.loopforge.config.LoopForgeConfig;
import io.loopforge.executor.CommandStepExecutor;
import io.loopforge.runtime.MemoryGate;
import picocli.CommandLine.Option;

import java.util.Arrays;
import java.util.List;

/**
 * Process-level knobs shared by {@code run} and {@code resume}; never persisted with a task.
 */
final class ExecutionOptions {
    @Option(names = {"--agent-command"},
            description = "Agent command line; {prompt} is replaced by the prompt text (default: claude -p {prompt} --dangerously-skip-permissions)")
    String agentCommand;

    @Option(names = {"--step-timeout-ms"}, defaultValue = "" + LoopForgeConfig.DEFAULT_STEP_TIMEOUT_MS,
            description = "Timeout for one agent or verify command")
    long stepTimeoutMs;

    @Option(names = {"--graceful-timeout-ms"}, defaultValue = "" + LoopForgeConfig.DEFAULT_GRACEFUL_TIMEOUT_MS,
            description = "How long an interrupt waits for running steps to finish")
    long gracefulTimeoutMs;

    @Option(names = {"--memory-high"}, defaultValue = "" + LoopForgeConfig.DEFAULT_MEMORY_HIGH_PERCENT,
            description = "Pause new claims at this system memory usage percent; 0 disables")
    double memoryHighPercent;

    @Option(names = {"--memory-low"}, defaultValue = "" + LoopForgeConfig.DEFAULT_MEMORY_LOW_PERCENT,
            description = "Resume claims below this system memory usage percent")
    double memoryLowPercent;

    List<String> agentCommandLine() {
        if (agentCommand == null || agentCommand.isBlank()) {
            return CommandStepExecutor.DEFAULT_AGENT_COMMAND;
        }
        return Arrays.asList(agentCommand.trim().split("\\s+"));
    }

    MemoryGate memoryGate() {
        if (memoryHighPercent <= 0.0d) {
            return MemoryGate.disabled();
        }
        return new MemoryGate(memoryHighPercent, memoryLowPercent, LoopForgeConfig.DEFAULT_MEMORY_CHECK_INTERVAL_MS);
    }
}
