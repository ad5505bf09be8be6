package io.loopforge.runtime;

import io.loopforge.changes.ChangeTracker;
import io.loopforge.changes.GitChangeTracker;
import io.loopforge.changes.NoopChangeTracker;
import io.loopforge.executor.CommandStepExecutor;
import io.loopforge.executor.StepExecutor;
import io.loopforge.model.GitSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Child-process executor and git-backed change tracking.
 */
public final class DefaultCollaborators implements CollaboratorFactory {
    private static final Logger log = LoggerFactory.getLogger(DefaultCollaborators.class);

    private final List<String> agentCommand;
    private final long stepTimeoutMs;

    public DefaultCollaborators(List<String> agentCommand, long stepTimeoutMs) {
        this.agentCommand = agentCommand == null || agentCommand.isEmpty()
                ? CommandStepExecutor.DEFAULT_AGENT_COMMAND
                : List.copyOf(agentCommand);
        this.stepTimeoutMs = stepTimeoutMs;
    }

    @Override
    public StepExecutor executor(Path workingDir) {
        return new CommandStepExecutor(agentCommand, workingDir, stepTimeoutMs);
    }

    @Override
    public ChangeTracker changeTracker(Path workingDir, GitSettings settings) {
        if (settings == null || !settings.tracksChanges()) {
            return NoopChangeTracker.INSTANCE;
        }
        if (!GitChangeTracker.isRepository(workingDir)) {
            log.warn("Git features requested but {} is not a git repository; change tracking disabled", workingDir);
            return NoopChangeTracker.INSTANCE;
        }
        return new GitChangeTracker(workingDir);
    }
}
