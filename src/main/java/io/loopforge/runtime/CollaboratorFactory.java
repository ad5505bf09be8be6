package io.loopforge.runtime;

import io.loopforge.changes.ChangeTracker;
import io.loopforge.executor.StepExecutor;
import io.loopforge.model.GitSettings;

import java.nio.file.Path;

/**
 * Supplies the external collaborators for a task's working directory.
 */
public interface CollaboratorFactory {
    StepExecutor executor(Path workingDir);

    ChangeTracker changeTracker(Path workingDir, GitSettings settings);
}
