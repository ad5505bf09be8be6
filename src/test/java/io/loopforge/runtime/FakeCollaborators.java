package io.loopforge.runtime;

import io.loopforge.changes.ChangeTracker;
import io.loopforge.changes.NoopChangeTracker;
import io.loopforge.executor.StepExecutor;
import io.loopforge.model.GitSettings;

import java.nio.file.Path;

final class FakeCollaborators implements CollaboratorFactory {
    private final StepExecutor executor;
    private final ChangeTracker tracker;

    FakeCollaborators(StepExecutor executor, ChangeTracker tracker) {
        this.executor = executor;
        this.tracker = tracker == null ? NoopChangeTracker.INSTANCE : tracker;
    }

    @Override
    public StepExecutor executor(Path workingDir) {
        return executor;
    }

    @Override
    public ChangeTracker changeTracker(Path workingDir, GitSettings settings) {
        return settings.tracksChanges() ? tracker : NoopChangeTracker.INSTANCE;
    }
}
