package io.loopforge.changes;

import java.util.Optional;
import java.util.Set;

public final class NoopChangeTracker implements ChangeTracker {
    public static final NoopChangeTracker INSTANCE = new NoopChangeTracker();

    private static final ChangeCheckpoint CHECKPOINT = new ChangeCheckpoint(0L);

    private NoopChangeTracker() {
    }

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public Set<String> captureBaseline() {
        return Set.of();
    }

    @Override
    public ChangeCheckpoint checkpoint() {
        return CHECKPOINT;
    }

    @Override
    public Set<String> diffSince(ChangeCheckpoint checkpoint) {
        return Set.of();
    }

    @Override
    public Optional<String> commit(String filePath, String message) {
        return Optional.empty();
    }

    @Override
    public Optional<String> currentBranch() {
        return Optional.empty();
    }

    @Override
    public String createTaskBranch(String taskId) {
        throw new ChangeTrackingException("change tracking is disabled; cannot create branch for " + taskId);
    }
}
