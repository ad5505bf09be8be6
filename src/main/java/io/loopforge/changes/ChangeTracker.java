package io.loopforge.changes;

import java.util.Optional;
import java.util.Set;

/**
 * Source of "which paths changed" facts for the authorization guard, plus optional
 * per-file commits. Implementations must tolerate concurrent calls from workers.
 */
public interface ChangeTracker {
    boolean enabled();

    /**
     * Paths already dirty before any processing; exempt from authorization checks.
     */
    Set<String> captureBaseline();

    ChangeCheckpoint checkpoint();

    /**
     * Paths modified since the checkpoint. A tracker that cannot attribute changes to a point in
     * time may report every modified path; the baseline and allowlists narrow it down.
     */
    Set<String> diffSince(ChangeCheckpoint checkpoint);

    /**
     * @return commit identifier, or empty when there was nothing to commit
     */
    Optional<String> commit(String filePath, String message);

    Optional<String> currentBranch();

    String createTaskBranch(String taskId);

    /**
     * Same tracker, with paths that were dirty before the task started excluded from commits.
     */
    default ChangeTracker withBaseline(Set<String> baseline) {
        return this;
    }
}
