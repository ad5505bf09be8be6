package io.loopforge.engine;

import io.loopforge.model.FileStatus;

public record Transition(FileStatus from, FileStatus to, int retryCount, boolean retryConsumed) {
    public boolean isCompletion() {
        return to == FileStatus.COMPLETED;
    }
}
