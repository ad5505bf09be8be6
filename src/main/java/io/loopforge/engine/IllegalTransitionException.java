package io.loopforge.engine;

import io.loopforge.model.FileStatus;

public final class IllegalTransitionException extends IllegalStateException {
    public IllegalTransitionException(FileStatus status, StepOutcome outcome, String detail) {
        super("No transition from " + status.wireName() + " on " + outcome + ": " + detail);
    }
}
