package io.loopforge.runtime;

import io.loopforge.model.TaskReport;

public record RunOutcome(RunStatus status, TaskReport report, String error) {
    public int exitCode() {
        return status.exitCode();
    }
}
