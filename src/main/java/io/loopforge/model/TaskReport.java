package io.loopforge.model;

import java.util.List;

/**
 * Final per-file status of a task, printed at the end of a run and by {@code loopforge report}.
 */
public record TaskReport(
        String taskId,
        String stateFile,
        boolean done,
        StateSummary summary,
        List<FileLine> files
) {
    public static TaskReport of(TaskState state, String stateFile) {
        List<FileLine> lines = state.files().values().stream()
                .map(f -> new FileLine(f.path(), f.status().wireName(), f.retryCount(),
                        f.status() == FileStatus.FAILED ? f.lastError() : null))
                .toList();
        return new TaskReport(state.id(), stateFile, state.isDone(), state.summary(), lines);
    }

    public record FileLine(String path, String status, int retryCount, String lastError) {
    }
}
