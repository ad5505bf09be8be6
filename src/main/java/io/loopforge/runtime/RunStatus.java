package io.loopforge.runtime;

public enum RunStatus {
    /** Every file reached completed or failed. */
    DONE(0),
    /** The run ended normally with files left for a later resume, e.g. because of max_files. */
    PARTIAL(0),
    /** A worker hit an unexpected error and left its file unfinished. */
    WORKER_ERROR(1),
    PERSISTENCE_FAILED(2),
    RESUME_INCONSISTENT(3),
    INTERRUPTED(130);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
