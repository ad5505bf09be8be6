package io.loopforge.storage;

/**
 * Persisted records cannot be turned back into a runnable task: a registry entry points at a
 * missing or unreadable state file, or the state file contradicts its own configuration.
 */
public final class ResumeInconsistencyException extends RuntimeException {
    public ResumeInconsistencyException(String message) {
        super(message);
    }

    public ResumeInconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
