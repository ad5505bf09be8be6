package io.loopforge.storage;

/**
 * A durable write or read of task records failed. Fatal to the run that hit it.
 */
public final class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
