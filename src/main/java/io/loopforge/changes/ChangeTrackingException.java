package io.loopforge.changes;

public final class ChangeTrackingException extends RuntimeException {
    public ChangeTrackingException(String message) {
        super(message);
    }

    public ChangeTrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
