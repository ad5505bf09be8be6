package io.loopforge.changes;

/**
 * Opaque marker returned by {@link ChangeTracker#checkpoint()}; only the tracker that issued it
 * knows what the sequence means.
 */
public record ChangeCheckpoint(long sequence) {
}
