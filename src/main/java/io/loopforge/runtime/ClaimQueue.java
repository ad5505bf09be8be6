package io.loopforge.runtime;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Ready files in insertion order plus the set of files currently claimed by a worker.
 *
 * <p>A path is never ready and claimed at the same time, so no two workers hold the same file.
 * {@link #claim()} blocks while nothing is ready but other claims are outstanding, because a
 * released file may come back; it returns empty once the queue is drained or closed.
 */
public final class ClaimQueue {
    private final Deque<String> ready = new ArrayDeque<>();
    private final Set<String> claimed = new LinkedHashSet<>();
    private boolean closed;

    public ClaimQueue(Collection<String> paths) {
        for (String path : paths) {
            if (!ready.contains(path)) {
                ready.addLast(path);
            }
        }
    }

    public synchronized Optional<String> claim() throws InterruptedException {
        while (true) {
            if (closed) {
                return Optional.empty();
            }
            String next = ready.pollFirst();
            if (next != null) {
                claimed.add(next);
                return Optional.of(next);
            }
            if (claimed.isEmpty()) {
                return Optional.empty();
            }
            wait();
        }
    }

    /**
     * Gives a claim back. With {@code requeue} the file goes to the end of the ready set.
     */
    public synchronized void release(String path, boolean requeue) {
        if (!claimed.remove(path)) {
            throw new IllegalStateException("file is not claimed: " + path);
        }
        if (requeue && !closed) {
            ready.addLast(path);
        }
        notifyAll();
    }

    /**
     * Stops handing out claims. Outstanding claims can still be released.
     */
    public synchronized void close() {
        closed = true;
        notifyAll();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int claimedCount() {
        return claimed.size();
    }

    public synchronized int readyCount() {
        return ready.size();
    }
}
