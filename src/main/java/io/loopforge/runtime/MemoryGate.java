package io.loopforge.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleSupplier;

/**
 * Holds back new claims while system memory is scarce.
 *
 * <p>Claims pause once usage reaches the high-water mark and resume only after it drops below the
 * low-water mark. A high-water mark of zero disables the gate.
 */
public final class MemoryGate {
    private static final Logger log = LoggerFactory.getLogger(MemoryGate.class);

    private final double highPercent;
    private final double lowPercent;
    private final long checkIntervalMs;
    private final DoubleSupplier usagePercent;
    private boolean paused;

    public MemoryGate(double highPercent, double lowPercent, long checkIntervalMs) {
        this(highPercent, lowPercent, checkIntervalMs, MemoryGate::systemUsagePercent);
    }

    MemoryGate(double highPercent, double lowPercent, long checkIntervalMs, DoubleSupplier usagePercent) {
        if (highPercent < 0.0d || highPercent > 100.0d) {
            throw new IllegalArgumentException("memory high-water mark must be within [0, 100], got " + highPercent);
        }
        if (highPercent > 0.0d && (lowPercent < 0.0d || lowPercent > highPercent)) {
            throw new IllegalArgumentException("memory low-water mark must be within [0, " + highPercent + "], got " + lowPercent);
        }
        this.highPercent = highPercent;
        this.lowPercent = lowPercent;
        this.checkIntervalMs = Math.max(10L, checkIntervalMs);
        this.usagePercent = usagePercent;
    }

    public static MemoryGate disabled() {
        return new MemoryGate(0.0d, 0.0d, 1_000L, () -> 0.0d);
    }

    public boolean enabled() {
        return highPercent > 0.0d;
    }

    public synchronized boolean admits() {
        if (!enabled()) {
            return true;
        }
        double usage = usagePercent.getAsDouble();
        if (paused) {
            if (usage < lowPercent) {
                paused = false;
                log.info("Memory usage {}% below {}%, resuming claims", round(usage), round(lowPercent));
            }
        } else if (usage >= highPercent) {
            paused = true;
            log.warn("Memory usage {}% at or above {}%, pausing new claims", round(usage), round(highPercent));
        }
        return !paused;
    }

    /**
     * Blocks until a claim is admitted or {@code stop} turns true.
     */
    public void awaitCapacity(BooleanSupplier stop) throws InterruptedException {
        while (!stop.getAsBoolean() && !admits()) {
            Thread.sleep(checkIntervalMs);
        }
    }

    static double systemUsagePercent() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean sun = (com.sun.management.OperatingSystemMXBean) os;
            long total = sun.getTotalMemorySize();
            if (total <= 0L) {
                return 0.0d;
            }
            long free = sun.getFreeMemorySize();
            return 100.0d * (total - free) / total;
        }
        return 0.0d;
    }

    private static double round(double value) {
        return Math.round(value * 10.0d) / 10.0d;
    }
}
