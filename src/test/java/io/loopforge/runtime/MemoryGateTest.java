package io.loopforge.runtime;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

final class MemoryGateTest {

    @Test
    void pausesAtHighWaterAndResumesBelowLowWater() {
        AtomicReference<Double> usage = new AtomicReference<>(50.0d);
        MemoryGate gate = new MemoryGate(85.0d, 70.0d, 10L, usage::get);

        Assertions.assertTrue(gate.admits());
        usage.set(90.0d);
        Assertions.assertFalse(gate.admits());
        usage.set(80.0d);
        Assertions.assertFalse(gate.admits());
        usage.set(69.0d);
        Assertions.assertTrue(gate.admits());
        usage.set(80.0d);
        Assertions.assertTrue(gate.admits());
    }

    @Test
    void zeroHighWaterMarkDisablesTheGate() {
        MemoryGate gate = new MemoryGate(0.0d, 0.0d, 10L, () -> 99.0d);
        Assertions.assertFalse(gate.enabled());
        Assertions.assertTrue(gate.admits());
        Assertions.assertTrue(MemoryGate.disabled().admits());
    }

    @Test
    void awaitCapacityReturnsWhenStopped() throws Exception {
        MemoryGate gate = new MemoryGate(50.0d, 40.0d, 10L, () -> 99.0d);
        gate.awaitCapacity(() -> true);
        Assertions.assertFalse(gate.admits());
    }

    @Test
    void lowWaterMarkAboveHighIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new MemoryGate(60.0d, 70.0d, 10L, () -> 0.0d));
    }

    @Test
    void systemUsageIsAPercentage() {
        double usage = MemoryGate.systemUsagePercent();
        Assertions.assertTrue(usage >= 0.0d && usage <= 100.0d, "usage " + usage);
    }
}
