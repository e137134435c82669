package io.paramfetch.retry;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public interface CooldownTimer extends AutoCloseable {
    enum Outcome { EXPIRED, ABORTED }

    /** Blocks until {@code duration} has passed or {@code shouldStop} returns true. */
    Outcome await(Duration duration, BooleanSupplier shouldStop) throws InterruptedException;

    @Override default void close() {}
}
