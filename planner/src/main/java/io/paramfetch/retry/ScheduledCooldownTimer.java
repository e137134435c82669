package io.paramfetch.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Countdown driven by a private daemon scheduler: one task fires at expiry, another polls the abort
 * predicate every {@code tick}. Both are cancelled once the latch opens.
 */
public class ScheduledCooldownTimer implements CooldownTimer {
    private static final Logger log = LoggerFactory.getLogger(ScheduledCooldownTimer.class);

    private final ScheduledExecutorService scheduler;
    private final Duration tick;

    public ScheduledCooldownTimer() {
        this(Duration.ofSeconds(1));
    }

    public ScheduledCooldownTimer(Duration tick) {
        this.tick = tick;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "paramfetch-cooldown");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Outcome await(Duration duration, BooleanSupplier shouldStop) throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        AtomicBoolean aborted = new AtomicBoolean(false);
        ScheduledFuture<?> expiry = scheduler.schedule(done::countDown, duration.toMillis(), TimeUnit.MILLISECONDS);
        ScheduledFuture<?> poll = scheduler.scheduleAtFixedRate(() -> {
            if (shouldStop.getAsBoolean()) {
                aborted.set(true);
                done.countDown();
            }
        }, 0, Math.max(1, tick.toMillis()), TimeUnit.MILLISECONDS);
        log.info("cooldown started: {} minutes", duration.toMinutes());
        try {
            done.await();
        } finally {
            expiry.cancel(false);
            poll.cancel(false);
        }
        Outcome outcome = aborted.get() ? Outcome.ABORTED : Outcome.EXPIRED;
        log.info("cooldown finished: {}", outcome);
        return outcome;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
