package io.paramfetch.retry;

import java.time.Duration;

/**
 * Restarts an item after a fixed cooldown when the failure is a rate limit. {@code attempt} counts
 * restarts already made for the item, starting at 1 for the first failure.
 */
public class RateLimitRetryPolicy implements RetryPolicy {
    private final int maxRestarts;
    private final long cooldownMillis;

    public RateLimitRetryPolicy(int maxRestarts, Duration cooldown) {
        this.maxRestarts = Math.max(0, maxRestarts);
        this.cooldownMillis = Math.max(0, cooldown.toMillis());
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt <= maxRestarts && RateLimitDetector.isRateLimit(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        return cooldownMillis;
    }

    public int maxRestarts() { return maxRestarts; }
}
