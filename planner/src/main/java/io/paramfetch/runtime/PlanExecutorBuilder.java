package io.paramfetch.runtime;

import io.paramfetch.config.PlannerConfig;
import io.paramfetch.core.DbCoverageChecker;
import io.paramfetch.core.ExecutionSink;
import io.paramfetch.core.ProgressSink;
import io.paramfetch.error.ItemFailureLog;
import io.paramfetch.metrics.Metrics;
import io.paramfetch.retry.CooldownTimer;
import io.paramfetch.retry.RateLimitRetryPolicy;
import io.paramfetch.retry.ScheduledCooldownTimer;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public class PlanExecutorBuilder {
    private ExecutionSink sink;
    private ProgressSink progress = ProgressSink.NONE;
    private DbCoverageChecker dbCoverage;
    private ItemFailureLog failureLog;
    private RateLimitRetryPolicy retryPolicy = new RateLimitRetryPolicy(3, Duration.ofMinutes(61));
    private CooldownTimer cooldownTimer;
    private Clock clock = Clock.systemUTC();
    private Metrics metrics;

    public PlanExecutorBuilder sink(ExecutionSink s) { this.sink = s; return this; }
    public PlanExecutorBuilder progress(ProgressSink p) { this.progress = p; return this; }
    public PlanExecutorBuilder dbCoverage(DbCoverageChecker c) { this.dbCoverage = c; return this; }
    public PlanExecutorBuilder failureLog(ItemFailureLog f) { this.failureLog = f; return this; }
    public PlanExecutorBuilder retry(RateLimitRetryPolicy r) { this.retryPolicy = r; return this; }
    public PlanExecutorBuilder cooldownTimer(CooldownTimer t) { this.cooldownTimer = t; return this; }
    public PlanExecutorBuilder clock(Clock c) { this.clock = c; return this; }
    public PlanExecutorBuilder metrics(Metrics m) { this.metrics = m; return this; }

    public PlanExecutorBuilder config(PlannerConfig config) {
        this.retryPolicy = new RateLimitRetryPolicy(config.maxRateLimitRestarts(), Duration.ofMinutes(config.rateLimitCooldownMinutes()));
        return this;
    }

    public PlanExecutor build() {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(progress, "progress");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(clock, "clock");
        boolean owned = cooldownTimer == null;
        return new PlanExecutor(sink, progress, dbCoverage, failureLog, retryPolicy,
                owned ? new ScheduledCooldownTimer() : cooldownTimer, owned, clock, metrics);
    }
}
