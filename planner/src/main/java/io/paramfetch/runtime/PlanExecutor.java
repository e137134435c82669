package io.paramfetch.runtime;

import com.codahale.metrics.Timer;
import io.paramfetch.core.DbCoverageChecker;
import io.paramfetch.core.ExecutionOutcome;
import io.paramfetch.core.ExecutionProgress;
import io.paramfetch.core.ExecutionRequest;
import io.paramfetch.core.ExecutionSink;
import io.paramfetch.core.ProgressSink;
import io.paramfetch.dsl.DslParseException;
import io.paramfetch.dsl.QueryConstraints;
import io.paramfetch.error.ItemFailureLog;
import io.paramfetch.metrics.Metrics;
import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.Classification;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.FetchPlan;
import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.FetchWindow;
import io.paramfetch.model.ItemType;
import io.paramfetch.model.TemporalMode;
import io.paramfetch.plan.FetchPlans;
import io.paramfetch.retry.CooldownTimer;
import io.paramfetch.retry.RateLimitDetector;
import io.paramfetch.retry.RateLimitRetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs a plan item by item against an {@link ExecutionSink}. Items sharing a scope (parameter, mode,
 * slice family, signature) reuse one retrieval timestamp. A rate limit in automated mode waits out a
 * cooldown and restarts the scope with a fresh timestamp and a cache bust; in manual mode it aborts.
 */
public class PlanExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    private final ExecutionSink sink;
    private final ProgressSink progress;
    private final DbCoverageChecker dbCoverage;
    private final ItemFailureLog failureLog;
    private final RateLimitRetryPolicy retryPolicy;
    private final CooldownTimer cooldownTimer;
    private final boolean ownsTimer;
    private final Clock clock;
    private final Metrics metrics;

    PlanExecutor(ExecutionSink sink, ProgressSink progress, DbCoverageChecker dbCoverage, ItemFailureLog failureLog,
                 RateLimitRetryPolicy retryPolicy, CooldownTimer cooldownTimer, boolean ownsTimer, Clock clock, Metrics metrics) {
        this.sink = sink;
        this.progress = progress;
        this.dbCoverage = dbCoverage;
        this.failureLog = failureLog;
        this.retryPolicy = retryPolicy;
        this.cooldownTimer = cooldownTimer;
        this.ownsTimer = ownsTimer;
        this.clock = clock;
        this.metrics = metrics;
    }

    public static PlanExecutorBuilder builder() { return new PlanExecutorBuilder(); }

    /** Stops the cooldown scheduler when this executor created it; a timer passed to the builder is left open. */
    @Override
    public void close() {
        if (ownsTimer) cooldownTimer.close();
    }

    CooldownTimer cooldownTimer() { return cooldownTimer; }

    private static final class Tally {
        int success, errors, cacheHits, apiFetches, restarts;
        long days;
        boolean aborted;
        String abortReason;

        ExecutionResult result() {
            return new ExecutionResult(success, errors, cacheHits, apiFetches, days, aborted, restarts, abortReason);
        }
    }

    public ExecutionResult execute(FetchPlan plan, ExecutionOptions options) {
        Map<String, Instant> batchAtByScope = new HashMap<>();
        Set<String> bustedScopes = new HashSet<>();
        Tally tally = new Tally();
        DateRange window = requestedWindow(plan);
        List<FetchPlanItem> items = plan.items();
        int restartsForItem = 0;

        for (int i = 0; i < items.size(); i++) {
            if (options.shouldAbort().getAsBoolean()) {
                tally.aborted = true;
                tally.abortReason = "aborted before " + items.get(i).itemKey();
                break;
            }
            FetchPlanItem item = widen(items.get(i), window);
            int index = i + 1;

            if (item.classification() == Classification.COVERED) {
                tally.cacheHits++;
                count(Metrics.EXEC_CACHE_HITS, 1);
                progress.onProgress(new ExecutionProgress(index, items.size(), item.itemKey(), ExecutionProgress.Status.CACHED));
                continue;
            }
            if (item.classification() == Classification.UNFETCHABLE) {
                log.debug("skipping {}: {}", item.itemKey(), item.unfetchableReason());
                progress.onProgress(new ExecutionProgress(index, items.size(), item.itemKey(), ExecutionProgress.Status.SKIPPED));
                continue;
            }

            String scope = scopeKey(item);
            Instant batchAt = batchAtByScope.computeIfAbsent(scope, s -> clock.instant());
            ExecutionRequest request = new ExecutionRequest(item, item.windows(), plan.dsl(), bustedScopes.contains(scope),
                    batchAt, options.simulate());
            Timer.Context timer = metrics == null ? null : metrics.timer(Metrics.EXEC_ITEM_TIME).time();
            try {
                ExecutionOutcome outcome = sink.execute(request);
                bustedScopes.remove(scope);
                restartsForItem = 0;
                tally.success++;
                count(Metrics.EXEC_SUCCESS, 1);
                ExecutionProgress.Status status;
                if (!options.simulate() && outcome.cacheHit()) {
                    tally.cacheHits++;
                    count(Metrics.EXEC_CACHE_HITS, 1);
                    status = ExecutionProgress.Status.CACHED;
                } else {
                    long days = options.simulate() ? item.totalDays() : outcome.daysFetched();
                    tally.apiFetches++;
                    tally.days += days;
                    count(Metrics.EXEC_API_FETCHES, 1);
                    count(Metrics.EXEC_DAYS_FETCHED, days);
                    status = ExecutionProgress.Status.FETCHED;
                }
                progress.onProgress(new ExecutionProgress(index, items.size(), item.itemKey(), status));
            } catch (Exception e) {
                if (RateLimitDetector.isRateLimit(e)) {
                    count(Metrics.EXEC_RATE_LIMITED, 1);
                    if (options.mode() == ExecutionOptions.Mode.AUTOMATED && retryPolicy.shouldRetry(restartsForItem + 1, e)) {
                        restartsForItem++;
                        log.warn("{} hit a rate limit; cooling down before restart {} of {}", item.itemKey(), restartsForItem,
                                retryPolicy.maxRestarts());
                        CooldownTimer.Outcome waited;
                        try {
                            waited = cooldownTimer.await(Duration.ofMillis(retryPolicy.backoffMillis(restartsForItem)), options.shouldAbort());
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            tally.aborted = true;
                            tally.abortReason = "interrupted during rate-limit cooldown at " + item.itemKey();
                            break;
                        }
                        if (waited == CooldownTimer.Outcome.ABORTED) {
                            tally.aborted = true;
                            tally.abortReason = "aborted during rate-limit cooldown at " + item.itemKey();
                            break;
                        }
                        batchAtByScope.remove(scope);
                        bustedScopes.add(scope);
                        tally.restarts++;
                        i--;
                        continue;
                    }
                    tally.errors++;
                    count(Metrics.EXEC_ERRORS, 1);
                    recordFailure(item, scope, e);
                    progress.onProgress(new ExecutionProgress(index, items.size(), item.itemKey(), ExecutionProgress.Status.FAILED));
                    tally.aborted = true;
                    tally.abortReason = rateLimitAbortReason(item, items.size() - index, options, restartsForItem);
                    log.warn(tally.abortReason);
                    break;
                }
                restartsForItem = 0;
                tally.errors++;
                count(Metrics.EXEC_ERRORS, 1);
                log.warn("{} failed: {}", item.itemKey(), e.toString());
                recordFailure(item, scope, e);
                progress.onProgress(new ExecutionProgress(index, items.size(), item.itemKey(), ExecutionProgress.Status.FAILED));
            } finally {
                if (timer != null) timer.stop();
            }
        }
        ExecutionResult result = tally.result();
        log.info("executed '{}': {}", plan.dsl(), result.describe());
        return result;
    }

    /** {@code <type>:<objectId>::<mode>::<sliceFamily>::sig:<signature, or item key when unsigned>}. */
    public static String scopeKey(FetchPlanItem item) {
        String sig = item.querySignature().isBlank() ? item.itemKey() : item.querySignature().trim();
        TemporalMode mode = item.mode() == null ? TemporalMode.WINDOW : item.mode();
        return item.type().wire() + ":" + item.objectId() + "::" + mode.wire() + "::" + item.sliceFamily() + "::sig:" + sig;
    }

    private static String rateLimitAbortReason(FetchPlanItem item, int remaining, ExecutionOptions options, int restarts) {
        String head = options.mode() == ExecutionOptions.Mode.AUTOMATED
                ? "rate limited at " + item.itemKey() + " after " + restarts + " restarts"
                : "rate limited at " + item.itemKey();
        return head + "; " + remaining + " items not attempted. Data fetched so far is kept; re-running replans from the "
                + "current cache state and skips what is already covered.";
    }

    private DateRange requestedWindow(FetchPlan plan) {
        if (dbCoverage == null) return null;
        try {
            return QueryConstraints.parse(plan.dsl()).dateRange(CalendarDates.utcDate(plan.referenceNow())).orElse(null);
        } catch (DslParseException e) {
            log.warn("no db coverage widening for '{}': {}", plan.dsl(), e.getMessage());
            return null;
        }
    }

    private FetchPlanItem widen(FetchPlanItem item, DateRange window) {
        if (dbCoverage == null || window == null || item.type() != ItemType.PARAMETER
                || item.classification() == Classification.UNFETCHABLE) {
            return item;
        }
        List<DateRange> gaps;
        try {
            gaps = dbCoverage.missingAnchorRanges(item, window);
        } catch (IOException e) {
            log.warn("db coverage check failed for {}: {}", item.itemKey(), e.toString());
            return item;
        }
        Set<LocalDate> days = new TreeSet<>();
        for (DateRange gap : gaps) {
            for (LocalDate d : gap.days()) {
                if (window.contains(d)) days.add(d);
            }
        }
        List<FetchWindow> widened = FetchPlans.widenWithDbMissing(item.windows(), days);
        long added = 0;
        for (FetchWindow w : widened) added += w.dayCount();
        added -= item.totalDays();
        if (added == 0) return item;
        log.info("{} widened by {} db_missing days", item.itemKey(), added);
        count(Metrics.EXEC_DB_WIDENED, 1);
        return item.withWindows(Classification.FETCH, widened);
    }

    private void recordFailure(FetchPlanItem item, String scope, Exception e) {
        if (failureLog != null) failureLog.recordFailure(item.itemKey(), scope, e);
    }

    private void count(String name, long n) {
        if (metrics != null) metrics.counter(name).inc(n);
    }
}
