package io.paramfetch.runtime;

import com.codahale.metrics.MetricRegistry;
import io.paramfetch.core.ExecutionOutcome;
import io.paramfetch.core.ExecutionProgress;
import io.paramfetch.core.ExecutionRequest;
import io.paramfetch.core.ExecutionSink;
import io.paramfetch.metrics.Metrics;
import io.paramfetch.model.Classification;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.FetchPlan;
import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.FetchWindow;
import io.paramfetch.model.FetchWindowReason;
import io.paramfetch.model.ItemType;
import io.paramfetch.model.ParamSlot;
import io.paramfetch.model.TemporalMode;
import io.paramfetch.retry.CooldownTimer;
import io.paramfetch.retry.RateLimitRetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static io.paramfetch.Fixtures.at;
import static io.paramfetch.Fixtures.d;
import static io.paramfetch.Fixtures.range;
import static org.junit.jupiter.api.Assertions.*;

class PlanExecutorTest {
    private static final Instant NOW = at("2026-02-01T12:00:00Z");
    private static final String DSL = "window(1-Jan-26:10-Jan-26)";

    private final List<ExecutionRequest> requests = new ArrayList<>();
    private final List<ExecutionProgress> progress = new ArrayList<>();
    private final List<String> failures = new ArrayList<>();
    private final FakeCooldown cooldown = new FakeCooldown();
    private final MetricRegistry metricRegistry = new MetricRegistry();

    /** Hands out one-second-apart instants. */
    static final class SteppingClock extends Clock {
        private Instant next;

        SteppingClock(Instant start) { this.next = start; }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }

        @Override
        public Instant instant() {
            Instant t = next;
            next = next.plusSeconds(1);
            return t;
        }
    }

    static final class FakeCooldown implements CooldownTimer {
        final List<Duration> waits = new ArrayList<>();
        Outcome outcome = Outcome.EXPIRED;
        int closes;

        @Override
        public Outcome await(Duration duration, BooleanSupplier shouldStop) {
            waits.add(duration);
            return outcome;
        }

        @Override
        public void close() {
            closes++;
        }
    }

    private PlanExecutorBuilder executor(ExecutionSink sink) {
        return PlanExecutor.builder()
                .sink(request -> {
                    requests.add(request);
                    return sink.execute(request);
                })
                .progress(progress::add)
                .failureLog((key, scope, e) -> failures.add(key + "|" + scope + "|" + e.getMessage()))
                .retry(new RateLimitRetryPolicy(2, Duration.ofMinutes(61)))
                .cooldownTimer(cooldown)
                .clock(new SteppingClock(NOW))
                .metrics(new Metrics(metricRegistry));
    }

    private static FetchPlanItem fetch(String objectId, Integer conditionalIndex, String signature, FetchWindow... windows) {
        return new FetchPlanItem(FetchPlanItem.itemKey(ItemType.PARAMETER, objectId, "e-uuid", ParamSlot.P, conditionalIndex),
                ItemType.PARAMETER, objectId, "e-uuid", ParamSlot.P, conditionalIndex, TemporalMode.WINDOW, "", signature,
                Classification.FETCH, null, List.of(windows));
    }

    private static FetchPlanItem classified(String objectId, Classification c, String reason) {
        return new FetchPlanItem(FetchPlanItem.itemKey(ItemType.PARAMETER, objectId, "e-uuid", ParamSlot.P, null),
                ItemType.PARAMETER, objectId, "e-uuid", ParamSlot.P, null, TemporalMode.WINDOW, "", "", c, reason, List.of());
    }

    private static FetchWindow missing(String from, String to) {
        return FetchWindow.of(d(from), d(to), FetchWindowReason.MISSING);
    }

    private static FetchPlan plan(FetchPlanItem... items) {
        return new FetchPlan(FetchPlan.CURRENT_VERSION, NOW, NOW, DSL, List.of(items));
    }

    private static ExecutionOutcome fetchAll(ExecutionRequest r) {
        long days = 0;
        for (FetchWindow w : r.windows()) days += w.dayCount();
        return ExecutionOutcome.fetched(days);
    }

    @Test
    void itemsSharingAScopeShareTheRetrievalTimestamp() {
        FetchPlanItem base = fetch("p-ab", null, "S", missing("1-Jan-26", "10-Jan-26"));
        FetchPlanItem cond = fetch("p-ab", 0, "S", missing("1-Jan-26", "5-Jan-26"));
        FetchPlanItem other = fetch("p-bc", null, "S", missing("1-Jan-26", "2-Jan-26"));

        ExecutionResult result = executor(PlanExecutorTest::fetchAll).build().execute(plan(base, cond, other), ExecutionOptions.manual());

        assertEquals(requests.get(0).retrievalBatchAt(), requests.get(1).retrievalBatchAt());
        assertNotEquals(requests.get(0).retrievalBatchAt(), requests.get(2).retrievalBatchAt());
        assertEquals(3, result.success());
        assertEquals(17, result.daysFetched());
        assertEquals(17, metricRegistry.counter(Metrics.EXEC_DAYS_FETCHED).getCount());
    }

    @Test
    void automatedRateLimitCoolsDownAndRestartsWithFreshTimestamp() {
        FetchPlanItem base = fetch("p-ab", null, "S", missing("1-Jan-26", "10-Jan-26"));
        FetchPlanItem cond = fetch("p-ab", 0, "S", missing("1-Jan-26", "5-Jan-26"));
        AtomicInteger calls = new AtomicInteger();
        ExecutionSink sink = r -> {
            if (calls.incrementAndGet() == 2) throw new RuntimeException("HTTP 429 Too Many Requests");
            return fetchAll(r);
        };

        ExecutionResult result = executor(sink).build().execute(plan(base, cond), ExecutionOptions.automated());

        assertEquals(3, requests.size());
        assertEquals(cond.itemKey(), requests.get(2).item().itemKey());
        assertEquals(requests.get(0).retrievalBatchAt(), requests.get(1).retrievalBatchAt());
        assertTrue(requests.get(2).retrievalBatchAt().isAfter(requests.get(1).retrievalBatchAt()));
        assertFalse(requests.get(1).bustCache());
        assertTrue(requests.get(2).bustCache());
        assertEquals(List.of(Duration.ofMinutes(61)), cooldown.waits);
        assertEquals(1, result.rateLimitRestarts());
        assertEquals(2, result.success());
        assertEquals(0, result.errors());
        assertFalse(result.aborted());
    }

    @Test
    void restartsAreBounded() {
        ExecutionSink sink = r -> { throw new IllegalStateException("wrapped", new RuntimeException("rate limit exceeded")); };
        FetchPlanItem first = fetch("p-ab", null, "S", missing("1-Jan-26", "2-Jan-26"));
        FetchPlanItem second = fetch("p-bc", null, "S", missing("1-Jan-26", "2-Jan-26"));

        ExecutionResult result = executor(sink).build().execute(plan(first, second), ExecutionOptions.automated());

        assertEquals(2, cooldown.waits.size());
        assertEquals(3, requests.size());
        assertTrue(result.aborted());
        assertEquals(1, result.errors());
        assertTrue(result.abortReason().contains("after 2 restarts"));
        assertTrue(result.abortReason().contains("1 items not attempted"));
        assertEquals(1, failures.size());
    }

    @Test
    void manualRateLimitAbortsImmediately() {
        ExecutionSink sink = r -> { throw new RuntimeException("Quota exceeded for project"); };
        FetchPlanItem first = fetch("p-ab", null, "", missing("1-Jan-26", "2-Jan-26"));
        FetchPlanItem second = fetch("p-bc", null, "", missing("1-Jan-26", "2-Jan-26"));

        ExecutionResult result = executor(sink).build().execute(plan(first, second), ExecutionOptions.manual());

        assertTrue(cooldown.waits.isEmpty());
        assertEquals(1, requests.size());
        assertTrue(result.aborted());
        assertTrue(result.abortReason().startsWith("rate limited at " + first.itemKey()));
        assertEquals(ExecutionProgress.Status.FAILED, progress.get(0).outcome());
        assertEquals(1, metricRegistry.counter(Metrics.EXEC_RATE_LIMITED).getCount());
    }

    @Test
    void abortDuringCooldownStopsTheRun() {
        cooldown.outcome = CooldownTimer.Outcome.ABORTED;
        ExecutionSink sink = r -> { throw new RuntimeException("429"); };
        ExecutionResult result = executor(sink).build()
                .execute(plan(fetch("p-ab", null, "", missing("1-Jan-26", "2-Jan-26"))), ExecutionOptions.automated());

        assertTrue(result.aborted());
        assertTrue(result.abortReason().startsWith("aborted during rate-limit cooldown"));
        assertEquals(0, result.rateLimitRestarts());
    }

    @Test
    void ordinaryFailuresAreIsolated() {
        FetchPlanItem bad = fetch("p-ab", null, "", missing("1-Jan-26", "2-Jan-26"));
        FetchPlanItem good = fetch("p-bc", null, "", missing("1-Jan-26", "2-Jan-26"));
        ExecutionSink sink = r -> {
            if (r.item().objectId().equals("p-ab")) throw new IllegalStateException("provider returned 500");
            return fetchAll(r);
        };

        ExecutionResult result = executor(sink).build().execute(plan(bad, good), ExecutionOptions.automated());

        assertEquals(1, result.errors());
        assertEquals(1, result.success());
        assertFalse(result.aborted());
        assertEquals(List.of(bad.itemKey() + "|" + PlanExecutor.scopeKey(bad) + "|provider returned 500"), failures);
        assertEquals(List.of(ExecutionProgress.Status.FAILED, ExecutionProgress.Status.FETCHED),
                progress.stream().map(ExecutionProgress::outcome).toList());
    }

    @Test
    void userAbortIsCheckedBeforeEachItem() {
        FetchPlanItem first = fetch("p-ab", null, "", missing("1-Jan-26", "2-Jan-26"));
        FetchPlanItem second = fetch("p-bc", null, "", missing("1-Jan-26", "2-Jan-26"));

        ExecutionResult result = executor(PlanExecutorTest::fetchAll).build()
                .execute(plan(first, second), ExecutionOptions.manual().withAbort(() -> !requests.isEmpty()));

        assertEquals(1, requests.size());
        assertTrue(result.aborted());
        assertEquals("aborted before " + second.itemKey(), result.abortReason());
    }

    @Test
    void coveredAndUnfetchableItemsNeverReachTheSink() {
        ExecutionResult result = executor(PlanExecutorTest::fetchAll).build().execute(plan(
                classified("p-ab", Classification.COVERED, null),
                classified("p-bc", Classification.UNFETCHABLE, "no_connection")), ExecutionOptions.manual());

        assertTrue(requests.isEmpty());
        assertEquals(1, result.cacheHits());
        assertEquals(List.of(ExecutionProgress.Status.CACHED, ExecutionProgress.Status.SKIPPED),
                progress.stream().map(ExecutionProgress::outcome).toList());
        assertEquals(2, progress.get(1).index());
        assertEquals(2, progress.get(1).total());
    }

    @Test
    void sinkReportedCacheHitCountsAsCached() {
        ExecutionResult result = executor(r -> ExecutionOutcome.cached()).build()
                .execute(plan(fetch("p-ab", null, "", missing("1-Jan-26", "2-Jan-26"))), ExecutionOptions.manual());
        assertEquals(1, result.cacheHits());
        assertEquals(0, result.apiFetches());
    }

    @Test
    void simulationCountsPlannedDays() {
        ExecutionResult result = executor(r -> ExecutionOutcome.fetched(0)).build()
                .execute(plan(fetch("p-ab", null, "", missing("1-Jan-26", "4-Jan-26"))), ExecutionOptions.dryRun());
        assertTrue(requests.get(0).simulate());
        assertEquals(4, result.daysFetched());
        assertEquals(1, result.apiFetches());
    }

    @Test
    void databaseGapsWidenWindows() {
        FetchPlanItem partial = fetch("p-ab", null, "", missing("8-Jan-26", "10-Jan-26"));
        FetchPlanItem covered = classified("p-bc", Classification.COVERED, null);
        PlanExecutor executor = executor(PlanExecutorTest::fetchAll)
                .dbCoverage((item, window) -> item.objectId().equals("p-ab")
                        ? List.of(range("30-Dec-25", "3-Jan-26"), range("9-Jan-26", "9-Jan-26"))
                        : List.of(new DateRange(window.start(), window.start())))
                .build();

        ExecutionResult result = executor.execute(plan(partial, covered), ExecutionOptions.manual());

        assertEquals(List.of(FetchWindow.of(d("1-Jan-26"), d("3-Jan-26"), FetchWindowReason.DB_MISSING),
                missing("8-Jan-26", "10-Jan-26")), requests.get(0).windows());
        assertEquals(List.of(FetchWindow.of(d("1-Jan-26"), d("1-Jan-26"), FetchWindowReason.DB_MISSING)), requests.get(1).windows());
        assertEquals(Classification.FETCH, requests.get(1).item().classification());
        assertEquals(2, result.apiFetches());
        assertEquals(2, metricRegistry.counter(Metrics.EXEC_DB_WIDENED).getCount());
    }

    @Test
    void scopeKeyNamesParameterModeFamilyAndSignature() {
        assertEquals("parameter:p-ab::window::::sig:S", PlanExecutor.scopeKey(fetch("p-ab", null, "S", missing("1-Jan-26", "1-Jan-26"))));
        FetchPlanItem unsigned = fetch("p-ab", 1, "", missing("1-Jan-26", "1-Jan-26"));
        assertEquals("parameter:p-ab::window::::sig:" + unsigned.itemKey(), PlanExecutor.scopeKey(unsigned));
    }

    @Test
    void closeLeavesSuppliedTimerOpen() {
        try (PlanExecutor executor = executor(request -> new ExecutionOutcome(false, 1)).build()) {
            assertNotNull(executor);
        }
        assertEquals(0, cooldown.closes);
    }

    @Test
    void closeStopsOwnScheduler() {
        PlanExecutor executor = PlanExecutor.builder().sink(request -> new ExecutionOutcome(false, 1)).build();
        executor.close();
        assertThrows(RejectedExecutionException.class,
                () -> executor.cooldownTimer().await(Duration.ofMillis(10), () -> false));
    }
}
