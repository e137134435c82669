package io.paramfetch.plan;

import com.codahale.metrics.MetricRegistry;
import io.paramfetch.InMemoryFileState;
import io.paramfetch.core.ConnectionChecker;
import io.paramfetch.graph.BindingConnectionChecker;
import io.paramfetch.graph.Graph;
import io.paramfetch.graph.GraphEdge;
import io.paramfetch.graph.GraphNode;
import io.paramfetch.mece.ContextDefinition;
import io.paramfetch.mece.DimensionalReducer;
import io.paramfetch.mece.ImplicitSliceSelector;
import io.paramfetch.mece.InMemoryContextRegistry;
import io.paramfetch.mece.OtherPolicy;
import io.paramfetch.metrics.Metrics;
import io.paramfetch.model.Classification;
import io.paramfetch.model.FetchPlan;
import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.FetchWindow;
import io.paramfetch.model.FetchWindowReason;
import io.paramfetch.model.ItemType;
import io.paramfetch.model.LatencyConfig;
import io.paramfetch.model.TemporalMode;
import io.paramfetch.policy.RefetchPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.paramfetch.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class FetchPlanBuilderTest {
    private static final Instant NOW = at("2026-02-01T12:00:00Z");
    private static final String DSL = "window(1-Jan-26:10-Jan-26)";
    private static final String AB = "parameter:p-ab:ab-uuid:p:";
    private static final String BC = "parameter:p-bc:bc-uuid:p:";

    private final InMemoryContextRegistry registry = new InMemoryContextRegistry(List.of(
            new ContextDefinition("channel", List.of("google", "meta"), OtherPolicy.NULL),
            new ContextDefinition("device", List.of("mobile", "desktop"), OtherPolicy.NULL)));
    private final MetricRegistry metricRegistry = new MetricRegistry();
    private final InMemoryFileState files = new InMemoryFileState();

    private FetchPlanBuilder builder(ConnectionChecker connections) {
        return new FetchPlanBuilder(files, connections, new RefetchPolicy(), new DimensionalReducer(registry),
                new ImplicitSliceSelector(registry), new Metrics(metricRegistry));
    }

    private PlanBuildResult build(Graph graph, String dsl, boolean bust, Map<String, String> signatures) {
        return builder(BindingConnectionChecker.forGraph(graph)).build(PlanRequest.fromDsl(graph, dsl, NOW, bust, signatures));
    }

    private PlanBuildResult build(Graph graph, String dsl) {
        return build(graph, dsl, false, Map.of());
    }

    private static FetchPlanItem item(PlanBuildResult r, String key) {
        return r.plan().items().stream().filter(i -> i.itemKey().equals(key)).findFirst().orElseThrow();
    }

    private static ItemDiagnostic diagnostic(PlanBuildResult r, String key) {
        return r.diagnostics().itemDiagnostics().stream().filter(d -> d.itemKey().equals(key)).findFirst().orElseThrow();
    }

    @Test
    void emptyCacheFetchesWholeWindow() {
        PlanBuildResult r = build(chain("amplitude", null), DSL);

        assertEquals(List.of(AB, BC), r.plan().items().stream().map(FetchPlanItem::itemKey).toList());
        FetchPlanItem ab = item(r, AB);
        assertEquals(Classification.FETCH, ab.classification());
        assertEquals(List.of(FetchWindow.of(d("1-Jan-26"), d("10-Jan-26"), FetchWindowReason.MISSING)), ab.windows());
        assertEquals("gaps_only", diagnostic(r, AB).refetchDecision());
        assertEquals(2, r.diagnostics().itemsNeedingFetch());
        assertEquals(2, metricRegistry.counter(Metrics.PLAN_ITEMS).getCount());
    }

    @Test
    void coveredParameterNeedsNothing() {
        files.parameter("p-ab", dailyWindow("", "1-Jan-26", "10-Jan-26", 10, 1).build())
                .parameter("p-bc", dailyWindow("", "1-Jan-26", "5-Jan-26", 10, 1).build());
        PlanBuildResult r = build(chain("amplitude", null), DSL);

        assertEquals(Classification.COVERED, item(r, AB).classification());
        assertTrue(item(r, AB).windows().isEmpty());
        assertEquals(List.of(FetchWindow.of(d("6-Jan-26"), d("10-Jan-26"), FetchWindowReason.MISSING)), item(r, BC).windows());
    }

    @Test
    void bustCacheIgnoresCoverage() {
        files.parameter("p-ab", dailyWindow("", "1-Jan-26", "10-Jan-26", 10, 1).build());
        PlanBuildResult r = build(chain("amplitude", null), DSL, true, Map.of());
        assertEquals(10, item(r, AB).totalDays());
    }

    @Test
    void missingConnectionIsUnfetchable() {
        files.parameter("p-ab", dailyWindow("", "1-Jan-26", "5-Jan-26", 10, 1).build());
        PlanBuildResult r = build(chain(null, null), DSL);

        assertEquals(Classification.UNFETCHABLE, item(r, AB).classification());
        assertEquals(FetchPlanBuilder.NO_CONNECTION, item(r, AB).unfetchableReason());
        assertEquals(FetchPlanBuilder.NO_CONNECTION_AND_NO_FILE, item(r, BC).unfetchableReason());
    }

    @Test
    void fullyCachedParameterIsCoveredEvenWithoutConnection() {
        files.parameter("p-ab", dailyWindow("", "1-Jan-26", "10-Jan-26", 10, 1).build());
        assertEquals(Classification.COVERED, item(build(chain(null, null), DSL), AB).classification());
    }

    @Test
    void endpointsWithoutEventIdsAreUnfetchable() {
        Graph partial = new Graph(List.of(node("a", null), node("b", "evt-b"), node("c", "evt-c")),
                chain("amplitude", null).edges(), null, null);
        PlanBuildResult r = build(partial, DSL);
        assertEquals(FetchPlanBuilder.PARTIAL_EVENT_IDS, item(r, AB).unfetchableReason());
        assertNull(diagnostic(r, AB).refetchDecision());
        assertEquals(Classification.FETCH, item(r, BC).classification());

        Graph none = new Graph(List.of(node("a", null), node("b", " "), node("c", "evt-c")),
                chain("amplitude", null).edges(), null, null);
        assertEquals(FetchPlanBuilder.NO_EVENT_IDS, item(build(none, DSL), AB).unfetchableReason());
    }

    @Test
    void eventIdFreeConnectionSkipsTheCheck() {
        Graph graph = new Graph(List.of(node("a", null), node("b", null), node("c", null)),
                chain("sheets", null).edges(), null, null);
        PlanBuildResult r = builder(new BindingConnectionChecker(null, Set.of("sheets")))
                .build(PlanRequest.fromDsl(graph, DSL, NOW, false, Map.of()));
        assertEquals(Classification.FETCH, item(r, AB).classification());
    }

    @Test
    void caseItems() {
        Graph graph = new Graph(List.of(node("a", "evt-a"), caseNode("x", "case-1", "statsig"), caseNode("y", "case-2", null),
                caseNode("z", "case-3", null)), List.of(), null, null);
        files.caseData("case-2", Map.of("schedules", List.of()));
        PlanBuildResult r = build(graph, DSL);

        FetchPlanItem fetch = item(r, "case:case-1:x-uuid::");
        assertEquals(ItemType.CASE, fetch.type());
        assertEquals(List.of(FetchWindow.of(d("1-Jan-26"), d("10-Jan-26"), FetchWindowReason.MISSING)), fetch.windows());
        assertEquals(Classification.COVERED, item(r, "case:case-2:y-uuid::").classification());
        assertEquals(FetchPlanBuilder.NO_CONNECTION_AND_NO_FILE, item(r, "case:case-3:z-uuid::").unfetchableReason());
    }

    @Test
    void immatureWindowTailIsStale() {
        Instant retrieved = at("2026-02-01T00:00:00Z");
        files.parameter("p-ab", dailyWindow("", "15-Jan-26", "31-Jan-26", 10, 1).retrievedAt(retrieved).build());
        PlanBuildResult r = build(chain("amplitude", LatencyConfig.ofT95(10)), "window(15-Jan-26:31-Jan-26)");

        FetchPlanItem ab = item(r, AB);
        assertEquals(List.of(FetchWindow.of(d("21-Jan-26"), d("31-Jan-26"), FetchWindowReason.STALE)), ab.windows());
        ItemDiagnostic diag = diagnostic(r, AB);
        assertEquals("partial", diag.refetchDecision());
        assertEquals(0, diag.missingDates());
        assertEquals(11, diag.staleDates());
    }

    @Test
    void immatureCohortsRefetchTheirTail() {
        LatencyConfig latency = new LatencyConfig(7.0, 7.0, null, null);
        files.parameter("p-ab", dailyCohort("", "1-Jan-26", "30-Jan-26", 10, 1).retrievedAt(NOW.minus(Duration.ofDays(1))).build());
        PlanBuildResult r = build(chain("amplitude", latency), "cohort(1-Jan-26:30-Jan-26)");

        FetchPlanItem ab = item(r, AB);
        assertEquals(TemporalMode.COHORT, ab.mode());
        assertEquals(Classification.FETCH, ab.classification());
        assertEquals(List.of(FetchWindow.of(d("26-Jan-26"), d("30-Jan-26"), FetchWindowReason.STALE)), ab.windows());
        ItemDiagnostic diag = diagnostic(r, AB);
        assertEquals("replace_slice", diag.refetchDecision());
        assertTrue(diag.hasImmatureCohorts());
        assertEquals(0, diag.missingDates());
        assertTrue(diag.notes().contains("Replace slice: immature_cohorts, maturity=7d"));
    }

    @Test
    void matureCohortsStayCovered() {
        LatencyConfig latency = new LatencyConfig(7.0, 7.0, null, null);
        files.parameter("p-ab", dailyCohort("", "1-Jan-26", "10-Jan-26", 10, 1).retrievedAt(NOW.minus(Duration.ofDays(1))).build());
        PlanBuildResult r = build(chain("amplitude", latency), "cohort(1-Jan-26:10-Jan-26)");

        assertEquals(Classification.COVERED, item(r, AB).classification());
        assertEquals("use_cache", diagnostic(r, AB).refetchDecision());
        assertFalse(diagnostic(r, AB).hasImmatureCohorts());
    }

    @Test
    void cohortQueryIgnoresWindowSlices() {
        files.parameter("p-ab", dailyWindow("", "1-Jan-26", "10-Jan-26", 10, 1).build());
        PlanBuildResult r = build(chain("amplitude", LatencyConfig.ofT95(7)), "cohort(1-Jan-26:10-Jan-26)");

        assertEquals(List.of(FetchWindow.of(d("1-Jan-26"), d("10-Jan-26"), FetchWindowReason.MISSING)), item(r, AB).windows());
        assertEquals("replace_slice", diagnostic(r, AB).refetchDecision());
        assertFalse(diagnostic(r, AB).hasImmatureCohorts());
    }

    @Test
    void signatureIsRecordedOnlyWhenItFilters() {
        String sig = "{\"c\":\"core1\",\"x\":{}}";
        files.parameter("p-ab", dailyWindow("", "1-Jan-26", "10-Jan-26", 10, 1).querySignature(sig).build());
        PlanBuildResult r = build(chain("amplitude", null), DSL, false, Map.of(AB, sig, BC, sig));

        assertEquals(Classification.COVERED, item(r, AB).classification());
        assertEquals(sig, item(r, AB).querySignature());
        assertEquals("", item(r, BC).querySignature());

        PlanBuildResult other = build(chain("amplitude", null), DSL, false, Map.of(AB, "{\"c\":\"core2\",\"x\":{}}"));
        assertEquals(10, item(other, AB).totalDays());
    }

    @Test
    void contextedQueryIsServedByDimensionalReduction() {
        files.parameter("p-ab",
                dailyWindow("context(channel:google).context(device:mobile)", "1-Jan-26", "10-Jan-26", 10, 1).build(),
                dailyWindow("context(channel:google).context(device:desktop)", "1-Jan-26", "10-Jan-26", 5, 1).build());
        PlanBuildResult r = build(chain("amplitude", null), "context(channel:google)." + DSL);

        FetchPlanItem ab = item(r, AB);
        assertEquals(Classification.COVERED, ab.classification());
        assertEquals("context(channel:google)", ab.sliceFamily());
        assertTrue(diagnostic(r, AB).notes().stream().anyMatch(n -> n.startsWith("Dimensional reduction: aggregated 2")));
    }

    @Test
    void uncontextedQueryIsServedByImplicitPartition() {
        files.parameter("p-ab",
                dailyWindow("context(channel:google)", "1-Jan-26", "10-Jan-26", 10, 1).build(),
                dailyWindow("context(channel:meta)", "1-Jan-26", "5-Jan-26", 10, 1).build());
        PlanBuildResult r = build(chain("amplitude", null), DSL);

        assertEquals(List.of(FetchWindow.of(d("6-Jan-26"), d("10-Jan-26"), FetchWindowReason.MISSING)), item(r, AB).windows());
    }

    @Test
    void planningIsDeterministic() {
        files.parameter("p-ab", dailyWindow("", "3-Jan-26", "6-Jan-26", 10, 1).build());
        FetchPlan first = build(chain("amplitude", LatencyConfig.ofT95(3)), DSL).plan();
        FetchPlan second = build(chain("amplitude", LatencyConfig.ofT95(3)), DSL).plan();
        assertTrue(FetchPlans.plansEqual(first, second));
        assertEquals(NOW, first.createdAt());
        assertEquals(DSL, first.dsl());
    }
}
