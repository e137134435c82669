package io.paramfetch.plan;

import com.codahale.metrics.Timer;
import io.paramfetch.core.CaseFile;
import io.paramfetch.core.ConnectionChecker;
import io.paramfetch.core.FileStateAccessor;
import io.paramfetch.core.ParameterFile;
import io.paramfetch.coverage.CoverageDetector;
import io.paramfetch.coverage.CoverageResult;
import io.paramfetch.coverage.HeaderCoveragePolicy;
import io.paramfetch.coverage.SliceIsolation;
import io.paramfetch.coverage.SliceIsolationException;
import io.paramfetch.dsl.SliceDsl;
import io.paramfetch.graph.FetchTarget;
import io.paramfetch.graph.FetchTargetEnumerator;
import io.paramfetch.graph.GraphEdge;
import io.paramfetch.graph.GraphNode;
import io.paramfetch.graph.GraphQueries;
import io.paramfetch.mece.DimensionalReducer;
import io.paramfetch.mece.ImplicitSliceSelector;
import io.paramfetch.mece.ReductionResult;
import io.paramfetch.mece.SliceSelection;
import io.paramfetch.metrics.Metrics;
import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.Classification;
import io.paramfetch.model.FetchPlan;
import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.FetchWindow;
import io.paramfetch.model.FetchWindowReason;
import io.paramfetch.model.ItemType;
import io.paramfetch.model.LatencyConfig;
import io.paramfetch.model.ParameterValue;
import io.paramfetch.model.TemporalMode;
import io.paramfetch.policy.RefetchDecision;
import io.paramfetch.policy.RefetchInput;
import io.paramfetch.policy.RefetchPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a {@link FetchPlan} for every fetchable unit in a graph. Deterministic for a given request and
 * cache state; planning failures degrade to notes and never escape {@link #build}.
 */
public class FetchPlanBuilder {
    private static final Logger log = LoggerFactory.getLogger(FetchPlanBuilder.class);

    public static final String NO_EVENT_IDS = "no_event_ids";
    public static final String PARTIAL_EVENT_IDS = "partial_event_ids";
    public static final String NO_CONNECTION = "no_connection";
    public static final String NO_CONNECTION_AND_NO_FILE = "no_connection_and_no_file";

    private final FileStateAccessor fileState;
    private final ConnectionChecker connectionChecker;
    private final RefetchPolicy policy;
    private final DimensionalReducer reducer;
    private final ImplicitSliceSelector selector;
    private final Metrics metrics;

    public FetchPlanBuilder(FileStateAccessor fileState, ConnectionChecker connectionChecker, RefetchPolicy policy,
                            DimensionalReducer reducer, ImplicitSliceSelector selector, Metrics metrics) {
        this.fileState = Objects.requireNonNull(fileState, "fileState");
        this.connectionChecker = Objects.requireNonNull(connectionChecker, "connectionChecker");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.metrics = metrics;
    }

    public PlanBuildResult build(PlanRequest request) {
        Timer.Context timer = metrics == null ? null : metrics.timer(Metrics.PLAN_BUILD_TIME).time();
        try {
            Ctx ctx = new Ctx(request, new GraphQueries(request.graph()));
            List<FetchPlanItem> items = new ArrayList<>();
            List<ItemDiagnostic> diagnostics = new ArrayList<>();
            for (FetchTarget target : FetchTargetEnumerator.enumerate(request.graph())) {
                List<String> notes = new ArrayList<>();
                Built built = target.type() == ItemType.CASE ? buildCase(target, ctx, notes) : buildParameter(target, ctx, notes);
                items.add(built.item());
                diagnostics.add(built.diagnostic());
                log.debug("planned {} -> {} {}", built.item().itemKey(), built.item().classification().wire(), notes);
            }
            items.sort(Comparator.comparing(FetchPlanItem::itemKey));
            diagnostics.sort(Comparator.comparing(ItemDiagnostic::itemKey));
            FetchPlan plan = new FetchPlan(FetchPlan.CURRENT_VERSION, request.createdAt(), request.referenceNow(), request.dsl(), items);
            PlanDiagnostics diag = new PlanDiagnostics(items.size(),
                    count(items, Classification.FETCH), count(items, Classification.COVERED), count(items, Classification.UNFETCHABLE),
                    diagnostics);
            if (metrics != null) metrics.counter(Metrics.PLAN_ITEMS).inc(items.size());
            log.info("plan for '{}': {}", request.dsl(), FetchPlans.summarise(plan).describe());
            return new PlanBuildResult(plan, diag);
        } finally {
            if (timer != null) timer.stop();
        }
    }

    private static int count(List<FetchPlanItem> items, Classification c) {
        int n = 0;
        for (FetchPlanItem i : items) if (i.classification() == c) n++;
        return n;
    }

    private record Ctx(PlanRequest request, GraphQueries graph, TemporalMode mode, String targetDims, LocalDate referenceDate) {
        Ctx(PlanRequest request, GraphQueries graph) {
            this(request, graph, SliceDsl.isCohort(request.dsl()) ? TemporalMode.COHORT : TemporalMode.WINDOW,
                    SliceDsl.dimensions(request.dsl()), CalendarDates.utcDate(request.referenceNow()));
        }
    }

    private record Built(FetchPlanItem item, ItemDiagnostic diagnostic) {}

    private Built buildCase(FetchTarget target, Ctx ctx, List<String> notes) {
        GraphNode node = target.node();
        boolean hasConnection = node != null && connectionChecker.hasCaseConnection(node);
        boolean hasFileData = fileState.caseFile(target.objectId()).map(CaseFile::hasData).orElse(false);
        Classification c = hasFileData ? Classification.COVERED : hasConnection ? Classification.FETCH : Classification.UNFETCHABLE;
        List<FetchWindow> windows = c == Classification.FETCH
                ? List.of(FetchWindow.of(ctx.request().window().start(), ctx.request().window().end(), FetchWindowReason.MISSING))
                : List.of();
        FetchPlanItem item = new FetchPlanItem(target.itemKey(), ItemType.CASE, target.objectId(), target.targetId(), null, null,
                ctx.mode(), ctx.targetDims(), "", c, c == Classification.UNFETCHABLE ? NO_CONNECTION_AND_NO_FILE : null, windows);
        int unit = c == Classification.FETCH ? 1 : 0;
        return new Built(item, new ItemDiagnostic(item.itemKey(), target.objectId(), ctx.mode(), unit, 0, unit, null, false, c, notes));
    }

    private Built buildParameter(FetchTarget target, Ctx ctx, List<String> notes) {
        PlanRequest req = ctx.request();
        Optional<String> eventIdProblem = eventIdProblem(target, ctx.graph());
        if (eventIdProblem.isPresent()) {
            notes.add("Edge endpoints lack event ids: " + eventIdProblem.get());
            return new Built(item(target, ctx, "", Classification.UNFETCHABLE, eventIdProblem.get(), List.of()),
                    new ItemDiagnostic(target.itemKey(), target.objectId(), ctx.mode(), 0, 0, 0, null, false, Classification.UNFETCHABLE, notes));
        }

        boolean hasConnection = target.edge() != null && connectionChecker.hasEdgeConnection(target.edge());
        List<ParameterValue> allValues = fileState.parameterFile(target.objectId()).map(ParameterFile::values).orElse(List.of());
        List<ParameterValue> modeValues = new ArrayList<>();
        for (ParameterValue v : allValues) if (v.mode() == ctx.mode()) modeValues.add(v);

        String signature = req.querySignatures().get(target.itemKey());
        boolean signatureApplied = CoverageDetector.shouldFilterBySignature(modeValues, signature);
        List<ParameterValue> candidates = CoverageDetector.filterBySignature(modeValues, signature);

        List<ParameterValue> coverageValues = candidates;
        ParameterValue existingSlice;
        if (SliceIsolation.isImplicitMece(candidates, req.dsl())) {
            SliceSelection sel = selector.select(candidates, true);
            existingSlice = switch (sel.kind()) {
                case EXPLICIT_UNCONTEXTED -> sel.values().get(0);
                case MECE_PARTITION -> stalest(sel.values());
                case NOT_RESOLVABLE -> null;
            };
            if (!sel.isResolved()) notes.add("Implicit uncontexted not resolvable: " + sel.reason());
            notes.addAll(sel.warnings());
        } else {
            List<ParameterValue> sliceValues = List.of();
            try {
                sliceValues = SliceIsolation.isolate(candidates, req.dsl());
                if (sliceValues.isEmpty() && !candidates.isEmpty() && !ctx.targetDims().isEmpty()) {
                    ReductionResult reduction = reducer.reduce(candidates, req.dsl());
                    if (reduction instanceof ReductionResult.Reduced reduced) {
                        sliceValues = reduced.aggregatedValues();
                        coverageValues = reduced.aggregatedValues();
                        notes.add("Dimensional reduction: aggregated " + reduced.diagnostics().slicesUsed() + " slices across "
                                + reduced.diagnostics().unspecifiedDimensions());
                        notes.addAll(reduced.diagnostics().warnings());
                    } else if (reduction instanceof ReductionResult.NotReducible refused) {
                        notes.add("Dimensional reduction refused: " + refused.reason());
                    }
                }
            } catch (SliceIsolationException e) {
                notes.add("Slice isolation failed: " + e.getMessage());
            }
            existingSlice = newest(sliceValues);
        }

        LatencyConfig latency = target.edge() == null ? null : target.edge().latency().orElse(null);
        RefetchDecision decision = policy.decide(new RefetchInput(existingSlice, latency, req.window(), ctx.mode(), req.referenceNow()));

        Set<LocalDate> missing = new TreeSet<>();
        try {
            boolean headerCovered = !req.bustCache() && HeaderCoveragePolicy.hasFullHeaderCoverage(coverageValues, req.window(), req.dsl());
            if (!headerCovered) {
                CoverageResult coverage = CoverageDetector.coverage(coverageValues, req.window(), null, req.bustCache(), req.dsl());
                missing.addAll(coverage.missingDates());
            }
        } catch (SliceIsolationException e) {
            notes.add("Slice isolation failed: " + e.getMessage());
            missing.addAll(req.window().days());
        }

        Set<LocalDate> stale = policy.staleDates(decision, req.window(), latency, ctx.referenceDate(), missing);
        decisionNotes(decision, latency, notes);

        Set<LocalDate> fetchDates = new TreeSet<>(missing);
        fetchDates.addAll(stale);
        Classification c;
        String reason = null;
        if (fetchDates.isEmpty()) {
            c = Classification.COVERED;
        } else if (!hasConnection && allValues.isEmpty()) {
            c = Classification.UNFETCHABLE;
            reason = NO_CONNECTION_AND_NO_FILE;
        } else if (!hasConnection) {
            c = Classification.UNFETCHABLE;
            reason = NO_CONNECTION;
        } else {
            c = Classification.FETCH;
        }
        List<FetchWindow> windows = c == Classification.FETCH ? FetchPlans.mergeWindowSets(missing, stale) : List.of();
        FetchPlanItem item = item(target, ctx, signatureApplied ? signature : "", c, reason, windows);
        boolean immatureCohorts = decision instanceof RefetchDecision.ReplaceSlice replace && replace.hasImmatureCohorts();
        return new Built(item, new ItemDiagnostic(item.itemKey(), target.objectId(), ctx.mode(), missing.size(), stale.size(),
                fetchDates.size(), decision.kind().wire(), immatureCohorts, c, notes));
    }

    private FetchPlanItem item(FetchTarget t, Ctx ctx, String signature, Classification c, String reason, List<FetchWindow> windows) {
        return new FetchPlanItem(t.itemKey(), t.type(), t.objectId(), t.targetId(), t.slot(), t.conditionalIndex(),
                ctx.mode(), ctx.targetDims(), signature, c, reason, windows);
    }

    private Optional<String> eventIdProblem(FetchTarget target, GraphQueries graph) {
        GraphEdge edge = target.edge();
        if (edge == null || !connectionChecker.requiresEventIds(target.connection())) return Optional.empty();
        boolean fromHas = graph.node(edge.from()).map(GraphNode::hasEventId).orElse(false);
        boolean toHas = graph.node(edge.to()).map(GraphNode::hasEventId).orElse(false);
        if (!fromHas && !toHas) return Optional.of(NO_EVENT_IDS);
        if (!fromHas || !toHas) return Optional.of(PARTIAL_EVENT_IDS);
        return Optional.empty();
    }

    private void decisionNotes(RefetchDecision decision, LatencyConfig latency, List<String> notes) {
        decision.cooldown().ifPresent(c -> notes.add(c.describe()));
        if (decision instanceof RefetchDecision.Partial p) {
            notes.add("Partial refetch: immature dates from " + p.matureCutoff());
        } else if (decision instanceof RefetchDecision.ReplaceSlice r) {
            notes.add("Replace slice: " + r.reason() + ", maturity=" + policy.computeEffectiveCohortMaturity(latency) + "d");
        }
    }

    /** Freshness of a partition is its least recently retrieved member. */
    private static ParameterValue stalest(List<ParameterValue> values) {
        ParameterValue best = null;
        for (ParameterValue v : values) {
            if (best == null || retrieved(v).isBefore(retrieved(best))) best = v;
        }
        return best;
    }

    private static ParameterValue newest(List<ParameterValue> values) {
        ParameterValue best = null;
        for (ParameterValue v : values) {
            if (best == null || recencyKey(v).compareTo(recencyKey(best)) > 0) best = v;
        }
        return best;
    }

    private static Instant retrieved(ParameterValue v) {
        return v.retrievedAt() == null ? Instant.EPOCH : v.retrievedAt();
    }

    private static String recencyKey(ParameterValue v) {
        if (v.retrievedAt() != null) return v.retrievedAt().toString();
        LocalDate end = v.cohortTo() != null ? v.cohortTo() : v.windowTo();
        return end == null ? "" : end.toString();
    }
}
