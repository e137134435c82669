package io.paramfetch.snapshot;

import io.paramfetch.core.HashService;
import io.paramfetch.core.RetrievalSummaryRow;
import io.paramfetch.core.SnapshotRetrievalClient;
import io.paramfetch.dsl.DslParseException;
import io.paramfetch.dsl.QueryConstraints;
import io.paramfetch.dsl.SliceDsl;
import io.paramfetch.graph.Graph;
import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.ItemType;
import io.paramfetch.model.TemporalMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a built plan into snapshot-store read requests. This is the only component that mints
 * core hashes.
 */
public class SnapshotSubjectMapper {
    private static final Logger log = LoggerFactory.getLogger(SnapshotSubjectMapper.class);

    private final HashService hashService;
    private final SnapshotRetrievalClient retrievalClient;
    private final CohortMaturityEpochs epochs;

    public SnapshotSubjectMapper(HashService hashService, SnapshotRetrievalClient retrievalClient, CohortMaturityEpochs epochs) {
        this.hashService = Objects.requireNonNull(hashService, "hashService");
        this.retrievalClient = Objects.requireNonNull(retrievalClient, "retrievalClient");
        this.epochs = Objects.requireNonNull(epochs, "epochs");
    }

    private record TimeBounds(LocalDate anchorFrom, LocalDate anchorTo, LocalDate asAt, LocalDate sweepFrom, LocalDate sweepTo) {}

    public MappingResult map(MappingRequest request) {
        List<SnapshotSubjectRequest> subjects = new ArrayList<>();
        List<SkippedItem> skipped = new ArrayList<>();
        Set<String> inScope = request.scope().edgesInScope(request.graph());
        LocalDate today = CalendarDates.utcDate(request.plan().referenceNow());

        TimeBounds bounds;
        try {
            bounds = timeBounds(request, today);
        } catch (DslParseException e) {
            log.warn("cannot derive snapshot time bounds from '{}': {}", request.queryDsl(), e.getMessage());
            bounds = null;
        }

        for (FetchPlanItem item : request.plan().items()) {
            if (item.type() != ItemType.PARAMETER) {
                skipped.add(new SkippedItem(item.itemKey(), SkippedItem.NOT_A_PARAMETER));
                continue;
            }
            if (!inScope.contains(item.targetId())) {
                skipped.add(new SkippedItem(item.itemKey(), SkippedItem.OUT_OF_SCOPE));
                continue;
            }
            if (item.querySignature().isEmpty()) {
                skipped.add(new SkippedItem(item.itemKey(), SkippedItem.NO_SIGNATURE));
                continue;
            }
            if (bounds == null) {
                skipped.add(new SkippedItem(item.itemKey(), SkippedItem.NO_TIME_BOUNDS));
                continue;
            }
            String coreHash = hashService.shortHash(item.querySignature());
            String paramId = request.workspace().paramId(item.objectId());
            SnapshotTarget target = new SnapshotTarget(item.targetId(), item.slot() == null ? null : item.slot().wire(),
                    item.conditionalIndex());
            if (request.readMode() == ReadMode.COHORT_MATURITY) {
                subjects.addAll(cohortMaturitySubjects(item, request, bounds, coreHash, paramId, target));
            } else {
                subjects.add(new SnapshotSubjectRequest(item.itemKey(), paramId, coreHash, request.readMode(),
                        bounds.anchorFrom(), bounds.anchorTo(), bounds.asAt(), null, null,
                        defaultSliceKeys(item, request.sliceKeysPolicy()), target));
            }
        }
        return new MappingResult(subjects, skipped);
    }

    /** {@code [family.mode()]}, or for uncontexted items {@code [""]} / {@code [mode()]} per policy. */
    public static List<String> defaultSliceKeys(FetchPlanItem item, SliceKeysPolicy policy) {
        TemporalMode mode = item.mode() == null ? TemporalMode.WINDOW : item.mode();
        if (!item.sliceFamily().isEmpty()) return List.of(item.sliceFamily() + "." + mode.clause());
        return policy == SliceKeysPolicy.MECE_FULFILMENT_ALLOWED ? List.of("") : List.of(mode.clause());
    }

    private TimeBounds timeBounds(MappingRequest request, LocalDate today) {
        QueryConstraints q = QueryConstraints.parse(request.queryDsl());
        DateRange anchor = q.dateRange(today).orElse(null);
        if (anchor == null) return null;
        LocalDate asAt = q.asatDate().orElse(null);
        if (request.readMode() != ReadMode.COHORT_MATURITY) {
            return new TimeBounds(anchor.start(), anchor.end(), asAt, null, null);
        }
        LocalDate sweepTo = asAt != null ? asAt : today;
        if (sweepTo.isBefore(anchor.start())) sweepTo = anchor.start();
        return new TimeBounds(anchor.start(), anchor.end(), asAt, anchor.start(), sweepTo);
    }

    private List<SnapshotSubjectRequest> cohortMaturitySubjects(FetchPlanItem item, MappingRequest request, TimeBounds b,
                                                                String coreHash, String paramId, SnapshotTarget target) {
        SnapshotSubjectRequest single = new SnapshotSubjectRequest(item.itemKey(), paramId, coreHash, ReadMode.COHORT_MATURITY,
                b.anchorFrom(), b.anchorTo(), b.asAt(), b.sweepFrom(), b.sweepTo(), familyKeys(item), target);
        List<RetrievalSummaryRow> rows;
        try {
            rows = retrievalClient.querySummary(paramId, coreHash, List.of(""), b.anchorFrom(), b.anchorTo());
        } catch (IOException e) {
            log.warn("retrieval summary unavailable for {}; reading its own slice family only: {}", item.itemKey(), e.getMessage());
            return List.of(single);
        }
        if (rows.isEmpty()) return List.of(single);

        Map<String, String> queryContext = SliceDsl.contextMap(item.sliceFamily());
        Set<String> pinned = request.graph().dataInterestsDsl() == null ? null : SliceDsl.contextKeys(request.graph().dataInterestsDsl());
        TemporalMode mode = item.mode() == null ? TemporalMode.COHORT : item.mode();
        List<CohortMaturityEpochs.Epoch> segments = epochs.segment(rows, new DateRange(b.sweepFrom(), b.sweepTo()), mode, queryContext, pinned);

        List<SnapshotSubjectRequest> out = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            CohortMaturityEpochs.Epoch epoch = segments.get(i);
            List<String> keys = epoch.isGap() ? List.of(CohortMaturityEpochs.GAP_SLICE_KEY) : epoch.sliceKeys();
            out.add(new SnapshotSubjectRequest(item.itemKey() + "::epoch:" + i, paramId, coreHash, ReadMode.COHORT_MATURITY,
                    b.anchorFrom(), b.anchorTo(), b.asAt(), epoch.days().start(), epoch.days().end(), keys, target));
        }
        log.debug("{} split into {} epochs", item.itemKey(), out.size());
        return out;
    }

    /** Item's own family in its mode, never the broad {@code [""]} read. */
    private static List<String> familyKeys(FetchPlanItem item) {
        TemporalMode mode = item.mode() == null ? TemporalMode.COHORT : item.mode();
        return item.sliceFamily().isEmpty() ? List.of(mode.clause()) : List.of(item.sliceFamily() + "." + mode.clause());
    }
}
