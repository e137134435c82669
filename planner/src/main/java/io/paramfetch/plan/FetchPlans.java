package io.paramfetch.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.FetchPlan;
import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.FetchWindow;
import io.paramfetch.model.FetchWindowReason;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Canonical form, equality, window merging and summaries for {@link FetchPlan}.
 */
public final class FetchPlans {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private FetchPlans() {}

    /** Items sorted by key, windows sorted by (start, end, reason). Idempotent. */
    public static FetchPlan canonicalise(FetchPlan plan) {
        List<FetchPlanItem> items = new ArrayList<>();
        for (FetchPlanItem item : plan.items()) {
            List<FetchWindow> windows = new ArrayList<>(item.windows());
            windows.sort(FetchPlanItem.WINDOW_ORDER);
            items.add(new FetchPlanItem(item.itemKey(), item.type(), item.objectId(), item.targetId(), item.slot(),
                    item.conditionalIndex(), item.mode(), item.sliceFamily(), item.querySignature(),
                    item.classification(), item.unfetchableReason(), windows));
        }
        items.sort(Comparator.comparing(FetchPlanItem::itemKey));
        return new FetchPlan(plan.version(), plan.createdAt(), plan.referenceNow(), plan.dsl(), items);
    }

    /** Deterministic JSON with recursively sorted keys. */
    public static String serialiseCanonical(FetchPlan plan) {
        FetchPlan c = canonicalise(plan);
        Map<String, Object> root = new TreeMap<>();
        root.put("version", c.version());
        root.put("createdAt", c.createdAt().toString());
        root.put("referenceNow", c.referenceNow().toString());
        root.put("dsl", c.dsl());
        List<Object> items = new ArrayList<>();
        for (FetchPlanItem item : c.items()) items.add(toMap(item));
        root.put("items", items);
        try {
            return CANONICAL.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialise plan", e);
        }
    }

    static Map<String, Object> toMap(FetchPlanItem item) {
        Map<String, Object> m = new TreeMap<>();
        m.put("itemKey", item.itemKey());
        m.put("type", item.type().wire());
        m.put("objectId", item.objectId());
        m.put("targetId", item.targetId());
        if (item.slot() != null) m.put("slot", item.slot().wire());
        if (item.conditionalIndex() != null) m.put("conditionalIndex", item.conditionalIndex());
        m.put("mode", item.mode() == null ? null : item.mode().wire());
        m.put("sliceFamily", item.sliceFamily());
        m.put("querySignature", item.querySignature());
        m.put("classification", item.classification().wire());
        if (item.unfetchableReason() != null) m.put("unfetchableReason", item.unfetchableReason());
        List<Object> windows = new ArrayList<>();
        for (FetchWindow w : item.windows()) {
            Map<String, Object> wm = new TreeMap<>();
            wm.put("start", w.start().toString());
            wm.put("end", w.end().toString());
            wm.put("reason", w.reason().wire());
            wm.put("dayCount", w.dayCount());
            windows.add(wm);
        }
        m.put("windows", windows);
        return m;
    }

    public static boolean plansEqual(FetchPlan a, FetchPlan b) {
        return serialiseCanonical(a).equals(serialiseCanonical(b));
    }

    public static List<FetchWindow> mergeDatesToWindows(Collection<LocalDate> dates, FetchWindowReason reason) {
        List<FetchWindow> out = new ArrayList<>();
        for (DateRange r : CalendarDates.contiguousRuns(dates)) {
            out.add(FetchWindow.of(r.start(), r.end(), reason));
        }
        return out;
    }

    /**
     * Combines missing and stale dates into sorted, non-overlapping windows. A date in both sets is
     * reported as missing.
     */
    public static List<FetchWindow> mergeWindowSets(Collection<LocalDate> missing, Collection<LocalDate> stale) {
        Set<LocalDate> missingSet = new TreeSet<>(missing);
        Set<LocalDate> staleOnly = new TreeSet<>(stale);
        staleOnly.removeAll(missingSet);
        List<FetchWindow> out = new ArrayList<>(mergeDatesToWindows(missingSet, FetchWindowReason.MISSING));
        out.addAll(mergeDatesToWindows(staleOnly, FetchWindowReason.STALE));
        out.sort(FetchPlanItem.WINDOW_ORDER);
        return out;
    }

    /** Adds {@code db_missing} windows for days not already in {@code windows}; existing reasons are kept. */
    public static List<FetchWindow> widenWithDbMissing(List<FetchWindow> windows, Collection<LocalDate> dbMissing) {
        Set<LocalDate> extra = new TreeSet<>(dbMissing);
        for (FetchWindow w : windows) extra.removeAll(w.range().days());
        List<FetchWindow> out = new ArrayList<>(windows);
        out.addAll(mergeDatesToWindows(extra, FetchWindowReason.DB_MISSING));
        out.sort(FetchPlanItem.WINDOW_ORDER);
        return out;
    }

    public static PlanSummary summarise(FetchPlan plan) {
        int fetch = 0, covered = 0, unfetchable = 0, windows = 0;
        long total = 0, missing = 0, stale = 0, dbMissing = 0;
        for (FetchPlanItem item : plan.items()) {
            switch (item.classification()) {
                case FETCH -> fetch++;
                case COVERED -> covered++;
                case UNFETCHABLE -> unfetchable++;
            }
            for (FetchWindow w : item.windows()) {
                windows++;
                total += w.dayCount();
                switch (w.reason()) {
                    case MISSING -> missing += w.dayCount();
                    case STALE -> stale += w.dayCount();
                    case DB_MISSING -> dbMissing += w.dayCount();
                }
            }
        }
        return new PlanSummary(plan.items().size(), fetch, covered, unfetchable, windows, total, missing, stale, dbMissing);
    }
}
