package io.paramfetch.snapshot;

import io.paramfetch.core.ContextRegistry;
import io.paramfetch.core.MecePartitionCheck;
import io.paramfetch.core.RetrievalSummaryRow;
import io.paramfetch.dsl.SliceDsl;
import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.TemporalMode;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Splits a cohort-maturity sweep into epochs: maximal runs of days that read the same slice-key set.
 * Each day uses its latest retrieval group and the least-aggregated key set that safely answers the
 * query; days without a safe choice become gap epochs.
 */
public class CohortMaturityEpochs {
    public static final String GAP_SLICE_KEY = "__epoch_gap__";

    private final ContextRegistry registry;

    public CohortMaturityEpochs(ContextRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** {@code sliceKeys} is empty for a gap epoch. */
    public record Epoch(DateRange days, List<String> sliceKeys) {
        public boolean isGap() {
            return sliceKeys.isEmpty();
        }
    }

    /**
     * @param pinnedKeys context keys the graph declares interest in; null means unrestricted
     */
    public List<Epoch> segment(List<RetrievalSummaryRow> rows, DateRange sweep, TemporalMode mode,
                               Map<String, String> queryContext, Set<String> pinnedKeys) {
        Map<LocalDate, List<String>> latestGroupByDay = latestGroups(rows);
        List<Epoch> epochs = new ArrayList<>();
        List<String> carried = null;
        LocalDate runStart = null;
        List<String> runKeys = null;
        for (LocalDate day : sweep.days()) {
            List<String> group = latestGroupByDay.get(day);
            List<String> selection = group == null ? carried : choose(group, mode, queryContext, pinnedKeys);
            if (group != null) carried = selection;
            List<String> keys = selection == null ? List.of() : selection;
            if (runStart == null) {
                runStart = day;
                runKeys = keys;
            } else if (!runKeys.equals(keys)) {
                epochs.add(new Epoch(new DateRange(runStart, day.minusDays(1)), runKeys));
                runStart = day;
                runKeys = keys;
            }
        }
        if (runStart != null) epochs.add(new Epoch(new DateRange(runStart, sweep.end()), runKeys));
        return epochs;
    }

    private static Map<LocalDate, List<String>> latestGroups(List<RetrievalSummaryRow> rows) {
        Map<LocalDate, Instant> latest = new HashMap<>();
        for (RetrievalSummaryRow r : rows) {
            LocalDate day = CalendarDates.utcDate(r.retrievedAt());
            Instant cur = latest.get(day);
            if (cur == null || r.retrievedAt().isAfter(cur)) latest.put(day, r.retrievedAt());
        }
        Map<LocalDate, List<String>> out = new TreeMap<>();
        for (RetrievalSummaryRow r : rows) {
            LocalDate day = CalendarDates.utcDate(r.retrievedAt());
            if (!r.retrievedAt().equals(latest.get(day))) continue;
            List<String> keys = out.computeIfAbsent(day, d -> new ArrayList<>());
            if (!keys.contains(r.sliceKey())) keys.add(r.sliceKey());
        }
        return out;
    }

    private record Candidate(List<String> keys, int extraDims) {}

    /** Least-aggregated safe key set among {@code available}, or null. */
    List<String> choose(List<String> available, TemporalMode mode, Map<String, String> queryContext, Set<String> pinnedKeys) {
        Map<Set<String>, List<String>> byExtraDims = new HashMap<>();
        for (String key : available) {
            if (!sameMode(key, mode)) continue;
            Map<String, String> ctx = SliceDsl.contextMap(key);
            boolean matches = true;
            for (Map.Entry<String, String> q : queryContext.entrySet()) {
                if (!q.getValue().equals(ctx.get(q.getKey()))) { matches = false; break; }
            }
            if (!matches) continue;
            Set<String> extra = new TreeSet<>(ctx.keySet());
            extra.removeAll(queryContext.keySet());
            byExtraDims.computeIfAbsent(extra, e -> new ArrayList<>()).add(key);
        }

        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<Set<String>, List<String>> e : byExtraDims.entrySet()) {
            Set<String> extra = e.getKey();
            List<String> keys = new ArrayList<>(new TreeSet<>(e.getValue()));
            if (extra.isEmpty()) {
                candidates.add(new Candidate(keys.subList(0, 1), 0));
                continue;
            }
            if (pinnedKeys != null && !pinnedKeys.containsAll(extra)) continue;
            if (isSafePartition(keys, extra)) candidates.add(new Candidate(keys, extra.size()));
        }
        candidates.sort(Comparator.comparingInt(Candidate::extraDims)
                .thenComparingInt(c -> c.keys().size())
                .thenComparing(c -> String.join("|", c.keys())));
        return candidates.isEmpty() ? null : List.copyOf(candidates.get(0).keys());
    }

    private boolean isSafePartition(List<String> keys, Set<String> dims) {
        Map<String, Set<String>> valuesPerDim = new TreeMap<>();
        Set<String> combos = new TreeSet<>();
        for (String key : keys) {
            Map<String, String> ctx = SliceDsl.contextMap(key);
            StringBuilder combo = new StringBuilder();
            for (String d : dims) {
                valuesPerDim.computeIfAbsent(d, x -> new TreeSet<>()).add(ctx.get(d));
                combo.append(d).append(':').append(ctx.get(d)).append('|');
            }
            combos.add(combo.toString());
        }
        long expected = 1;
        for (String d : dims) {
            List<String> probe = new ArrayList<>();
            for (String v : valuesPerDim.get(d)) probe.add("context(" + d + ":" + v + ")");
            MecePartitionCheck check = registry.detectMecePartition(probe, d);
            if (!check.isMece() || !check.isComplete() || !check.canAggregate()) return false;
            expected *= valuesPerDim.get(d).size();
        }
        return combos.size() == expected;
    }

    private static boolean sameMode(String sliceKey, TemporalMode mode) {
        boolean cohort = sliceKey.contains("cohort(");
        boolean window = sliceKey.contains("window(");
        if (!cohort && !window) return true;
        return mode == TemporalMode.COHORT ? cohort : window;
    }
}
