package io.paramfetch.mece;

import io.paramfetch.core.ContextRegistry;
import io.paramfetch.core.MecePartitionCheck;
import io.paramfetch.dsl.SliceDsl;
import io.paramfetch.model.ParameterValue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collapses slices cached on a finer partition (e.g. per channel) into the coarser slice a query asks
 * for, refusing whenever the partition cannot be proven complete and mutually exclusive.
 */
public class DimensionalReducer {
    public static final int MAX_COMBINATION_DIMENSIONS = 4;

    private final ContextRegistry registry;

    public DimensionalReducer(ContextRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ReductionResult reduce(List<ParameterValue> values, String queryDsl) {
        Map<String, String> specified = SliceDsl.contextMap(queryDsl);
        List<String> specifiedKeys = new ArrayList<>(specified.keySet());
        List<String> warnings = new ArrayList<>();

        List<ParameterValue> matching = new ArrayList<>();
        List<String> unspecified = null;
        for (ParameterValue v : values) {
            Map<String, String> ctx = SliceDsl.contextMap(v.sliceDsl());
            if (!matches(ctx, specified)) continue;
            matching.add(v);
            if (unspecified == null) {
                Set<String> keys = new TreeSet<>(ctx.keySet());
                keys.removeAll(specified.keySet());
                unspecified = new ArrayList<>(keys);
            }
        }
        if (matching.isEmpty()) {
            return new ReductionResult.NotReducible("no_matching_slices", new ReductionDiagnostics(specifiedKeys, List.of(), 0,
                    Map.of(), List.of("No slices match the specified dimension values")));
        }
        if (unspecified.isEmpty()) {
            return new ReductionResult.Reduced(matching,
                    new ReductionDiagnostics(specifiedKeys, List.of(), matching.size(), Map.of(), List.of()));
        }

        Map<String, ReductionDiagnostics.DimensionCheck> observed = new LinkedHashMap<>();
        for (String key : unspecified) {
            Set<String> present = new TreeSet<>();
            for (ParameterValue v : matching) {
                String val = SliceDsl.contextMap(v.sliceDsl()).get(key);
                if (val != null) present.add(val);
            }
            List<String> probe = new ArrayList<>();
            for (String val : present) probe.add("context(" + key + ":" + val + ")");
            MecePartitionCheck check = registry.detectMecePartition(probe, key);
            observed.put(key, new ReductionDiagnostics.DimensionCheck(check.isComplete(), check.canAggregate(), List.copyOf(present)));
            if (!check.isMece()) {
                return notReducible("dimension_not_mece:" + key, specifiedKeys, unspecified, matching.size(), observed,
                        append(warnings, "Dimension '" + key + "' is not MECE (missing: " + String.join(", ", check.missingValues()) + ")"));
            }
            if (!check.canAggregate()) {
                return notReducible("dimension_not_aggregatable:" + key, specifiedKeys, unspecified, matching.size(), observed,
                        append(warnings, "Dimension '" + key + "' cannot be aggregated (policy " + check.policy()
                                + ", missing: " + String.join(", ", check.missingValues()) + ")"));
            }
        }

        if (unspecified.size() > 1) {
            List<String> missingCombos = missingCombinations(matching, unspecified);
            if (!missingCombos.isEmpty()) {
                String reason = missingCombos.contains("too_many_dimensions") ? "too_many_dimensions" : "incomplete_combinations";
                return notReducible(reason, specifiedKeys, unspecified, matching.size(), observed,
                        append(warnings, "Missing combinations: " + String.join(", ", missingCombos.subList(0, Math.min(5, missingCombos.size())))));
            }
        }

        List<ParameterValue> deduped = dedupe(matching);
        ParameterValue aggregated = aggregate(deduped, SliceDsl.format(specified));
        if (aggregated == null) {
            return notReducible("aggregation_failed", specifiedKeys, unspecified, matching.size(), observed,
                    append(warnings, "Date arrays of the partition do not align"));
        }
        return new ReductionResult.Reduced(List.of(aggregated),
                new ReductionDiagnostics(specifiedKeys, unspecified, deduped.size(), observed, warnings));
    }

    private static ReductionResult notReducible(String reason, List<String> specified, List<String> unspecified, int used,
                                                Map<String, ReductionDiagnostics.DimensionCheck> observed, List<String> warnings) {
        return new ReductionResult.NotReducible(reason, new ReductionDiagnostics(specified, unspecified, used, observed, warnings));
    }

    private static List<String> append(List<String> warnings, String w) {
        List<String> out = new ArrayList<>(warnings);
        out.add(w);
        return out;
    }

    private static boolean matches(Map<String, String> ctx, Map<String, String> specified) {
        for (Map.Entry<String, String> e : specified.entrySet()) {
            if (!e.getValue().equals(ctx.get(e.getKey()))) return false;
        }
        return true;
    }

    /** Empty when every combination of the dimensions' observed values is present. */
    static List<String> missingCombinations(List<ParameterValue> slices, List<String> dims) {
        if (dims.size() > MAX_COMBINATION_DIMENSIONS) return List.of("too_many_dimensions");
        Set<String> actual = new TreeSet<>();
        Map<String, Set<String>> valuesPerDim = new TreeMap<>();
        for (String d : dims) valuesPerDim.put(d, new TreeSet<>());
        for (ParameterValue v : slices) {
            Map<String, String> ctx = SliceDsl.contextMap(v.sliceDsl());
            List<String> parts = new ArrayList<>();
            for (String d : dims) {
                String val = ctx.getOrDefault(d, "");
                parts.add(d + ":" + val);
                if (!val.isEmpty()) valuesPerDim.get(d).add(val);
            }
            actual.add(String.join("|", parts));
        }
        List<String> missing = new ArrayList<>();
        collect(dims, valuesPerDim, 0, new ArrayList<>(), actual, missing);
        return missing;
    }

    private static void collect(List<String> dims, Map<String, Set<String>> valuesPerDim, int idx, List<String> cur,
                                Set<String> actual, List<String> missing) {
        if (missing.size() >= 10) return;
        if (idx == dims.size()) {
            String key = String.join("|", cur);
            if (!actual.contains(key)) missing.add(key);
            return;
        }
        String d = dims.get(idx);
        for (String val : valuesPerDim.get(d)) {
            cur.add(d + ":" + val);
            collect(dims, valuesPerDim, idx + 1, cur, actual, missing);
            cur.remove(cur.size() - 1);
        }
    }

    /** Dedupes by (sliceDSL, signature, window_from, window_to); the most recently retrieved wins. */
    static List<ParameterValue> dedupe(List<ParameterValue> slices) {
        Map<String, ParameterValue> byKey = new LinkedHashMap<>();
        for (ParameterValue v : slices) {
            String key = v.sliceDsl() + "|" + Objects.toString(v.querySignature(), "") + "|"
                    + Objects.toString(v.windowFrom(), "") + "|" + Objects.toString(v.windowTo(), "");
            ParameterValue existing = byKey.get(key);
            if (existing == null || epoch(v.retrievedAt()) > epoch(existing.retrievedAt())) byKey.put(key, v);
        }
        return new ArrayList<>(byKey.values());
    }

    private static long epoch(Instant t) {
        return t == null ? 0 : t.toEpochMilli();
    }

    /** Element-wise sum; null when the date arrays are empty or not index-aligned. */
    static ParameterValue aggregate(List<ParameterValue> slices, String relabelTo) {
        if (slices.isEmpty()) return null;
        ParameterValue template = slices.get(0);
        List<LocalDate> dates = template.dates();
        if (dates.isEmpty()) return null;
        for (ParameterValue v : slices) {
            if (!v.dates().equals(dates)) return null;
        }
        List<Long> nDaily = new ArrayList<>();
        List<Long> kDaily = new ArrayList<>();
        long n = 0;
        long k = 0;
        for (int i = 0; i < dates.size(); i++) {
            long ns = 0;
            long ks = 0;
            for (ParameterValue v : slices) {
                ns += at(v.nDaily(), i);
                ks += at(v.kDaily(), i);
            }
            nDaily.add(ns);
            kDaily.add(ks);
            n += ns;
            k += ks;
        }
        return template.toBuilder()
                .sliceDsl(relabelTo)
                .daily(dates, nDaily, kDaily)
                .aggregate(n > 0 ? (double) k / n : 0.0, n, k)
                .build();
    }

    private static long at(List<Long> daily, int i) {
        if (daily.isEmpty()) return 0;
        Long v = daily.get(i);
        return v == null ? 0 : v;
    }
}
