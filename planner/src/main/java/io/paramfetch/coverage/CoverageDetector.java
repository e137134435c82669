package io.paramfetch.coverage;

import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.ParameterValue;
import io.paramfetch.signature.SignatureMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the calendar days of a requested range that the cache cannot serve and merges them into
 * minimal contiguous windows.
 */
public final class CoverageDetector {
    private static final Logger log = LoggerFactory.getLogger(CoverageDetector.class);

    private CoverageDetector() {}

    /**
     * @throws SliceIsolationException if the query DSL cannot be parsed
     */
    public static CoverageResult coverage(List<ParameterValue> values, DateRange requested, String signature,
                                          boolean bustCache, String queryDsl) {
        List<LocalDate> allDays = requested.days();
        if (bustCache) {
            return new CoverageResult(Set.of(), allDays, List.of(requested), true, allDays.size(), false);
        }

        List<ParameterValue> candidates = filterBySignature(values, signature);

        if (!SliceIsolation.isImplicitMece(candidates, queryDsl)) {
            try {
                List<ParameterValue> family = SliceIsolation.isolate(candidates, queryDsl);
                if (HeaderCoveragePolicy.hasAggregateCoverage(family, requested)) {
                    return new CoverageResult(new HashSet<>(allDays), List.of(), List.of(), false, allDays.size(), true);
                }
            } catch (SliceIsolationException e) {
                log.debug("aggregate fast path skipped: {}", e.getMessage());
            }
        }

        Set<LocalDate> existing = existingDates(candidates, requested, queryDsl);
        List<LocalDate> missing = new ArrayList<>();
        for (LocalDate d : allDays) {
            if (!existing.contains(d)) missing.add(d);
        }
        List<DateRange> windows = CalendarDates.contiguousRuns(missing);
        return new CoverageResult(existing, missing, windows, !missing.isEmpty(), allDays.size(), false);
    }

    /**
     * When a signature is supplied and any value is signed, keeps only values whose signature can
     * serve the query. Otherwise returns {@code values} unchanged.
     */
    public static List<ParameterValue> filterBySignature(List<ParameterValue> values, String signature) {
        if (!shouldFilterBySignature(values, signature)) return values;
        List<ParameterValue> out = new ArrayList<>();
        for (ParameterValue v : values) {
            if (v.isSigned() && SignatureMatcher.canCacheSatisfyQuery(v.querySignature(), signature)) out.add(v);
        }
        return out;
    }

    public static boolean shouldFilterBySignature(List<ParameterValue> values, String signature) {
        if (signature == null || signature.isEmpty()) return false;
        for (ParameterValue v : values) {
            if (v.isSigned()) return true;
        }
        return false;
    }

    private static Set<LocalDate> existingDates(List<ParameterValue> values, DateRange requested, String queryDsl) {
        if (SliceIsolation.isImplicitMece(values, queryDsl)) {
            Map<String, Set<LocalDate>> perFamily = new HashMap<>();
            for (ParameterValue v : values) {
                perFamily.computeIfAbsent(v.sliceFamily(), k -> new HashSet<>()).addAll(observedDays(v, requested));
            }
            Set<LocalDate> out = new TreeSet<>();
            for (LocalDate d : requested.days()) {
                boolean all = true;
                for (Set<LocalDate> days : perFamily.values()) {
                    if (!days.contains(d)) { all = false; break; }
                }
                if (all) out.add(d);
            }
            return out;
        }
        Set<LocalDate> out = new TreeSet<>();
        for (ParameterValue v : SliceIsolation.isolate(values, queryDsl)) {
            out.addAll(observedDays(v, requested));
        }
        return out;
    }

    private static List<LocalDate> observedDays(ParameterValue v, DateRange requested) {
        List<LocalDate> out = new ArrayList<>();
        for (int i = 0; i < v.dates().size(); i++) {
            LocalDate d = v.dates().get(i);
            if (requested.contains(d) && v.hasObservationAt(i)) out.add(d);
        }
        return out;
    }
}
