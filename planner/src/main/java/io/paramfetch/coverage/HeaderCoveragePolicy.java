package io.paramfetch.coverage;

import io.paramfetch.dsl.SliceDsl;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.ParameterValue;
import io.paramfetch.model.TemporalMode;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Header coverage: a slice family is covered when a slice carrying aggregate {@code mean}/{@code n} has a
 * header envelope ({@code window_from/to} or {@code cohort_from/to}) that fully contains the requested
 * range. Per-day sparsity inside the envelope is not inspected, so a sparse slice whose header claims
 * full coverage counts as covered.
 */
public final class HeaderCoveragePolicy {
    private HeaderCoveragePolicy() {}

    public static boolean hasFullHeaderCoverage(List<ParameterValue> values, DateRange requested, String queryDsl) {
        if (values.isEmpty()) return false;
        TemporalMode wanted = SliceDsl.isCohort(queryDsl) ? TemporalMode.COHORT
                : queryDsl != null && queryDsl.contains("window(") ? TemporalMode.WINDOW : null;

        if (SliceIsolation.isImplicitMece(values, queryDsl)) {
            Map<String, Boolean> covered = new TreeMap<>();
            for (ParameterValue v : values) {
                boolean ok = (wanted == null || v.mode() == wanted) && v.hasAggregate() && covers(v, requested);
                covered.merge(v.sliceFamily(), ok, Boolean::logicalOr);
            }
            return !covered.isEmpty() && !covered.containsValue(Boolean.FALSE);
        }

        return hasAggregateCoverage(SliceIsolation.isolate(values, queryDsl), requested);
    }

    /** Header contains the request and the slice carries mean and n. */
    public static boolean hasAggregateCoverage(List<ParameterValue> family, DateRange requested) {
        for (ParameterValue v : family) {
            if (v.hasAggregate() && covers(v, requested)) return true;
        }
        return false;
    }

    private static boolean covers(ParameterValue v, DateRange requested) {
        return v.header().map(h -> h.contains(requested)).orElse(false);
    }
}
