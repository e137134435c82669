package io.paramfetch.coverage;

import io.paramfetch.dsl.DslParseException;
import io.paramfetch.dsl.QueryConstraints;
import io.paramfetch.dsl.SliceDsl;
import io.paramfetch.model.ParameterValue;

import java.util.ArrayList;
import java.util.List;

public final class SliceIsolation {
    private SliceIsolation() {}

    /**
     * Values whose slice family equals the query's context dimensions, restricted to the query's
     * temporal mode when the query names one.
     *
     * @throws SliceIsolationException if the query DSL cannot be parsed
     */
    public static List<ParameterValue> isolate(List<ParameterValue> values, String queryDsl) {
        QueryConstraints q;
        try {
            q = QueryConstraints.parse(queryDsl);
        } catch (DslParseException e) {
            throw new SliceIsolationException("cannot isolate slice for '" + queryDsl + "': " + e.getMessage(), e);
        }
        String target = SliceDsl.format(q.contextValues());
        List<ParameterValue> out = new ArrayList<>();
        for (ParameterValue v : values) {
            if (!v.sliceFamily().equals(target)) continue;
            if (q.temporal().isPresent() && v.mode() != q.mode()) continue;
            out.add(v);
        }
        return out;
    }

    /** Uncontexted query over a file holding only contexted slices. */
    public static boolean isImplicitMece(List<ParameterValue> values, String queryDsl) {
        if (!SliceDsl.dimensions(queryDsl).isEmpty()) return false;
        boolean contexted = false;
        for (ParameterValue v : values) {
            if (v.sliceFamily().isEmpty()) return false;
            contexted = true;
        }
        return contexted;
    }
}
