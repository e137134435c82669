package io.paramfetch.plan;

import io.paramfetch.dsl.DslParseException;
import io.paramfetch.dsl.QueryConstraints;
import io.paramfetch.graph.Graph;
import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Inputs to one plan build. {@code querySignatures} maps item keys to execution-grade signatures.
 */
public record PlanRequest(
        Graph graph,
        String dsl,
        DateRange window,
        Instant referenceNow,
        Instant createdAt,
        boolean bustCache,
        Map<String, String> querySignatures
) {
    public PlanRequest {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(referenceNow, "referenceNow");
        dsl = dsl == null ? "" : dsl;
        querySignatures = querySignatures == null ? Map.of() : Map.copyOf(querySignatures);
    }

    /**
     * Derives the window from the DSL's window or cohort clause, resolved against {@code referenceNow}.
     *
     * @throws DslParseException if the DSL is malformed or has no temporal clause
     */
    public static PlanRequest fromDsl(Graph graph, String dsl, Instant referenceNow, boolean bustCache,
                                      Map<String, String> querySignatures) {
        DateRange window = QueryConstraints.parse(dsl).dateRange(CalendarDates.utcDate(referenceNow))
                .orElseThrow(() -> new DslParseException("query '" + dsl + "' has no window() or cohort() clause"));
        return new PlanRequest(graph, dsl, window, referenceNow, null, bustCache, querySignatures);
    }
}
