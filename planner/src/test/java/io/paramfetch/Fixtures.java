package io.paramfetch;

import io.paramfetch.graph.CaseBinding;
import io.paramfetch.graph.Graph;
import io.paramfetch.graph.GraphEdge;
import io.paramfetch.graph.GraphNode;
import io.paramfetch.graph.ParamBinding;
import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.LatencyConfig;
import io.paramfetch.model.ParamSlot;
import io.paramfetch.model.ParameterValue;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Shared builders for planner tests. */
public final class Fixtures {
    private Fixtures() {}

    public static LocalDate d(String s) {
        return CalendarDates.parse(s);
    }

    public static DateRange range(String from, String to) {
        return new DateRange(d(from), d(to));
    }

    /** Window-mode slice with one n/k observation per day of {@code from..to}. */
    public static ParameterValue.Builder dailyWindow(String sliceDsl, String from, String to, long n, long k) {
        List<LocalDate> dates = range(from, to).days();
        List<Long> ns = new ArrayList<>();
        List<Long> ks = new ArrayList<>();
        for (int i = 0; i < dates.size(); i++) {
            ns.add(n);
            ks.add(k);
        }
        return ParameterValue.builder()
                .sliceDsl(sliceDsl)
                .window(d(from), d(to))
                .daily(dates, ns, ks);
    }

    public static ParameterValue.Builder dailyCohort(String sliceDsl, String from, String to, long n, long k) {
        ParameterValue.Builder b = dailyWindow(sliceDsl, from, to, n, k);
        return b.window(null, null).cohort(d(from), d(to));
    }

    public static GraphNode node(String id, String eventId) {
        return new GraphNode(id + "-uuid", id, eventId, null);
    }

    public static GraphNode caseNode(String id, String caseId, String connection) {
        return new GraphNode(id + "-uuid", id, "evt-" + id, new CaseBinding(caseId, connection));
    }

    public static GraphEdge edge(String id, String from, String to, String paramId, String connection, LatencyConfig latency) {
        return new GraphEdge(id + "-uuid", id, from, to,
                Map.of(ParamSlot.P, new ParamBinding(paramId, connection, latency)), List.of());
    }

    /** a -> b -> c with event ids on every node; edges bound to params p-ab and p-bc. */
    public static Graph chain(String connection, LatencyConfig latency) {
        return new Graph(
                List.of(node("a", "evt-a"), node("b", "evt-b"), node("c", "evt-c")),
                List.of(edge("ab", "a", "b", "p-ab", connection, latency), edge("bc", "b", "c", "p-bc", connection, latency)),
                null, null);
    }

    public static Instant at(String iso) {
        return Instant.parse(iso);
    }
}
