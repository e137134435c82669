package io.paramfetch.dsl;

import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.TemporalMode;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structured form of a query DSL string such as
 * {@code context(channel:google).cohort(landing,1-Jan-26:31-Jan-26).asat(5-Feb-26)}.
 * Clauses other than window, cohort, asat/at and context are ignored.
 */
public record QueryConstraints(TemporalClause window, TemporalClause cohort, String asat, Map<String, String> contexts) {

    public static QueryConstraints parse(String dsl) {
        TemporalClause window = null;
        TemporalClause cohort = null;
        String asat = null;
        Map<String, String> contexts = new LinkedHashMap<>();
        for (String clause : splitClauses(dsl == null ? "" : dsl)) {
            int open = clause.indexOf('(');
            if (open <= 0 || !clause.endsWith(")")) {
                throw new DslParseException("malformed clause '" + clause + "'");
            }
            String name = clause.substring(0, open).trim();
            String args = clause.substring(open + 1, clause.length() - 1).trim();
            switch (name) {
                case "window" -> window = range(TemporalMode.WINDOW, null, args);
                case "cohort" -> {
                    int comma = args.indexOf(',');
                    String anchor = comma >= 0 ? args.substring(0, comma).trim() : null;
                    cohort = range(TemporalMode.COHORT, anchor, comma >= 0 ? args.substring(comma + 1) : args);
                }
                case "asat", "at" -> {
                    if (args.isEmpty()) throw new DslParseException("empty " + name + "()");
                    asat = args;
                }
                case "context" -> {
                    int colon = args.indexOf(':');
                    String key = colon >= 0 ? args.substring(0, colon).trim() : args;
                    if (key.isEmpty()) throw new DslParseException("context() without key");
                    contexts.put(key, colon >= 0 ? args.substring(colon + 1).trim() : null);
                }
                default -> {
                    // other clauses (visited, case, minus ...) do not affect fetch planning
                }
            }
        }
        return new QueryConstraints(window, cohort, asat, contexts);
    }

    private static TemporalClause range(TemporalMode mode, String anchor, String args) {
        int colon = args.indexOf(':');
        if (colon < 0) throw new DslParseException(mode.wire() + "(" + args + ") needs start:end");
        return new TemporalClause(mode, anchor, args.substring(0, colon).trim(), args.substring(colon + 1).trim());
    }

    /** Splits on '.' outside parentheses. */
    static List<String> splitClauses(String dsl) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        StringBuilder cur = new StringBuilder();
        for (char c : dsl.toCharArray()) {
            if (c == '(') depth++;
            if (c == ')') depth--;
            if (c == '.' && depth == 0) {
                if (cur.toString().isBlank()) cur.setLength(0);
                else { out.add(cur.toString().trim()); cur.setLength(0); }
                continue;
            }
            cur.append(c);
        }
        if (depth != 0) throw new DslParseException("unbalanced parentheses in '" + dsl + "'");
        if (!cur.toString().isBlank()) out.add(cur.toString().trim());
        return out;
    }

    public boolean isCohort() {
        return cohort != null;
    }

    public TemporalMode mode() {
        return isCohort() ? TemporalMode.COHORT : TemporalMode.WINDOW;
    }

    /** The active temporal clause; cohort wins when both are present. */
    public Optional<TemporalClause> temporal() {
        return Optional.ofNullable(cohort != null ? cohort : window);
    }

    public Optional<DateRange> dateRange(LocalDate today) {
        return temporal().map(c -> c.resolve(today));
    }

    public Optional<LocalDate> asatDate() {
        if (asat == null) return Optional.empty();
        try {
            return Optional.of(CalendarDates.parse(asat));
        } catch (IllegalArgumentException e) {
            throw new DslParseException("bad asat date '" + asat + "'", e);
        }
    }

    /** Context constraints that carry a value. */
    public Map<String, String> contextValues() {
        Map<String, String> out = new LinkedHashMap<>();
        contexts.forEach((k, v) -> { if (v != null && !v.isEmpty()) out.put(k, v); });
        return out;
    }
}
