package io.paramfetch.dsl;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient helpers for slice DSL strings. Unlike {@link QueryConstraints#parse} these never throw;
 * anything that is not a {@code context(...)} clause is ignored.
 */
public final class SliceDsl {
    private static final Pattern CONTEXT = Pattern.compile("context\\(\\s*([^:()]+?)\\s*(?::\\s*([^()]*?)\\s*)?\\)");

    private SliceDsl() {}

    /** Canonical dimensions, e.g. {@code context(channel:uk).context(device:mobile)}; empty if none. */
    public static String dimensions(String dsl) {
        return format(contextMap(dsl));
    }

    /** Key to value for every valued context clause, sorted by key. */
    public static Map<String, String> contextMap(String dsl) {
        Map<String, String> out = new TreeMap<>();
        if (dsl == null) return out;
        Matcher m = CONTEXT.matcher(dsl);
        while (m.find()) {
            String v = m.group(2);
            if (v != null && !v.isEmpty()) out.put(m.group(1), v);
        }
        return out;
    }

    /** Keys named by context clauses with or without a value, in order of appearance. */
    public static Set<String> contextKeys(String dsl) {
        Set<String> out = new LinkedHashSet<>();
        if (dsl == null) return out;
        Matcher m = CONTEXT.matcher(dsl);
        while (m.find()) out.add(m.group(1));
        return out;
    }

    public static String format(Map<String, String> contexts) {
        List<String> parts = new ArrayList<>();
        new TreeMap<>(contexts).forEach((k, v) -> parts.add("context(" + k + ":" + v + ")"));
        return String.join(".", parts);
    }

    public static boolean isCohort(String dsl) {
        return dsl != null && dsl.contains("cohort(");
    }
}
