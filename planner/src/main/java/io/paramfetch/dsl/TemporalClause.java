package io.paramfetch.dsl;

import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.TemporalMode;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@code window(start:end)} or {@code cohort([anchor,]start:end)} clause. Bounds are kept as written;
 * {@link #resolve(LocalDate)} turns them into calendar dates. An empty end means "today" and
 * {@code -7d} / {@code -2w} are offsets from today.
 */
public record TemporalClause(TemporalMode mode, String anchor, String start, String end) {
    private static final Pattern RELATIVE = Pattern.compile("^(-?\\d+)([dw])$");

    public DateRange resolve(LocalDate today) {
        LocalDate s = bound(start, today);
        LocalDate e = bound(end, today);
        if (e.isBefore(s)) throw new DslParseException(mode.wire() + "(" + start + ":" + end + ") ends before it starts");
        return new DateRange(s, e);
    }

    private static LocalDate bound(String raw, LocalDate today) {
        if (raw == null || raw.isBlank()) return today;
        Matcher m = RELATIVE.matcher(raw.trim());
        if (m.matches()) {
            long amount = Long.parseLong(m.group(1));
            return "w".equals(m.group(2)) ? today.plusWeeks(amount) : today.plusDays(amount);
        }
        try {
            return CalendarDates.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new DslParseException("bad date '" + raw + "'", e);
        }
    }
}
