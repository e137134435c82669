package io.paramfetch.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/** Inclusive calendar range. */
public record DateRange(LocalDate start, LocalDate end) {
    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) throw new IllegalArgumentException("range end " + end + " before start " + start);
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange parse(String start, String end) {
        return new DateRange(CalendarDates.parse(start), CalendarDates.parse(end));
    }

    public boolean contains(LocalDate d) {
        return !d.isBefore(start) && !d.isAfter(end);
    }

    public boolean contains(DateRange other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public List<LocalDate> days() {
        return CalendarDates.daysInclusive(start, end);
    }

    public long dayCount() {
        return CalendarDates.dayCount(start, end);
    }
}
