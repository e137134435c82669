package io.paramfetch.model;

import java.time.LocalDate;
import java.util.Objects;

public record FetchWindow(LocalDate start, LocalDate end, FetchWindowReason reason, long dayCount) {
    public FetchWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(reason, "reason");
        if (end.isBefore(start)) throw new IllegalArgumentException("window end before start: " + start + ".." + end);
        if (dayCount != CalendarDates.dayCount(start, end)) {
            throw new IllegalArgumentException("dayCount " + dayCount + " does not match " + start + ".." + end);
        }
    }

    public static FetchWindow of(LocalDate start, LocalDate end, FetchWindowReason reason) {
        return new FetchWindow(start, end, reason, CalendarDates.dayCount(start, end));
    }

    public DateRange range() {
        return new DateRange(start, end);
    }
}
