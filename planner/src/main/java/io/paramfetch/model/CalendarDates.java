package io.paramfetch.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Calendar date helpers. All planning happens on UTC calendar days.
 */
public final class CalendarDates {
    private static final DateTimeFormatter UK = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-")
            .appendValueReduced(ChronoField.YEAR, 2, 4, 2000)
            .toFormatter(Locale.ENGLISH);
    private static final DateTimeFormatter UK_OUT = DateTimeFormatter.ofPattern("d-MMM-yy", Locale.ENGLISH);

    private CalendarDates() {}

    /**
     * Parses {@code 1-Jan-26}, {@code 01-Jan-2026} or {@code 2026-01-01}; a time suffix on an ISO date is dropped.
     */
    public static LocalDate parse(String text) {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("empty date");
        String s = text.trim();
        boolean iso = s.length() >= 10 && Character.isDigit(s.charAt(0)) && s.charAt(4) == '-' && s.charAt(7) == '-';
        if (iso && s.length() > 10 && (s.charAt(10) == 'T' || s.charAt(10) == 't')) s = s.substring(0, 10);
        try {
            if (iso && s.length() == 10) {
                return LocalDate.parse(s);
            }
            return LocalDate.parse(s, UK);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable date: " + text, e);
        }
    }

    public static String formatUk(LocalDate date) {
        return UK_OUT.format(date);
    }

    public static LocalDate utcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public static List<LocalDate> daysInclusive(LocalDate start, LocalDate end) {
        List<LocalDate> out = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) out.add(d);
        return out;
    }

    public static long dayCount(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    /**
     * Sorts and dedupes {@code dates}, then merges neighbours at most one calendar day apart.
     */
    public static List<DateRange> contiguousRuns(Collection<LocalDate> dates) {
        List<LocalDate> sorted = new ArrayList<>(new TreeSet<>(dates));
        List<DateRange> out = new ArrayList<>();
        if (sorted.isEmpty()) return out;
        LocalDate runStart = sorted.get(0);
        LocalDate prev = runStart;
        for (int i = 1; i < sorted.size(); i++) {
            LocalDate cur = sorted.get(i);
            if (ChronoUnit.DAYS.between(prev, cur) > 1) {
                out.add(new DateRange(runStart, prev));
                runStart = cur;
            }
            prev = cur;
        }
        out.add(new DateRange(runStart, prev));
        return out;
    }

    /** Whole days from {@code date} to {@code reference}; negative when date is in the future. */
    public static long ageInDays(LocalDate date, LocalDate reference) {
        return ChronoUnit.DAYS.between(date, reference);
    }
}
