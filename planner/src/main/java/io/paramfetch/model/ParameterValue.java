package io.paramfetch.model;

import io.paramfetch.dsl.SliceDsl;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One cached slice of a parameter file. Daily arrays are index-aligned with {@code dates};
 * a null element means the provider returned no observation for that day.
 */
public record ParameterValue(
        String sliceDsl,
        LocalDate windowFrom,
        LocalDate windowTo,
        LocalDate cohortFrom,
        LocalDate cohortTo,
        List<LocalDate> dates,
        List<Long> nDaily,
        List<Long> kDaily,
        Double mean,
        Long n,
        Long k,
        String querySignature,
        Instant retrievedAt
) {
    public ParameterValue {
        sliceDsl = sliceDsl == null ? "" : sliceDsl;
        dates = copy(dates);
        nDaily = copy(nDaily);
        kDaily = copy(kDaily);
        if (!nDaily.isEmpty() && nDaily.size() != dates.size()) {
            throw new IllegalArgumentException("n_daily length " + nDaily.size() + " != dates length " + dates.size());
        }
        if (!kDaily.isEmpty() && kDaily.size() != dates.size()) {
            throw new IllegalArgumentException("k_daily length " + kDaily.size() + " != dates length " + dates.size());
        }
    }

    private static <T> List<T> copy(List<T> in) {
        return in == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(in));
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder().sliceDsl(sliceDsl).window(windowFrom, windowTo).cohort(cohortFrom, cohortTo)
                .daily(dates, nDaily, kDaily).aggregate(mean, n, k)
                .querySignature(querySignature).retrievedAt(retrievedAt);
    }

    public TemporalMode mode() {
        if (cohortFrom != null || cohortTo != null || sliceDsl.contains("cohort(")) return TemporalMode.COHORT;
        return TemporalMode.WINDOW;
    }

    /** Canonical context dimensions of this slice; empty when uncontexted. */
    public String sliceFamily() {
        return SliceDsl.dimensions(sliceDsl);
    }

    /** Header envelope matching this value's mode, falling back to the other envelope. */
    public Optional<DateRange> header() {
        boolean cohort = mode() == TemporalMode.COHORT;
        LocalDate from = cohort ? firstNonNull(cohortFrom, windowFrom) : firstNonNull(windowFrom, cohortFrom);
        LocalDate to = cohort ? firstNonNull(cohortTo, windowTo) : firstNonNull(windowTo, cohortTo);
        if (from == null || to == null || to.isBefore(from)) return Optional.empty();
        return Optional.of(new DateRange(from, to));
    }

    private static LocalDate firstNonNull(LocalDate a, LocalDate b) {
        return a != null ? a : b;
    }

    public boolean hasAggregate() {
        return mean != null && n != null;
    }

    public boolean isSigned() {
        return querySignature != null && !querySignature.isEmpty();
    }

    /** True if the day at {@code i} carries a non-null n or k observation. */
    public boolean hasObservationAt(int i) {
        Long nv = nDaily.isEmpty() ? null : nDaily.get(i);
        Long kv = kDaily.isEmpty() ? null : kDaily.get(i);
        return nv != null || kv != null;
    }

    public static final class Builder {
        private String sliceDsl = "";
        private LocalDate windowFrom;
        private LocalDate windowTo;
        private LocalDate cohortFrom;
        private LocalDate cohortTo;
        private List<LocalDate> dates;
        private List<Long> nDaily;
        private List<Long> kDaily;
        private Double mean;
        private Long n;
        private Long k;
        private String querySignature;
        private Instant retrievedAt;

        public Builder sliceDsl(String s) { this.sliceDsl = s; return this; }
        public Builder window(LocalDate from, LocalDate to) { this.windowFrom = from; this.windowTo = to; return this; }
        public Builder cohort(LocalDate from, LocalDate to) { this.cohortFrom = from; this.cohortTo = to; return this; }
        public Builder dates(List<LocalDate> d) { this.dates = d; return this; }
        public Builder nDaily(List<Long> v) { this.nDaily = v; return this; }
        public Builder kDaily(List<Long> v) { this.kDaily = v; return this; }
        public Builder daily(List<LocalDate> d, List<Long> nd, List<Long> kd) { this.dates = d; this.nDaily = nd; this.kDaily = kd; return this; }
        public Builder aggregate(Double mean, Long n, Long k) { this.mean = mean; this.n = n; this.k = k; return this; }
        public Builder querySignature(String s) { this.querySignature = s; return this; }
        public Builder retrievedAt(Instant t) { this.retrievedAt = t; return this; }

        public ParameterValue build() {
            return new ParameterValue(sliceDsl, windowFrom, windowTo, cohortFrom, cohortTo, dates, nDaily, kDaily,
                    mean, n, k, querySignature, retrievedAt);
        }
    }
}
