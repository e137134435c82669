package io.paramfetch.policy;

import io.paramfetch.model.CalendarDates;
import io.paramfetch.model.DateRange;
import io.paramfetch.model.LatencyConfig;
import io.paramfetch.model.ParameterValue;
import io.paramfetch.model.TemporalMode;

import java.time.Duration;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maturity policy: decides whether cached data can be reused, needs only its gaps filled, needs its
 * immature tail refetched (window mode) or must be replaced wholesale (cohort mode).
 * Stateless apart from its two thresholds.
 */
public class RefetchPolicy {
    public static final int DEFAULT_T95_DAYS = 30;
    public static final long LATENCY_REFETCH_COOLDOWN_MINUTES = 720;

    private final int defaultMaturityDays;
    private final long cooldownMinutes;

    public RefetchPolicy() {
        this(DEFAULT_T95_DAYS, LATENCY_REFETCH_COOLDOWN_MINUTES);
    }

    public RefetchPolicy(int defaultMaturityDays, long cooldownMinutes) {
        if (defaultMaturityDays <= 0) throw new IllegalArgumentException("defaultMaturityDays must be positive");
        this.defaultMaturityDays = defaultMaturityDays;
        this.cooldownMinutes = Math.max(0, cooldownMinutes);
    }

    public RefetchDecision decide(RefetchInput in) {
        LatencyConfig latency = in.latency();
        RefetchDecision decision;
        if (latency == null || !latency.enabled()) {
            decision = new RefetchDecision.GapsOnly();
        } else if (in.mode() == TemporalMode.WINDOW) {
            decision = decideWindow(in, latency);
        } else {
            decision = decideCohort(in, latency);
        }
        Optional<CooldownNote> note = cooldownNote(in);
        return note.isPresent() ? decision.withCooldown(note.get()) : decision;
    }

    private RefetchDecision decideWindow(RefetchInput in, LatencyConfig latency) {
        LocalDate referenceDate = CalendarDates.utcDate(in.referenceNow());
        LocalDate matureCutoff = matureCutoff(latency, referenceDate);
        DateRange req = in.requestedWindow();
        if (req.end().isBefore(matureCutoff)) {
            return coversRequest(in.existingSlice(), req) ? new RefetchDecision.UseCache() : new RefetchDecision.GapsOnly();
        }
        LocalDate start = req.start().isAfter(matureCutoff) ? req.start() : matureCutoff;
        return new RefetchDecision.Partial(new DateRange(start, req.end()), matureCutoff);
    }

    private RefetchDecision decideCohort(RefetchInput in, LatencyConfig latency) {
        ParameterValue slice = in.existingSlice();
        if (slice == null) {
            return new RefetchDecision.ReplaceSlice(RefetchDecision.ReplaceSlice.NO_EXISTING_SLICE, false);
        }
        if (slice.dates().isEmpty()) {
            return new RefetchDecision.ReplaceSlice(RefetchDecision.ReplaceSlice.NO_COHORT_DATES, false);
        }
        int maturity = computeEffectiveCohortMaturity(latency);
        LocalDate referenceDate = CalendarDates.utcDate(in.referenceNow());
        for (LocalDate d : slice.dates()) {
            if (withinHorizon(d, referenceDate, maturity)) {
                return new RefetchDecision.ReplaceSlice(RefetchDecision.ReplaceSlice.IMMATURE_COHORTS, true);
            }
        }
        if (slice.retrievedAt() != null
                && Duration.between(slice.retrievedAt(), in.referenceNow()).toDays() > maturity) {
            return new RefetchDecision.ReplaceSlice(RefetchDecision.ReplaceSlice.STALE_DATA, false);
        }
        return new RefetchDecision.UseCache();
    }

    private Optional<CooldownNote> cooldownNote(RefetchInput in) {
        ParameterValue slice = in.existingSlice();
        if (cooldownMinutes == 0 || slice == null || slice.retrievedAt() == null) return Optional.empty();
        long age = Duration.between(slice.retrievedAt(), in.referenceNow()).toMinutes();
        if (age < 0 || age >= cooldownMinutes) return Optional.empty();
        return Optional.of(new CooldownNote(slice.retrievedAt(), age, cooldownMinutes));
    }

    /** {@code ceil(t95)} when positive, then the edge's maturity days, then the configured default. */
    public int effectiveWindowMaturity(LatencyConfig latency) {
        if (latency != null && latency.t95() != null && latency.t95() > 0) return (int) Math.ceil(latency.t95());
        if (latency != null && latency.maturityDays() != null && latency.maturityDays() > 0) return latency.maturityDays();
        return defaultMaturityDays;
    }

    /** Cohort horizon: path t95, then edge t95, then the default. */
    public int computeEffectiveCohortMaturity(LatencyConfig latency) {
        if (latency != null && latency.pathT95() != null && latency.pathT95() > 0) {
            return (int) Math.ceil(latency.pathT95());
        }
        return effectiveWindowMaturity(latency);
    }

    /** First date considered immature in window mode: {@code referenceDate - (ceil(t95) + 1)}. */
    public LocalDate matureCutoff(LatencyConfig latency, LocalDate referenceDate) {
        return referenceDate.minusDays(effectiveWindowMaturity(latency) + 1L);
    }

    /**
     * Converts a decision into per-date staleness. Dates already in {@code missing} are never stale.
     */
    public Set<LocalDate> staleDates(RefetchDecision decision, DateRange requested, LatencyConfig latency,
                                     LocalDate referenceDate, Set<LocalDate> missing) {
        Set<LocalDate> out = new TreeSet<>();
        if (decision instanceof RefetchDecision.Partial partial) {
            for (LocalDate d : partial.refetchWindow().days()) {
                if (!missing.contains(d)) out.add(d);
            }
        } else if (decision instanceof RefetchDecision.ReplaceSlice) {
            int maturity = computeEffectiveCohortMaturity(latency);
            for (LocalDate d : requested.days()) {
                if (withinHorizon(d, referenceDate, maturity) && !missing.contains(d)) out.add(d);
            }
        }
        return out;
    }

    private static boolean withinHorizon(LocalDate d, LocalDate referenceDate, int maturityDays) {
        return CalendarDates.ageInDays(d, referenceDate) < maturityDays;
    }

    private static boolean coversRequest(ParameterValue slice, DateRange req) {
        if (slice == null) return false;
        if (slice.header().map(h -> h.contains(req)).orElse(false)) return true;
        Set<LocalDate> have = new HashSet<>(slice.dates());
        return have.containsAll(req.days());
    }
}
