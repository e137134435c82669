package io.paramfetch.policy;

import io.paramfetch.model.DateRange;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Outcome of the maturity policy for one item. Every variant may carry an informational cooldown note.
 */
public interface RefetchDecision {
    enum Kind {
        USE_CACHE("use_cache"),
        GAPS_ONLY("gaps_only"),
        PARTIAL("partial"),
        REPLACE_SLICE("replace_slice");

        private final String wire;

        Kind(String wire) { this.wire = wire; }

        public String wire() { return wire; }
    }

    Kind kind();

    Optional<CooldownNote> cooldown();

    RefetchDecision withCooldown(CooldownNote note);

    record UseCache(Optional<CooldownNote> cooldown) implements RefetchDecision {
        public UseCache() { this(Optional.empty()); }
        @Override public Kind kind() { return Kind.USE_CACHE; }
        @Override public RefetchDecision withCooldown(CooldownNote note) { return new UseCache(Optional.of(note)); }
    }

    record GapsOnly(Optional<CooldownNote> cooldown) implements RefetchDecision {
        public GapsOnly() { this(Optional.empty()); }
        @Override public Kind kind() { return Kind.GAPS_ONLY; }
        @Override public RefetchDecision withCooldown(CooldownNote note) { return new GapsOnly(Optional.of(note)); }
    }

    record Partial(DateRange refetchWindow, LocalDate matureCutoff, Optional<CooldownNote> cooldown) implements RefetchDecision {
        public Partial(DateRange refetchWindow, LocalDate matureCutoff) { this(refetchWindow, matureCutoff, Optional.empty()); }
        @Override public Kind kind() { return Kind.PARTIAL; }
        @Override public RefetchDecision withCooldown(CooldownNote note) { return new Partial(refetchWindow, matureCutoff, Optional.of(note)); }
    }

    record ReplaceSlice(String reason, boolean hasImmatureCohorts, Optional<CooldownNote> cooldown) implements RefetchDecision {
        public static final String NO_EXISTING_SLICE = "no_existing_slice";
        public static final String NO_COHORT_DATES = "no_cohort_dates";
        public static final String IMMATURE_COHORTS = "immature_cohorts";
        public static final String STALE_DATA = "stale_data";

        public ReplaceSlice(String reason, boolean hasImmatureCohorts) { this(reason, hasImmatureCohorts, Optional.empty()); }
        @Override public Kind kind() { return Kind.REPLACE_SLICE; }
        @Override public RefetchDecision withCooldown(CooldownNote note) { return new ReplaceSlice(reason, hasImmatureCohorts, Optional.of(note)); }
    }
}
