package io.paramfetch.plan;

import io.paramfetch.model.Classification;
import io.paramfetch.model.TemporalMode;

import java.util.List;

/** {@code refetchDecision} is null for case items and items rejected before the policy ran. */
public record ItemDiagnostic(
        String itemKey,
        String objectId,
        TemporalMode mode,
        int missingDates,
        int staleDates,
        int totalFetchDates,
        String refetchDecision,
        boolean hasImmatureCohorts,
        Classification classification,
        List<String> notes
) {
    public ItemDiagnostic {
        notes = List.copyOf(notes);
    }
}
