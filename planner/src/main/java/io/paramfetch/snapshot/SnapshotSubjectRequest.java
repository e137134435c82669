package io.paramfetch.snapshot;

import java.time.LocalDate;
import java.util.List;

/**
 * Backend read descriptor. Optional fields ({@code asAt}, {@code sweepFrom}, {@code sweepTo}) are null
 * when unused by the read mode.
 */
public record SnapshotSubjectRequest(
        String subjectId,
        String paramId,
        String coreHash,
        ReadMode readMode,
        LocalDate anchorFrom,
        LocalDate anchorTo,
        LocalDate asAt,
        LocalDate sweepFrom,
        LocalDate sweepTo,
        List<String> sliceKeys,
        SnapshotTarget target
) {
    public SnapshotSubjectRequest {
        sliceKeys = List.copyOf(sliceKeys);
    }
}
