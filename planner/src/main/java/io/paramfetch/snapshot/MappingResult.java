package io.paramfetch.snapshot;

import java.util.List;

public record MappingResult(List<SnapshotSubjectRequest> subjects, List<SkippedItem> skipped) {
    public MappingResult {
        subjects = List.copyOf(subjects);
        skipped = List.copyOf(skipped);
    }
}
