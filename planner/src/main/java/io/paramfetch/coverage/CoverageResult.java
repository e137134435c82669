package io.paramfetch.coverage;

import io.paramfetch.model.DateRange;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

public record CoverageResult(
        Set<LocalDate> existingDates,
        List<LocalDate> missingDates,
        List<DateRange> fetchWindows,
        boolean needsFetch,
        int totalDays,
        boolean fastPath
) {
    public CoverageResult {
        existingDates = Set.copyOf(existingDates);
        missingDates = List.copyOf(missingDates);
        fetchWindows = List.copyOf(fetchWindows);
    }

    public int daysToFetch() {
        return missingDates.size();
    }
}
