package io.paramfetch.core;

import io.paramfetch.model.DateRange;
import io.paramfetch.model.FetchPlanItem;

import java.io.IOException;
import java.util.List;

/** Reports anchor-day ranges inside {@code window} that the snapshot database has no rows for. */
public interface DbCoverageChecker {
    List<DateRange> missingAnchorRanges(FetchPlanItem item, DateRange window) throws IOException;
}
