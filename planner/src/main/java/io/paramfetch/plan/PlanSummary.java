package io.paramfetch.plan;

public record PlanSummary(
        int totalItems,
        int fetchItems,
        int coveredItems,
        int unfetchableItems,
        int windows,
        long totalDays,
        long missingDays,
        long staleDays,
        long dbMissingDays
) {
    public String describe() {
        return String.format("items=%d fetch=%d covered=%d unfetchable=%d windows=%d days=%d (missing=%d stale=%d db_missing=%d)",
                totalItems, fetchItems, coveredItems, unfetchableItems, windows, totalDays, missingDays, staleDays, dbMissingDays);
    }
}
