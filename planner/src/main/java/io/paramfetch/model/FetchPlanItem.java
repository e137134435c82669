package io.paramfetch.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One planning unit. {@code windows} is non-empty exactly when the item is classified {@code fetch};
 * windows are sorted ascending and never overlap.
 */
public record FetchPlanItem(
        String itemKey,
        ItemType type,
        String objectId,
        String targetId,
        ParamSlot slot,
        Integer conditionalIndex,
        TemporalMode mode,
        String sliceFamily,
        String querySignature,
        Classification classification,
        String unfetchableReason,
        List<FetchWindow> windows
) {
    public static final Comparator<FetchWindow> WINDOW_ORDER = Comparator
            .comparing(FetchWindow::start)
            .thenComparing(FetchWindow::end)
            .thenComparing(FetchWindow::reason);

    public FetchPlanItem {
        Objects.requireNonNull(itemKey, "itemKey");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(classification, "classification");
        sliceFamily = sliceFamily == null ? "" : sliceFamily;
        querySignature = querySignature == null ? "" : querySignature;
        windows = windows == null ? List.of() : List.copyOf(windows);
        if (classification == Classification.FETCH && windows.isEmpty()) {
            throw new IllegalArgumentException(itemKey + ": fetch item without windows");
        }
        if (classification != Classification.FETCH && !windows.isEmpty()) {
            throw new IllegalArgumentException(itemKey + ": " + classification.wire() + " item must not carry windows");
        }
        if (classification == Classification.UNFETCHABLE && unfetchableReason == null) {
            throw new IllegalArgumentException(itemKey + ": unfetchable item without reason");
        }
        List<FetchWindow> sorted = new ArrayList<>(windows);
        sorted.sort(WINDOW_ORDER);
        for (int i = 1; i < sorted.size(); i++) {
            if (!sorted.get(i).start().isAfter(sorted.get(i - 1).end())) {
                throw new IllegalArgumentException(itemKey + ": overlapping windows " + sorted.get(i - 1) + " and " + sorted.get(i));
            }
        }
        windows = List.copyOf(sorted);
    }

    public static String itemKey(ItemType type, String objectId, String targetId, ParamSlot slot, Integer conditionalIndex) {
        return type.wire() + ":" + nz(objectId) + ":" + nz(targetId) + ":"
                + (slot == null ? "" : slot.wire()) + ":" + (conditionalIndex == null ? "" : conditionalIndex);
    }

    private static String nz(String s) { return s == null ? "" : s; }

    public long totalDays() {
        long total = 0;
        for (FetchWindow w : windows) total += w.dayCount();
        return total;
    }

    public FetchPlanItem withWindows(Classification newClassification, List<FetchWindow> newWindows) {
        return new FetchPlanItem(itemKey, type, objectId, targetId, slot, conditionalIndex, mode, sliceFamily,
                querySignature, newClassification, newClassification == Classification.UNFETCHABLE ? unfetchableReason : null,
                newWindows);
    }
}
