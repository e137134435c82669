package io.paramfetch.plan;

import java.util.List;

public record PlanDiagnostics(int totalItems, int itemsNeedingFetch, int itemsCovered, int itemsUnfetchable,
                              List<ItemDiagnostic> itemDiagnostics) {
    public PlanDiagnostics {
        itemDiagnostics = List.copyOf(itemDiagnostics);
    }
}
