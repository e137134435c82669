package io.paramfetch.graph;

import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.ItemType;
import io.paramfetch.model.ParamSlot;

/**
 * A fetchable unit resolved from the graph: a parameter slot on an edge (base, cost, labour or
 * conditional probability) or a case on a node.
 */
public record FetchTarget(
        ItemType type,
        String objectId,
        String targetId,
        ParamSlot slot,
        Integer conditionalIndex,
        GraphEdge edge,
        GraphNode node,
        String connection
) {
    public String itemKey() {
        return FetchPlanItem.itemKey(type, objectId, targetId, slot, conditionalIndex);
    }

    public boolean isConditional() {
        return conditionalIndex != null;
    }
}
