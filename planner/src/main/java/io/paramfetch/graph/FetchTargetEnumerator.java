package io.paramfetch.graph;

import io.paramfetch.model.ItemType;
import io.paramfetch.model.ParamSlot;

import java.util.ArrayList;
import java.util.List;

public final class FetchTargetEnumerator {
    private FetchTargetEnumerator() {}

    public static List<FetchTarget> enumerate(Graph graph) {
        List<FetchTarget> out = new ArrayList<>();
        for (GraphEdge edge : graph.edges()) {
            String targetId = edge.uuid() != null ? edge.uuid() : edge.id();
            for (ParamSlot slot : ParamSlot.values()) {
                ParamBinding b = edge.slots().get(slot);
                if (b == null || !b.isBound()) continue;
                out.add(new FetchTarget(ItemType.PARAMETER, b.parameterId(), targetId, slot, null, edge, null,
                        resolve(b.connection(), graph)));
            }
            for (int i = 0; i < edge.conditionals().size(); i++) {
                ParamBinding b = edge.conditionals().get(i).p();
                if (b == null || !b.isBound()) continue;
                out.add(new FetchTarget(ItemType.PARAMETER, b.parameterId(), targetId, ParamSlot.P, i, edge, null,
                        resolve(b.connection(), graph)));
            }
        }
        for (GraphNode node : graph.nodes()) {
            CaseBinding c = node.caseBinding();
            if (c == null || c.caseId() == null || c.caseId().isBlank()) continue;
            out.add(new FetchTarget(ItemType.CASE, c.caseId(), node.uuid(), null, null, null, node,
                    resolve(c.connection(), graph)));
        }
        return out;
    }

    private static String resolve(String own, Graph graph) {
        if (own != null && !own.isBlank()) return own;
        String def = graph.defaultConnection();
        return def == null || def.isBlank() ? null : def;
    }
}
