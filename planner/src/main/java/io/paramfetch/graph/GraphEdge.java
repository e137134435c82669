package io.paramfetch.graph;

import io.paramfetch.model.ParamSlot;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record GraphEdge(String uuid, String id, String from, String to, Map<ParamSlot, ParamBinding> slots,
                        List<ConditionalBinding> conditionals) {
    public GraphEdge {
        slots = slots == null || slots.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(slots));
        conditionals = conditionals == null ? List.of() : List.copyOf(conditionals);
    }

    public Optional<ParamBinding> slot(ParamSlot slot) {
        return Optional.ofNullable(slots.get(slot));
    }

    /** Latency model lives on the probability slot. */
    public Optional<io.paramfetch.model.LatencyConfig> latency() {
        return slot(ParamSlot.P).map(ParamBinding::latency);
    }
}
