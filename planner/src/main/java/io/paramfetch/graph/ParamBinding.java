package io.paramfetch.graph;

import io.paramfetch.model.LatencyConfig;

/** A parameter file bound to an edge slot, with the connection that can refresh it. */
public record ParamBinding(String parameterId, String connection, LatencyConfig latency) {
    public boolean isBound() {
        return parameterId != null && !parameterId.isBlank();
    }
}
