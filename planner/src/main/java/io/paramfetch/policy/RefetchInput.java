package io.paramfetch.policy;

import io.paramfetch.model.DateRange;
import io.paramfetch.model.LatencyConfig;
import io.paramfetch.model.ParameterValue;
import io.paramfetch.model.TemporalMode;

import java.time.Instant;
import java.util.Objects;

/** {@code existingSlice} and {@code latency} may be null. */
public record RefetchInput(ParameterValue existingSlice, LatencyConfig latency, DateRange requestedWindow,
                           TemporalMode mode, Instant referenceNow) {
    public RefetchInput {
        Objects.requireNonNull(requestedWindow, "requestedWindow");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(referenceNow, "referenceNow");
    }
}
