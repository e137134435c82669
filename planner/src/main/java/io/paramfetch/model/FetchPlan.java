package io.paramfetch.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record FetchPlan(int version, Instant createdAt, Instant referenceNow, String dsl, List<FetchPlanItem> items) {
    public static final int CURRENT_VERSION = 1;

    public FetchPlan {
        Objects.requireNonNull(referenceNow, "referenceNow");
        createdAt = createdAt == null ? referenceNow : createdAt;
        dsl = dsl == null ? "" : dsl;
        items = items == null ? List.of() : List.copyOf(items);
    }
}
