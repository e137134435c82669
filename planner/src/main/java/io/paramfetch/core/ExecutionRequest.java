package io.paramfetch.core;

import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.FetchWindow;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One item handed to the data layer. {@code windows} are the plan's windows (possibly widened with
 * {@code db_missing} days); the sink must not recompute them. Every write for the same scope shares
 * {@code retrievalBatchAt}.
 */
public record ExecutionRequest(
        FetchPlanItem item,
        List<FetchWindow> windows,
        String dsl,
        boolean bustCache,
        Instant retrievalBatchAt,
        boolean simulate
) {
    public ExecutionRequest {
        Objects.requireNonNull(item, "item");
        Objects.requireNonNull(retrievalBatchAt, "retrievalBatchAt");
        windows = List.copyOf(windows);
    }
}
