package io.paramfetch.snapshot;

import io.paramfetch.graph.Graph;
import io.paramfetch.model.FetchPlan;

import java.util.Objects;

/** {@code queryDsl} supplies time bounds; it defaults to the plan's own DSL. */
public record MappingRequest(
        FetchPlan plan,
        Graph graph,
        Workspace workspace,
        ReadMode readMode,
        SnapshotScope scope,
        String queryDsl,
        SliceKeysPolicy sliceKeysPolicy
) {
    public MappingRequest {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(workspace, "workspace");
        Objects.requireNonNull(readMode, "readMode");
        scope = scope == null ? new SnapshotScope.AllGraphParameters() : scope;
        queryDsl = queryDsl == null ? plan.dsl() : queryDsl;
        sliceKeysPolicy = sliceKeysPolicy == null ? SliceKeysPolicy.MECE_FULFILMENT_ALLOWED : sliceKeysPolicy;
    }
}
