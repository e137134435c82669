package io.paramfetch.graph;

import java.util.List;

/**
 * Planning view of a model graph. {@code dataInterestsDsl} lists the context keys the graph pins,
 * e.g. {@code context(channel).context(device)}.
 */
public record Graph(List<GraphNode> nodes, List<GraphEdge> edges, String defaultConnection, String dataInterestsDsl) {
    public Graph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
