package io.paramfetch.core;

import io.paramfetch.graph.GraphEdge;
import io.paramfetch.graph.GraphNode;

public interface ConnectionChecker {
    boolean hasEdgeConnection(GraphEdge edge);

    boolean hasCaseConnection(GraphNode node);

    /**
     * Whether queries through this connection need event ids on both edge endpoints.
     * Spreadsheet-style connections return false.
     */
    default boolean requiresEventIds(String connectionName) {
        return true;
    }
}
