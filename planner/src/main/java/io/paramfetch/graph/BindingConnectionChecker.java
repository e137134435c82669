package io.paramfetch.graph;

import io.paramfetch.core.ConnectionChecker;

import java.util.Set;

/**
 * Connection checker driven by the graph's own bindings: an edge or case is connected when it names a
 * connection or the graph supplies a default.
 */
public class BindingConnectionChecker implements ConnectionChecker {
    private final String defaultConnection;
    private final Set<String> eventIdFreeConnections;

    public BindingConnectionChecker(String defaultConnection, Set<String> eventIdFreeConnections) {
        this.defaultConnection = defaultConnection;
        this.eventIdFreeConnections = Set.copyOf(eventIdFreeConnections);
    }

    public static BindingConnectionChecker forGraph(Graph graph) {
        return new BindingConnectionChecker(graph.defaultConnection(), Set.of());
    }

    @Override
    public boolean hasEdgeConnection(GraphEdge edge) {
        if (hasDefault()) {
            for (ParamBinding b : edge.slots().values()) {
                if (b.isBound()) return true;
            }
            for (ConditionalBinding c : edge.conditionals()) {
                if (c.p() != null && c.p().isBound()) return true;
            }
        }
        for (ParamBinding b : edge.slots().values()) {
            if (named(b.connection())) return true;
        }
        for (ConditionalBinding c : edge.conditionals()) {
            if (c.p() != null && named(c.p().connection())) return true;
        }
        return false;
    }

    @Override
    public boolean hasCaseConnection(GraphNode node) {
        return node.caseBinding() != null && (named(node.caseBinding().connection()) || hasDefault());
    }

    @Override
    public boolean requiresEventIds(String connectionName) {
        return connectionName == null || !eventIdFreeConnections.contains(connectionName);
    }

    private boolean hasDefault() {
        return named(defaultConnection);
    }

    private static boolean named(String s) {
        return s != null && !s.isBlank();
    }
}
