package io.paramfetch.snapshot;

import io.paramfetch.graph.Graph;
import io.paramfetch.graph.GraphEdge;
import io.paramfetch.graph.GraphQueries;

import java.util.HashSet;
import java.util.Set;

/**
 * Which edges of the graph a snapshot read covers. {@link #edgesInScope} returns edge uuids (or ids
 * for edges without a uuid).
 */
public interface SnapshotScope {
    Set<String> edgesInScope(Graph graph);

    record SelectionEdges(Set<String> edgeRefs) implements SnapshotScope {
        public SelectionEdges {
            edgeRefs = Set.copyOf(edgeRefs);
        }

        @Override
        public Set<String> edgesInScope(Graph graph) {
            Set<String> out = new HashSet<>();
            for (GraphEdge e : graph.edges()) {
                if (edgeRefs.contains(e.uuid()) || edgeRefs.contains(e.id())) out.add(key(e));
            }
            return out;
        }
    }

    record AllGraphParameters() implements SnapshotScope {
        @Override
        public Set<String> edgesInScope(Graph graph) {
            Set<String> out = new HashSet<>();
            for (GraphEdge e : graph.edges()) out.add(key(e));
            return out;
        }
    }

    /** Edges lying on some path from {@code fromNode} to {@code toNode}. */
    record FunnelPath(String fromNode, String toNode) implements SnapshotScope {
        @Override
        public Set<String> edgesInScope(Graph graph) {
            GraphQueries q = new GraphQueries(graph);
            Set<String> onPath = new HashSet<>(q.reachableForward(fromNode));
            onPath.retainAll(q.reachableBackward(toNode));
            Set<String> out = new HashSet<>();
            for (GraphEdge e : graph.edges()) {
                if (onPath.contains(q.canonical(e.from())) && onPath.contains(q.canonical(e.to()))) out.add(key(e));
            }
            return out;
        }
    }

    record ReachableFrom(String node) implements SnapshotScope {
        @Override
        public Set<String> edgesInScope(Graph graph) {
            GraphQueries q = new GraphQueries(graph);
            Set<String> reach = q.reachableForward(node);
            Set<String> out = new HashSet<>();
            for (GraphEdge e : graph.edges()) {
                if (reach.contains(q.canonical(e.from()))) out.add(key(e));
            }
            return out;
        }
    }

    static String key(GraphEdge e) {
        return e.uuid() != null ? e.uuid() : e.id();
    }
}
