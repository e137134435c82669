package io.paramfetch.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Lookup and reachability over a {@link Graph}. Edge endpoints may reference node uuid or id. */
public final class GraphQueries {
    private final Graph graph;
    private final Map<String, GraphNode> nodesByRef = new HashMap<>();

    public GraphQueries(Graph graph) {
        this.graph = graph;
        for (GraphNode n : graph.nodes()) {
            if (n.uuid() != null) nodesByRef.put(n.uuid(), n);
            if (n.id() != null) nodesByRef.putIfAbsent(n.id(), n);
        }
    }

    public Optional<GraphNode> node(String ref) {
        return Optional.ofNullable(nodesByRef.get(ref));
    }

    /** Canonical node key (uuid if known) for an endpoint reference. */
    public String canonical(String ref) {
        GraphNode n = nodesByRef.get(ref);
        return n == null || n.uuid() == null ? ref : n.uuid();
    }

    public Set<String> reachableForward(String startRef) {
        return bfs(canonical(startRef), true);
    }

    public Set<String> reachableBackward(String startRef) {
        return bfs(canonical(startRef), false);
    }

    private Set<String> bfs(String start, boolean forward) {
        Map<String, List<String>> adj = new HashMap<>();
        for (GraphEdge e : graph.edges()) {
            String a = canonical(e.from());
            String b = canonical(e.to());
            if (forward) adj.computeIfAbsent(a, k -> new ArrayList<>()).add(b);
            else adj.computeIfAbsent(b, k -> new ArrayList<>()).add(a);
        }
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        seen.add(start);
        queue.add(start);
        while (!queue.isEmpty()) {
            String cur = queue.poll();
            for (String next : adj.getOrDefault(cur, List.of())) {
                if (seen.add(next)) queue.add(next);
            }
        }
        return seen;
    }
}
