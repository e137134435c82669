package io.paramfetch.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.paramfetch.graph.CaseBinding;
import io.paramfetch.graph.ConditionalBinding;
import io.paramfetch.graph.Graph;
import io.paramfetch.graph.GraphEdge;
import io.paramfetch.graph.GraphNode;
import io.paramfetch.graph.ParamBinding;
import io.paramfetch.model.LatencyConfig;
import io.paramfetch.model.ParamSlot;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a graph document. Edge slots are keyed by their wire names ({@code p}, {@code cost_gbp},
 * {@code labour_cost}); conditional probabilities live under {@code conditional_p}.
 */
public class GraphJsonLoader {
    private final ObjectMapper mapper;

    public GraphJsonLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Graph load(Path file) throws IOException {
        return parse(mapper.readTree(file.toFile()));
    }

    public Graph parse(JsonNode root) {
        List<GraphNode> nodes = new ArrayList<>();
        for (JsonNode n : root.path("nodes")) {
            JsonNode c = n.path("case");
            CaseBinding caseBinding = c.isObject() ? new CaseBinding(text(c, "id"), text(c, "connection")) : null;
            nodes.add(new GraphNode(text(n, "uuid"), text(n, "id"), text(n, "event_id"), caseBinding));
        }
        List<GraphEdge> edges = new ArrayList<>();
        for (JsonNode e : root.path("edges")) {
            Map<ParamSlot, ParamBinding> slots = new EnumMap<>(ParamSlot.class);
            for (ParamSlot slot : ParamSlot.values()) {
                JsonNode b = e.path(slot.wire());
                if (b.isObject()) slots.put(slot, binding(b));
            }
            List<ConditionalBinding> conditionals = new ArrayList<>();
            for (JsonNode c : e.path("conditional_p")) {
                conditionals.add(new ConditionalBinding(text(c, "condition"), c.path("p").isObject() ? binding(c.path("p")) : null));
            }
            edges.add(new GraphEdge(text(e, "uuid"), text(e, "id"), text(e, "from"), text(e, "to"), slots, conditionals));
        }
        return new Graph(nodes, edges, text(root, "defaultConnection"), text(root, "dataInterestsDSL"));
    }

    private static ParamBinding binding(JsonNode b) {
        JsonNode l = b.path("latency");
        LatencyConfig latency = l.isObject()
                ? new LatencyConfig(dbl(l, "t95"), dbl(l, "path_t95"), dbl(l, "onset_delta_days"),
                        l.hasNonNull("maturity_days") ? l.get("maturity_days").asInt() : null)
                : null;
        return new ParamBinding(text(b, "id"), text(b, "connection"), latency);
    }

    private static String text(JsonNode n, String field) {
        return n.hasNonNull(field) ? n.get(field).asText() : null;
    }

    private static Double dbl(JsonNode n, String field) {
        return n.hasNonNull(field) ? n.get(field).asDouble() : null;
    }
}
