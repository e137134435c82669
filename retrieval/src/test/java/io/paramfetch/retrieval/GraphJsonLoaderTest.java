package io.paramfetch.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.paramfetch.graph.Graph;
import io.paramfetch.graph.GraphEdge;
import io.paramfetch.graph.GraphNode;
import io.paramfetch.model.LatencyConfig;
import io.paramfetch.model.ParamSlot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GraphJsonLoaderTest {
    static final String GRAPH = """
            {"defaultConnection": "amplitude", "dataInterestsDSL": "context(channel)",
             "nodes": [
               {"uuid": "a-uuid", "id": "a", "event_id": "evt-a"},
               {"uuid": "b-uuid", "id": "b", "event_id": "evt-b", "case": {"id": "case-1", "connection": "statsig"}}
             ],
             "edges": [
               {"uuid": "ab-uuid", "id": "ab", "from": "a", "to": "b",
                "p": {"id": "p-ab", "latency": {"t95": 9.5, "path_t95": 14, "maturity_days": 7}},
                "cost_gbp": {"id": "cost-ab", "connection": "sheets"},
                "conditional_p": [{"condition": "visited(x)", "p": {"id": "p-ab-x"}}, {"condition": "visited(y)"}]}
             ]}
            """;

    @TempDir
    Path dir;

    @Test
    void loadsNodesEdgesAndBindings() throws Exception {
        Path file = dir.resolve("graph.json");
        Files.writeString(file, GRAPH);

        Graph graph = new GraphJsonLoader(new ObjectMapper()).load(file);

        assertEquals("amplitude", graph.defaultConnection());
        assertEquals("context(channel)", graph.dataInterestsDsl());
        GraphNode b = graph.nodes().get(1);
        assertEquals("case-1", b.caseBinding().caseId());
        assertNull(graph.nodes().get(0).caseBinding());

        GraphEdge ab = graph.edges().get(0);
        assertEquals("p-ab", ab.slot(ParamSlot.P).orElseThrow().parameterId());
        assertEquals(new LatencyConfig(9.5, 14.0, null, 7), ab.latency().orElseThrow());
        assertEquals("sheets", ab.slot(ParamSlot.COST_GBP).orElseThrow().connection());
        assertTrue(ab.slot(ParamSlot.LABOUR_COST).isEmpty());
        assertEquals(2, ab.conditionals().size());
        assertEquals("p-ab-x", ab.conditionals().get(0).p().parameterId());
        assertNull(ab.conditionals().get(1).p());
    }
}
