package io.paramfetch.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.paramfetch.core.RetrievalSummaryRow;
import io.paramfetch.core.SnapshotRetrievalClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Retrieval summaries exported next to the cache as {@code snapshots/summary-<paramId>.json}.
 * A slice-key list containing {@code ""} matches every key; rows naming another {@code core_hash} are skipped.
 */
public class JsonRetrievalSummaryClient implements SnapshotRetrievalClient {
    private final Path dir;
    private final ObjectMapper mapper;

    public JsonRetrievalSummaryClient(Path dir, ObjectMapper mapper) {
        this.dir = dir;
        this.mapper = mapper;
    }

    @Override
    public List<RetrievalSummaryRow> querySummary(String paramId, String coreHash, List<String> sliceKeys,
                                                  LocalDate anchorFrom, LocalDate anchorTo) throws IOException {
        Path file = dir.resolve("summary-" + paramId + ".json");
        if (!Files.isRegularFile(file)) return List.of();
        boolean any = sliceKeys.contains("");
        List<RetrievalSummaryRow> out = new ArrayList<>();
        for (JsonNode row : mapper.readTree(file.toFile())) {
            String key = row.path("slice_key").asText("");
            if (!any && !sliceKeys.contains(key)) continue;
            if (row.hasNonNull("core_hash") && !row.get("core_hash").asText().equals(coreHash)) continue;
            try {
                out.add(new RetrievalSummaryRow(Instant.parse(row.path("retrieved_at").asText()), key));
            } catch (RuntimeException e) {
                throw new IOException("bad retrieved_at in " + file + ": " + row.path("retrieved_at").asText(), e);
            }
        }
        return out;
    }
}
