package io.paramfetch.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.paramfetch.mece.ContextDefinition;
import io.paramfetch.mece.OtherPolicy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Reads {@code [{"id": "channel", "values": ["google", ...], "otherPolicy": "computed"}, ...]}. */
public class ContextDefinitionsLoader {
    private final ObjectMapper mapper;

    public ContextDefinitionsLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<ContextDefinition> load(Path file) throws IOException {
        List<ContextDefinition> out = new ArrayList<>();
        for (JsonNode d : mapper.readTree(file.toFile())) {
            List<String> values = new ArrayList<>();
            for (JsonNode v : d.path("values")) values.add(v.asText());
            OtherPolicy policy = d.hasNonNull("otherPolicy") ? OtherPolicy.fromWire(d.get("otherPolicy").asText()) : null;
            out.add(new ContextDefinition(d.path("id").asText(), values, policy));
        }
        return out;
    }
}
