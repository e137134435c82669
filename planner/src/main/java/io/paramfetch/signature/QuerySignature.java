package io.paramfetch.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structured query signature: {@code {"c": coreHash, "x": {contextKey: definitionHash}}}.
 * Context values are not part of the signature; only the definition of each context key is.
 */
public record QuerySignature(String coreHash, Map<String, String> contextDefHashes) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final QuerySignature EMPTY = new QuerySignature("", Map.of());

    public QuerySignature {
        coreHash = coreHash == null ? "" : coreHash;
        contextDefHashes = contextDefHashes == null ? Map.of() : Map.copyOf(contextDefHashes);
    }

    /** Malformed and legacy (non-JSON) strings parse to {@link #EMPTY}. */
    public static QuerySignature parse(String raw) {
        if (raw == null || raw.isBlank() || !raw.trim().startsWith("{")) return EMPTY;
        try {
            JsonNode root = MAPPER.readTree(raw);
            if (root == null || !root.isObject()) return EMPTY;
            String core = root.path("c").asText("");
            Map<String, String> x = new TreeMap<>();
            JsonNode ctx = root.path("x");
            if (ctx.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = ctx.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    x.put(e.getKey(), e.getValue().asText(""));
                }
            }
            return new QuerySignature(core, x);
        } catch (JsonProcessingException e) {
            return EMPTY;
        }
    }

    public String serialise() {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("c", coreHash);
        ObjectNode x = root.putObject("x");
        new TreeMap<>(contextDefHashes).forEach(x::put);
        return root.toString();
    }

    public boolean isEmpty() {
        return coreHash.isEmpty();
    }
}
