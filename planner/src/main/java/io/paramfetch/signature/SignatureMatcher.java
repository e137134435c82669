package io.paramfetch.signature;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Subset-aware signature matching: a cached slice can serve a query when the core query is identical
 * and the cache was partitioned on every context key the query constrains, with the same definition.
 */
public final class SignatureMatcher {
    private static final Set<String> INVALID_DEF_HASHES = Set.of("missing", "error");

    private SignatureMatcher() {}

    public record Compatibility(boolean compatible, String reason) {
        static final Compatibility OK = new Compatibility(true, null);

        static Compatibility no(String reason) {
            return new Compatibility(false, reason);
        }
    }

    public static Compatibility canSatisfy(QuerySignature cache, QuerySignature query) {
        if (cache.isEmpty() || query.isEmpty() || !cache.coreHash().equals(query.coreHash())) {
            return Compatibility.no("core_mismatch");
        }
        for (Map.Entry<String, String> e : new TreeMap<>(query.contextDefHashes()).entrySet()) {
            String key = e.getKey();
            String cached = cache.contextDefHashes().get(key);
            if (cached == null) return Compatibility.no("missing_context_key:" + key);
            if (INVALID_DEF_HASHES.contains(cached) || INVALID_DEF_HASHES.contains(e.getValue())) {
                return Compatibility.no("invalid_context_hash:" + key);
            }
            if (!cached.equals(e.getValue())) return Compatibility.no("context_hash_mismatch:" + key);
        }
        return Compatibility.OK;
    }

    public static boolean canCacheSatisfyQuery(String cacheSignature, String querySignature) {
        if (cacheSignature == null || querySignature == null) return false;
        if (cacheSignature.equals(querySignature)) return true;
        return canSatisfy(QuerySignature.parse(cacheSignature), QuerySignature.parse(querySignature)).compatible();
    }

    /** Context keys the cache is partitioned on that the query does not constrain. */
    public static Set<String> unspecifiedDimensions(QuerySignature cache, QuerySignature query) {
        Set<String> out = new TreeSet<>(cache.contextDefHashes().keySet());
        out.removeAll(query.contextDefHashes().keySet());
        return out;
    }
}
