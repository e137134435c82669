package io.paramfetch.mece;

import io.paramfetch.core.ContextRegistry;
import io.paramfetch.core.MecePartitionCheck;
import io.paramfetch.dsl.SliceDsl;
import io.paramfetch.model.ParameterValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Chooses what answers an uncontexted query: the newest explicit uncontexted slice, or the newest
 * single-key MECE partition generation (slices sharing a key and a query signature), whichever is
 * more recent. A generation's recency is its oldest member's retrieval time; generations are never mixed.
 */
public class ImplicitSliceSelector {
    private final ContextRegistry registry;

    public ImplicitSliceSelector(ContextRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    private record Candidate(String key, String signature, List<ParameterValue> values, Instant recency,
                             boolean complete, List<String> warnings) {}

    public SliceSelection select(List<ParameterValue> values, boolean requireCompleteMece) {
        ParameterValue explicit = null;
        Map<String, Map<String, Map<String, ParameterValue>>> generations = new TreeMap<>();
        for (ParameterValue v : values) {
            Map<String, String> ctx = SliceDsl.contextMap(v.sliceDsl());
            if (ctx.isEmpty()) {
                if (explicit == null || recency(v).isAfter(recency(explicit))) explicit = v;
                continue;
            }
            if (ctx.size() != 1) continue;
            Map.Entry<String, String> only = ctx.entrySet().iterator().next();
            Map<String, ParameterValue> byValue = generations
                    .computeIfAbsent(only.getKey(), k -> new TreeMap<>())
                    .computeIfAbsent(Objects.toString(v.querySignature(), ""), s -> new LinkedHashMap<>());
            ParameterValue prev = byValue.get(only.getValue());
            if (prev == null || recency(v).isAfter(recency(prev))) byValue.put(only.getValue(), v);
        }

        List<Candidate> candidates = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (Map.Entry<String, Map<String, Map<String, ParameterValue>>> byKey : generations.entrySet()) {
            String key = byKey.getKey();
            for (Map.Entry<String, Map<String, ParameterValue>> gen : byKey.getValue().entrySet()) {
                List<ParameterValue> members = new ArrayList<>(gen.getValue().values());
                List<String> dsls = new ArrayList<>();
                for (ParameterValue m : members) dsls.add(m.sliceDsl());
                MecePartitionCheck check = registry.detectMecePartition(dsls, key);
                List<String> warnings = new ArrayList<>();
                boolean complete;
                if (check.isUnknown()) {
                    warnings.add("Context '" + key + "' is not registered; assuming its slices are MECE");
                    complete = true;
                } else if (!check.isMece()) {
                    rejected.add(key + ":not_mece");
                    continue;
                } else {
                    complete = check.isComplete() && check.canAggregate();
                    if (!complete && requireCompleteMece) {
                        rejected.add(key + ":incomplete(" + String.join(",", check.missingValues()) + ")");
                        continue;
                    }
                }
                Instant oldest = members.stream().map(ImplicitSliceSelector::recency).min(Comparator.naturalOrder()).orElse(Instant.EPOCH);
                candidates.add(new Candidate(key, gen.getKey(), members, oldest, complete, warnings));
            }
        }

        candidates.sort(Comparator.comparing(Candidate::recency).reversed()
                .thenComparing(Candidate::complete, Comparator.reverseOrder())
                .thenComparing(c -> c.values().size(), Comparator.reverseOrder())
                .thenComparing(Candidate::key));
        Candidate best = candidates.isEmpty() ? null : candidates.get(0);

        if (explicit != null && (best == null || !recency(explicit).isBefore(best.recency()))) {
            return new SliceSelection(SliceSelection.Kind.EXPLICIT_UNCONTEXTED, null, explicit.querySignature(),
                    List.of(explicit), null, List.of());
        }
        if (best != null) {
            return new SliceSelection(SliceSelection.Kind.MECE_PARTITION, best.key(),
                    best.signature().isEmpty() ? null : best.signature(), best.values(), null, best.warnings());
        }
        String reason = rejected.isEmpty() ? "no_single_key_partition" : "no_complete_mece_partition";
        return new SliceSelection(SliceSelection.Kind.NOT_RESOLVABLE, null, null, List.of(), reason, rejected);
    }

    private static Instant recency(ParameterValue v) {
        return v.retrievedAt() == null ? Instant.EPOCH : v.retrievedAt();
    }
}
