package io.paramfetch.mece;

import io.paramfetch.core.ContextRegistry;
import io.paramfetch.core.MecePartitionCheck;
import io.paramfetch.dsl.SliceDsl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryContextRegistry implements ContextRegistry {
    private final Map<String, ContextDefinition> definitions = new HashMap<>();

    public InMemoryContextRegistry(Collection<ContextDefinition> definitions) {
        for (ContextDefinition d : definitions) this.definitions.put(d.id(), d);
    }

    public Optional<ContextDefinition> definition(String key) {
        return Optional.ofNullable(definitions.get(key));
    }

    @Override
    public MecePartitionCheck detectMecePartition(Collection<String> sliceDsls, String dimensionKey) {
        ContextDefinition def = definitions.get(dimensionKey);
        if (def == null) return MecePartitionCheck.unknown();
        String policy = def.otherPolicy().wire();

        Set<String> present = new LinkedHashSet<>();
        for (String dsl : sliceDsls) {
            String v = SliceDsl.contextMap(dsl).get(dimensionKey);
            if (v != null) present.add(v);
        }
        if (present.size() < sliceDsls.size()) {
            return new MecePartitionCheck(false, false, false, List.of(), policy);
        }
        Set<String> expected = expectedValues(def);
        for (String v : present) {
            if (!expected.contains(v)) return new MecePartitionCheck(false, false, false, List.of(), policy);
        }
        List<String> missing = new ArrayList<>();
        for (String v : expected) {
            if (!present.contains(v)) missing.add(v);
        }
        boolean complete = missing.isEmpty();
        return new MecePartitionCheck(true, complete, canAggregate(def.otherPolicy(), complete), missing, policy);
    }

    private static Set<String> expectedValues(ContextDefinition def) {
        Set<String> out = new LinkedHashSet<>();
        for (String v : def.values()) {
            if (!ContextDefinition.OTHER.equals(v)) out.add(v);
        }
        if (def.otherPolicy().includesOther()) out.add(ContextDefinition.OTHER);
        return out;
    }

    private static boolean canAggregate(OtherPolicy policy, boolean complete) {
        return switch (policy) {
            case NULL, COMPUTED, EXPLICIT -> complete;
            case UNDEFINED -> false;
        };
    }
}
