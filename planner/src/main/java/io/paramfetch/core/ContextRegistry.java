package io.paramfetch.core;

import java.util.Collection;

/**
 * Ground truth for context dimensions: which values exist and whether a set of slices partitions a key.
 */
public interface ContextRegistry {
    MecePartitionCheck detectMecePartition(Collection<String> sliceDsls, String dimensionKey);
}
