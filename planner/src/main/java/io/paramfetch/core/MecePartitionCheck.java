package io.paramfetch.core;

import java.util.List;

/**
 * Registry verdict for one dimension. {@code policy} is the key's "other" bucket policy,
 * or {@code unknown} when the key is not registered.
 */
public record MecePartitionCheck(boolean isMece, boolean isComplete, boolean canAggregate,
                                 List<String> missingValues, String policy) {
    public static final String UNKNOWN_POLICY = "unknown";

    public MecePartitionCheck {
        missingValues = missingValues == null ? List.of() : List.copyOf(missingValues);
    }

    public static MecePartitionCheck unknown() {
        return new MecePartitionCheck(false, false, false, List.of(), UNKNOWN_POLICY);
    }

    public boolean isUnknown() {
        return UNKNOWN_POLICY.equals(policy);
    }
}
