package io.paramfetch.mece;

import java.util.List;
import java.util.Map;

/**
 * What the reducer saw. {@code observedValues} maps each unspecified dimension to the values present.
 */
public record ReductionDiagnostics(
        List<String> specifiedDimensions,
        List<String> unspecifiedDimensions,
        int slicesUsed,
        Map<String, DimensionCheck> observedValues,
        List<String> warnings
) {
    public record DimensionCheck(boolean isComplete, boolean canAggregate, List<String> values) {}

    public ReductionDiagnostics {
        specifiedDimensions = List.copyOf(specifiedDimensions);
        unspecifiedDimensions = List.copyOf(unspecifiedDimensions);
        observedValues = Map.copyOf(observedValues);
        warnings = List.copyOf(warnings);
    }
}
