package io.paramfetch.mece;

import io.paramfetch.model.ParameterValue;

import java.util.List;

public interface ReductionResult {
    ReductionDiagnostics diagnostics();

    boolean isReduced();

    record Reduced(List<ParameterValue> aggregatedValues, ReductionDiagnostics diagnostics) implements ReductionResult {
        public Reduced {
            aggregatedValues = List.copyOf(aggregatedValues);
        }

        @Override public boolean isReduced() { return true; }
    }

    record NotReducible(String reason, ReductionDiagnostics diagnostics) implements ReductionResult {
        @Override public boolean isReduced() { return false; }
    }
}
