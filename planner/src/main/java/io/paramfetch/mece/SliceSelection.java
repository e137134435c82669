package io.paramfetch.mece;

import io.paramfetch.model.ParameterValue;

import java.util.List;

/** Slice set chosen to stand in for an uncontexted query. */
public record SliceSelection(Kind kind, String key, String querySignature, List<ParameterValue> values,
                             String reason, List<String> warnings) {
    public enum Kind { EXPLICIT_UNCONTEXTED, MECE_PARTITION, NOT_RESOLVABLE }

    public SliceSelection {
        values = values == null ? List.of() : List.copyOf(values);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isResolved() {
        return kind != Kind.NOT_RESOLVABLE;
    }
}
