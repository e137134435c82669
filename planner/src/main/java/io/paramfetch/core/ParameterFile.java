package io.paramfetch.core;

import io.paramfetch.model.ParameterValue;

import java.util.List;

public record ParameterFile(String objectId, List<ParameterValue> values) {
    public ParameterFile {
        values = values == null ? List.of() : List.copyOf(values);
    }
}
