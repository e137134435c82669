package io.paramfetch.mece;

import java.util.List;
import java.util.Objects;

public record ContextDefinition(String id, List<String> values, OtherPolicy otherPolicy) {
    public static final String OTHER = "other";

    public ContextDefinition {
        Objects.requireNonNull(id, "id");
        values = values == null ? List.of() : List.copyOf(values);
        otherPolicy = otherPolicy == null ? OtherPolicy.UNDEFINED : otherPolicy;
    }
}
