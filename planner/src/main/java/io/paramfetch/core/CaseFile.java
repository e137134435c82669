package io.paramfetch.core;

import java.util.Map;

/** Stored case schedule; only presence of data matters to planning. */
public record CaseFile(String objectId, Map<String, Object> data) {
    public CaseFile {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public boolean hasData() {
        return !data.isEmpty();
    }
}
