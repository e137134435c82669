package io.paramfetch.snapshot;

import java.util.Objects;

public record Workspace(String repository, String branch) {
    public Workspace {
        Objects.requireNonNull(repository, "repository");
        Objects.requireNonNull(branch, "branch");
    }

    public String paramId(String objectId) {
        return repository + "-" + branch + "-" + objectId;
    }
}
