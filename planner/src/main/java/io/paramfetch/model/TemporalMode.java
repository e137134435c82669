package io.paramfetch.model;

public enum TemporalMode {
    WINDOW("window"),
    COHORT("cohort");

    private final String wire;

    TemporalMode(String wire) { this.wire = wire; }

    public String wire() { return wire; }

    /** Slice-key suffix used by the snapshot store, e.g. {@code window()}. */
    public String clause() { return wire + "()"; }
}
