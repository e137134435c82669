package io.paramfetch.snapshot;

public enum ReadMode {
    RAW_SNAPSHOTS("raw_snapshots"),
    VIRTUAL_SNAPSHOT("virtual_snapshot"),
    COHORT_MATURITY("cohort_maturity");

    private final String wire;

    ReadMode(String wire) { this.wire = wire; }

    public String wire() { return wire; }

    public static ReadMode fromWire(String s) {
        for (ReadMode m : values()) {
            if (m.wire.equals(s)) return m;
        }
        throw new IllegalArgumentException("unknown read mode '" + s + "'");
    }
}
