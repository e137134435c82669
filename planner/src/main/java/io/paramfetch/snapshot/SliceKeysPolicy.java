package io.paramfetch.snapshot;

/** How an uncontexted item is addressed in the snapshot store. */
public enum SliceKeysPolicy {
    /** {@code [""]}: any slice family may fulfil the read via MECE aggregation. */
    MECE_FULFILMENT_ALLOWED("mece_fulfilment_allowed"),
    /** {@code ["window()"]} or {@code ["cohort()"]}: only the uncontexted family. */
    EXACT("exact");

    private final String wire;

    SliceKeysPolicy(String wire) { this.wire = wire; }

    public String wire() { return wire; }

    public static SliceKeysPolicy fromWire(String s) {
        for (SliceKeysPolicy p : values()) {
            if (p.wire.equals(s)) return p;
        }
        throw new IllegalArgumentException("unknown slice keys policy '" + s + "'");
    }
}
