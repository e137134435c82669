package io.paramfetch.model;

public enum FetchWindowReason {
    MISSING("missing"),
    STALE("stale"),
    DB_MISSING("db_missing");

    private final String wire;

    FetchWindowReason(String wire) { this.wire = wire; }

    public String wire() { return wire; }
}
