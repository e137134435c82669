package io.paramfetch.model;

public enum Classification {
    FETCH("fetch"),
    COVERED("covered"),
    UNFETCHABLE("unfetchable");

    private final String wire;

    Classification(String wire) { this.wire = wire; }

    public String wire() { return wire; }
}
