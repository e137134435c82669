package io.paramfetch.model;

public enum ItemType {
    PARAMETER("parameter"),
    CASE("case");

    private final String wire;

    ItemType(String wire) { this.wire = wire; }

    public String wire() { return wire; }
}
