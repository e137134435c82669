package io.paramfetch.model;

import java.util.Optional;

/** Parameter slots an edge can bind, in enumeration order. */
public enum ParamSlot {
    P("p"),
    COST_GBP("cost_gbp"),
    LABOUR_COST("labour_cost");

    private final String wire;

    ParamSlot(String wire) { this.wire = wire; }

    public String wire() { return wire; }

    public static Optional<ParamSlot> fromWire(String s) {
        for (ParamSlot slot : values()) {
            if (slot.wire.equals(s)) return Optional.of(slot);
        }
        return Optional.empty();
    }
}
