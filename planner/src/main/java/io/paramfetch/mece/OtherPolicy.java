package io.paramfetch.mece;

/** How a context key treats values outside its explicit enumeration. */
public enum OtherPolicy {
    /** No "other" bucket; the listed values are exhaustive. */
    NULL("null"),
    /** "other" is computed as the remainder and must be fetched like any value. */
    COMPUTED("computed"),
    /** "other" is an explicit value. */
    EXPLICIT("explicit"),
    /** Values outside the list may exist; the key can never be summed. */
    UNDEFINED("undefined");

    private final String wire;

    OtherPolicy(String wire) { this.wire = wire; }

    public String wire() { return wire; }

    public static OtherPolicy fromWire(String s) {
        if (s == null) return UNDEFINED;
        for (OtherPolicy p : values()) {
            if (p.wire.equals(s)) return p;
        }
        throw new IllegalArgumentException("unknown otherPolicy '" + s + "'");
    }

    public boolean includesOther() {
        return this == COMPUTED || this == EXPLICIT;
    }
}
