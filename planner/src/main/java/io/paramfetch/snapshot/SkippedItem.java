package io.paramfetch.snapshot;

public record SkippedItem(String itemKey, String reason) {
    public static final String NO_SIGNATURE = "no_signature";
    public static final String NOT_A_PARAMETER = "not_a_parameter";
    public static final String OUT_OF_SCOPE = "out_of_scope";
    public static final String NO_TIME_BOUNDS = "no_time_bounds";
}
