package io.paramfetch.core;

public record ExecutionOutcome(boolean cacheHit, long daysFetched) {
    public static ExecutionOutcome cached() { return new ExecutionOutcome(true, 0); }
    public static ExecutionOutcome fetched(long days) { return new ExecutionOutcome(false, days); }
}
