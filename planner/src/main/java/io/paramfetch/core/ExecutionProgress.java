package io.paramfetch.core;

/** {@code index} is 1-based. */
public record ExecutionProgress(int index, int total, String itemKey, Status outcome) {
    public enum Status { FETCHED, CACHED, SKIPPED, FAILED }
}
