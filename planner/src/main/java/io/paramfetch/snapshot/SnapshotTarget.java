package io.paramfetch.snapshot;

/** Provenance of a subject: the edge and slot it was derived from. */
public record SnapshotTarget(String targetId, String slot, Integer conditionalIndex) {}
