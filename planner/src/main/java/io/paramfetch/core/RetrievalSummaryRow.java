package io.paramfetch.core;

import java.time.Instant;

public record RetrievalSummaryRow(Instant retrievedAt, String sliceKey) {}
