package io.paramfetch.core;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/** Read-only retrieval summary of the snapshot store. */
public interface SnapshotRetrievalClient {
    List<RetrievalSummaryRow> querySummary(String paramId, String coreHash, List<String> sliceKeys,
                                           LocalDate anchorFrom, LocalDate anchorTo) throws IOException;
}
