package io.paramfetch.snapshot;

import io.paramfetch.core.RetrievalSummaryRow;
import io.paramfetch.mece.ContextDefinition;
import io.paramfetch.mece.InMemoryContextRegistry;
import io.paramfetch.mece.OtherPolicy;
import io.paramfetch.model.TemporalMode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.paramfetch.Fixtures.at;
import static io.paramfetch.Fixtures.range;
import static org.junit.jupiter.api.Assertions.*;

class CohortMaturityEpochsTest {
    private final CohortMaturityEpochs epochs = new CohortMaturityEpochs(new InMemoryContextRegistry(List.of(
            new ContextDefinition("channel", List.of("google", "meta"), OtherPolicy.NULL),
            new ContextDefinition("device", List.of("mobile", "desktop"), OtherPolicy.NULL))));

    @Test
    void prefersLeastAggregatedSafeKeySet() {
        List<String> available = List.of("context(channel:google).cohort()", "context(channel:meta).cohort()",
                "context(device:mobile).cohort()", "context(device:desktop).cohort()", "cohort()");
        assertEquals(List.of("cohort()"), epochs.choose(available, TemporalMode.COHORT, Map.of(), null));
        assertEquals(List.of("context(channel:google).cohort()", "context(channel:meta).cohort()"),
                epochs.choose(available.subList(0, 4), TemporalMode.COHORT, Map.of(), null));
    }

    @Test
    void queryContextNarrowsCandidates() {
        List<String> available = List.of("context(channel:google).cohort()", "context(channel:meta).cohort()");
        assertEquals(List.of("context(channel:google).cohort()"),
                epochs.choose(available, TemporalMode.COHORT, Map.of("channel", "google"), null));
    }

    @Test
    void incompleteOrWrongModeIsNotSafe() {
        assertNull(epochs.choose(List.of("context(channel:google).cohort()"), TemporalMode.COHORT, Map.of(), null));
        assertNull(epochs.choose(List.of("window()"), TemporalMode.COHORT, Map.of(), null));
    }

    @Test
    void sweepWithoutRowsIsOneGap() {
        List<CohortMaturityEpochs.Epoch> out = epochs.segment(List.of(), range("1-Jan-26", "4-Jan-26"), TemporalMode.COHORT, Map.of(), null);
        assertEquals(1, out.size());
        assertTrue(out.get(0).isGap());
        assertEquals(range("1-Jan-26", "4-Jan-26"), out.get(0).days());
    }

    @Test
    void latestRetrievalOfTheDayWins() {
        List<RetrievalSummaryRow> rows = List.of(
                new RetrievalSummaryRow(at("2026-01-02T08:00:00Z"), "context(channel:google).cohort()"),
                new RetrievalSummaryRow(at("2026-01-02T08:00:00Z"), "context(channel:meta).cohort()"),
                new RetrievalSummaryRow(at("2026-01-02T18:00:00Z"), "cohort()"));
        List<CohortMaturityEpochs.Epoch> out = epochs.segment(rows, range("1-Jan-26", "3-Jan-26"), TemporalMode.COHORT, Map.of(), null);
        assertEquals(2, out.size());
        assertTrue(out.get(0).isGap());
        assertEquals(range("2-Jan-26", "3-Jan-26"), out.get(1).days());
        assertEquals(List.of("cohort()"), out.get(1).sliceKeys());
    }
}
