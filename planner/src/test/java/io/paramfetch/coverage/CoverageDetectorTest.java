package io.paramfetch.coverage;

import io.paramfetch.model.DateRange;
import io.paramfetch.model.ParameterValue;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static io.paramfetch.Fixtures.d;
import static io.paramfetch.Fixtures.dailyWindow;
import static io.paramfetch.Fixtures.range;
import static org.junit.jupiter.api.Assertions.*;

class CoverageDetectorTest {
    private static final String DSL = "window(1-Jan-26:10-Jan-26)";
    private static final DateRange REQ = range("1-Jan-26", "10-Jan-26");

    @Test
    void existingAndMissingPartitionTheRequest() {
        ParameterValue v = dailyWindow("window(3-Jan-26:6-Jan-26)", "3-Jan-26", "6-Jan-26", 100, 10).build();
        CoverageResult r = CoverageDetector.coverage(List.of(v), REQ, null, false, DSL);

        Set<LocalDate> union = new HashSet<>(r.existingDates());
        union.addAll(r.missingDates());
        assertEquals(new HashSet<>(REQ.days()), union);
        assertEquals(4, r.existingDates().size());
        assertEquals(List.of(range("1-Jan-26", "2-Jan-26"), range("7-Jan-26", "10-Jan-26")), r.fetchWindows());
        assertTrue(r.needsFetch());
        assertFalse(r.fastPath());
    }

    @Test
    void aggregateHeaderCoverageSkipsDailyInspection() {
        List<Long> sparse = new ArrayList<>();
        for (int i = 0; i < 10; i++) sparse.add(i % 2 == 0 ? 5L : null);
        ParameterValue v = ParameterValue.builder()
                .sliceDsl("window(1-Jan-26:10-Jan-26)")
                .window(d("1-Jan-26"), d("10-Jan-26"))
                .daily(REQ.days(), sparse, sparse)
                .aggregate(0.5, 100L, 50L)
                .build();
        CoverageResult r = CoverageDetector.coverage(List.of(v), REQ, null, false, DSL);
        assertTrue(r.fastPath());
        assertFalse(r.needsFetch());
        assertTrue(r.missingDates().isEmpty());
    }

    @Test
    void sparseSliceWithoutAggregateUsesDailyArrays() {
        List<Long> sparse = new ArrayList<>();
        for (int i = 0; i < 10; i++) sparse.add(i < 8 ? 5L : null);
        ParameterValue v = ParameterValue.builder()
                .sliceDsl("window(1-Jan-26:10-Jan-26)")
                .window(d("1-Jan-26"), d("10-Jan-26"))
                .daily(REQ.days(), sparse, sparse)
                .build();
        CoverageResult r = CoverageDetector.coverage(List.of(v), REQ, null, false, DSL);
        assertEquals(List.of(d("9-Jan-26"), d("10-Jan-26")), r.missingDates());
    }

    @Test
    void bustCacheMarksEverythingMissing() {
        ParameterValue v = dailyWindow("window(1-Jan-26:10-Jan-26)", "1-Jan-26", "10-Jan-26", 100, 10)
                .aggregate(0.1, 1000L, 100L).build();
        CoverageResult r = CoverageDetector.coverage(List.of(v), REQ, null, true, DSL);
        assertEquals(10, r.missingDates().size());
        assertEquals(List.of(REQ), r.fetchWindows());
    }

    @Test
    void contextedSliceDoesNotServeOtherFamily() {
        ParameterValue google = dailyWindow("context(channel:google).window(1-Jan-26:10-Jan-26)", "1-Jan-26", "10-Jan-26", 10, 1).build();
        ParameterValue plain = dailyWindow("window(1-Jan-26:5-Jan-26)", "1-Jan-26", "5-Jan-26", 10, 1).build();
        CoverageResult r = CoverageDetector.coverage(List.of(google, plain), REQ, null, false, DSL);
        assertEquals(5, r.missingDates().size());

        CoverageResult g = CoverageDetector.coverage(List.of(google, plain), REQ, null, false,
                "context(channel:google).window(1-Jan-26:10-Jan-26)");
        assertFalse(g.needsFetch());
    }

    @Test
    void implicitMeceRequiresEveryFamily() {
        ParameterValue google = dailyWindow("context(channel:google)", "1-Jan-26", "10-Jan-26", 10, 1).build();
        ParameterValue meta = dailyWindow("context(channel:meta)", "1-Jan-26", "6-Jan-26", 10, 1).build();
        CoverageResult r = CoverageDetector.coverage(List.of(google, meta), REQ, null, false, DSL);
        assertEquals(List.of(range("7-Jan-26", "10-Jan-26")), r.fetchWindows());
    }

    @Test
    void signatureFilterExcludesIncompatibleAndUnsignedValues() {
        String sig = "{\"c\":\"core1\",\"x\":{}}";
        ParameterValue matching = dailyWindow("window(1-Jan-26:4-Jan-26)", "1-Jan-26", "4-Jan-26", 1, 1).querySignature(sig).build();
        ParameterValue other = dailyWindow("window(5-Jan-26:8-Jan-26)", "5-Jan-26", "8-Jan-26", 1, 1)
                .querySignature("{\"c\":\"core2\",\"x\":{}}").build();
        ParameterValue unsigned = dailyWindow("window(9-Jan-26:10-Jan-26)", "9-Jan-26", "10-Jan-26", 1, 1).build();

        CoverageResult r = CoverageDetector.coverage(List.of(matching, other, unsigned), REQ, sig, false, DSL);
        assertEquals(List.of(range("5-Jan-26", "10-Jan-26")), r.fetchWindows());

        CoverageResult noSig = CoverageDetector.coverage(List.of(matching, other, unsigned), REQ, null, false, DSL);
        assertFalse(noSig.needsFetch());
    }

    @Test
    void unparsableQueryIsAnIsolationError() {
        ParameterValue v = dailyWindow("window(1-Jan-26:2-Jan-26)", "1-Jan-26", "2-Jan-26", 1, 1).build();
        assertThrows(SliceIsolationException.class,
                () -> CoverageDetector.coverage(List.of(v), REQ, null, false, "window(1-Jan-26:"));
    }
}
