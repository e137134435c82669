package io.paramfetch.retrieval;

import io.paramfetch.core.ExecutionRequest;
import io.paramfetch.model.Classification;
import io.paramfetch.model.FetchPlanItem;
import io.paramfetch.model.FetchWindow;
import io.paramfetch.model.FetchWindowReason;
import io.paramfetch.model.ItemType;
import io.paramfetch.model.ParamSlot;
import io.paramfetch.model.TemporalMode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DryRunExecutionSinkTest {

    private static ExecutionRequest request(String objectId, LocalDate start, LocalDate end) {
        List<FetchWindow> windows = List.of(FetchWindow.of(start, end, FetchWindowReason.MISSING));
        FetchPlanItem item = new FetchPlanItem(FetchPlanItem.itemKey(ItemType.PARAMETER, objectId, "e", ParamSlot.P, null),
                ItemType.PARAMETER, objectId, "e", ParamSlot.P, null, TemporalMode.WINDOW, "", "",
                Classification.FETCH, null, windows);
        return new ExecutionRequest(item, windows, "window(1-Jan-26:10-Jan-26)", false, Instant.EPOCH, true);
    }

    @Test
    void keepsRunningTotalsOnly() {
        DryRunExecutionSink sink = new DryRunExecutionSink();
        LocalDate jan1 = LocalDate.of(2026, 1, 1);

        assertEquals(3, sink.execute(request("p1", jan1, jan1.plusDays(2))).daysFetched());
        assertFalse(sink.execute(request("p2", jan1, jan1.plusDays(9))).cacheHit());

        assertEquals(2, sink.requestCount());
        assertEquals(13, sink.daysRequested());
    }
}
