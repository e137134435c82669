package io.paramfetch.retrieval;

import io.paramfetch.core.ExecutionOutcome;
import io.paramfetch.core.ExecutionRequest;
import io.paramfetch.core.ExecutionSink;
import io.paramfetch.model.FetchWindow;
import io.paramfetch.model.CalendarDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Logs the windows each item would fetch. No provider is contacted. */
public class DryRunExecutionSink implements ExecutionSink {
    private static final Logger log = LoggerFactory.getLogger(DryRunExecutionSink.class);

    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong days = new AtomicLong();

    @Override
    public ExecutionOutcome execute(ExecutionRequest request) {
        List<String> ranges = new ArrayList<>();
        long itemDays = 0;
        for (FetchWindow w : request.windows()) {
            ranges.add(CalendarDates.formatUk(w.start()) + ":" + CalendarDates.formatUk(w.end()) + " " + w.reason().wire());
            itemDays += w.dayCount();
        }
        requests.incrementAndGet();
        days.addAndGet(itemDays);
        log.info("would fetch {} ({} days{}): {}", request.item().itemKey(), itemDays,
                request.bustCache() ? ", cache busted" : "", ranges);
        return ExecutionOutcome.fetched(itemDays);
    }

    public long requestCount() { return requests.get(); }

    public long daysRequested() { return days.get(); }
}
