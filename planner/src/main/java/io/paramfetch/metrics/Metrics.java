package io.paramfetch.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String PLAN_BUILD_TIME = "paramfetch.plan.build.time";
    public static final String PLAN_ITEMS = "paramfetch.plan.items";
    public static final String EXEC_SUCCESS = "paramfetch.execution.success";
    public static final String EXEC_ERRORS = "paramfetch.execution.errors";
    public static final String EXEC_CACHE_HITS = "paramfetch.execution.cache_hits";
    public static final String EXEC_API_FETCHES = "paramfetch.execution.api_fetches";
    public static final String EXEC_DAYS_FETCHED = "paramfetch.execution.days_fetched";
    public static final String EXEC_RATE_LIMITED = "paramfetch.execution.rate_limited";
    public static final String EXEC_DB_WIDENED = "paramfetch.execution.db_widened";
    public static final String EXEC_ITEM_TIME = "paramfetch.execution.item.time";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
