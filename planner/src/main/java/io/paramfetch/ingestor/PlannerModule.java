package io.paramfetch.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.paramfetch.config.PlannerConfig;
import io.paramfetch.core.ConnectionChecker;
import io.paramfetch.core.ContextRegistry;
import io.paramfetch.core.ExecutionSink;
import io.paramfetch.core.FileStateAccessor;
import io.paramfetch.core.ProgressSink;
import io.paramfetch.error.FileItemFailureLog;
import io.paramfetch.error.ItemFailureLog;
import io.paramfetch.mece.DimensionalReducer;
import io.paramfetch.mece.ImplicitSliceSelector;
import io.paramfetch.metrics.Metrics;
import io.paramfetch.plan.FetchPlanBuilder;
import io.paramfetch.policy.RefetchPolicy;
import io.paramfetch.runtime.PlanExecutor;
import io.paramfetch.runtime.SliceRunner;

import java.io.IOException;

/**
 * Engine wiring. A deployment module supplies {@link FileStateAccessor}, {@link ConnectionChecker},
 * {@link ContextRegistry}, {@link ExecutionSink} and {@link ProgressSink}.
 */
public class PlannerModule extends AbstractModule {
    private final PlannerConfig config;

    public PlannerModule(PlannerConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(PlannerConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton RefetchPolicy refetchPolicy() {
        return new RefetchPolicy(config.defaultMaturityDays(), config.refetchCooldownMinutes());
    }

    @Provides @Singleton DimensionalReducer reducer(ContextRegistry registry) { return new DimensionalReducer(registry); }

    @Provides @Singleton ImplicitSliceSelector selector(ContextRegistry registry) { return new ImplicitSliceSelector(registry); }

    @Provides @Singleton FetchPlanBuilder planBuilder(FileStateAccessor fileState, ConnectionChecker connections, RefetchPolicy policy,
                                                      DimensionalReducer reducer, ImplicitSliceSelector selector, Metrics metrics) {
        return new FetchPlanBuilder(fileState, connections, policy, reducer, selector, metrics);
    }

    @Provides @Singleton ItemFailureLog failureLog() throws IOException { return new FileItemFailureLog(config.failuresFile()); }

    @Provides @Singleton PlanExecutor executor(ExecutionSink sink, ProgressSink progress, ItemFailureLog failureLog, Metrics metrics) {
        return PlanExecutor.builder()
                .sink(sink)
                .progress(progress)
                .failureLog(failureLog)
                .metrics(metrics)
                .config(config)
                .build();
    }

    @Provides @Singleton SliceRunner sliceRunner(FetchPlanBuilder planBuilder, PlanExecutor executor) {
        return new SliceRunner(planBuilder, executor);
    }
}
