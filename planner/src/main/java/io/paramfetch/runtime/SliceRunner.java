package io.paramfetch.runtime;

import io.paramfetch.dsl.DslParseException;
import io.paramfetch.graph.Graph;
import io.paramfetch.plan.FetchPlanBuilder;
import io.paramfetch.plan.PlanBuildResult;
import io.paramfetch.plan.PlanRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Plans and executes several slice DSLs in turn. Every slice is planned against the same frozen
 * {@code referenceNow}, so staleness does not drift during a long run.
 */
public class SliceRunner {
    private static final Logger log = LoggerFactory.getLogger(SliceRunner.class);

    private final FetchPlanBuilder planBuilder;
    private final PlanExecutor executor;

    public SliceRunner(FetchPlanBuilder planBuilder, PlanExecutor executor) {
        this.planBuilder = Objects.requireNonNull(planBuilder, "planBuilder");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public record SliceStat(String sliceDsl, ExecutionResult result) {}

    public record RunResult(List<SliceStat> slices, ExecutionResult total) {}

    /**
     * @param signaturesForSlice item-key to signature map per slice DSL; may be null
     */
    public RunResult run(Graph graph, List<String> sliceDsls, Instant referenceNow, boolean bustCache,
                         Function<String, Map<String, String>> signaturesForSlice, ExecutionOptions options) {
        List<SliceStat> stats = new ArrayList<>();
        ExecutionResult total = ExecutionResult.EMPTY;
        for (String slice : sliceDsls) {
            if (options.shouldAbort().getAsBoolean()) {
                total = total.plus(new ExecutionResult(0, 0, 0, 0, 0, true, 0, "aborted before slice '" + slice + "'"));
                break;
            }
            Map<String, String> signatures = signaturesForSlice == null ? Map.of() : signaturesForSlice.apply(slice);
            ExecutionResult result;
            try {
                PlanBuildResult built = planBuilder.build(PlanRequest.fromDsl(graph, slice, referenceNow, bustCache, signatures));
                result = executor.execute(built.plan(), options);
            } catch (DslParseException e) {
                log.warn("skipping slice '{}': {}", slice, e.getMessage());
                result = new ExecutionResult(0, 1, 0, 0, 0, false, 0, null);
            }
            stats.add(new SliceStat(slice, result));
            total = total.plus(result);
            log.info("slice '{}': {}", slice, result.describe());
            if (result.aborted()) break;
        }
        return new RunResult(stats, total);
    }
}
