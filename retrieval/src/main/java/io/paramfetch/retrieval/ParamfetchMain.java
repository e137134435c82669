package io.paramfetch.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.paramfetch.config.PlannerConfig;
import io.paramfetch.dsl.DslParseException;
import io.paramfetch.graph.Graph;
import io.paramfetch.ingestor.PlannerModule;
import io.paramfetch.mece.ContextDefinition;
import io.paramfetch.model.FetchPlan;
import io.paramfetch.plan.FetchPlanBuilder;
import io.paramfetch.plan.FetchPlans;
import io.paramfetch.plan.PlanBuildResult;
import io.paramfetch.plan.PlanRequest;
import io.paramfetch.runtime.ExecutionOptions;
import io.paramfetch.runtime.ExecutionResult;
import io.paramfetch.runtime.PlanExecutor;
import io.paramfetch.snapshot.MappingRequest;
import io.paramfetch.snapshot.MappingResult;
import io.paramfetch.snapshot.ReadMode;
import io.paramfetch.snapshot.SkippedItem;
import io.paramfetch.snapshot.SnapshotScope;
import io.paramfetch.snapshot.SnapshotSubjectMapper;
import io.paramfetch.snapshot.SnapshotSubjectRequest;
import io.paramfetch.snapshot.Workspace;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * CLI over a JSON cache directory: {@code plan} prints the canonical plan, {@code dry-run} walks it
 * through the executor without contacting a provider, {@code subjects} maps it to snapshot reads.
 */
@CommandLine.Command(name = "paramfetch", mixinStandardHelpOptions = true, description = "Plan parameter fetches against a local cache",
        subcommands = {ParamfetchMain.PlanCommand.class, ParamfetchMain.DryRunCommand.class, ParamfetchMain.SubjectsCommand.class})
public final class ParamfetchMain implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new ParamfetchMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 2;
    }

    static final class PlanOptions {
        @CommandLine.Option(names = {"-g", "--graph"}, required = true, description = "Graph JSON file")
        Path graph;

        @CommandLine.Option(names = {"-c", "--cache"}, description = "Cache directory; default paramfetch.cache.dir")
        Path cacheDir;

        @CommandLine.Option(names = {"-d", "--dsl"}, required = true, description = "Query DSL, e.g. window(1-Jan-26:7-Jan-26)")
        String dsl;

        @CommandLine.Option(names = "--now", description = "Reference instant (ISO-8601); default now")
        Instant now;

        @CommandLine.Option(names = "--bust-cache", description = "Treat every cached day as missing")
        boolean bustCache;

        @CommandLine.Option(names = "--contexts", description = "Context definitions JSON file")
        Path contexts;

        @CommandLine.Option(names = "--signatures", description = "JSON object of item key to query signature")
        Path signatures;
    }

    abstract static class PlanningCommand implements Callable<Integer> {
        @CommandLine.Mixin
        PlanOptions options = new PlanOptions();

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        Injector injector;
        Graph graph;
        PlannerConfig config;
        ObjectMapper mapper;
        FetchPlan plan;

        @Override
        public Integer call() {
            mapper = new ObjectMapper();
            config = PlannerConfig.fromEnv();
            if (options.cacheDir != null) config = config.withCacheDir(options.cacheDir);
            List<ContextDefinition> contexts;
            Map<String, String> signatures;
            try {
                graph = new GraphJsonLoader(mapper).load(options.graph);
                contexts = options.contexts == null ? List.of() : new ContextDefinitionsLoader(mapper).load(options.contexts);
                signatures = options.signatures == null ? Map.of()
                        : mapper.readValue(options.signatures.toFile(), new TypeReference<Map<String, String>>() {});
            } catch (IOException e) {
                spec.commandLine().getErr().println("Cannot read input: " + e.getMessage());
                return 2;
            }
            injector = Guice.createInjector(new PlannerModule(config), new RetrievalModule(config, graph, contexts));
            Instant now = options.now == null ? Instant.now() : options.now;
            PlanBuildResult built;
            try {
                built = injector.getInstance(FetchPlanBuilder.class)
                        .build(PlanRequest.fromDsl(graph, options.dsl, now, options.bustCache, signatures));
            } catch (DslParseException e) {
                spec.commandLine().getErr().println("Invalid DSL: " + e.getMessage());
                return 2;
            }
            plan = built.plan();
            return run(spec.commandLine().getOut());
        }

        abstract int run(PrintWriter out);
    }

    @CommandLine.Command(name = "plan", mixinStandardHelpOptions = true, description = "Print the canonical fetch plan")
    static final class PlanCommand extends PlanningCommand {
        @Override
        int run(PrintWriter out) {
            out.println(FetchPlans.serialiseCanonical(plan));
            out.println(FetchPlans.summarise(plan).describe());
            out.flush();
            return 0;
        }
    }

    @CommandLine.Command(name = "dry-run", mixinStandardHelpOptions = true, description = "Execute the plan in simulate mode")
    static final class DryRunCommand extends PlanningCommand {
        @Override
        int run(PrintWriter out) {
            ExecutionResult result;
            try (PlanExecutor executor = injector.getInstance(PlanExecutor.class)) {
                result = executor.execute(plan, ExecutionOptions.dryRun());
            }
            out.println(FetchPlans.summarise(plan).describe());
            out.println(result.describe());
            out.flush();
            return result.errors() > 0 ? 1 : 0;
        }
    }

    @CommandLine.Command(name = "subjects", mixinStandardHelpOptions = true, description = "Map the plan to snapshot subject requests")
    static final class SubjectsCommand extends PlanningCommand {
        @CommandLine.Option(names = "--read-mode", defaultValue = "virtual_snapshot",
                description = "raw_snapshots, virtual_snapshot or cohort_maturity")
        String readMode;

        @CommandLine.Option(names = "--edges", split = ",", description = "Restrict to these edge ids or uuids")
        List<String> edges;

        @Override
        int run(PrintWriter out) {
            ReadMode mode;
            try {
                mode = ReadMode.fromWire(readMode);
            } catch (IllegalArgumentException e) {
                spec.commandLine().getErr().println(e.getMessage());
                return 2;
            }
            SnapshotScope scope = edges == null || edges.isEmpty()
                    ? new SnapshotScope.AllGraphParameters()
                    : new SnapshotScope.SelectionEdges(Set.copyOf(edges));
            MappingResult result = injector.getInstance(SnapshotSubjectMapper.class).map(new MappingRequest(plan, graph,
                    new Workspace(config.workspaceRepository(), config.workspaceBranch()), mode, scope, null, config.sliceKeysPolicy()));
            try {
                for (SnapshotSubjectRequest s : result.subjects()) out.println(mapper.writeValueAsString(subjectJson(s)));
                for (SkippedItem s : result.skipped()) {
                    out.println(mapper.writeValueAsString(new TreeMap<>(Map.of("skipped", s.itemKey(), "reason", s.reason()))));
                }
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("cannot serialise subjects", e);
            }
            out.flush();
            return 0;
        }

        private static Map<String, Object> subjectJson(SnapshotSubjectRequest s) {
            Map<String, Object> m = new TreeMap<>();
            m.put("subjectId", s.subjectId());
            m.put("paramId", s.paramId());
            m.put("coreHash", s.coreHash());
            m.put("readMode", s.readMode().wire());
            m.put("anchorFrom", s.anchorFrom().toString());
            m.put("anchorTo", s.anchorTo().toString());
            if (s.asAt() != null) m.put("asAt", s.asAt().toString());
            if (s.sweepFrom() != null) m.put("sweepFrom", s.sweepFrom().toString());
            if (s.sweepTo() != null) m.put("sweepTo", s.sweepTo().toString());
            m.put("sliceKeys", s.sliceKeys());
            m.put("targetId", s.target().targetId());
            if (s.target().slot() != null) m.put("slot", s.target().slot());
            if (s.target().conditionalIndex() != null) m.put("conditionalIndex", s.target().conditionalIndex());
            return m;
        }
    }
}
