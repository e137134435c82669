package io.paramfetch.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.paramfetch.config.PlannerConfig;
import io.paramfetch.core.ConnectionChecker;
import io.paramfetch.core.ContextRegistry;
import io.paramfetch.core.ExecutionSink;
import io.paramfetch.core.FileStateAccessor;
import io.paramfetch.core.HashService;
import io.paramfetch.core.ProgressSink;
import io.paramfetch.core.SnapshotRetrievalClient;
import io.paramfetch.graph.BindingConnectionChecker;
import io.paramfetch.graph.Graph;
import io.paramfetch.mece.ContextDefinition;
import io.paramfetch.mece.InMemoryContextRegistry;
import io.paramfetch.snapshot.CohortMaturityEpochs;
import io.paramfetch.snapshot.SnapshotSubjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** File-backed deployment: JSON cache directory, graph-driven connections, dry-run sink, exported snapshot summaries. */
public class RetrievalModule extends AbstractModule {
    private static final Logger log = LoggerFactory.getLogger(RetrievalModule.class);

    private final PlannerConfig config;
    private final Graph graph;
    private final List<ContextDefinition> contexts;

    public RetrievalModule(PlannerConfig config, Graph graph, List<ContextDefinition> contexts) {
        this.config = config;
        this.graph = graph;
        this.contexts = List.copyOf(contexts);
    }

    @Override
    protected void configure() {
        bind(Graph.class).toInstance(graph);
        bind(HashService.class).to(Sha256HashService.class).in(Singleton.class);
    }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton FileStateAccessor fileState(ObjectMapper mapper) { return new JsonFileStateAccessor(config.cacheDir(), mapper); }

    @Provides @Singleton ConnectionChecker connectionChecker() { return BindingConnectionChecker.forGraph(graph); }

    @Provides @Singleton ContextRegistry contextRegistry() { return new InMemoryContextRegistry(contexts); }

    @Provides @Singleton SnapshotRetrievalClient retrievalClient(ObjectMapper mapper) {
        return new JsonRetrievalSummaryClient(config.cacheDir().resolve("snapshots"), mapper);
    }

    @Provides @Singleton SnapshotSubjectMapper subjectMapper(HashService hashes, SnapshotRetrievalClient client, ContextRegistry registry) {
        return new SnapshotSubjectMapper(hashes, client, new CohortMaturityEpochs(registry));
    }

    @Provides @Singleton DryRunExecutionSink dryRunSink() { return new DryRunExecutionSink(); }

    @Provides @Singleton ExecutionSink executionSink(DryRunExecutionSink sink) { return sink; }

    @Provides @Singleton ProgressSink progressSink() {
        return p -> log.debug("[{}/{}] {} {}", p.index(), p.total(), p.itemKey(), p.outcome());
    }
}
