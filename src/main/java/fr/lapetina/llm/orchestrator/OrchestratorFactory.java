package fr.lapetina.llm.orchestrator;

import fr.lapetina.llm.orchestrator.aggregation.AggregationPipeline;
import fr.lapetina.llm.orchestrator.aggregation.StreamAggregator;
import fr.lapetina.llm.orchestrator.domain.routing.ModelBinding;
import fr.lapetina.llm.orchestrator.domain.routing.ModelRegistry;
import fr.lapetina.llm.orchestrator.domain.routing.RouteSelector;
import fr.lapetina.llm.orchestrator.domain.routing.RouteSelectorFactory;
import fr.lapetina.llm.orchestrator.domain.workflow.SessionRegistry;
import fr.lapetina.llm.orchestrator.domain.workflow.WorkflowStateMachine;
import fr.lapetina.llm.orchestrator.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.llm.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.orchestrator.infrastructure.metrics.MetricsUsageRecorder;
import fr.lapetina.llm.orchestrator.infrastructure.persistence.DiagramRepository;
import fr.lapetina.llm.orchestrator.infrastructure.persistence.InMemoryDiagramRepository;
import fr.lapetina.llm.orchestrator.infrastructure.provider.ProviderClientRegistry;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimitBudget;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimitPolicy;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating a fully-wired orchestrator from configuration.
 * This is the primary entry point of the library.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     CandidateOrchestrator orchestrator = factory.getOrchestrator();
 *     // use orchestrator...
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final OrchestratorConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ProviderClientRegistry clients;
    private final RateLimiter rateLimiter;
    private final ModelRegistry modelRegistry;
    private final StreamAggregator aggregator;
    private final WorkflowStateMachine stateMachine;
    private final CandidateOrchestrator orchestrator;

    protected OrchestratorFactory(String configPath, ProviderClientRegistry clientsOverride,
                                  DiagramRepository repositoryOverride) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);

        this.config = new ConfigLoader(configPath).load();
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        // Allow override for testing
        this.clients = clientsOverride != null ? clientsOverride : ProviderClientRegistry.fromConfig(config);

        this.rateLimiter = createRateLimiter();
        this.modelRegistry = createModelRegistry();

        RouteSelector routeSelector = RouteSelectorFactory.forConfig(
                config.getRouting().getStrategy(),
                config.getRouting().isEnabled(),
                config.getRouting().getDefaultRoute()
        );
        log.info("Using route selector: {}", routeSelector.getName());

        AggregationPipeline pipeline = AggregationPipeline.builder()
                .ringBufferSize(config.getAggregation().getRingBufferSize())
                .waitStrategy(config.getAggregation().getWaitStrategy())
                .metricsRegistry(metricsRegistry)
                .build();

        this.aggregator = StreamAggregator.builder()
                .fromConfig(config)
                .routeSelector(routeSelector)
                .modelRegistry(modelRegistry)
                .clients(clients)
                .rateLimiter(rateLimiter)
                .usageRecorder(new MetricsUsageRecorder(metricsRegistry))
                .metricsRegistry(metricsRegistry)
                .pipeline(pipeline)
                .build();

        SessionRegistry sessions = new SessionRegistry(Duration.ofMillis(config.getSessions().getIdleTimeoutMs()));
        this.stateMachine = WorkflowStateMachine.builder()
                .fromConfig(config)
                .aggregator(aggregator)
                .repository(repositoryOverride != null ? repositoryOverride : new InMemoryDiagramRepository())
                .sessions(sessions)
                .build();

        this.orchestrator = new CandidateOrchestrator(stateMachine, rateLimiter, metricsRegistry);

        log.info("OrchestratorFactory initialized: providers={}, models={}, workerProcesses={}",
                clients.getNames(), modelRegistry.getLogicalModels(), rateLimiter.getWorkerProcesses());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        return new OrchestratorFactory(configPath, null, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static OrchestratorFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the aggregation pipeline and the idle-session sweeper.
     */
    public OrchestratorFactory start() {
        aggregator.start();
        stateMachine.startSweeper(Duration.ofMillis(config.getSessions().getSweepIntervalMs()));
        log.info("Orchestrator started");
        return this;
    }

    public CandidateOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public WorkflowStateMachine getStateMachine() {
        return stateMachine;
    }

    public StreamAggregator getAggregator() {
        return aggregator;
    }

    public ModelRegistry getModelRegistry() {
        return modelRegistry;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ProviderClientRegistry getClients() {
        return clients;
    }

    public OrchestratorConfig getConfig() {
        return config;
    }

    private RateLimiter createRateLimiter() {
        RateLimiter limiter = new RateLimiter(config.getDeployment().getWorkerProcesses());
        for (OrchestratorConfig.RateLimitConfig limit : config.getRateLimits()) {
            if (!limit.isEnabled()) {
                log.info("Rate limit disabled: class={}", limit.getName());
                continue;
            }
            try {
                limiter.register(limit.getName(), new RateLimitBudget(
                        limit.getRequestsPerWindow(),
                        limit.getTokensPerWindow(),
                        limit.getMaxConcurrent(),
                        Duration.ofMillis(limit.getWindowMs()),
                        RateLimitPolicy.fromName(limit.getPolicy())
                ));
            } catch (IllegalArgumentException e) {
                throw new ConfigLoader.ConfigurationException(
                        "Invalid rate limit '" + limit.getName() + "': " + e.getMessage(), e);
            }
        }
        return limiter;
    }

    private ModelRegistry createModelRegistry() {
        List<String> routes = new ArrayList<>();
        for (OrchestratorConfig.RouteConfig route : config.getRouting().getRoutes()) {
            routes.add(route.getName());
        }

        List<ModelBinding> bindings = new ArrayList<>();
        for (OrchestratorConfig.ModelConfig model : config.getModels()) {
            model.getBindings().forEach((route, binding) -> bindings.add(new ModelBinding(
                    model.getName(),
                    route,
                    binding.getProvider(),
                    binding.getPhysicalId() != null ? binding.getPhysicalId() : model.getName(),
                    binding.getRateLimitClass()
            )));
        }

        String defaultProvider = config.getProviders().get(0).getName();
        try {
            return new ModelRegistry(routes, config.getRouting().getDefaultRoute(), defaultProvider, bindings);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoader.ConfigurationException("Invalid model table: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            stateMachine.close();
        } catch (Exception e) {
            log.warn("Error closing state machine", e);
        }

        try {
            aggregator.close();
        } catch (Exception e) {
            log.warn("Error closing aggregator", e);
        }

        try {
            clients.close();
        } catch (Exception e) {
            log.warn("Error closing provider clients", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("OrchestratorFactory shut down");
    }
}
