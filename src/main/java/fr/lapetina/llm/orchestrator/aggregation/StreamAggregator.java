package fr.lapetina.llm.orchestrator.aggregation;

import fr.lapetina.llm.orchestrator.domain.event.EventSink;
import fr.lapetina.llm.orchestrator.domain.event.WorkflowEvent;
import fr.lapetina.llm.orchestrator.domain.model.ChatRequest;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ModelStats;
import fr.lapetina.llm.orchestrator.domain.model.ProviderError;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import fr.lapetina.llm.orchestrator.domain.model.TokenUsage;
import fr.lapetina.llm.orchestrator.domain.routing.ModelBinding;
import fr.lapetina.llm.orchestrator.domain.routing.ModelRegistry;
import fr.lapetina.llm.orchestrator.domain.routing.Route;
import fr.lapetina.llm.orchestrator.domain.routing.RouteSelector;
import fr.lapetina.llm.orchestrator.domain.workflow.StateException;
import fr.lapetina.llm.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.llm.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.orchestrator.infrastructure.metrics.UsageRecorder;
import fr.lapetina.llm.orchestrator.infrastructure.provider.DeltaListener;
import fr.lapetina.llm.orchestrator.infrastructure.provider.ProviderClient;
import fr.lapetina.llm.orchestrator.infrastructure.provider.ProviderClientRegistry;
import fr.lapetina.llm.orchestrator.infrastructure.provider.RetryPolicy;
import fr.lapetina.llm.orchestrator.infrastructure.provider.error.ErrorClassifier;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.Permit;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans one prompt out to several models and merges their streams into a
 * single deduplicated candidate stream.
 *
 * <p>The route is chosen once per batch, so every model of a batch is served
 * under the same route. Each model call acquires a rate-limit permit per
 * attempt, retries retryable errors with backoff, and ends in exactly one
 * terminal entry on the {@link AggregationPipeline}. A failing model never
 * aborts the others.
 *
 * <p>At most one batch may be in flight per session and stage.
 */
public final class StreamAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamAggregator.class);

    private final RouteSelector routeSelector;
    private final List<Route> routes;
    private final ModelRegistry modelRegistry;
    private final ProviderClientRegistry clients;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Duration permitTimeout;
    private final Map<String, SegmentationMode> segmentation;
    private final UsageRecorder usageRecorder;
    private final MetricsRegistry metricsRegistry;
    private final AggregationPipeline pipeline;
    private final ExecutorService workers;

    private final Map<String, BatchHandle> activeBatches = new ConcurrentHashMap<>();

    private StreamAggregator(Builder builder) {
        this.routeSelector = builder.routeSelector;
        this.routes = List.copyOf(builder.routes);
        this.modelRegistry = builder.modelRegistry;
        this.clients = builder.clients;
        this.rateLimiter = builder.rateLimiter;
        this.retryPolicy = builder.retryPolicy;
        this.permitTimeout = builder.permitTimeout;
        this.segmentation = Map.copyOf(builder.segmentation);
        this.usageRecorder = builder.usageRecorder;
        this.metricsRegistry = builder.metricsRegistry;
        this.pipeline = builder.pipeline;

        AtomicInteger threadCounter = new AtomicInteger(0);
        this.workers = Executors.newFixedThreadPool(builder.workerThreads, r -> {
            Thread t = new Thread(r, "model-call-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });

        log.info("StreamAggregator created: selector={}, routes={}, workerThreads={}, maxRetries={}",
                routeSelector.getName(), routes, builder.workerThreads, retryPolicy.maxRetries());
    }

    public void start() {
        pipeline.start();
    }

    /**
     * Starts one batch. Returns once the calls are launched; events flow to
     * {@code sink} from pipeline threads.
     *
     * @throws StateException with {@code BATCH_IN_PROGRESS} if a batch for the
     *                        same session and stage has not completed
     */
    public BatchHandle fanOut(BatchRequest request, EventSink sink) {
        String scopeKey = request.stage().scopeKey(request.sessionId());
        if (activeBatches.containsKey(scopeKey)) {
            throw new StateException(StateException.Violation.BATCH_IN_PROGRESS, request.stage().toString());
        }

        Route route = routeSelector.select(routes);
        // Released before the completion future completes, so waiters may start the next batch at once
        BatchHandle batch = new BatchHandle(request, route, sink, () -> {
            activeBatches.remove(scopeKey);
            metricsRegistry.setActiveBatches(activeBatches.size());
        });
        if (activeBatches.putIfAbsent(scopeKey, batch) != null) {
            throw new StateException(StateException.Violation.BATCH_IN_PROGRESS, request.stage().toString());
        }
        metricsRegistry.incrementRouteSelection(route.name());
        metricsRegistry.setActiveBatches(activeBatches.size());

        batch.completion().whenComplete((summary, failure) -> {
            if (summary != null) {
                log.info("Batch finished: sessionId={}, stage={}, batch={}, route={}, newCandidates={}, cancelled={}",
                        summary.sessionId(), summary.stage(), summary.batchNumber(), summary.route(),
                        summary.newCandidates().size(), summary.cancelled());
            }
        });

        log.info("Batch started: sessionId={}, stage={}, batch={}, route={}, models={}, temperature={}",
                request.sessionId(), request.stage(), request.batchNumber(), route.name(),
                request.models(), request.temperature());

        batch.emit(WorkflowEvent.batchStart(request.sessionId(), request.stage(), request.batchNumber(),
                route.name(), request.models().size()));

        for (String model : request.models()) {
            ModelBinding binding = modelRegistry.resolve(model, route.name());
            ModelCall call = new ModelCall(batch, binding, new ChatRequest(
                    binding.physicalId(),
                    request.prompt(),
                    request.system(),
                    request.temperature(),
                    request.maxTokens()
            ));
            workers.execute(() -> attempt(call, 0));
        }
        return batch;
    }

    private void attempt(ModelCall call, int attemptNumber) {
        BatchHandle batch = call.batch;
        if (batch.isCancelled()) {
            return;
        }
        ModelBinding binding = call.binding;
        call.attempts.incrementAndGet();

        Permit permit = rateLimiter.acquire(binding.rateLimitClass(), permitTimeout);
        if (!permit.isGranted()) {
            metricsRegistry.incrementRateLimited(binding.rateLimitClass());
            onFailure(call, attemptNumber, ProviderError.of(ErrorKind.RATE_LIMIT, binding.provider(),
                    "local_" + permit.getOutcome().name().toLowerCase(), permit.toString()));
            return;
        }

        CandidateSegmenter segmenter = CandidateSegmenter.create(
                segmentation.getOrDefault(binding.provider(), SegmentationMode.LINE));
        long startNanos = System.nanoTime();

        CompletableFuture<TokenUsage> stream;
        try {
            ProviderClient client = clients.get(binding.provider());
            stream = client.streamChat(call.request, new DeltaListener() {
                @Override
                public void onDelta(String delta) {
                    publishAll(batch, binding.logicalName(), segmenter.accept(delta));
                }

                @Override
                public boolean isCancelled() {
                    return batch.isCancelled();
                }
            });
        } catch (RuntimeException e) {
            permit.release();
            onFailure(call, attemptNumber, ErrorClassifier.classifyFailure(binding.provider(), e));
            return;
        }

        CompletableFuture<TokenUsage> open = stream;
        // Cancelling the call future closes a stalled stream instead of waiting for its next chunk
        batch.completion().thenRun(() -> {
            if (batch.isCancelled()) {
                open.cancel(true);
            }
        });

        stream.whenComplete((usage, failure) -> {
            permit.release();
            Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
            metricsRegistry.recordCallLatency(binding.provider(), binding.logicalName(), latency);
            try {
                if (failure == null) {
                    onSuccess(call, segmenter, usage, latency);
                } else {
                    onFailure(call, attemptNumber, ErrorClassifier.classifyFailure(binding.provider(), failure));
                }
            } catch (RuntimeException e) {
                log.error("Model call completion failed: batch={}, model={}", batch, binding.logicalName(), e);
            }
        });
    }

    private void publishAll(BatchHandle batch, String model, List<String> texts) {
        for (String text : texts) {
            if (batch.isCancelled()) {
                return;
            }
            pipeline.publishCandidate(batch, model, text);
        }
    }

    private void onSuccess(ModelCall call, CandidateSegmenter segmenter, TokenUsage usage, Duration latency) {
        BatchHandle batch = call.batch;
        ModelBinding binding = call.binding;
        if (batch.isCancelled()) {
            return;
        }
        publishAll(batch, binding.logicalName(), segmenter.flush());

        TokenUsage tokens = usage != null ? usage : TokenUsage.ZERO;
        rateLimiter.recordTokens(binding.rateLimitClass(), tokens.totalTokens());
        metricsRegistry.recordTokens(binding.provider(), binding.logicalName(),
                tokens.inputTokens(), tokens.outputTokens());
        try {
            usageRecorder.recordUsage(binding.provider(), binding.logicalName(),
                    tokens.inputTokens(), tokens.outputTokens(), latency);
        } catch (RuntimeException e) {
            log.warn("Usage recording failed: provider={}, model={}", binding.provider(), binding.logicalName(), e);
        }

        log.debug("Model complete: batch={}, model={}, attempts={}, latencyMs={}",
                batch, binding.logicalName(), call.attempts.get(), latency.toMillis());
        pipeline.publishModelComplete(batch,
                new ModelStats(binding.logicalName(), 0, call.attempts.get(), batch.elapsedMs(), null));
    }

    private void onFailure(ModelCall call, int attemptNumber, ProviderError error) {
        BatchHandle batch = call.batch;
        ModelBinding binding = call.binding;
        if (batch.isCancelled()) {
            return;
        }
        metricsRegistry.incrementProviderError(binding.provider(), binding.logicalName(), error.kind());

        if (retryPolicy.shouldRetry(error, attemptNumber)) {
            Duration backoff = retryPolicy.backoff(attemptNumber);
            log.info("Retrying model call: batch={}, model={}, errorKind={}, attempt={}, backoffMs={}",
                    batch, binding.logicalName(), error.kind(), attemptNumber + 1, backoff.toMillis());
            CompletableFuture.delayedExecutor(backoff.toMillis(), TimeUnit.MILLISECONDS, workers)
                    .execute(() -> attempt(call, attemptNumber + 1));
            return;
        }

        log.warn("Model call failed: batch={}, model={}, provider={}, errorKind={}, code={}, digest={}, attempts={}",
                batch, binding.logicalName(), binding.provider(), error.kind(), error.code(), error.digest(),
                call.attempts.get());
        pipeline.publishModelFailed(batch,
                new ModelStats(binding.logicalName(), 0, call.attempts.get(), batch.elapsedMs(), error.kind()));
    }

    /**
     * Cancels the in-flight batch of one stage, if any.
     *
     * @return true if a batch was cancelled
     */
    public boolean cancel(String sessionId, StageKey stage) {
        BatchHandle batch = activeBatches.get(stage.scopeKey(sessionId));
        return batch != null && batch.cancel();
    }

    /**
     * Cancels every in-flight batch of a session.
     *
     * @return number of batches cancelled
     */
    public int cancelSession(String sessionId) {
        int cancelled = 0;
        for (BatchHandle batch : new ArrayList<>(activeBatches.values())) {
            if (batch.getSessionId().equals(sessionId) && batch.cancel()) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public boolean isInFlight(String sessionId, StageKey stage) {
        return activeBatches.containsKey(stage.scopeKey(sessionId));
    }

    public int getActiveBatchCount() {
        return activeBatches.size();
    }

    public List<Route> getRoutes() {
        return routes;
    }

    @Override
    public void close() {
        log.info("Shutting down StreamAggregator: activeBatches={}", activeBatches.size());
        for (BatchHandle batch : new ArrayList<>(activeBatches.values())) {
            batch.cancel();
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Model call workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pipeline.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * One model's share of a batch, shared by all its attempts.
     */
    private static final class ModelCall {
        private final BatchHandle batch;
        private final ModelBinding binding;
        private final ChatRequest request;
        private final AtomicInteger attempts = new AtomicInteger(0);

        private ModelCall(BatchHandle batch, ModelBinding binding, ChatRequest request) {
            this.batch = batch;
            this.binding = binding;
            this.request = request;
        }
    }

    /**
     * Builder for StreamAggregator.
     */
    public static final class Builder {
        private RouteSelector routeSelector;
        private List<Route> routes = List.of();
        private ModelRegistry modelRegistry;
        private ProviderClientRegistry clients;
        private RateLimiter rateLimiter = new RateLimiter(1);
        private RetryPolicy retryPolicy = RetryPolicy.none();
        private Duration permitTimeout = Duration.ofSeconds(5);
        private Map<String, SegmentationMode> segmentation = new HashMap<>();
        private UsageRecorder usageRecorder = UsageRecorder.NO_OP;
        private MetricsRegistry metricsRegistry;
        private AggregationPipeline pipeline;
        private int workerThreads = 16;

        public Builder routeSelector(RouteSelector selector) {
            this.routeSelector = selector;
            return this;
        }

        public Builder routes(List<Route> routes) {
            this.routes = routes;
            return this;
        }

        public Builder modelRegistry(ModelRegistry registry) {
            this.modelRegistry = registry;
            return this;
        }

        public Builder clients(ProviderClientRegistry clients) {
            this.clients = clients;
            return this;
        }

        public Builder rateLimiter(RateLimiter limiter) {
            this.rateLimiter = limiter;
            return this;
        }

        public Builder retryPolicy(RetryPolicy policy) {
            this.retryPolicy = policy;
            return this;
        }

        public Builder permitTimeout(Duration timeout) {
            this.permitTimeout = timeout;
            return this;
        }

        public Builder segmentation(String provider, SegmentationMode mode) {
            this.segmentation.put(provider, mode);
            return this;
        }

        public Builder usageRecorder(UsageRecorder recorder) {
            this.usageRecorder = recorder;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder pipeline(AggregationPipeline pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public Builder workerThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("At least one worker thread is required");
            }
            this.workerThreads = threads;
            return this;
        }

        public Builder fromConfig(OrchestratorConfig config) {
            List<Route> configured = new ArrayList<>();
            for (OrchestratorConfig.RouteConfig route : config.getRouting().getRoutes()) {
                configured.add(new Route(route.getName(), route.getWeight()));
            }
            this.routes = configured;

            OrchestratorConfig.RetryConfig retry = config.getRetry();
            this.retryPolicy = new RetryPolicy(
                    retry.getMaxRetries(),
                    Duration.ofMillis(retry.getInitialBackoffMs()),
                    Duration.ofMillis(retry.getMaxBackoffMs()),
                    retry.getMultiplier()
            );
            this.permitTimeout = Duration.ofMillis(config.getTimeouts().getPermitTimeoutMs());
            this.workerThreads = config.getAggregation().getWorkerThreads();
            for (OrchestratorConfig.ProviderConfig provider : config.getProviders()) {
                this.segmentation.put(provider.getName(), SegmentationMode.fromName(provider.getSegmentation()));
            }
            return this;
        }

        public StreamAggregator build() {
            if (routeSelector == null) {
                throw new IllegalStateException("RouteSelector is required");
            }
            if (routes == null || routes.isEmpty()) {
                throw new IllegalStateException("At least one route is required");
            }
            if (modelRegistry == null) {
                throw new IllegalStateException("ModelRegistry is required");
            }
            if (clients == null) {
                throw new IllegalStateException("ProviderClientRegistry is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            if (pipeline == null) {
                throw new IllegalStateException("AggregationPipeline is required");
            }
            return new StreamAggregator(this);
        }
    }
}
