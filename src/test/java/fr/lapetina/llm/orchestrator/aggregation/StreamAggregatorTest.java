package fr.lapetina.llm.orchestrator.aggregation;

import fr.lapetina.llm.orchestrator.domain.event.EventType;
import fr.lapetina.llm.orchestrator.domain.event.WorkflowEvent;
import fr.lapetina.llm.orchestrator.domain.model.BatchSummary;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.ChatRequest;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ModelStats;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import fr.lapetina.llm.orchestrator.domain.routing.FixedRouteSelector;
import fr.lapetina.llm.orchestrator.domain.routing.ModelBinding;
import fr.lapetina.llm.orchestrator.domain.routing.ModelRegistry;
import fr.lapetina.llm.orchestrator.domain.routing.Route;
import fr.lapetina.llm.orchestrator.domain.workflow.StateException;
import fr.lapetina.llm.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.orchestrator.infrastructure.provider.ProviderClientRegistry;
import fr.lapetina.llm.orchestrator.infrastructure.provider.RetryPolicy;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimitBudget;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimitPolicy;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.llm.orchestrator.integration.ScriptedProviderClient;
import fr.lapetina.llm.orchestrator.integration.ScriptedProviderClient.Script;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamAggregatorTest {

    private static final List<String> MODELS = List.of("qwen", "deepseek", "kimi", "doubao");
    private static final StageKey STAGE = StageKey.of("dimensions");

    private ScriptedProviderClient dashscope;
    private ScriptedProviderClient volcengine;
    private ProviderClientRegistry clients;
    private MetricsRegistry metrics;
    private StreamAggregator aggregator;
    private final List<WorkflowEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        dashscope = new ScriptedProviderClient("dashscope");
        volcengine = new ScriptedProviderClient("volcengine");
        clients = new ProviderClientRegistry().register(dashscope).register(volcengine);
        metrics = new MetricsRegistry("aggregator_test");
    }

    @AfterEach
    void tearDown() {
        if (aggregator != null) {
            aggregator.close();
        }
        clients.close();
        metrics.close();
    }

    private static ModelRegistry modelRegistry() {
        return new ModelRegistry(List.of("A", "B"), "A", "dashscope", List.of(
                new ModelBinding("qwen", "A", "dashscope", "qwen-plus", null),
                new ModelBinding("deepseek", "A", "dashscope", "deepseek-v3", null),
                new ModelBinding("deepseek", "B", "volcengine", "ark-deepseek", null),
                new ModelBinding("kimi", "A", "volcengine", "ark-kimi", null),
                new ModelBinding("doubao", "A", "volcengine", "ark-doubao", null)
        ));
    }

    private StreamAggregator start(String route, RateLimiter limiter, RetryPolicy retryPolicy) {
        aggregator = StreamAggregator.builder()
                .routeSelector(new FixedRouteSelector(route))
                .routes(List.of(new Route("A", 50), new Route("B", 50)))
                .modelRegistry(modelRegistry())
                .clients(clients)
                .rateLimiter(limiter)
                .retryPolicy(retryPolicy)
                .permitTimeout(Duration.ofMillis(100))
                .metricsRegistry(metrics)
                .pipeline(AggregationPipeline.builder().ringBufferSize(256).metricsRegistry(metrics).build())
                .workerThreads(8)
                .build();
        aggregator.start();
        return aggregator;
    }

    private StreamAggregator start() {
        return start("A", new RateLimiter(1), RetryPolicy.none());
    }

    private static BatchRequest request(String sessionId, StageKey stage, Set<String> existingKeys) {
        return new BatchRequest(sessionId, stage, 1, "List dimensions of a plant", "system", MODELS,
                0.7, 200, existingKeys, existingKeys.size());
    }

    private static BatchRequest request(String sessionId) {
        return request(sessionId, STAGE, Set.of());
    }

    private BatchSummary await(BatchHandle batch) throws Exception {
        return batch.completion().get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should merge every model and survive one failing model")
    void shouldSurviveFailingModel() throws Exception {
        dashscope.script("qwen-plus", Script.lines("1. Roots", "2. Stem"))
                .script("deepseek-v3", Script.lines("roots!", "Leaves"));
        volcengine.script("ark-kimi", Script.alwaysFailing(ErrorKind.CONTENT_FILTER))
                .script("ark-doubao", Script.lines("Flower", "STEM"));
        start();

        BatchSummary summary = await(aggregator.fanOut(request("s1"), events::add));

        assertThat(summary.cancelled()).isFalse();
        assertThat(summary.isFullyFailed()).isFalse();
        assertThat(summary.newCandidates()).extracting(Candidate::dedupKey)
                .containsExactlyInAnyOrder("roots", "stem", "leaves", "flower");
        assertThat(summary.modelStats()).extracting(ModelStats::model).containsExactlyInAnyOrderElementsOf(MODELS);
        assertThat(summary.modelStats()).filteredOn(s -> s.model().equals("kimi"))
                .singleElement()
                .extracting(ModelStats::error)
                .isEqualTo(ErrorKind.CONTENT_FILTER);

        assertThat(events.get(0).type()).isEqualTo(EventType.BATCH_START);
        assertThat(events.get(0).route()).isEqualTo("A");
        assertThat(events.get(0).modelCount()).isEqualTo(4);
        assertThat(events.get(events.size() - 1).type()).isEqualTo(EventType.BATCH_COMPLETE);
        assertThat(events).filteredOn(e -> e.type() == EventType.ERROR)
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.model()).isEqualTo("kimi");
                    assertThat(e.messageKey()).isEqualTo("error.content_filter");
                });
        assertThat(events).filteredOn(e -> e.type() == EventType.CANDIDATE)
                .extracting(e -> e.candidate().model())
                .allMatch(MODELS::contains);
    }

    @Test
    @DisplayName("should never emit two candidates with the same key")
    void shouldDeduplicateAcrossModels() throws Exception {
        dashscope.script("qwen-plus", Script.lines("Water", "Sun", "Soil", "Air"))
                .script("deepseek-v3", Script.lines("water", "SUN.", "Light"));
        volcengine.script("ark-kimi", Script.lines("Soil", "Water!", "Minerals"))
                .script("ark-doubao", Script.lines("Air", "Light", "Heat"));
        start();

        await(aggregator.fanOut(request("s1", STAGE, Set.of("heat")), events::add));

        List<String> keys = events.stream()
                .filter(e -> e.type() == EventType.CANDIDATE)
                .map(e -> e.candidate().dedupKey())
                .toList();
        assertThat(keys).doesNotHaveDuplicates()
                .containsExactlyInAnyOrder("water", "sun", "soil", "air", "light", "minerals");
    }

    @Test
    @DisplayName("should reject a second batch for the same stage while one is in flight")
    void shouldRejectConcurrentBatch() throws Exception {
        dashscope.script("qwen-plus", Script.lines("Slow one", "Slow two").withDelay(200));
        start();

        BatchHandle first = aggregator.fanOut(request("s1"), events::add);

        assertThatThrownBy(() -> aggregator.fanOut(request("s1"), events::add))
                .isInstanceOf(StateException.class)
                .hasMessageContaining("batch in progress")
                .extracting(e -> ((StateException) e).getViolation())
                .isEqualTo(StateException.Violation.BATCH_IN_PROGRESS);

        BatchHandle otherStage = aggregator.fanOut(
                request("s1", StageKey.of("parts"), Set.of()), e -> { });
        assertThat(otherStage).isNotNull();

        await(first);
        await(otherStage);
        assertThat(aggregator.isInFlight("s1", STAGE)).isFalse();
        assertThat(aggregator.fanOut(request("s1"), e -> { })).isNotNull();
    }

    @Test
    @DisplayName("should stop emitting once cancelled")
    void shouldStopOnCancel() throws Exception {
        String[] lines = new String[40];
        for (int i = 0; i < lines.length; i++) {
            lines[i] = "Idea number " + i;
        }
        dashscope.script("qwen-plus", Script.lines(lines).withDelay(50));
        start();
        BatchHandle batch = aggregator.fanOut(request("s1"), events::add);

        long deadline = System.currentTimeMillis() + 2000;
        while (events.stream().noneMatch(e -> e.type() == EventType.CANDIDATE)
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertThat(aggregator.cancel("s1", STAGE)).isTrue();
        assertThat(batch.completion()).isDone();
        assertThat(batch.completion().join().cancelled()).isTrue();

        Thread.sleep(100);
        int seen = events.size();
        Thread.sleep(500);

        assertThat(events).hasSize(seen);
        assertThat(events).noneMatch(e -> e.type() == EventType.BATCH_COMPLETE);
        assertThat(aggregator.cancel("s1", STAGE)).isFalse();
    }

    @Test
    @DisplayName("should retry a retryable error with a fresh attempt")
    void shouldRetryRetryableError() throws Exception {
        dashscope.script("qwen-plus", Script.lines("Recovered").failing(ErrorKind.RATE_LIMIT, 1));
        start("A", new RateLimiter(1), new RetryPolicy(2, Duration.ofMillis(10), Duration.ofMillis(50), 2.0));

        BatchSummary summary = await(aggregator.fanOut(request("s1"), events::add));

        assertThat(dashscope.callCount("qwen-plus")).isEqualTo(2);
        assertThat(summary.modelStats()).filteredOn(s -> s.model().equals("qwen"))
                .singleElement()
                .satisfies(s -> {
                    assertThat(s.isSuccess()).isTrue();
                    assertThat(s.attempts()).isEqualTo(2);
                    assertThat(s.candidates()).isEqualTo(1);
                });
        assertThat(events).noneMatch(e -> e.type() == EventType.ERROR);
    }

    @Test
    @DisplayName("should give up after the retry budget")
    void shouldExhaustRetries() throws Exception {
        dashscope.script("qwen-plus", Script.alwaysFailing(ErrorKind.SERVER_ERROR));
        start("A", new RateLimiter(1), new RetryPolicy(2, Duration.ofMillis(5), Duration.ofMillis(10), 1.0));

        BatchSummary summary = await(aggregator.fanOut(request("s1"), events::add));

        assertThat(dashscope.callCount("qwen-plus")).isEqualTo(3);
        assertThat(summary.modelStats()).filteredOn(s -> s.model().equals("qwen"))
                .singleElement()
                .extracting(ModelStats::error)
                .isEqualTo(ErrorKind.SERVER_ERROR);
    }

    @Test
    @DisplayName("should report a rate limit error when the local budget rejects")
    void shouldFailOnLocalRateLimit() throws Exception {
        RateLimiter limiter = new RateLimiter(1);
        limiter.register("dashscope", new RateLimitBudget(1, 0, 0, Duration.ofMinutes(1), RateLimitPolicy.REJECT));
        start("A", limiter, RetryPolicy.none());

        BatchSummary summary = await(aggregator.fanOut(request("s1"), events::add));

        assertThat(summary.modelStats()).filteredOn(s -> s.error() == ErrorKind.RATE_LIMIT).hasSize(1);
        assertThat(dashscope.getRequests()).hasSize(1);
        assertThat(volcengine.getRequests()).hasSize(2);
    }

    @Test
    @DisplayName("should serve every model of a batch under the selected route")
    void shouldUseOneRoutePerBatch() throws Exception {
        start("B", new RateLimiter(1), RetryPolicy.none());

        BatchSummary summary = await(aggregator.fanOut(request("s1"), events::add));

        assertThat(summary.route()).isEqualTo("B");
        assertThat(volcengine.getRequests()).extracting(ChatRequest::model)
                .containsExactlyInAnyOrder("ark-deepseek", "ark-kimi", "ark-doubao");
        assertThat(dashscope.getRequests()).extracting(ChatRequest::model).containsExactly("qwen-plus");
        assertThat(summary.newCandidates()).extracting(Candidate::model)
                .containsExactlyInAnyOrderElementsOf(MODELS);
    }

    @Test
    @DisplayName("should cancel every batch of a session")
    void shouldCancelSession() {
        dashscope.script("qwen-plus", Script.lines("a1", "a2", "a3").withDelay(300));
        start();

        BatchHandle first = aggregator.fanOut(request("s1"), events::add);
        BatchHandle second = aggregator.fanOut(request("s1", StageKey.of("parts"), Set.of()), events::add);
        BatchHandle other = aggregator.fanOut(request("s2"), e -> { });

        assertThat(aggregator.cancelSession("s1")).isEqualTo(2);
        assertThat(first.isCancelled()).isTrue();
        assertThat(second.isCancelled()).isTrue();
        assertThat(other.isCancelled()).isFalse();
    }
}
