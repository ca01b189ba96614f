package fr.lapetina.llm.orchestrator.infrastructure.metrics;

import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Route selection counters
 * - Candidate and duplicate counters per model
 * - Provider error counters by kind
 * - Provider call latency and token usage
 * - Active batch and session gauges
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    private final AtomicInteger activeBatches = new AtomicInteger(0);
    private final AtomicInteger activeSessions = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        Gauge.builder(prefix + "_active_batches", activeBatches, AtomicInteger::get)
                .description("Batches currently fanning out")
                .register(registry);

        Gauge.builder(prefix + "_active_sessions", activeSessions, AtomicInteger::get)
                .description("Open workflow sessions")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("llm_orchestrator");
    }

    public void incrementRouteSelection(String route) {
        counter("route_selections_total", "Batches per selected route", "route", route).increment();
    }

    public void incrementCandidates(String model) {
        counter("candidates_total", "Unique candidates emitted", "model", model).increment();
    }

    public void incrementDuplicates(String model) {
        counter("duplicates_total", "Candidates dropped as duplicates", "model", model).increment();
    }

    public void incrementProviderError(String provider, String model, ErrorKind kind) {
        counter("provider_errors_total", "Classified provider errors",
                "provider", provider, "model", model, "kind", kind.name()).increment();
    }

    public void incrementRateLimited(String rateLimitClass) {
        counter("rate_limited_total", "Calls denied by the rate limiter", "class", rateLimitClass).increment();
    }

    /**
     * Records provider call latency. {@code model} is always the logical name.
     */
    public void recordCallLatency(String provider, String model, Duration latency) {
        String key = provider + ":" + model;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_call_latency")
                        .description("Provider call latency")
                        .tag("provider", provider)
                        .tag("model", model)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void recordTokens(String provider, String model, int inputTokens, int outputTokens) {
        counter("tokens_total", "Tokens consumed", "provider", provider, "model", model, "direction", "input")
                .increment(inputTokens);
        counter("tokens_total", "Tokens consumed", "provider", provider, "model", model, "direction", "output")
                .increment(outputTokens);
    }

    public void setActiveBatches(int value) {
        activeBatches.set(value);
    }

    public void setActiveSessions(int value) {
        activeSessions.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + String.join(":", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_" + name)
                        .description(description)
                        .tags(tags)
                        .register(registry)
        );
    }

    @Override
    public void close() {
        registry.close();
    }
}
