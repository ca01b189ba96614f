package fr.lapetina.llm.orchestrator.infrastructure.metrics;

import java.time.Duration;

/**
 * Default {@link UsageRecorder} publishing to Micrometer.
 */
public final class MetricsUsageRecorder implements UsageRecorder {

    private final MetricsRegistry metricsRegistry;

    public MetricsUsageRecorder(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void recordUsage(String provider, String model, int inputTokens, int outputTokens, Duration latency) {
        metricsRegistry.recordCallLatency(provider, model, latency);
        metricsRegistry.recordTokens(provider, model, inputTokens, outputTokens);
    }
}
