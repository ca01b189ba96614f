package fr.lapetina.llm.orchestrator.infrastructure.metrics;

import java.time.Duration;

/**
 * Telemetry sink for provider usage. Fire-and-forget: implementations must
 * not block and callers ignore their failures.
 */
@FunctionalInterface
public interface UsageRecorder {

    UsageRecorder NO_OP = (provider, model, inputTokens, outputTokens, latency) -> { };

    /**
     * @param model logical model name
     */
    void recordUsage(String provider, String model, int inputTokens, int outputTokens, Duration latency);
}
