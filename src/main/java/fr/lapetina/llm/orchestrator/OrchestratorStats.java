package fr.lapetina.llm.orchestrator;

import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimiterStats;

import java.util.Map;

/**
 * Operational snapshot of one process.
 *
 * @param rateLimits    per rate-limit class snapshot, keyed by class name
 * @param activeSessions open sessions
 * @param activeBatches  batches in flight
 */
public record OrchestratorStats(Map<String, RateLimiterStats> rateLimits, int activeSessions, int activeBatches) {

    public OrchestratorStats {
        rateLimits = Map.copyOf(rateLimits);
    }
}
