package fr.lapetina.llm.orchestrator.infrastructure.ratelimit;

/**
 * Point-in-time view of one rate-limit class on this process.
 * Remaining budgets are never negative.
 */
public record RateLimiterStats(
        String rateLimitClass,
        int requestBudget,
        int requestsRemaining,
        long tokenBudget,
        long tokensRemaining,
        int maxConcurrent,
        int inFlight,
        long granted,
        long denied
) {
}
