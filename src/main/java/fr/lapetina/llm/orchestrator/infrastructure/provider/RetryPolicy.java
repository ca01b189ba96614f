package fr.lapetina.llm.orchestrator.infrastructure.provider;

import fr.lapetina.llm.orchestrator.domain.model.ProviderError;

import java.time.Duration;

/**
 * Bounded exponential backoff for retryable provider errors.
 *
 * @param maxRetries     retries after the first attempt
 * @param initialBackoff delay before the first retry
 * @param maxBackoff     ceiling of any single delay
 * @param multiplier     growth factor per retry
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
    }

    public static RetryPolicy none() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Whether attempt number {@code attempt} (0-based) may be followed by another.
     */
    public boolean shouldRetry(ProviderError error, int attempt) {
        return error.retryable() && attempt < maxRetries;
    }

    /**
     * Delay before retrying after attempt {@code attempt} (0-based).
     */
    public Duration backoff(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt);
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}
