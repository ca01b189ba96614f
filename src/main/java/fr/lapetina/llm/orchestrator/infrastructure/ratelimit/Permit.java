package fr.lapetina.llm.orchestrator.infrastructure.ratelimit;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outcome of a {@link RateLimiter#acquire} call.
 *
 * <p>A granted permit may hold a concurrency slot; {@link #release()} must be
 * called once the provider call ends. Releasing is idempotent and a no-op
 * for permits that were not granted.
 */
public final class Permit {

    public enum Outcome {
        /** Call may proceed */
        GRANTED,

        /** Budget spent and the window did not replenish within the timeout */
        WAIT,

        /** Budget spent and the policy refuses to wait */
        REJECTED
    }

    private static final Runnable NO_OP = () -> { };

    private final String rateLimitClass;
    private final Outcome outcome;
    private final Duration retryAfter;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean(false);

    private Permit(String rateLimitClass, Outcome outcome, Duration retryAfter, Runnable onRelease) {
        this.rateLimitClass = rateLimitClass;
        this.outcome = outcome;
        this.retryAfter = retryAfter;
        this.onRelease = onRelease;
    }

    static Permit granted(String rateLimitClass, Runnable onRelease) {
        return new Permit(rateLimitClass, Outcome.GRANTED, Duration.ZERO, onRelease);
    }

    static Permit unlimited(String rateLimitClass) {
        return new Permit(rateLimitClass, Outcome.GRANTED, Duration.ZERO, NO_OP);
    }

    static Permit denied(String rateLimitClass, Outcome outcome, Duration retryAfter) {
        return new Permit(rateLimitClass, outcome, retryAfter, NO_OP);
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getRateLimitClass() {
        return rateLimitClass;
    }

    /**
     * Time until the current window resets, for denied permits.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }

    @Override
    public String toString() {
        return "Permit{class=" + rateLimitClass + ", outcome=" + outcome + ", retryAfter=" + retryAfter + '}';
    }
}
