package fr.lapetina.llm.orchestrator.infrastructure.ratelimit;

/**
 * What {@link RateLimiter#acquire} does when the budget is spent.
 */
public enum RateLimitPolicy {
    /** Block up to the caller's timeout for the window to replenish */
    WAIT,

    /** Refuse immediately */
    REJECT;

    public static RateLimitPolicy fromName(String name) {
        if (name == null) {
            return WAIT;
        }
        return switch (name.trim().toLowerCase()) {
            case "reject" -> REJECT;
            case "wait" -> WAIT;
            default -> throw new IllegalArgumentException("Unknown rate limit policy: " + name);
        };
    }
}
