package fr.lapetina.llm.orchestrator.domain.model;

/**
 * Token accounting reported by a provider at the end of a call.
 */
public record TokenUsage(int inputTokens, int outputTokens) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0);

    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0) {
            throw new IllegalArgumentException("Token counts cannot be negative");
        }
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }
}
