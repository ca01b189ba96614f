package fr.lapetina.llm.orchestrator.domain.model;

import java.util.Objects;

/**
 * A single chat-completion call addressed to a physical model.
 * Immutable and thread-safe.
 */
public record ChatRequest(
        String model,
        String prompt,
        String system,
        double temperature,
        int maxTokens
) {
    public ChatRequest {
        Objects.requireNonNull(model, "Model is required");
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("Temperature must be within [0, 2]: " + temperature);
        }
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public static ChatRequest of(String model, String prompt) {
        return new ChatRequest(model, prompt, null, 0.7, 500);
    }

    public boolean hasSystem() {
        return system != null && !system.isBlank();
    }
}
