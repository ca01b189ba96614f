package fr.lapetina.llm.orchestrator.domain.model;

import java.util.Objects;

/**
 * Uniform non-streaming result: content plus usage, whatever the provider.
 */
public record ChatResult(String content, TokenUsage usage) {

    public ChatResult {
        content = content != null ? content : "";
        Objects.requireNonNull(usage, "Usage is required");
    }
}
