package fr.lapetina.llm.orchestrator.domain.model;

import java.util.Objects;

/**
 * One generated text unit offered for selection within a stage.
 * Immutable once emitted; {@code model} is always the logical model name.
 */
public record Candidate(
        String id,
        String text,
        String model,
        StageKey stage,
        String dedupKey,
        int batchNumber
) {
    public Candidate {
        Objects.requireNonNull(id, "Candidate ID is required");
        Objects.requireNonNull(text, "Candidate text is required");
        Objects.requireNonNull(model, "Source model is required");
        Objects.requireNonNull(stage, "Stage is required");
        Objects.requireNonNull(dedupKey, "Dedup key is required");
    }

    /**
     * Builds the candidate id: {@code {session}_{model}_{batch}_{n}}.
     */
    public static String idOf(String sessionId, String model, int batchNumber, int sequence) {
        return sessionId + "_" + model + "_" + batchNumber + "_" + sequence;
    }
}
