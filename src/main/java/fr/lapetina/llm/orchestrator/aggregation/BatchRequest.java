package fr.lapetina.llm.orchestrator.aggregation;

import fr.lapetina.llm.orchestrator.domain.model.StageKey;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One fan-out request.
 *
 * @param models          logical model names to fan out to
 * @param existingKeys    dedup keys already recorded for the stage
 * @param existingCount   candidates already recorded for the stage
 */
public record BatchRequest(
        String sessionId,
        StageKey stage,
        int batchNumber,
        String prompt,
        String system,
        List<String> models,
        double temperature,
        int maxTokens,
        Set<String> existingKeys,
        int existingCount
) {
    public BatchRequest {
        Objects.requireNonNull(sessionId, "Session ID is required");
        Objects.requireNonNull(stage, "Stage is required");
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("At least one model is required");
        }
        models = List.copyOf(new LinkedHashSet<>(models));
        existingKeys = existingKeys != null ? Set.copyOf(existingKeys) : Set.of();
        if (batchNumber < 1) {
            throw new IllegalArgumentException("Batch number starts at 1");
        }
    }
}
