package fr.lapetina.llm.orchestrator.domain.model;

import java.util.List;

/**
 * Result of one fan-out batch.
 *
 * @param newCandidates   unique candidates produced by this batch, in emission order
 * @param totalCandidates candidates recorded for the stage including this batch
 * @param cancelled       the batch was cancelled before every model finished
 */
public record BatchSummary(
        String sessionId,
        StageKey stage,
        int batchNumber,
        String route,
        List<Candidate> newCandidates,
        int totalCandidates,
        List<ModelStats> modelStats,
        boolean cancelled
) {
    public BatchSummary {
        newCandidates = List.copyOf(newCandidates);
        modelStats = List.copyOf(modelStats);
    }

    /**
     * True when every model ended in error.
     */
    public boolean isFullyFailed() {
        return !modelStats.isEmpty() && modelStats.stream().noneMatch(ModelStats::isSuccess);
    }
}
