package fr.lapetina.llm.orchestrator.domain.workflow;

import fr.lapetina.llm.orchestrator.domain.model.StageKey;

import java.util.List;

/**
 * Read-only view of one stage (or stage tab) of a session.
 */
public record StageView(StageKey key, boolean locked, int candidateCount, List<String> selectedIds, int batches) {

    public StageView {
        selectedIds = List.copyOf(selectedIds);
    }
}
