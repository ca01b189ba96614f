package fr.lapetina.llm.orchestrator.domain.workflow;

import fr.lapetina.llm.orchestrator.domain.model.StageKey;

import java.util.List;
import java.util.Optional;

/**
 * Point-in-time state of a session, as carried by {@code state_changed} events.
 *
 * @param activeStage first unlocked stage the caller may generate for,
 *                    {@code null} once every stage is locked or the session is closed
 * @param stages      every opened stage and tab, in workflow order
 */
public record WorkflowSnapshot(
        String sessionId,
        String diagramType,
        Phase phase,
        StageKey activeStage,
        List<StageView> stages
) {
    public WorkflowSnapshot {
        stages = List.copyOf(stages);
    }

    public Optional<StageView> stage(StageKey key) {
        return stages.stream().filter(s -> s.key().equals(key)).findFirst();
    }
}
