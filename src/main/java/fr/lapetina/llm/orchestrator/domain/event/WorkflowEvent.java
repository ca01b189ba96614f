package fr.lapetina.llm.orchestrator.domain.event;

import fr.lapetina.llm.orchestrator.domain.model.BatchSummary;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.ErrorKind;
import fr.lapetina.llm.orchestrator.domain.model.ModelStats;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import fr.lapetina.llm.orchestrator.domain.workflow.WorkflowSnapshot;

import java.time.Instant;
import java.util.Objects;

/**
 * Event streamed to the calling layer. Fields not relevant to a type are null.
 * Models are always logical names.
 */
public record WorkflowEvent(
        EventType type,
        String sessionId,
        StageKey stage,
        int batchNumber,
        String route,
        int modelCount,
        Candidate candidate,
        String model,
        ModelStats modelStats,
        ErrorKind errorKind,
        String messageKey,
        BatchSummary summary,
        WorkflowSnapshot state,
        Instant timestamp
) {
    public WorkflowEvent {
        Objects.requireNonNull(type, "Event type is required");
        Objects.requireNonNull(sessionId, "Session ID is required");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static WorkflowEvent stateChanged(WorkflowSnapshot state) {
        return new WorkflowEvent(EventType.STATE_CHANGED, state.sessionId(), state.activeStage(), 0, null, 0,
                null, null, null, null, null, null, state, null);
    }

    public static WorkflowEvent batchStart(String sessionId, StageKey stage, int batchNumber, String route, int modelCount) {
        return new WorkflowEvent(EventType.BATCH_START, sessionId, stage, batchNumber, route, modelCount,
                null, null, null, null, null, null, null, null);
    }

    public static WorkflowEvent candidate(String sessionId, Candidate candidate) {
        return new WorkflowEvent(EventType.CANDIDATE, sessionId, candidate.stage(), candidate.batchNumber(), null, 0,
                candidate, candidate.model(), null, null, null, null, null, null);
    }

    public static WorkflowEvent modelComplete(String sessionId, StageKey stage, int batchNumber, ModelStats stats) {
        return new WorkflowEvent(EventType.MODEL_COMPLETE, sessionId, stage, batchNumber, null, 0,
                null, stats.model(), stats, null, null, null, null, null);
    }

    public static WorkflowEvent error(String sessionId, StageKey stage, int batchNumber, ModelStats stats) {
        ErrorKind kind = stats.error() != null ? stats.error() : ErrorKind.UNKNOWN;
        return new WorkflowEvent(EventType.ERROR, sessionId, stage, batchNumber, null, 0,
                null, stats.model(), stats, kind, kind.getMessageKey(), null, null, null);
    }

    public static WorkflowEvent batchComplete(BatchSummary summary) {
        return new WorkflowEvent(EventType.BATCH_COMPLETE, summary.sessionId(), summary.stage(),
                summary.batchNumber(), summary.route(), summary.modelStats().size(),
                null, null, null, null, null, summary, null, null);
    }
}
