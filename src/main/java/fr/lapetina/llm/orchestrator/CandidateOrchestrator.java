package fr.lapetina.llm.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.orchestrator.aggregation.BatchHandle;
import fr.lapetina.llm.orchestrator.domain.event.EventSink;
import fr.lapetina.llm.orchestrator.domain.event.WorkflowEvent;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import fr.lapetina.llm.orchestrator.domain.workflow.StageView;
import fr.lapetina.llm.orchestrator.domain.workflow.WorkflowSnapshot;
import fr.lapetina.llm.orchestrator.domain.workflow.WorkflowStateMachine;
import fr.lapetina.llm.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.orchestrator.infrastructure.ratelimit.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;

/**
 * Operations exposed to the calling (HTTP/SSE) layer.
 *
 * <p>Every operation reports through an {@link EventSink}: {@code start} and
 * {@code select} synchronously, {@code nextBatch} from pipeline threads until
 * {@code batch_complete}. Misuse raises
 * {@link fr.lapetina.llm.orchestrator.domain.workflow.StateException}.
 */
public final class CandidateOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CandidateOrchestrator.class);

    private static final String MDC_SESSION = "sessionId";

    private final WorkflowStateMachine stateMachine;
    private final RateLimiter rateLimiter;
    private final MetricsRegistry metricsRegistry;

    public CandidateOrchestrator(WorkflowStateMachine stateMachine, RateLimiter rateLimiter,
                                 MetricsRegistry metricsRegistry) {
        this.stateMachine = stateMachine;
        this.rateLimiter = rateLimiter;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Opens a session and replays its state: one {@code state_changed}, then
     * the candidates of every stage resumed from the diagram.
     *
     * @param diagramData current diagram, or {@code null} to read it from the repository
     */
    public WorkflowSnapshot start(String sessionId, String diagramType, JsonNode diagramData, EventSink sink) {
        MDC.put(MDC_SESSION, sessionId);
        try {
            WorkflowSnapshot snapshot = stateMachine.start(sessionId, diagramType, diagramData);
            metricsRegistry.setActiveSessions(stateMachine.getActiveSessionCount());
            sink.accept(WorkflowEvent.stateChanged(snapshot));
            for (StageView stage : snapshot.stages()) {
                for (Candidate candidate : stateMachine.candidates(sessionId, stage.key())) {
                    sink.accept(WorkflowEvent.candidate(sessionId, candidate));
                }
            }
            return snapshot;
        } finally {
            MDC.remove(MDC_SESSION);
        }
    }

    /**
     * Generates the next batch for a stage.
     *
     * @return the running batch; its completion future completes after
     *         {@code batch_complete} or on cancellation
     */
    public BatchHandle nextBatch(String sessionId, StageKey stage, int count, EventSink sink) {
        MDC.put(MDC_SESSION, sessionId);
        try {
            return stateMachine.generate(sessionId, stage, count, sink);
        } finally {
            MDC.remove(MDC_SESSION);
        }
    }

    /**
     * Locks a stage with the given candidate ids and emits the new state.
     */
    public WorkflowSnapshot select(String sessionId, StageKey stage, List<String> candidateIds, EventSink sink) {
        MDC.put(MDC_SESSION, sessionId);
        try {
            WorkflowSnapshot snapshot = stateMachine.select(sessionId, stage, candidateIds);
            sink.accept(WorkflowEvent.stateChanged(snapshot));
            return snapshot;
        } finally {
            MDC.remove(MDC_SESSION);
        }
    }

    /**
     * Cancels every in-flight batch of the session and closes it. Idempotent.
     */
    public boolean cancel(String sessionId) {
        MDC.put(MDC_SESSION, sessionId);
        try {
            boolean cancelled = stateMachine.cancel(sessionId);
            metricsRegistry.setActiveSessions(stateMachine.getActiveSessionCount());
            return cancelled;
        } finally {
            MDC.remove(MDC_SESSION);
        }
    }

    /**
     * Closes the session.
     *
     * @return ack; false when the session was unknown or already closed
     */
    public boolean finish(String sessionId) {
        MDC.put(MDC_SESSION, sessionId);
        try {
            boolean finished = stateMachine.finish(sessionId);
            metricsRegistry.setActiveSessions(stateMachine.getActiveSessionCount());
            if (!finished) {
                log.debug("Finish ignored, no open session");
            }
            return finished;
        } finally {
            MDC.remove(MDC_SESSION);
        }
    }

    public WorkflowSnapshot snapshot(String sessionId) {
        return stateMachine.snapshot(sessionId);
    }

    public OrchestratorStats stats() {
        return new OrchestratorStats(
                rateLimiter.getStats(),
                stateMachine.getActiveSessionCount(),
                stateMachine.getActiveBatchCount()
        );
    }
}
