package fr.lapetina.llm.orchestrator.domain.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.llm.orchestrator.aggregation.BatchHandle;
import fr.lapetina.llm.orchestrator.aggregation.BatchRequest;
import fr.lapetina.llm.orchestrator.aggregation.DedupKeys;
import fr.lapetina.llm.orchestrator.aggregation.StreamAggregator;
import fr.lapetina.llm.orchestrator.domain.event.EventSink;
import fr.lapetina.llm.orchestrator.domain.event.EventType;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import fr.lapetina.llm.orchestrator.domain.workflow.StateException.Violation;
import fr.lapetina.llm.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.llm.orchestrator.infrastructure.persistence.DiagramRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Staged candidate workflow per session.
 *
 * <p>Stages run in order; a stage can be generated for only while it is
 * unlocked and its previous stage is locked. Selecting locks the stage and
 * opens the next one. Per-item stages get one tab per selected item of the
 * previous stage, each with its own candidates and lock.
 *
 * <p>At most one batch is in flight per session and stage, which keeps a
 * single writer on each stage's candidate list.
 */
public final class WorkflowStateMachine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowStateMachine.class);

    static final String DIAGRAM_SOURCE = "diagram";

    private final StreamAggregator aggregator;
    private final DiagramRepository repository;
    private final SessionRegistry sessions;
    private final List<String> models;
    private final int maxTokens;
    private final double baseTemperature;
    private final double temperatureStep;
    private final double maxTemperature;

    private WorkflowStateMachine(Builder builder) {
        this.aggregator = builder.aggregator;
        this.repository = builder.repository;
        this.sessions = builder.sessions;
        this.models = List.copyOf(builder.models);
        this.maxTokens = builder.maxTokens;
        this.baseTemperature = builder.baseTemperature;
        this.temperatureStep = builder.temperatureStep;
        this.maxTemperature = builder.maxTemperature;
    }

    /**
     * Opens (or reopens) a session, resuming at the first stage whose
     * selection does not exist yet in the diagram.
     *
     * @param diagramData current diagram content; when {@code null} it is read
     *                    from the repository
     */
    public WorkflowSnapshot start(String sessionId, String diagramType, JsonNode diagramData) {
        DiagramWorkflow workflow = DiagramWorkflows.get(diagramType);
        JsonNode data = diagramData != null ? diagramData : repository.load(sessionId).orElse(null);
        ResumeDetector.Resume resume = ResumeDetector.detect(workflow, data);

        Session session = new Session(sessionId, workflow, resume.topic(), sessions.getClock());
        for (StageDefinition stage : workflow.stages()) {
            if (!openStage(session, stage, resume)) {
                break;
            }
        }

        Optional<Session> replaced = sessions.put(session);
        replaced.ifPresent(old -> {
            aggregator.cancelSession(sessionId);
            old.close(Phase.CANCELLED);
        });

        WorkflowSnapshot snapshot = session.snapshot();
        log.info("Session started: sessionId={}, diagramType={}, phase={}, activeStage={}, resumedStages={}, restarted={}",
                sessionId, workflow.diagramType(), snapshot.phase(), snapshot.activeStage(),
                resume.confirmed().size(), replaced.isPresent());
        return snapshot;
    }

    /**
     * Opens one stage, locking whatever the diagram already confirms.
     *
     * @return true when the stage ended fully locked and the next one may open
     */
    private boolean openStage(Session session, StageDefinition stage, ResumeDetector.Resume resume) {
        List<StageKey> keys = new ArrayList<>();
        if (stage.perItem()) {
            StageDefinition previous = session.getWorkflow().previous(stage.name()).orElseThrow();
            for (String item : session.selectedTexts(StageKey.of(previous.name()))) {
                keys.add(StageKey.of(stage.name(), item));
            }
        } else {
            keys.add(StageKey.of(stage.name()));
        }

        boolean allLocked = !keys.isEmpty();
        for (StageKey key : keys) {
            List<String> confirmed = resume.confirmed().get(key);
            if (confirmed != null) {
                session.lockConfirmed(key, synthesize(session.getSessionId(), key, confirmed));
            } else {
                session.openStage(key);
                allLocked = false;
            }
        }
        return allLocked;
    }

    private static List<Candidate> synthesize(String sessionId, StageKey key, List<String> texts) {
        List<Candidate> candidates = new ArrayList<>(texts.size());
        int seq = 0;
        for (String text : texts) {
            seq++;
            candidates.add(new Candidate(Candidate.idOf(sessionId, DIAGRAM_SOURCE, 0, seq),
                    text, DIAGRAM_SOURCE, key, DedupKeys.normalize(text), 0));
        }
        return candidates;
    }

    /**
     * Starts the next batch for an unlocked stage.
     *
     * @throws StateException when the stage is locked, its prerequisite is not,
     *                        the item tab does not exist or a batch is in flight
     */
    public BatchHandle generate(String sessionId, StageKey stage, int count, EventSink sink) {
        if (count < 1) {
            throw new IllegalArgumentException("Count must be positive");
        }
        Session session = require(sessionId);
        session.touch();

        synchronized (session) {
            StageDefinition definition = checkStage(session, stage);
            if (session.isLocked(stage)) {
                throw new StateException(Violation.STAGE_LOCKED, stage.toString());
            }
            if (aggregator.isInFlight(sessionId, stage)) {
                throw new StateException(Violation.BATCH_IN_PROGRESS, stage.toString());
            }

            int batchNumber = session.batchCount(stage) + 1;
            String prompt = StagePrompts.render(definition, session.getTopic(), session.dimension(),
                    stage.item(), count, batchNumber);
            BatchRequest request = new BatchRequest(
                    sessionId,
                    stage,
                    batchNumber,
                    prompt,
                    StagePrompts.SYSTEM_MESSAGE,
                    models,
                    temperatureFor(batchNumber),
                    maxTokens,
                    session.dedupKeys(stage),
                    session.candidateCount(stage)
            );

            EventSink recording = event -> {
                if (event.type() == EventType.CANDIDATE && !session.recordCandidate(event.candidate())) {
                    return;
                }
                sink.accept(event);
            };
            BatchHandle batch = aggregator.fanOut(request, recording);
            session.batchStarted(stage);
            return batch;
        }
    }

    double temperatureFor(int batchNumber) {
        return Math.min(baseTemperature + (batchNumber - 1) * temperatureStep, maxTemperature);
    }

    /**
     * Locks a stage with the given candidates and opens the next stage.
     * The selection is validated before anything changes; an in-flight batch
     * for the stage is then cancelled.
     */
    public WorkflowSnapshot select(String sessionId, StageKey stage, List<String> candidateIds) {
        Session session = require(sessionId);
        session.touch();
        List<String> ids = candidateIds == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(candidateIds));

        List<Candidate> selected;
        synchronized (session) {
            StageDefinition definition = checkStage(session, stage);
            if (session.isLocked(stage)) {
                throw new StateException(Violation.STAGE_LOCKED, stage.toString());
            }
            if (ids.isEmpty()) {
                throw new StateException(Violation.INVALID_SELECTION, "no candidate selected");
            }
            if (definition.mode() == SelectionMode.SINGLE && ids.size() != 1) {
                throw new StateException(Violation.INVALID_SELECTION, "stage " + stage + " accepts exactly one candidate");
            }
            List<Candidate> known = session.getCandidates(stage);
            for (String id : ids) {
                if (known.stream().noneMatch(c -> c.id().equals(id))) {
                    throw new StateException(Violation.INVALID_SELECTION, "unknown candidate " + id);
                }
            }

            aggregator.cancel(sessionId, stage);
            selected = session.lock(stage, ids);
            if (session.isStageLocked(definition.name())) {
                session.getWorkflow().next(definition.name())
                        .ifPresent(next -> openStage(session, next, new ResumeDetector.Resume("", Map.of())));
            }
        }

        repository.saveSelection(sessionId, session.getWorkflow().diagramType(), stage, selected);

        WorkflowSnapshot snapshot = session.snapshot();
        log.info("Stage locked: sessionId={}, stage={}, selected={}, phase={}, activeStage={}",
                sessionId, stage, ids.size(), snapshot.phase(), snapshot.activeStage());
        return snapshot;
    }

    /**
     * Candidates recorded so far for a stage, in emission order.
     */
    public List<Candidate> candidates(String sessionId, StageKey stage) {
        return require(sessionId).getCandidates(stage);
    }

    public WorkflowSnapshot snapshot(String sessionId) {
        return require(sessionId).snapshot();
    }

    /**
     * Cancels in-flight batches and closes the session, discarding candidates
     * that were never selected. Idempotent.
     *
     * @return true if a session was closed
     */
    public boolean cancel(String sessionId) {
        return close(sessionId, Phase.CANCELLED);
    }

    /**
     * Closes the session normally. Idempotent.
     *
     * @return true if a session was closed
     */
    public boolean finish(String sessionId) {
        return close(sessionId, Phase.FINISHED);
    }

    private boolean close(String sessionId, Phase phase) {
        Optional<Session> removed = sessions.remove(sessionId);
        if (removed.isEmpty()) {
            return false;
        }
        int cancelledBatches = aggregator.cancelSession(sessionId);
        removed.get().close(phase);
        log.info("Session closed: sessionId={}, phase={}, cancelledBatches={}", sessionId, phase, cancelledBatches);
        return true;
    }

    /**
     * Starts idle-session expiry.
     */
    public void startSweeper(Duration interval) {
        sessions.startSweeper(interval, this::expire);
    }

    void expire(String sessionId) {
        log.info("Session idle, expiring: sessionId={}", sessionId);
        cancel(sessionId);
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    public int getActiveBatchCount() {
        return aggregator.getActiveBatchCount();
    }

    SessionRegistry getSessions() {
        return sessions;
    }

    private Session require(String sessionId) {
        Session session = sessions.find(sessionId)
                .orElseThrow(() -> new StateException(Violation.UNKNOWN_SESSION, sessionId));
        if (session.isClosed()) {
            throw new StateException(Violation.SESSION_CLOSED, sessionId);
        }
        return session;
    }

    private StageDefinition checkStage(Session session, StageKey stage) {
        DiagramWorkflow workflow = session.getWorkflow();
        StageDefinition definition = workflow.stage(stage.stage())
                .orElseThrow(() -> new StateException(Violation.UNKNOWN_STAGE, stage.stage()));

        if (definition.perItem() != stage.isItemScoped()) {
            throw new StateException(Violation.UNKNOWN_ITEM, definition.perItem()
                    ? "stage " + definition.name() + " requires an item"
                    : "stage " + definition.name() + " has no items");
        }

        Optional<StageDefinition> previous = workflow.previous(definition.name());
        if (previous.isPresent() && !session.isStageLocked(previous.get().name())) {
            throw new StateException(Violation.PREREQUISITE_UNLOCKED, previous.get().name());
        }
        if (!session.hasStage(stage)) {
            throw new StateException(Violation.UNKNOWN_ITEM, stage.toString());
        }
        return definition;
    }

    @Override
    public void close() {
        sessions.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for WorkflowStateMachine.
     */
    public static final class Builder {
        private StreamAggregator aggregator;
        private DiagramRepository repository;
        private SessionRegistry sessions;
        private List<String> models = List.of("qwen", "deepseek", "kimi", "doubao");
        private int maxTokens = 500;
        private double baseTemperature = 0.7;
        private double temperatureStep = 0.1;
        private double maxTemperature = 1.0;

        public Builder aggregator(StreamAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder repository(DiagramRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder sessions(SessionRegistry sessions) {
            this.sessions = sessions;
            return this;
        }

        public Builder models(List<String> models) {
            this.models = models;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder temperatures(double base, double step, double max) {
            this.baseTemperature = base;
            this.temperatureStep = step;
            this.maxTemperature = max;
            return this;
        }

        public Builder fromConfig(OrchestratorConfig config) {
            OrchestratorConfig.AggregationConfig aggregation = config.getAggregation();
            this.models = aggregation.getDefaultModels();
            this.maxTokens = aggregation.getMaxTokens();
            this.baseTemperature = aggregation.getBaseTemperature();
            this.temperatureStep = aggregation.getTemperatureStep();
            this.maxTemperature = aggregation.getMaxTemperature();
            return this;
        }

        public WorkflowStateMachine build() {
            if (aggregator == null) {
                throw new IllegalStateException("StreamAggregator is required");
            }
            if (repository == null) {
                throw new IllegalStateException("DiagramRepository is required");
            }
            if (sessions == null) {
                throw new IllegalStateException("SessionRegistry is required");
            }
            if (models == null || models.isEmpty()) {
                throw new IllegalStateException("At least one model is required");
            }
            return new WorkflowStateMachine(this);
        }
    }
}
