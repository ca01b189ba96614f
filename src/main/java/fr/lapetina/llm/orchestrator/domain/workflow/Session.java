package fr.lapetina.llm.orchestrator.domain.workflow;

import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-session workflow state: opened stages, their candidates, lock flags
 * and selections.
 *
 * All methods are synchronized. Writers are the workflow operations and the
 * emission thread of the session's in-flight batch.
 */
public final class Session {

    private final String sessionId;
    private final DiagramWorkflow workflow;
    private final String topic;
    private final Clock clock;

    private final Map<StageKey, StageState> stages = new LinkedHashMap<>();
    private StageKey lastGenerated;
    private Phase closedAs;
    private volatile long lastTouchedMillis;

    Session(String sessionId, DiagramWorkflow workflow, String topic, Clock clock) {
        this.sessionId = sessionId;
        this.workflow = workflow;
        this.topic = topic;
        this.clock = clock;
        this.lastTouchedMillis = clock.millis();
    }

    public String getSessionId() {
        return sessionId;
    }

    public DiagramWorkflow getWorkflow() {
        return workflow;
    }

    public String getTopic() {
        return topic;
    }

    public long getLastTouchedMillis() {
        return lastTouchedMillis;
    }

    void touch() {
        lastTouchedMillis = clock.millis();
    }

    synchronized void openStage(StageKey key) {
        stages.computeIfAbsent(key, k -> new StageState());
    }

    synchronized boolean hasStage(StageKey key) {
        return stages.containsKey(key);
    }

    synchronized boolean isLocked(StageKey key) {
        StageState state = stages.get(key);
        return state != null && state.locked;
    }

    /**
     * True when the stage has at least one opened key and all of them are locked.
     */
    synchronized boolean isStageLocked(String stageName) {
        boolean any = false;
        for (Map.Entry<StageKey, StageState> entry : stages.entrySet()) {
            if (entry.getKey().stage().equals(stageName)) {
                if (!entry.getValue().locked) {
                    return false;
                }
                any = true;
            }
        }
        return any;
    }

    synchronized int batchCount(StageKey key) {
        return require(key).batchCount;
    }

    synchronized void batchStarted(StageKey key) {
        require(key).batchCount++;
        lastGenerated = key;
    }

    synchronized Set<String> dedupKeys(StageKey key) {
        return new HashSet<>(require(key).keys);
    }

    synchronized int candidateCount(StageKey key) {
        return require(key).candidates.size();
    }

    /**
     * Records an emitted candidate.
     *
     * @return false if the session is closed, the stage is locked or the key repeats
     */
    synchronized boolean recordCandidate(Candidate candidate) {
        StageState state = stages.get(candidate.stage());
        if (closedAs != null || state == null || state.locked) {
            return false;
        }
        if (!state.keys.add(candidate.dedupKey())) {
            return false;
        }
        state.candidates.add(candidate);
        return true;
    }

    synchronized List<Candidate> getCandidates(StageKey key) {
        StageState state = stages.get(key);
        return state != null ? List.copyOf(state.candidates) : List.of();
    }

    /**
     * Locks a stage with the given selection.
     *
     * @return the selected candidates, in selection order
     * @throws StateException if the stage is already locked
     */
    synchronized List<Candidate> lock(StageKey key, List<String> candidateIds) {
        StageState state = require(key);
        if (state.locked) {
            throw new StateException(StateException.Violation.STAGE_LOCKED, key.toString());
        }
        List<Candidate> selected = new ArrayList<>(candidateIds.size());
        for (String id : candidateIds) {
            state.candidates.stream()
                    .filter(c -> c.id().equals(id))
                    .findFirst()
                    .ifPresent(selected::add);
        }
        state.locked = true;
        state.selectedIds.addAll(candidateIds);
        return selected;
    }

    /**
     * Adds confirmed content read from an existing diagram as a locked stage.
     */
    synchronized void lockConfirmed(StageKey key, List<Candidate> confirmed) {
        StageState state = stages.computeIfAbsent(key, k -> new StageState());
        for (Candidate candidate : confirmed) {
            if (state.keys.add(candidate.dedupKey())) {
                state.candidates.add(candidate);
                state.selectedIds.add(candidate.id());
            }
        }
        state.locked = true;
    }

    /**
     * Texts of the selected candidates of a locked stage, in selection order.
     */
    synchronized List<String> selectedTexts(StageKey key) {
        StageState state = stages.get(key);
        if (state == null || !state.locked) {
            return List.of();
        }
        List<String> texts = new ArrayList<>();
        for (String id : state.selectedIds) {
            state.candidates.stream()
                    .filter(c -> c.id().equals(id))
                    .findFirst()
                    .ifPresent(c -> texts.add(c.text()));
        }
        return texts;
    }

    /**
     * Selected text of a single-selection first stage, used as the
     * decomposition dimension in later prompts.
     */
    synchronized String dimension() {
        StageDefinition first = workflow.first();
        if (first.mode() != SelectionMode.SINGLE) {
            return null;
        }
        List<String> texts = selectedTexts(StageKey.of(first.name()));
        return texts.isEmpty() ? null : texts.get(0);
    }

    synchronized StageKey activeStage() {
        if (closedAs != null) {
            return null;
        }
        if (lastGenerated != null && !isLocked(lastGenerated) && stages.containsKey(lastGenerated)) {
            return lastGenerated;
        }
        for (Map.Entry<StageKey, StageState> entry : stages.entrySet()) {
            if (!entry.getValue().locked) {
                return entry.getKey();
            }
        }
        return null;
    }

    synchronized Phase phase() {
        if (closedAs != null) {
            return closedAs;
        }
        StageKey active = activeStage();
        if (active == null) {
            return Phase.COMPLETE;
        }
        return Phase.ofStageIndex(workflow.indexOf(active.stage()));
    }

    synchronized boolean isClosed() {
        return closedAs != null;
    }

    /**
     * Closes the session. Cancelling discards candidates of unlocked stages;
     * locked stages are kept as they are.
     */
    synchronized void close(Phase phase) {
        if (closedAs != null) {
            return;
        }
        closedAs = phase;
        if (phase == Phase.CANCELLED) {
            for (StageState state : stages.values()) {
                if (!state.locked) {
                    state.candidates.clear();
                    state.keys.clear();
                }
            }
        }
    }

    synchronized WorkflowSnapshot snapshot() {
        List<StageView> views = new ArrayList<>(stages.size());
        for (Map.Entry<StageKey, StageState> entry : stages.entrySet()) {
            StageState state = entry.getValue();
            views.add(new StageView(entry.getKey(), state.locked, state.candidates.size(),
                    new ArrayList<>(state.selectedIds), state.batchCount));
        }
        return new WorkflowSnapshot(sessionId, workflow.diagramType(), phase(), activeStage(), views);
    }

    private StageState require(StageKey key) {
        StageState state = stages.get(key);
        if (state == null) {
            throw new StateException(StateException.Violation.UNKNOWN_STAGE, key.toString());
        }
        return state;
    }

    private static final class StageState {
        private final List<Candidate> candidates = new ArrayList<>();
        private final Set<String> keys = new LinkedHashSet<>();
        private final List<String> selectedIds = new ArrayList<>();
        private boolean locked;
        private int batchCount;
    }
}
