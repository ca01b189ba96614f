package fr.lapetina.llm.orchestrator.aggregation;

import fr.lapetina.llm.orchestrator.domain.event.EventSink;
import fr.lapetina.llm.orchestrator.domain.event.WorkflowEvent;
import fr.lapetina.llm.orchestrator.domain.model.BatchSummary;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.ModelStats;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import fr.lapetina.llm.orchestrator.domain.routing.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A running batch, as seen by its caller.
 *
 * <p>The dedup set is touched only by the dedup handler thread and the
 * per-model sequences and pending count only by the emission handler thread;
 * the ring buffer orders both.
 */
public final class BatchHandle {

    private static final Logger log = LoggerFactory.getLogger(BatchHandle.class);

    private final BatchRequest request;
    private final Route route;
    private final EventSink sink;
    private final Runnable onDone;
    private final long startNanos = System.nanoTime();
    private final CompletableFuture<BatchSummary> completion = new CompletableFuture<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);

    // Dedup handler thread only
    private final Set<String> dedupKeys;

    // Emission handler thread only
    private final Map<String, Integer> sequences = new HashMap<>();
    private final Set<String> terminalModels = new HashSet<>();
    private int pendingModels;

    private final List<Candidate> newCandidates = new CopyOnWriteArrayList<>();
    private final List<ModelStats> modelStats = new CopyOnWriteArrayList<>();

    BatchHandle(BatchRequest request, Route route, EventSink sink) {
        this(request, route, sink, () -> { });
    }

    /**
     * @param onDone runs once, before the completion future completes
     */
    BatchHandle(BatchRequest request, Route route, EventSink sink, Runnable onDone) {
        this.request = request;
        this.route = route;
        this.sink = sink;
        this.onDone = onDone;
        this.dedupKeys = new HashSet<>(request.existingKeys());
        this.pendingModels = request.models().size();
    }

    public String getSessionId() {
        return request.sessionId();
    }

    public StageKey getStage() {
        return request.stage();
    }

    public int getBatchNumber() {
        return request.batchNumber();
    }

    public String getRoute() {
        return route.name();
    }

    /**
     * Completes with the batch summary once every model is terminal, or with a
     * cancelled summary on {@link #cancel()}. Never completes exceptionally.
     */
    public CompletableFuture<BatchSummary> completion() {
        return completion;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Stops further emission. Idempotent; no effect on a completed batch.
     *
     * @return true if this call cancelled the batch
     */
    public boolean cancel() {
        if (completion.isDone() || !cancelled.compareAndSet(false, true)) {
            return false;
        }
        release();
        boolean completedHere = completion.complete(summary(true));
        log.info("Batch cancelled: sessionId={}, stage={}, batch={}, emitted={}",
                request.sessionId(), request.stage(), request.batchNumber(), newCandidates.size());
        return completedHere;
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    BatchRequest getRequest() {
        return request;
    }

    /**
     * @return true if {@code key} was not seen before in this stage
     */
    public boolean registerKey(String key) {
        return dedupKeys.add(key);
    }

    public int nextSequence(String model) {
        return sequences.merge(model, 1, Integer::sum);
    }

    public void recordCandidate(Candidate candidate) {
        newCandidates.add(candidate);
    }

    public boolean isModelTerminal(String model) {
        return terminalModels.contains(model);
    }

    public int candidatesFrom(String model) {
        return sequences.getOrDefault(model, 0);
    }

    /**
     * @return true when this was the last pending model
     */
    public boolean markModelTerminal(ModelStats stats) {
        if (!terminalModels.add(stats.model())) {
            return false;
        }
        modelStats.add(stats);
        pendingModels--;
        return pendingModels == 0;
    }

    public void finish() {
        BatchSummary summary = summary(false);
        release();
        emit(WorkflowEvent.batchComplete(summary));
        completion.complete(summary);
    }

    public void emit(WorkflowEvent event) {
        if (cancelled.get()) {
            return;
        }
        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed: sessionId={}, stage={}, eventType={}",
                    request.sessionId(), request.stage(), event.type(), e);
        }
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            onDone.run();
        }
    }

    private BatchSummary summary(boolean wasCancelled) {
        List<Candidate> candidates = new ArrayList<>(newCandidates);
        return new BatchSummary(
                request.sessionId(),
                request.stage(),
                request.batchNumber(),
                route.name(),
                candidates,
                request.existingCount() + candidates.size(),
                new ArrayList<>(modelStats),
                wasCancelled
        );
    }

    @Override
    public String toString() {
        return "BatchHandle{sessionId=" + request.sessionId()
                + ", stage=" + request.stage()
                + ", batch=" + request.batchNumber()
                + ", route=" + route.name()
                + ", cancelled=" + cancelled.get() + '}';
    }
}
