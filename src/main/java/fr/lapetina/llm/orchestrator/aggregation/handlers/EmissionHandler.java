package fr.lapetina.llm.orchestrator.aggregation.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.orchestrator.aggregation.AggregationEvent;
import fr.lapetina.llm.orchestrator.aggregation.BatchHandle;
import fr.lapetina.llm.orchestrator.domain.event.WorkflowEvent;
import fr.lapetina.llm.orchestrator.domain.model.Candidate;
import fr.lapetina.llm.orchestrator.domain.model.ModelStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second stage handler: turns unique candidates and model outcomes into
 * workflow events, and completes the batch once every model is terminal.
 *
 * Because one producer thread publishes a model's candidates before its
 * terminal entry, {@code model_complete} and {@code error} always follow
 * that model's last candidate.
 */
public final class EmissionHandler implements EventHandler<AggregationEvent> {

    private static final Logger log = LoggerFactory.getLogger(EmissionHandler.class);

    @Override
    public void onEvent(AggregationEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip()) {
            return;
        }

        BatchHandle batch = event.getBatch();
        switch (event.getType()) {
            case CANDIDATE -> emitCandidate(event, batch);
            case MODEL_COMPLETE -> terminal(batch, event.getStats(), false);
            case MODEL_FAILED -> terminal(batch, event.getStats(), true);
        }
    }

    private void emitCandidate(AggregationEvent event, BatchHandle batch) {
        // A timed-out stream may still deliver after its model ended
        if (event.isDuplicate() || batch.isModelTerminal(event.getModel())) {
            return;
        }
        int seq = batch.nextSequence(event.getModel());
        Candidate candidate = new Candidate(
                Candidate.idOf(batch.getSessionId(), event.getModel(), batch.getBatchNumber(), seq),
                event.getText(),
                event.getModel(),
                batch.getStage(),
                event.getDedupKey(),
                batch.getBatchNumber()
        );
        batch.recordCandidate(candidate);
        batch.emit(WorkflowEvent.candidate(batch.getSessionId(), candidate));
    }

    private void terminal(BatchHandle batch, ModelStats reported, boolean failed) {
        if (batch.isModelTerminal(reported.model())) {
            log.warn("Second terminal entry ignored: batch={}, model={}", batch, reported.model());
            return;
        }
        ModelStats stats = new ModelStats(
                reported.model(),
                batch.candidatesFrom(reported.model()),
                reported.attempts(),
                reported.elapsedMs(),
                reported.error()
        );

        if (failed) {
            batch.emit(WorkflowEvent.error(batch.getSessionId(), batch.getStage(), batch.getBatchNumber(), stats));
        } else {
            batch.emit(WorkflowEvent.modelComplete(batch.getSessionId(), batch.getStage(), batch.getBatchNumber(), stats));
        }

        if (batch.markModelTerminal(stats)) {
            log.debug("All models terminal: batch={}", batch);
            batch.finish();
        }
    }
}
