package fr.lapetina.llm.orchestrator.aggregation;

import fr.lapetina.llm.orchestrator.domain.model.ModelStats;

/**
 * Mutable ring-buffer entry, reused across batches.
 *
 * It should never be accessed outside the pipeline handlers.
 */
public final class AggregationEvent {

    private AggregationEventType type;
    private BatchHandle batch;
    private String model;
    private String text;
    private String dedupKey;
    private boolean duplicate;
    private ModelStats stats;

    /**
     * Clears the event for reuse.
     */
    public void clear() {
        this.type = null;
        this.batch = null;
        this.model = null;
        this.text = null;
        this.dedupKey = null;
        this.duplicate = false;
        this.stats = null;
    }

    public void initializeCandidate(BatchHandle batch, String model, String text) {
        clear();
        this.type = AggregationEventType.CANDIDATE;
        this.batch = batch;
        this.model = model;
        this.text = text;
    }

    public void initializeTerminal(BatchHandle batch, AggregationEventType type, ModelStats stats) {
        clear();
        this.type = type;
        this.batch = batch;
        this.model = stats.model();
        this.stats = stats;
    }

    public AggregationEventType getType() {
        return type;
    }

    public BatchHandle getBatch() {
        return batch;
    }

    public String getModel() {
        return model;
    }

    public String getText() {
        return text;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    public boolean isDuplicate() {
        return duplicate;
    }

    public ModelStats getStats() {
        return stats;
    }

    public void markDeduplicated(String dedupKey, boolean duplicate) {
        this.dedupKey = dedupKey;
        this.duplicate = duplicate;
    }

    /**
     * Whether handlers should ignore this entry.
     */
    public boolean shouldSkip() {
        return type == null || batch == null || batch.isCancelled() || batch.isDone();
    }

    @Override
    public String toString() {
        return "AggregationEvent{type=" + type
                + ", batch=" + batch
                + ", model=" + model
                + ", duplicate=" + duplicate + '}';
    }
}
