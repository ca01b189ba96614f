package fr.lapetina.llm.orchestrator.aggregation;

/**
 * Kind of entry travelling through the aggregation ring buffer.
 */
public enum AggregationEventType {
    /** A candidate text parsed from a model's stream */
    CANDIDATE,

    /** A model finished successfully */
    MODEL_COMPLETE,

    /** A model ended in error after its retries */
    MODEL_FAILED
}
