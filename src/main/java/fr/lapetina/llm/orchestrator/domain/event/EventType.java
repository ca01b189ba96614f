package fr.lapetina.llm.orchestrator.domain.event;

/**
 * Kinds of events streamed to the calling layer.
 */
public enum EventType {
    /** Session state changed (start, select, cancel, finish) */
    STATE_CHANGED("state_changed"),

    /** A batch fanned out; carries route and model count */
    BATCH_START("batch_start"),

    /** One unique candidate */
    CANDIDATE("candidate"),

    /** One model of a batch finished successfully */
    MODEL_COMPLETE("model_complete"),

    /** One model of a batch ended in error; siblings are unaffected */
    ERROR("error"),

    /** Every model of a batch reached a terminal state */
    BATCH_COMPLETE("batch_complete");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
