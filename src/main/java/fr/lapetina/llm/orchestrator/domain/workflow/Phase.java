package fr.lapetina.llm.orchestrator.domain.workflow;

/**
 * Coarse position of a session in its workflow.
 */
public enum Phase {
    STAGE_1,
    STAGE_2,
    STAGE_3,

    /** Every stage is locked */
    COMPLETE,

    /** Closed by {@code finish} */
    FINISHED,

    /** Closed by {@code cancel} or idle timeout */
    CANCELLED;

    static Phase ofStageIndex(int index) {
        return switch (index) {
            case 0 -> STAGE_1;
            case 1 -> STAGE_2;
            default -> STAGE_3;
        };
    }

    public boolean isClosed() {
        return this == FINISHED || this == CANCELLED;
    }
}
