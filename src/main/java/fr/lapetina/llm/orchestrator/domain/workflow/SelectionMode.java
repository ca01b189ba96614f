package fr.lapetina.llm.orchestrator.domain.workflow;

/**
 * How many candidates a stage accepts on {@code select}.
 */
public enum SelectionMode {
    /** Exactly one candidate */
    SINGLE,

    /** One or more candidates */
    MULTIPLE
}
