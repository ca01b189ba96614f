package fr.lapetina.llm.orchestrator.domain.workflow;

/**
 * A workflow operation that the current session state does not allow.
 *
 * Carries a stable {@link Violation} so callers can map it without parsing
 * the message.
 */
public class StateException extends RuntimeException {

    public enum Violation {
        UNKNOWN_SESSION("unknown session"),
        SESSION_CLOSED("session closed"),
        UNKNOWN_STAGE("unknown stage"),
        STAGE_LOCKED("stage locked"),
        PREREQUISITE_UNLOCKED("previous stage not locked"),
        UNKNOWN_ITEM("unknown item"),
        BATCH_IN_PROGRESS("batch in progress"),
        INVALID_SELECTION("invalid selection");

        private final String reason;

        Violation(String reason) {
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }
    }

    private final Violation violation;

    public StateException(Violation violation, String detail) {
        super(detail == null || detail.isBlank() ? violation.getReason() : violation.getReason() + ": " + detail);
        this.violation = violation;
    }

    public StateException(Violation violation) {
        this(violation, null);
    }

    public Violation getViolation() {
        return violation;
    }
}
