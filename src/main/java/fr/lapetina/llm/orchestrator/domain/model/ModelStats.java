package fr.lapetina.llm.orchestrator.domain.model;

/**
 * Outcome of one model within a batch.
 *
 * @param model      logical model name
 * @param candidates unique candidates this model contributed
 * @param attempts   calls made, retries included
 * @param elapsedMs  time from batch start to the model's terminal state
 * @param error      terminal error kind, {@code null} on success
 */
public record ModelStats(String model, int candidates, int attempts, long elapsedMs, ErrorKind error) {

    public boolean isSuccess() {
        return error == null;
    }
}
