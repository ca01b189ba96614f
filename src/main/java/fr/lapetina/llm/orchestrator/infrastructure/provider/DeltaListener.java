package fr.lapetina.llm.orchestrator.infrastructure.provider;

/**
 * Receives text deltas of a streaming call, in receipt order.
 */
@FunctionalInterface
public interface DeltaListener {

    /**
     * Called for every non-empty content delta.
     */
    void onDelta(String delta);

    /**
     * Polled between chunks; returning {@code true} stops reading the stream.
     */
    default boolean isCancelled() {
        return false;
    }
}
