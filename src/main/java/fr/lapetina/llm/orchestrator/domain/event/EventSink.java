package fr.lapetina.llm.orchestrator.domain.event;

/**
 * Receives workflow events.
 *
 * Batch events are delivered from the aggregation thread, so
 * implementations must return quickly.
 */
@FunctionalInterface
public interface EventSink {

    EventSink DISCARD = event -> { };

    void accept(WorkflowEvent event);
}
