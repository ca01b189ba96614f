package fr.lapetina.llm.orchestrator.aggregation;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link AggregationEvent} slots for the ring buffer.
 */
public final class AggregationEventFactory implements EventFactory<AggregationEvent> {

    @Override
    public AggregationEvent newInstance() {
        return new AggregationEvent();
    }
}
