package fr.lapetina.llm.orchestrator.aggregation.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.orchestrator.aggregation.AggregationEvent;
import fr.lapetina.llm.orchestrator.aggregation.AggregationEventType;
import fr.lapetina.llm.orchestrator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Final stage handler: records candidate metrics and releases the slot.
 */
public final class AggregationMetricsHandler implements EventHandler<AggregationEvent> {

    private static final Logger log = LoggerFactory.getLogger(AggregationMetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public AggregationMetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(AggregationEvent event, long sequence, boolean endOfBatch) {
        try {
            if (event.getType() == AggregationEventType.CANDIDATE && event.getBatch() != null) {
                MDC.put("sessionId", event.getBatch().getSessionId());
                record(event);
            }
        } finally {
            MDC.remove("sessionId");
            // Drop references so finished batches can be collected
            event.clear();
        }
    }

    private void record(AggregationEvent event) {
        if (event.getBatch().isCancelled()) {
            return;
        }
        if (event.isDuplicate()) {
            metricsRegistry.incrementDuplicates(event.getModel());
        } else {
            metricsRegistry.incrementCandidates(event.getModel());
        }
        log.trace("Candidate recorded: model={}, duplicate={}", event.getModel(), event.isDuplicate());
    }
}
