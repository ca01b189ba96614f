package fr.lapetina.llm.orchestrator.aggregation.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.orchestrator.aggregation.AggregationEvent;
import fr.lapetina.llm.orchestrator.aggregation.AggregationEventType;
import fr.lapetina.llm.orchestrator.aggregation.DedupKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First stage handler: computes the dedup key of each candidate and marks
 * repeats within the stage.
 *
 * Runs on a single consumer thread, so the batch's key set needs no lock.
 * The first arrival of a key wins, whatever model produced it.
 */
public final class DedupHandler implements EventHandler<AggregationEvent> {

    private static final Logger log = LoggerFactory.getLogger(DedupHandler.class);

    @Override
    public void onEvent(AggregationEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getType() != AggregationEventType.CANDIDATE) {
            return;
        }

        String key = DedupKeys.normalize(event.getText());
        boolean duplicate = key.isEmpty() || !event.getBatch().registerKey(key);
        event.markDeduplicated(key, duplicate);

        if (duplicate) {
            log.debug("Duplicate candidate dropped: batch={}, model={}, key={}",
                    event.getBatch(), event.getModel(), key);
        }
    }
}
