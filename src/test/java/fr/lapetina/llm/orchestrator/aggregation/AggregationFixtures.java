package fr.lapetina.llm.orchestrator.aggregation;

import fr.lapetina.llm.orchestrator.domain.event.EventSink;
import fr.lapetina.llm.orchestrator.domain.model.StageKey;
import fr.lapetina.llm.orchestrator.domain.routing.Route;

import java.util.List;
import java.util.Set;

/**
 * Builds batches outside the aggregator, for handler tests.
 */
public final class AggregationFixtures {

    private AggregationFixtures() {
    }

    public static BatchRequest request(String sessionId, StageKey stage, List<String> models, Set<String> existingKeys) {
        return new BatchRequest(sessionId, stage, 1, "List parts of a plant", null, models,
                0.7, 200, existingKeys, existingKeys.size());
    }

    public static BatchHandle batch(BatchRequest request, EventSink sink) {
        return new BatchHandle(request, new Route("A", 100), sink);
    }
}
