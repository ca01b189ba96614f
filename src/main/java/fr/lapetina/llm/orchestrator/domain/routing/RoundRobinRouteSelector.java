package fr.lapetina.llm.orchestrator.domain.routing;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Alternates routes with a process-local counter, ignoring weights.
 *
 * <p><b>Not safe under multi-process deployment:</b> every worker process keeps
 * its own counter, so the global split drifts with process count and request
 * interleaving. Kept for single-process setups and tests only; prefer
 * {@link WeightedRouteSelector}.
 */
public final class RoundRobinRouteSelector implements RouteSelector {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Route select(List<Route> routes) {
        if (routes.isEmpty()) {
            throw new IllegalArgumentException("No routes configured");
        }
        int index = Math.floorMod(counter.getAndIncrement(), routes.size());
        return routes.get(index);
    }

    @Override
    public boolean isMultiProcessSafe() {
        return false;
    }
}
