package fr.lapetina.llm.orchestrator.domain.routing;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Stateless weighted-random route selection.
 *
 * <p>Draws a uniform integer in {@code [1, totalWeight]} and returns the first
 * route whose cumulative weight boundary is at or above the draw. With two
 * routes weighted to 100, route A wins exactly when the draw is {@code <= weightA}.
 * No counter is shared, so the realized split is the same whether one or
 * many processes serve traffic.
 */
public final class WeightedRouteSelector implements RouteSelector {

    private final RandomGenerator random;

    public WeightedRouteSelector() {
        this(null);
    }

    /**
     * @param random fixed generator (tests); {@code null} uses {@link ThreadLocalRandom}
     */
    public WeightedRouteSelector(RandomGenerator random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "weighted";
    }

    @Override
    public Route select(List<Route> routes) {
        if (routes.isEmpty()) {
            throw new IllegalArgumentException("No routes configured");
        }
        int total = 0;
        for (Route route : routes) {
            total += route.weight();
        }
        if (total <= 0) {
            return routes.get(0);
        }

        RandomGenerator generator = random != null ? random : ThreadLocalRandom.current();
        int draw = generator.nextInt(1, total + 1);

        int boundary = 0;
        for (Route route : routes) {
            boundary += route.weight();
            if (draw <= boundary) {
                return route;
            }
        }
        return routes.get(routes.size() - 1);
    }
}
