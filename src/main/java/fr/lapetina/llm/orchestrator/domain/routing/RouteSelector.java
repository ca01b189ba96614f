package fr.lapetina.llm.orchestrator.domain.routing;

import java.util.List;

/**
 * Picks the route for one batch.
 *
 * Implementations must be thread-safe; they are called concurrently from
 * every request thread.
 */
public interface RouteSelector {

    /**
     * Returns the name of this selector for configuration and metrics.
     */
    String getName();

    /**
     * Selects one route.
     *
     * @param routes configured routes, in configuration order
     * @return the selected route
     * @throws IllegalArgumentException if {@code routes} is empty
     */
    Route select(List<Route> routes);

    /**
     * Whether the split stays correct when several OS processes each run
     * their own instance.
     */
    default boolean isMultiProcessSafe() {
        return true;
    }
}
