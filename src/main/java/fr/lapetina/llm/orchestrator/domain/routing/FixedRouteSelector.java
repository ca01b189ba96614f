package fr.lapetina.llm.orchestrator.domain.routing;

import java.util.List;

/**
 * Always returns the default route. Used when routing is disabled.
 */
public final class FixedRouteSelector implements RouteSelector {

    private final String routeName;

    public FixedRouteSelector(String routeName) {
        this.routeName = routeName;
    }

    @Override
    public String getName() {
        return "disabled";
    }

    @Override
    public Route select(List<Route> routes) {
        for (Route route : routes) {
            if (route.name().equals(routeName)) {
                return route;
            }
        }
        throw new IllegalArgumentException("Default route is not configured: " + routeName);
    }
}
