package fr.lapetina.llm.orchestrator.domain.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for route selectors by configuration name.
 */
public final class RouteSelectorFactory {

    private static final Logger log = LoggerFactory.getLogger(RouteSelectorFactory.class);

    private static final Map<String, Supplier<RouteSelector>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("weighted", WeightedRouteSelector::new);
        register("round-robin", RoundRobinRouteSelector::new);
    }

    private RouteSelectorFactory() {
        // Utility class
    }

    /**
     * Registers a custom selector.
     *
     * @param name     selector name (used in configuration)
     * @param supplier factory for selector instances
     */
    public static void register(String name, Supplier<RouteSelector> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a selector by name.
     *
     * @return selector instance, or empty if not found
     */
    public static Optional<RouteSelector> create(String name) {
        Supplier<RouteSelector> supplier = REGISTRY.get(name.toLowerCase().replace('_', '-'));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Resolves the selector for a routing configuration.
     *
     * @param strategy     configured strategy name
     * @param enabled      whether routing is enabled at all
     * @param defaultRoute route used when disabled
     * @return the selector; unknown names fall back to weighted
     */
    public static RouteSelector forConfig(String strategy, boolean enabled, String defaultRoute) {
        if (!enabled || strategy == null || "disabled".equalsIgnoreCase(strategy)) {
            return new FixedRouteSelector(defaultRoute);
        }
        RouteSelector selector = create(strategy).orElseGet(() -> {
            log.warn("Unknown routing strategy '{}', using weighted", strategy);
            return new WeightedRouteSelector();
        });
        if (!selector.isMultiProcessSafe()) {
            log.warn("Routing strategy '{}' keeps a process-local counter; "
                    + "the realized split is skewed when several worker processes run", selector.getName());
        }
        return selector;
    }

    /**
     * Returns all registered selector names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
