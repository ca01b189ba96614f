package fr.lapetina.llm.orchestrator.domain.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bidirectional table between logical model names and their physical
 * bindings per route.
 *
 * <p>The table is validated once at construction: every binding must have a
 * unique inverse entry, so that {@code inverse(resolve(logical, route))}
 * always yields {@code logical}. Physical ids must not leak to callers. The
 * aggregator labels events from the resolved {@link ModelBinding}, so it never
 * needs a reverse lookup; {@link #inverse(String)} is kept for callers that
 * receive a bare physical id from elsewhere and for checking the round trip.
 */
public final class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final String defaultRoute;
    private final String defaultProvider;
    private final Map<String, Map<String, ModelBinding>> bindings;
    private final Map<String, String> inverse;
    private final Set<String> warnedUnknown = ConcurrentHashMap.newKeySet();

    /**
     * @param routes          all configured route names
     * @param defaultRoute    route used when a model has no binding for the requested one
     * @param defaultProvider provider used for identity fallbacks
     * @param bindings        every configured binding
     * @throws IllegalArgumentException if the table is not bidirectionally complete
     */
    public ModelRegistry(
            Collection<String> routes,
            String defaultRoute,
            String defaultProvider,
            List<ModelBinding> bindings
    ) {
        if (!routes.contains(defaultRoute)) {
            throw new IllegalArgumentException("Default route is not configured: " + defaultRoute);
        }
        this.defaultRoute = defaultRoute;
        this.defaultProvider = defaultProvider;

        Map<String, Map<String, ModelBinding>> table = new LinkedHashMap<>();
        Map<String, String> reverse = new HashMap<>();
        for (ModelBinding binding : bindings) {
            if (!routes.contains(binding.route())) {
                throw new IllegalArgumentException("Binding for '" + binding.logicalName()
                        + "' references unknown route: " + binding.route());
            }
            ModelBinding previous = table
                    .computeIfAbsent(binding.logicalName(), k -> new LinkedHashMap<>())
                    .put(binding.route(), binding);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate binding: model=" + binding.logicalName()
                        + ", route=" + binding.route());
            }
            String owner = reverse.putIfAbsent(binding.physicalId(), binding.logicalName());
            if (owner != null && !owner.equals(binding.logicalName())) {
                throw new IllegalArgumentException("Physical model '" + binding.physicalId()
                        + "' is bound to both '" + owner + "' and '" + binding.logicalName() + "'");
            }
        }
        for (Map.Entry<String, Map<String, ModelBinding>> entry : table.entrySet()) {
            if (!entry.getValue().containsKey(defaultRoute)) {
                throw new IllegalArgumentException("Model '" + entry.getKey()
                        + "' has no binding on default route: " + defaultRoute);
            }
        }
        // A physical id may not shadow a different logical name either
        for (Map.Entry<String, String> entry : reverse.entrySet()) {
            if (table.containsKey(entry.getKey()) && !entry.getKey().equals(entry.getValue())) {
                throw new IllegalArgumentException("Physical model '" + entry.getKey()
                        + "' collides with logical model of the same name");
            }
        }

        this.bindings = copyOf(table);
        this.inverse = Map.copyOf(reverse);

        log.info("ModelRegistry initialized: models={}, routes={}, defaultRoute={}",
                this.bindings.keySet(), routes, defaultRoute);
    }

    /**
     * Resolves a logical model under a route.
     * Unknown models fall back to identity on the default provider.
     */
    public ModelBinding resolve(String logicalModel, String route) {
        Map<String, ModelBinding> perRoute = bindings.get(logicalModel);
        if (perRoute == null) {
            if (warnedUnknown.add(logicalModel)) {
                log.warn("Unknown logical model, using identity binding: model={}, provider={}",
                        logicalModel, defaultProvider);
            }
            return ModelBinding.identity(logicalModel, route, defaultProvider);
        }
        ModelBinding binding = perRoute.get(route);
        return binding != null ? binding : perRoute.get(defaultRoute);
    }

    /**
     * Maps a physical id back to its logical name; unknown ids map to themselves.
     * Not used on the aggregation path, which already holds the logical name.
     */
    public String inverse(String physicalModel) {
        return inverse.getOrDefault(physicalModel, physicalModel);
    }

    public Set<String> getLogicalModels() {
        return bindings.keySet();
    }

    public Map<String, ModelBinding> getBindings(String logicalModel) {
        return bindings.getOrDefault(logicalModel, Map.of());
    }

    public String getDefaultRoute() {
        return defaultRoute;
    }

    private static Map<String, Map<String, ModelBinding>> copyOf(Map<String, Map<String, ModelBinding>> table) {
        Map<String, Map<String, ModelBinding>> copy = new LinkedHashMap<>();
        table.forEach((model, perRoute) -> copy.put(model, Map.copyOf(perRoute)));
        return Collections.unmodifiableMap(copy);
    }
}
