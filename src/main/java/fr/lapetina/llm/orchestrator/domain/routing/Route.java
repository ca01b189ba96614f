package fr.lapetina.llm.orchestrator.domain.routing;

/**
 * A named provider route with its traffic weight.
 * Created once from configuration and never mutated.
 */
public record Route(String name, int weight) {

    public Route {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Route name is required");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("Route weight cannot be negative: " + name);
        }
    }
}
