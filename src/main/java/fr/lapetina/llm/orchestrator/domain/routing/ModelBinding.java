package fr.lapetina.llm.orchestrator.domain.routing;

import java.util.Objects;

/**
 * Physical binding of a logical model under one route.
 *
 * @param logicalName    caller-facing model name
 * @param route          route this binding belongs to
 * @param provider       provider client name
 * @param physicalId     model or endpoint id sent to the provider
 * @param rateLimitClass rate limiter bucket, defaults to the provider name
 */
public record ModelBinding(
        String logicalName,
        String route,
        String provider,
        String physicalId,
        String rateLimitClass
) {
    public ModelBinding {
        Objects.requireNonNull(logicalName, "Logical name is required");
        Objects.requireNonNull(route, "Route is required");
        Objects.requireNonNull(provider, "Provider is required");
        Objects.requireNonNull(physicalId, "Physical id is required");
        if (rateLimitClass == null || rateLimitClass.isBlank()) {
            rateLimitClass = provider;
        }
    }

    public static ModelBinding identity(String logicalName, String route, String provider) {
        return new ModelBinding(logicalName, route, provider, logicalName, provider);
    }
}
