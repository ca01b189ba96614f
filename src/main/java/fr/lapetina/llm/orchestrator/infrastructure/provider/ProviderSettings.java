package fr.lapetina.llm.orchestrator.infrastructure.provider;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings of one provider client.
 *
 * @param callTimeout absolute deadline of one call, streaming included
 */
public record ProviderSettings(
        String name,
        URI baseUri,
        String apiKey,
        Duration connectTimeout,
        Duration callTimeout
) {
    public ProviderSettings {
        Objects.requireNonNull(name, "Provider name is required");
        Objects.requireNonNull(baseUri, "Base URI is required");
        apiKey = apiKey != null ? apiKey : "";
        Objects.requireNonNull(connectTimeout, "Connect timeout is required");
        Objects.requireNonNull(callTimeout, "Call timeout is required");
    }

    /**
     * Resolves {@code path} against the base URI, keeping any base path.
     */
    public URI endpoint(String path) {
        String base = baseUri.toString();
        if (!base.endsWith("/")) {
            base += "/";
        }
        return URI.create(base + path);
    }
}
