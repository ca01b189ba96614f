package fr.lapetina.llm.orchestrator.infrastructure.provider;

import fr.lapetina.llm.orchestrator.infrastructure.config.OrchestratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Provider clients by name. Every other component reaches providers through
 * this registry, never through a concrete client type.
 */
public class ProviderClientRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderClientRegistry.class);

    private final Map<String, ProviderClient> clients = new LinkedHashMap<>();

    public ProviderClientRegistry() {
    }

    /**
     * Builds one client per configured provider.
     */
    public static ProviderClientRegistry fromConfig(OrchestratorConfig config) {
        ProviderClientRegistry registry = new ProviderClientRegistry();
        OrchestratorConfig.TimeoutsConfig timeouts = config.getTimeouts();
        for (OrchestratorConfig.ProviderConfig providerConfig : config.getProviders()) {
            ProviderSettings settings = new ProviderSettings(
                    providerConfig.getName(),
                    URI.create(providerConfig.getBaseUrl()),
                    providerConfig.resolveApiKey(),
                    Duration.ofMillis(timeouts.getConnectTimeoutMs()),
                    Duration.ofMillis(timeouts.getCallTimeoutMs())
            );
            registry.register(create(providerConfig.getType(), settings));
        }
        return registry;
    }

    /**
     * Creates the client variant for a provider type.
     */
    public static ProviderClient create(String type, ProviderSettings settings) {
        return switch (type.toLowerCase()) {
            case "dashscope" -> new DashscopeClient(settings);
            case "volcengine" -> new VolcengineClient(settings);
            case "hunyuan" -> new HunyuanClient(settings);
            default -> throw new IllegalArgumentException("Unsupported provider type: " + type);
        };
    }

    public ProviderClientRegistry register(ProviderClient client) {
        ProviderClient previous = clients.put(client.getName(), client);
        if (previous != null) {
            previous.close();
        }
        log.info("Provider client registered: provider={}, type={}",
                client.getName(), client.getClass().getSimpleName());
        return this;
    }

    public Optional<ProviderClient> find(String provider) {
        return Optional.ofNullable(clients.get(provider));
    }

    /**
     * @throws IllegalStateException if no client is registered under {@code provider}
     */
    public ProviderClient get(String provider) {
        ProviderClient client = clients.get(provider);
        if (client == null) {
            throw new IllegalStateException("No client for provider: " + provider);
        }
        return client;
    }

    public Collection<String> getNames() {
        return clients.keySet();
    }

    @Override
    public void close() {
        for (ProviderClient client : clients.values()) {
            try {
                client.close();
            } catch (Exception e) {
                log.warn("Error closing provider client: provider={}", client.getName(), e);
            }
        }
    }
}
