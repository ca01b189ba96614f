package fr.lapetina.llm.orchestrator.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;

/**
 * Loads and validates the orchestrator configuration.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Structural validation before anything is wired
 *
 * Routes and bindings are fixed for the lifetime of the process, so the
 * configuration is read once at startup.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Set<String> PROVIDER_TYPES = Set.of("dashscope", "volcengine", "hunyuan");

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded, validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public OrchestratorConfig load() {
        OrchestratorConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private OrchestratorConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private OrchestratorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public OrchestratorConfig loadFromStream(InputStream inputStream) {
        OrchestratorConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private OrchestratorConfig parse(InputStream inputStream, String source) {
        try {
            OrchestratorConfig config = yaml.load(inputStream);
            return config != null ? config : new OrchestratorConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks cross-references that SnakeYAML cannot: route weights, provider
     * types, and that every binding points to a configured provider.
     */
    static void validate(OrchestratorConfig config) {
        OrchestratorConfig.RoutingConfig routing = config.getRouting();
        if (routing.getRoutes().isEmpty()) {
            throw new ConfigurationException("At least one route must be configured");
        }
        Set<String> routeNames = new HashSet<>();
        int totalWeight = 0;
        for (OrchestratorConfig.RouteConfig route : routing.getRoutes()) {
            if (route.getName() == null || !routeNames.add(route.getName())) {
                throw new ConfigurationException("Route names must be present and unique: " + route.getName());
            }
            if (route.getWeight() < 0) {
                throw new ConfigurationException("Route weight cannot be negative: " + route.getName());
            }
            totalWeight += route.getWeight();
        }
        if (routing.isEnabled() && totalWeight <= 0) {
            throw new ConfigurationException("Route weights must sum to a positive value");
        }
        if (!routeNames.contains(routing.getDefaultRoute())) {
            throw new ConfigurationException("Default route is not configured: " + routing.getDefaultRoute());
        }

        Set<String> providerNames = new HashSet<>();
        for (OrchestratorConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getName() == null || !providerNames.add(provider.getName())) {
                throw new ConfigurationException("Provider names must be present and unique: " + provider.getName());
            }
            if (provider.getType() == null || !PROVIDER_TYPES.contains(provider.getType().toLowerCase())) {
                throw new ConfigurationException("Unsupported provider type '" + provider.getType()
                        + "' for provider " + provider.getName());
            }
            if (provider.getBaseUrl() == null || provider.getBaseUrl().isBlank()) {
                throw new ConfigurationException("Provider base URL is required: " + provider.getName());
            }
        }
        if (providerNames.isEmpty()) {
            throw new ConfigurationException("At least one provider must be configured");
        }

        for (OrchestratorConfig.ModelConfig model : config.getModels()) {
            if (model.getName() == null || model.getName().isBlank()) {
                throw new ConfigurationException("Model name is required");
            }
            model.getBindings().forEach((route, binding) -> {
                if (!routeNames.contains(route)) {
                    throw new ConfigurationException("Model " + model.getName() + " binds unknown route: " + route);
                }
                if (!providerNames.contains(binding.getProvider())) {
                    throw new ConfigurationException("Model " + model.getName()
                            + " binds unknown provider: " + binding.getProvider());
                }
            });
        }

        if (config.getDeployment().getWorkerProcesses() < 1) {
            throw new ConfigurationException("deployment.workerProcesses must be at least 1");
        }
        if (Integer.bitCount(config.getAggregation().getRingBufferSize()) != 1) {
            throw new ConfigurationException("aggregation.ringBufferSize must be a power of 2");
        }
    }

    /**
     * Creates a default configuration.
     */
    public static OrchestratorConfig createDefault() {
        return new OrchestratorConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
