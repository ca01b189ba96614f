package fr.lapetina.llm.orchestrator.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the orchestrator.
 * Designed to be populated from YAML.
 */
public class OrchestratorConfig {

    private RoutingConfig routing = new RoutingConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private List<RateLimitConfig> rateLimits = new ArrayList<>();
    private List<ModelConfig> models = new ArrayList<>();
    private DeploymentConfig deployment = new DeploymentConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private RetryConfig retry = new RetryConfig();
    private AggregationConfig aggregation = new AggregationConfig();
    private SessionsConfig sessions = new SessionsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public List<RateLimitConfig> getRateLimits() { return rateLimits; }
    public void setRateLimits(List<RateLimitConfig> rateLimits) { this.rateLimits = rateLimits; }

    public List<ModelConfig> getModels() { return models; }
    public void setModels(List<ModelConfig> models) { this.models = models; }

    public DeploymentConfig getDeployment() { return deployment; }
    public void setDeployment(DeploymentConfig deployment) { this.deployment = deployment; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public AggregationConfig getAggregation() { return aggregation; }
    public void setAggregation(AggregationConfig aggregation) { this.aggregation = aggregation; }

    public SessionsConfig getSessions() { return sessions; }
    public void setSessions(SessionsConfig sessions) { this.sessions = sessions; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Route selection configuration.
     */
    public static class RoutingConfig {
        private boolean enabled = true;
        private String strategy = "weighted";
        private String defaultRoute = "A";
        private List<RouteConfig> routes = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public String getDefaultRoute() { return defaultRoute; }
        public void setDefaultRoute(String defaultRoute) { this.defaultRoute = defaultRoute; }

        public List<RouteConfig> getRoutes() { return routes; }
        public void setRoutes(List<RouteConfig> routes) { this.routes = routes; }
    }

    public static class RouteConfig {
        private String name;
        private int weight = 50;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }
    }

    /**
     * One provider endpoint.
     */
    public static class ProviderConfig {
        private String name;
        private String type;
        private String baseUrl;
        private String apiKey;
        private String apiKeyEnv;
        private String segmentation = "line";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getSegmentation() { return segmentation; }
        public void setSegmentation(String segmentation) { this.segmentation = segmentation; }

        /**
         * Returns the literal key, or the value of {@code apiKeyEnv} when no literal is set.
         */
        public String resolveApiKey() {
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey;
            }
            if (apiKeyEnv != null) {
                String value = System.getenv(apiKeyEnv);
                return value != null ? value : "";
            }
            return "";
        }
    }

    /**
     * Total (all processes) budget of one rate-limit class.
     */
    public static class RateLimitConfig {
        private String name;
        private boolean enabled = true;
        private int requestsPerWindow = 600;
        private long tokensPerWindow = 0;
        private int maxConcurrent = 0;
        private long windowMs = 60000;
        private String policy = "wait";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRequestsPerWindow() { return requestsPerWindow; }
        public void setRequestsPerWindow(int requestsPerWindow) { this.requestsPerWindow = requestsPerWindow; }

        public long getTokensPerWindow() { return tokensPerWindow; }
        public void setTokensPerWindow(long tokensPerWindow) { this.tokensPerWindow = tokensPerWindow; }

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }

        public String getPolicy() { return policy; }
        public void setPolicy(String policy) { this.policy = policy; }
    }

    /**
     * A logical model and its binding per route.
     */
    public static class ModelConfig {
        private String name;
        private Map<String, BindingConfig> bindings = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public Map<String, BindingConfig> getBindings() { return bindings; }
        public void setBindings(Map<String, BindingConfig> bindings) { this.bindings = bindings; }
    }

    public static class BindingConfig {
        private String provider;
        private String physicalId;
        private String rateLimitClass;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getPhysicalId() { return physicalId; }
        public void setPhysicalId(String physicalId) { this.physicalId = physicalId; }

        public String getRateLimitClass() { return rateLimitClass; }
        public void setRateLimitClass(String rateLimitClass) { this.rateLimitClass = rateLimitClass; }
    }

    /**
     * Deployment facts the process cannot discover at runtime.
     */
    public static class DeploymentConfig {
        private int workerProcesses = 1;

        public int getWorkerProcesses() { return workerProcesses; }
        public void setWorkerProcesses(int workerProcesses) { this.workerProcesses = workerProcesses; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long callTimeoutMs = 20000;
        private long permitTimeoutMs = 5000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getCallTimeoutMs() { return callTimeoutMs; }
        public void setCallTimeoutMs(long callTimeoutMs) { this.callTimeoutMs = callTimeoutMs; }

        public long getPermitTimeoutMs() { return permitTimeoutMs; }
        public void setPermitTimeoutMs(long permitTimeoutMs) { this.permitTimeoutMs = permitTimeoutMs; }
    }

    /**
     * Retry configuration for retryable provider errors.
     */
    public static class RetryConfig {
        private int maxRetries = 3;
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 10000;
        private double multiplier = 2.0;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
    }

    /**
     * Fan-out and merge configuration.
     */
    public static class AggregationConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int workerThreads = 16;
        private int maxTokens = 500;
        private List<String> defaultModels = new ArrayList<>(List.of("qwen", "deepseek", "kimi", "doubao"));
        private double baseTemperature = 0.7;
        private double temperatureStep = 0.1;
        private double maxTemperature = 1.0;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public List<String> getDefaultModels() { return defaultModels; }
        public void setDefaultModels(List<String> defaultModels) { this.defaultModels = defaultModels; }

        public double getBaseTemperature() { return baseTemperature; }
        public void setBaseTemperature(double baseTemperature) { this.baseTemperature = baseTemperature; }

        public double getTemperatureStep() { return temperatureStep; }
        public void setTemperatureStep(double temperatureStep) { this.temperatureStep = temperatureStep; }

        public double getMaxTemperature() { return maxTemperature; }
        public void setMaxTemperature(double maxTemperature) { this.maxTemperature = maxTemperature; }
    }

    /**
     * Session lifetime configuration.
     */
    public static class SessionsConfig {
        private long idleTimeoutMs = 1_800_000;
        private long sweepIntervalMs = 60_000;

        public long getIdleTimeoutMs() { return idleTimeoutMs; }
        public void setIdleTimeoutMs(long idleTimeoutMs) { this.idleTimeoutMs = idleTimeoutMs; }

        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private String prefix = "llm_orchestrator";

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
