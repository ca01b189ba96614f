package fr.lapetina.llm.orchestrator.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String MINIMAL = String.join("\n",
            "routing:",
            "  defaultRoute: A",
            "  routes:",
            "    - { name: A, weight: 30 }",
            "    - { name: B, weight: 70 }",
            "providers:",
            "  - { name: dashscope, type: dashscope, baseUrl: 'https://example.invalid/v1', segmentation: json }",
            "models:",
            "  - name: qwen",
            "    bindings:",
            "      A: { provider: dashscope, physicalId: qwen-plus }",
            "");

    private static InputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }

    private static OrchestratorConfig load(String yaml) {
        return new ConfigLoader("unused.yaml").loadFromStream(stream(yaml));
    }

    @Nested
    @DisplayName("Valid configuration")
    class ValidTests {

        @Test
        @DisplayName("should bind nested sections and keep defaults")
        void shouldBindSections() {
            OrchestratorConfig config = load(MINIMAL);

            assertThat(config.getRouting().getRoutes()).extracting(OrchestratorConfig.RouteConfig::getWeight)
                    .containsExactly(30, 70);
            assertThat(config.getProviders().get(0).getSegmentation()).isEqualTo("json");
            assertThat(config.getModels().get(0).getBindings().get("A").getPhysicalId()).isEqualTo("qwen-plus");
            assertThat(config.getDeployment().getWorkerProcesses()).isEqualTo(1);
            assertThat(config.getAggregation().getRingBufferSize()).isEqualTo(1024);
            assertThat(config.getAggregation().getDefaultModels()).contains("qwen", "kimi");
        }

        @Test
        @DisplayName("should load the bundled test configuration from the classpath")
        void shouldLoadFromClasspath() {
            OrchestratorConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getProviders()).extracting(OrchestratorConfig.ProviderConfig::getName)
                    .containsExactly("dashscope", "volcengine");
            assertThat(config.getRetry().getMaxRetries()).isEqualTo(2);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_orchestrator");
        }

        @Test
        @DisplayName("should prefer a literal API key over the environment")
        void shouldResolveApiKey() {
            OrchestratorConfig.ProviderConfig provider = new OrchestratorConfig.ProviderConfig();
            provider.setApiKey("literal");
            provider.setApiKeyEnv("ORCHESTRATOR_TEST_UNSET_VARIABLE");

            assertThat(provider.resolveApiKey()).isEqualTo("literal");

            provider.setApiKey(null);
            assertThat(provider.resolveApiKey()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Invalid configuration")
    class InvalidTests {

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> load("routing: [unclosed"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Invalid YAML");
        }

        @Test
        @DisplayName("should reject unknown provider types")
        void shouldRejectUnknownProviderType() {
            assertThatThrownBy(() -> load(MINIMAL.replace("type: dashscope", "type: openai")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("openai");
        }

        @Test
        @DisplayName("should reject bindings to unknown providers")
        void shouldRejectUnknownProvider() {
            assertThatThrownBy(() -> load(MINIMAL.replace("provider: dashscope", "provider: hunyuan")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("unknown provider");
        }

        @Test
        @DisplayName("should reject a missing default route")
        void shouldRejectMissingDefaultRoute() {
            assertThatThrownBy(() -> load(MINIMAL.replace("defaultRoute: A", "defaultRoute: C")))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Default route");
        }

        @Test
        @DisplayName("should reject zero total weight")
        void shouldRejectZeroWeight() {
            String yaml = MINIMAL.replace("weight: 30", "weight: 0").replace("weight: 70", "weight: 0");

            assertThatThrownBy(() -> load(yaml))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("positive");
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of 2")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> load(MINIMAL + "aggregation:\n  ringBufferSize: 1000\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("power of 2");
        }
    }
}
