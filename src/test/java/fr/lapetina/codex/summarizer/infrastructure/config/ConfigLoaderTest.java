package fr.lapetina.codex.summarizer.infrastructure.config;

import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;
import fr.lapetina.codex.summarizer.domain.model.ProviderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ConfigLoader loader(Map<String, String> env) {
        return new ConfigLoader(null, env::get);
    }

    private static SummarizerConfig parse(String yaml, Map<String, String> env) {
        return loader(env).loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        ConfigLoader loader = new ConfigLoader("test-config.yaml", name -> null);

        SummarizerConfig config = loader.load();
        List<ModelConfig> models = loader.toModelConfigs(config);

        assertThat(models).extracting(ModelConfig::provider)
                .containsExactly(ProviderType.PERPLEXITY, ProviderType.OPENAI);
        assertThat(config.getProcessing().getChunkSize()).isEqualTo(200);
        assertThat(config.getRetry().getAttempts()).isEqualTo(2);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("codex_test");
    }

    @Test
    @DisplayName("should load from file system before classpath")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.yaml");
        Files.writeString(file, "models:\n"
                + "  - provider: anthropic\n"
                + "    model: claude-3-haiku-20240307\n"
                + "    apiKey: file-key\n"
                + "    maxTokens: 2000\n"
                + "    temperature: 0.2\n"
                + "    baseUrl: http://localhost:9999/v1\n");
        ConfigLoader loader = new ConfigLoader(file.toString(), name -> null);

        ModelConfig model = loader.toModelConfigs(loader.load()).get(0);

        assertThat(model.provider()).isEqualTo(ProviderType.ANTHROPIC);
        assertThat(model.maxTokens()).isEqualTo(2000);
        assertThat(model.temperature()).isEqualTo(0.2);
        assertThat(model.baseUrl()).isEqualTo("http://localhost:9999/v1");
    }

    @Test
    @DisplayName("should apply defaults for omitted sections")
    void shouldApplyDefaults() {
        SummarizerConfig config = parse("models:\n"
                + "  - provider: openai\n"
                + "    model: gpt-4o\n"
                + "    apiKey: k\n", Map.of());

        assertThat(config.getProcessing().getChunkSize()).isEqualTo(2000);
        assertThat(config.getProcessing().getChunkOverlap()).isEqualTo(400);
        assertThat(config.getProcessing().getMaxChunksPerFile()).isEqualTo(10);
        assertThat(config.getProcessing().getMaxWorkers()).isEqualTo(8);
        assertThat(config.getProcessing().getTimeoutSeconds()).isEqualTo(30);
        assertThat(config.getRetry().getAttempts()).isEqualTo(3);
        assertThat(config.getRetry().isFallbackEnabled()).isTrue();
        assertThat(config.getModels().get(0).getMaxTokens()).isEqualTo(16000);
    }

    @Nested
    @DisplayName("API keys")
    class ApiKeys {

        @Test
        @DisplayName("should resolve keys from named variables")
        void shouldResolveKeyFromVariable() {
            ConfigLoader loader = loader(Map.of("MY_KEY", "from-env"));
            SummarizerConfig config = loader.loadFromStream(new ByteArrayInputStream((
                    "models:\n"
                            + "  - provider: openai\n"
                            + "    model: gpt-4o\n"
                            + "    apiKeyEnv: MY_KEY\n").getBytes(StandardCharsets.UTF_8)));

            assertThat(loader.toModelConfigs(config).get(0).apiKey()).isEqualTo("from-env");
        }

        @Test
        @DisplayName("should skip entries whose key variable is unset")
        void shouldSkipUnsetVariables() {
            SummarizerConfig config = parse("models:\n"
                    + "  - provider: perplexity\n"
                    + "    model: sonar-large-chat\n"
                    + "    apiKeyEnv: PPLX_API_KEY\n"
                    + "  - provider: openai\n"
                    + "    model: gpt-4o\n"
                    + "    apiKey: inline\n", Map.of());

            assertThat(config.getModels()).extracting(SummarizerConfig.ModelSettings::getProvider)
                    .containsExactly("openai");
        }
    }

    @Nested
    @DisplayName("Legacy and environment")
    class LegacyAndEnvironment {

        @Test
        @DisplayName("should turn legacy fields into a single model")
        void shouldConvertLegacyFields() {
            SummarizerConfig config = parse("apiKey: legacy\nmodel: claude-2.1\n", Map.of());

            assertThat(config.getModels()).hasSize(1);
            assertThat(config.getModels().get(0).getProvider()).isEqualTo("anthropic");
            assertThat(config.getModels().get(0).getModel()).isEqualTo("claude-2.1");
        }

        @Test
        @DisplayName("should discover providers from environment in order")
        void shouldDiscoverFromEnvironment() {
            ConfigLoader loader = loader(Map.of(
                    "ANTHROPIC_API_KEY", "a",
                    "PERPLEXITY_API_KEY", "p",
                    "OPENAI_API_KEY", "o"));

            List<ModelConfig> models = loader.toModelConfigs(loader.load());

            assertThat(models).extracting(ModelConfig::model)
                    .containsExactly("sonar-large-chat", "gpt-4o", "claude-3-sonnet-20240229");
            assertThat(models).extracting(ModelConfig::maxTokens).containsExactly(16000, 8000, 100000);
        }

        @Test
        @DisplayName("should fail when nothing is configured")
        void shouldFailWithoutProviders() {
            assertThatThrownBy(() -> loader(Map.of()).load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("No AI providers configured");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject unknown provider")
        void shouldRejectUnknownProvider() {
            assertThatThrownBy(() -> parse("models:\n"
                    + "  - provider: cohere\n"
                    + "    model: command\n"
                    + "    apiKey: k\n", Map.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Unknown provider: cohere");
        }

        @Test
        @DisplayName("should reject non-positive chunk size")
        void shouldRejectChunkSize() {
            assertThatThrownBy(() -> parse("models:\n"
                    + "  - {provider: openai, model: gpt-4o, apiKey: k}\n"
                    + "processing:\n"
                    + "  chunkSize: 0\n", Map.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("chunkSize");
        }

        @Test
        @DisplayName("should reject zero retry attempts")
        void shouldRejectRetryAttempts() {
            assertThatThrownBy(() -> parse("models:\n"
                    + "  - {provider: openai, model: gpt-4o, apiKey: k}\n"
                    + "retry:\n"
                    + "  attempts: 0\n", Map.of()))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("retry.attempts");
        }

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml() {
            assertThatThrownBy(() -> parse("models: [unclosed", Map.of()))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
