package fr.lapetina.codex.summarizer.infrastructure.config;

import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;
import fr.lapetina.codex.summarizer.domain.model.ProviderType;
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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Legacy single-model configuration
 * - Provider discovery from well-known environment variables when no model is configured
 * - Validation of the resulting configuration
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Function<String, String> env;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    /**
     * @param env environment lookup, replaced in tests
     */
    public ConfigLoader(String configPath, Function<String, String> env) {
        this.configPath = configPath != null ? Paths.get(configPath) : null;
        this.env = env;
        this.yaml = new Yaml(new Constructor(SummarizerConfig.class, new LoaderOptions()));
    }

    /**
     * Loads, completes and validates the configuration.
     * A missing file is not an error as long as the environment provides a provider.
     *
     * @throws ConfigurationException if loading or validation fails
     */
    public SummarizerConfig load() {
        SummarizerConfig config = loadFromPath();
        return complete(config);
    }

    /**
     * Loads configuration from an input stream.
     */
    public SummarizerConfig loadFromStream(InputStream inputStream) {
        return complete(parse(inputStream, "stream"));
    }

    private SummarizerConfig complete(SummarizerConfig config) {
        applyLegacyModel(config);
        resolveEnvironmentKeys(config);
        if (config.getModels().isEmpty()) {
            applyEnvironmentFallback(config);
        }
        validate(config);
        return config;
    }

    private SummarizerConfig loadFromPath() {
        if (configPath == null) {
            return new SummarizerConfig();
        }

        // Try file system first
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
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

        log.warn("Configuration file not found, relying on environment: {}", configPath);
        return new SummarizerConfig();
    }

    private SummarizerConfig parse(InputStream is, String source) {
        try {
            SummarizerConfig config = yaml.load(is);
            // empty document
            return config != null ? config : new SummarizerConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private void applyLegacyModel(SummarizerConfig config) {
        if (config.getModels() == null) {
            config.setModels(new ArrayList<>());
        }
        if (!config.getModels().isEmpty() || isBlank(config.getApiKey())) {
            return;
        }
        String model = isBlank(config.getModel()) ? "sonar-large-chat" : config.getModel();
        ProviderType provider = ProviderType.detectFromModel(model);
        log.info("Using legacy single-model configuration: provider={}, model={}", provider, model);
        config.getModels().add(new SummarizerConfig.ModelSettings(
                provider.getId(), model, config.getApiKey(), ModelConfig.DEFAULT_MAX_TOKENS));
    }

    private void resolveEnvironmentKeys(SummarizerConfig config) {
        Iterator<SummarizerConfig.ModelSettings> it = config.getModels().iterator();
        while (it.hasNext()) {
            SummarizerConfig.ModelSettings settings = it.next();
            if (!isBlank(settings.getApiKey()) || isBlank(settings.getApiKeyEnv())) {
                continue;
            }
            String value = env.apply(settings.getApiKeyEnv());
            if (isBlank(value)) {
                log.warn("API key variable not set, skipping provider: provider={}, model={}, variable={}",
                        settings.getProvider(), settings.getModel(), settings.getApiKeyEnv());
                it.remove();
            } else {
                settings.setApiKey(value);
            }
        }
    }

    private void applyEnvironmentFallback(SummarizerConfig config) {
        List<SummarizerConfig.ModelSettings> models = config.getModels();

        String perplexityKey = firstNonBlank(env.apply("PPLX_API_KEY"), env.apply("PERPLEXITY_API_KEY"));
        if (perplexityKey != null) {
            models.add(new SummarizerConfig.ModelSettings("perplexity", "sonar-large-chat", perplexityKey, 16000));
        }
        String openAiKey = firstNonBlank(env.apply("OPENAI_API_KEY"));
        if (openAiKey != null) {
            models.add(new SummarizerConfig.ModelSettings("openai", "gpt-4o", openAiKey, 8000));
        }
        String anthropicKey = firstNonBlank(env.apply("ANTHROPIC_API_KEY"));
        if (anthropicKey != null) {
            models.add(new SummarizerConfig.ModelSettings(
                    "anthropic", "claude-3-sonnet-20240229", anthropicKey, 100000));
        }

        if (!models.isEmpty()) {
            log.info("Configured providers from environment: count={}", models.size());
        }
    }

    /**
     * Checks the configuration for values the engine cannot run with.
     *
     * @throws ConfigurationException on the first problem found
     */
    public void validate(SummarizerConfig config) {
        if (config.getModels() == null || config.getModels().isEmpty()) {
            throw new ConfigurationException(
                    "No AI providers configured. Set 'models' in the configuration or export "
                            + "PPLX_API_KEY, OPENAI_API_KEY or ANTHROPIC_API_KEY");
        }
        for (SummarizerConfig.ModelSettings settings : config.getModels()) {
            toModelConfig(settings);
        }

        SummarizerConfig.ProcessingConfig processing = config.getProcessing();
        if (processing.getChunkSize() <= 0) {
            throw new ConfigurationException("processing.chunkSize must be positive: " + processing.getChunkSize());
        }
        if (processing.getChunkOverlap() < 0) {
            throw new ConfigurationException("processing.chunkOverlap must not be negative: "
                    + processing.getChunkOverlap());
        }
        if (processing.getMaxChunksPerFile() <= 0) {
            throw new ConfigurationException("processing.maxChunksPerFile must be positive: "
                    + processing.getMaxChunksPerFile());
        }
        if (processing.getMaxWorkers() <= 0) {
            throw new ConfigurationException("processing.maxWorkers must be positive: " + processing.getMaxWorkers());
        }
        if (processing.getTimeoutSeconds() <= 0) {
            throw new ConfigurationException("processing.timeoutSeconds must be positive: "
                    + processing.getTimeoutSeconds());
        }
        if (config.getRetry().getAttempts() < 1) {
            throw new ConfigurationException("retry.attempts must be at least 1: " + config.getRetry().getAttempts());
        }
        if (config.getRetry().getBackoffBaseMs() < 0) {
            throw new ConfigurationException("retry.backoffBaseMs must not be negative: "
                    + config.getRetry().getBackoffBaseMs());
        }
    }

    /**
     * Converts the configured models, in order, to validated {@link ModelConfig}s.
     */
    public List<ModelConfig> toModelConfigs(SummarizerConfig config) {
        List<ModelConfig> result = new ArrayList<>();
        for (SummarizerConfig.ModelSettings settings : config.getModels()) {
            result.add(toModelConfig(settings));
        }
        return result;
    }

    private ModelConfig toModelConfig(SummarizerConfig.ModelSettings settings) {
        ProviderType provider = ProviderType.fromId(settings.getProvider())
                .orElseThrow(() -> new ConfigurationException("Unknown provider: " + settings.getProvider()));

        return new ModelConfig(provider, settings.getModel(), settings.getApiKey(),
                settings.getTemperature(), settings.getMaxTokens(), settings.getBaseUrl());
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
