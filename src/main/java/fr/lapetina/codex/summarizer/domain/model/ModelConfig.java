package fr.lapetina.codex.summarizer.domain.model;

import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;

/**
 * Configuration of one model in the provider chain.
 * Immutable; built once from configuration or the environment.
 *
 * @param provider    backend family
 * @param model       model identifier sent to the backend
 * @param apiKey      secret passed through as-is
 * @param temperature sampling temperature
 * @param maxTokens   response cap, also used as the content token budget ceiling
 * @param baseUrl     endpoint override, or null for the provider default
 */
public record ModelConfig(
        ProviderType provider,
        String model,
        String apiKey,
        double temperature,
        int maxTokens,
        String baseUrl
) {
    public static final double DEFAULT_TEMPERATURE = 0.0;
    public static final int DEFAULT_MAX_TOKENS = 16000;

    public ModelConfig {
        if (provider == null) {
            throw new ConfigurationException("Provider is required for model config");
        }
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("Model name is required for model config");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("API key is required for model config: " + provider + "/" + model);
        }
        if (maxTokens <= 0) {
            throw new ConfigurationException("maxTokens must be positive for model config: " + provider + "/" + model);
        }
        if (baseUrl != null && baseUrl.isBlank()) {
            baseUrl = null;
        }
    }

    public static ModelConfig of(ProviderType provider, String model, String apiKey) {
        return new ModelConfig(provider, model, apiKey, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, null);
    }

    public static ModelConfig of(ProviderType provider, String model, String apiKey, int maxTokens) {
        return new ModelConfig(provider, model, apiKey, DEFAULT_TEMPERATURE, maxTokens, null);
    }

    public ModelConfig withBaseUrl(String url) {
        return new ModelConfig(provider, model, apiKey, temperature, maxTokens, url);
    }

    @Override
    public String toString() {
        return "ModelConfig{" +
                "provider=" + provider +
                ", model='" + model + '\'' +
                ", apiKey='***'" +
                ", temperature=" + temperature +
                ", maxTokens=" + maxTokens +
                (baseUrl != null ? ", baseUrl='" + baseUrl + '\'' : "") +
                '}';
    }
}
