package fr.lapetina.codex.summarizer.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Backend families a provider chain can be assembled from.
 *
 * Each kind carries the hard ceiling its API places on response tokens;
 * adapters clamp the configured {@code maxTokens} to it.
 */
public enum ProviderType {
    PERPLEXITY("perplexity", 4096),
    OPENAI("openai", Integer.MAX_VALUE),
    ANTHROPIC("anthropic", 4096);

    private final String id;
    private final int responseTokenCeiling;

    ProviderType(String id, int responseTokenCeiling) {
        this.id = id;
        this.responseTokenCeiling = responseTokenCeiling;
    }

    public String getId() {
        return id;
    }

    public int getResponseTokenCeiling() {
        return responseTokenCeiling;
    }

    /**
     * Clamps a configured response cap to this provider's ceiling.
     */
    public int capResponseTokens(int configured) {
        return Math.min(configured, responseTokenCeiling);
    }

    /**
     * Resolves a provider by its configuration id (case-insensitive).
     */
    public static Optional<ProviderType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Guesses the provider from a model identifier. Used for the legacy
     * single-model configuration where no provider is given.
     */
    public static ProviderType detectFromModel(String model) {
        if (model != null) {
            if (model.startsWith("gpt-")) {
                return OPENAI;
            }
            if (model.startsWith("claude-")) {
                return ANTHROPIC;
            }
            if (model.startsWith("sonar-")) {
                return PERPLEXITY;
            }
        }
        return OPENAI;
    }

    @Override
    public String toString() {
        return id;
    }
}
