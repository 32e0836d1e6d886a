package fr.lapetina.codex.summarizer.domain.provider;

import fr.lapetina.codex.summarizer.domain.exception.ProviderException;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;

/**
 * Uniform handle on one configured backend.
 *
 * Implementations must be thread-safe: a single adapter serves every worker
 * thread of a run. {@link #invoke(String)} performs exactly one request; retry
 * and fallback belong to the engine.
 */
public interface ProviderAdapter {

    /**
     * Sends a fully formatted prompt and returns the generated text.
     *
     * @throws ProviderException if the request fails for any reason
     */
    String invoke(String prompt);

    /**
     * The configuration this adapter was built from.
     */
    ModelConfig getModelConfig();

    default String getModelName() {
        return getModelConfig().model();
    }

    default String getProviderName() {
        return getModelConfig().provider().getId();
    }
}
