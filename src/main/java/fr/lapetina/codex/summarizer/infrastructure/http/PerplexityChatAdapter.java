package fr.lapetina.codex.summarizer.infrastructure.http;

import fr.lapetina.codex.summarizer.domain.model.ModelConfig;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Adapter for Perplexity, which exposes an OpenAI-compatible chat endpoint.
 * Response tokens are capped at 4096 whatever the configured value.
 */
public final class PerplexityChatAdapter extends OpenAiChatAdapter {

    public static final String DEFAULT_BASE_URL = "https://api.perplexity.ai";

    public PerplexityChatAdapter(ModelConfig modelConfig, HttpClient httpClient, Duration requestTimeout) {
        super(modelConfig, httpClient, DEFAULT_BASE_URL, requestTimeout);
    }
}
