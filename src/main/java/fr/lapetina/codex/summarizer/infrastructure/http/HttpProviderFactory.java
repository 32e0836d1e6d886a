package fr.lapetina.codex.summarizer.infrastructure.http;

import fr.lapetina.codex.summarizer.domain.model.ProviderType;
import fr.lapetina.codex.summarizer.domain.provider.ProviderFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds a {@link ProviderFactory} wired with the HTTP adapters.
 * All adapters share one {@link HttpClient}.
 */
public final class HttpProviderFactory {

    private HttpProviderFactory() {
        // Utility class
    }

    public static ProviderFactory create(Duration connectTimeout, Duration requestTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        return create(httpClient, requestTimeout);
    }

    public static ProviderFactory create(HttpClient httpClient, Duration requestTimeout) {
        return new ProviderFactory()
                .register(ProviderType.OPENAI,
                        config -> new OpenAiChatAdapter(config, httpClient, requestTimeout))
                .register(ProviderType.PERPLEXITY,
                        config -> new PerplexityChatAdapter(config, httpClient, requestTimeout))
                .register(ProviderType.ANTHROPIC,
                        config -> new AnthropicMessagesAdapter(config, httpClient, requestTimeout));
    }
}
