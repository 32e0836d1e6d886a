package fr.lapetina.codex.summarizer.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter for the OpenAI chat completions API, and for any backend speaking
 * the same wire format.
 */
public class OpenAiChatAdapter extends AbstractHttpProviderAdapter {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String PATH = "/chat/completions";

    public OpenAiChatAdapter(ModelConfig modelConfig, HttpClient httpClient, Duration requestTimeout) {
        this(modelConfig, httpClient, DEFAULT_BASE_URL, requestTimeout);
    }

    protected OpenAiChatAdapter(
            ModelConfig modelConfig,
            HttpClient httpClient,
            String defaultBaseUrl,
            Duration requestTimeout
    ) {
        super(modelConfig, httpClient, defaultBaseUrl, PATH, requestTimeout);
    }

    @Override
    protected Map<String, Object> buildRequestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", getModelName());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("temperature", getModelConfig().temperature());
        body.put("max_tokens", responseTokenCap());
        body.put("stream", false);
        return body;
    }

    @Override
    protected void addHeaders(HttpRequest.Builder builder) {
        builder.header("Authorization", "Bearer " + getModelConfig().apiKey());
    }

    @Override
    protected String extractText(JsonNode body) {
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }
}
