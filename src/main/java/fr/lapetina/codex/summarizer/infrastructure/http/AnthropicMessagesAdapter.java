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
 * Adapter for the Anthropic messages API.
 */
public final class AnthropicMessagesAdapter extends AbstractHttpProviderAdapter {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com/v1";
    public static final String API_VERSION = "2023-06-01";
    private static final String PATH = "/messages";

    public AnthropicMessagesAdapter(ModelConfig modelConfig, HttpClient httpClient, Duration requestTimeout) {
        super(modelConfig, httpClient, DEFAULT_BASE_URL, PATH, requestTimeout);
    }

    @Override
    protected Map<String, Object> buildRequestBody(String prompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", getModelName());
        body.put("max_tokens", responseTokenCap());
        body.put("temperature", getModelConfig().temperature());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        return body;
    }

    @Override
    protected void addHeaders(HttpRequest.Builder builder) {
        builder.header("x-api-key", getModelConfig().apiKey());
        builder.header("anthropic-version", API_VERSION);
    }

    @Override
    protected String extractText(JsonNode body) {
        JsonNode content = body.path("content");
        if (!content.isArray()) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        boolean found = false;
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                text.append(block.get("text").asText());
                found = true;
            }
        }
        return found ? text.toString() : null;
    }
}
