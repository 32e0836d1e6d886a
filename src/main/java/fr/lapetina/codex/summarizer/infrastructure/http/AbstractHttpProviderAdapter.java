package fr.lapetina.codex.summarizer.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;
import fr.lapetina.codex.summarizer.domain.exception.ProviderException;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;
import fr.lapetina.codex.summarizer.domain.model.ProviderErrorType;
import fr.lapetina.codex.summarizer.domain.provider.ProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Shared plumbing for adapters talking JSON over HTTP.
 *
 * One blocking POST per {@link #invoke(String)}; status codes and transport
 * failures are mapped to {@link ProviderException} with a {@link ProviderErrorType}.
 */
public abstract class AbstractHttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProviderAdapter.class);

    protected static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ModelConfig modelConfig;
    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration requestTimeout;

    protected AbstractHttpProviderAdapter(
            ModelConfig modelConfig,
            HttpClient httpClient,
            String defaultBaseUrl,
            String path,
            Duration requestTimeout
    ) {
        this.modelConfig = modelConfig;
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
        this.endpoint = resolveEndpoint(
                modelConfig.baseUrl() != null ? modelConfig.baseUrl() : defaultBaseUrl, path);
    }

    private static URI resolveEndpoint(String baseUrl, String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        try {
            URI uri = URI.create(base + path);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigurationException("Base URL must be absolute: " + baseUrl);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid base URL: " + baseUrl, e);
        }
    }

    @Override
    public ModelConfig getModelConfig() {
        return modelConfig;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    /**
     * Response cap actually sent to the API.
     */
    protected int responseTokenCap() {
        return modelConfig.provider().capResponseTokens(modelConfig.maxTokens());
    }

    /**
     * Builds the JSON request body for a prompt.
     */
    protected abstract Map<String, Object> buildRequestBody(String prompt);

    /**
     * Adds provider-specific headers such as authentication.
     */
    protected abstract void addHeaders(HttpRequest.Builder builder);

    /**
     * Extracts the generated text from a successful response body.
     *
     * @return the text, or null if the body has none
     */
    protected abstract String extractText(JsonNode body);

    @Override
    public String invoke(String prompt) {
        HttpRequest request = buildHttpRequest(prompt);
        Instant startTime = Instant.now();

        log.debug("Sending request: provider={}, model={}, endpoint={}",
                getProviderName(), getModelName(), endpoint);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(getProviderName(), ProviderErrorType.INTERRUPTED,
                    "Request interrupted", e);
        } catch (IOException e) {
            throw new ProviderException(getProviderName(), classifyException(e),
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }

        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            String message = "HTTP " + statusCode + ": " + extractErrorMessage(response.body());
            log.warn("Request failed with HTTP error: provider={}, model={}, status={}, latencyMs={}",
                    getProviderName(), getModelName(), statusCode, latencyMs);
            throw new ProviderException(getProviderName(), ProviderErrorType.fromStatus(statusCode), message);
        }

        String text = parseText(response.body());
        log.debug("Request successful: provider={}, model={}, status={}, latencyMs={}",
                getProviderName(), getModelName(), statusCode, latencyMs);
        return text;
    }

    private HttpRequest buildHttpRequest(String prompt) {
        String body;
        try {
            body = MAPPER.writeValueAsString(buildRequestBody(prompt));
        } catch (IOException e) {
            throw new ProviderException(getProviderName(), ProviderErrorType.INTERNAL_ERROR,
                    "Failed to serialize request: " + e.getMessage(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        addHeaders(builder);
        return builder.build();
    }

    private String parseText(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new ProviderException(getProviderName(), ProviderErrorType.MALFORMED_RESPONSE,
                    "Failed to parse response: " + e.getMessage(), e);
        }
        String text = root == null ? null : extractText(root);
        if (text == null) {
            throw new ProviderException(getProviderName(), ProviderErrorType.MALFORMED_RESPONSE,
                    "Response contained no generated text");
        }
        return text;
    }

    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no response body";
        }
        try {
            JsonNode error = MAPPER.readTree(body).path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
        } catch (IOException e) {
            log.debug("Error body is not JSON: provider={}", getProviderName());
        }
        return body.length() > 200 ? body.substring(0, 200) : body;
    }

    private ProviderErrorType classifyException(IOException e) {
        if (e instanceof HttpConnectTimeoutException || e instanceof ConnectException) {
            return ProviderErrorType.CONNECTION_ERROR;
        }
        if (e instanceof HttpTimeoutException) {
            return ProviderErrorType.TIMEOUT;
        }
        return ProviderErrorType.CONNECTION_ERROR;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "provider=" + getProviderName() +
                ", model='" + getModelName() + '\'' +
                ", endpoint=" + endpoint +
                '}';
    }
}
