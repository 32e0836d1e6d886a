package fr.lapetina.codex.summarizer.domain.model;

/**
 * Classification of errors raised by a single provider invocation.
 */
public enum ProviderErrorType {
    TIMEOUT,
    RATE_LIMITED,
    CLIENT_ERROR,
    PROVIDER_ERROR,
    CONNECTION_ERROR,
    MALFORMED_RESPONSE,
    INTERRUPTED,
    INTERNAL_ERROR;

    /**
     * Maps an HTTP status code returned by a provider API.
     */
    public static ProviderErrorType fromStatus(int statusCode) {
        if (statusCode == 429) {
            return RATE_LIMITED;
        }
        if (statusCode == 408) {
            return TIMEOUT;
        }
        if (statusCode >= 400 && statusCode < 500) {
            return CLIENT_ERROR;
        }
        if (statusCode >= 500) {
            return PROVIDER_ERROR;
        }
        return INTERNAL_ERROR;
    }
}
