package fr.lapetina.codex.summarizer.domain.exception;

import fr.lapetina.codex.summarizer.domain.model.ProviderErrorType;

/**
 * Failure of a single provider invocation.
 *
 * Thrown by adapters and consumed by the engine's retry and fallback loops;
 * it never crosses the engine's public boundary.
 */
public final class ProviderException extends RuntimeException {

    private final String provider;
    private final ProviderErrorType errorType;

    public ProviderException(String provider, ProviderErrorType errorType, String message) {
        super(message);
        this.provider = provider;
        this.errorType = errorType;
    }

    public ProviderException(String provider, ProviderErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.errorType = errorType;
    }

    public String getProvider() {
        return provider;
    }

    public ProviderErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return errorType != ProviderErrorType.INTERRUPTED;
    }
}
