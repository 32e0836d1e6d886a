package fr.lapetina.codex.summarizer.domain.exception;

/**
 * Raised when the summarizer cannot be set up: malformed model configuration,
 * invalid settings, or a provider chain with no usable entry.
 *
 * There is no recovery from this at runtime; it must reach the top-level caller.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
