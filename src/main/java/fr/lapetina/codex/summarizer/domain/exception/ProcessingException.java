package fr.lapetina.codex.summarizer.domain.exception;

/**
 * A unit of work in a batch run could not be summarized.
 * Caught per unit; the batch carries on with the remaining units.
 */
public class ProcessingException extends RuntimeException {

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
