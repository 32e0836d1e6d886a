package fr.lapetina.codex.summarizer.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one summarize or aggregate call. Exactly one is produced per call.
 * Immutable and thread-safe.
 *
 * <p>On failure {@code summary} holds an {@code "Error: ..."} placeholder and
 * {@code error} carries the last underlying message.
 */
public record SummaryResponse(
        String summary,
        int tokensUsed,
        Duration processingTime,
        String modelUsed,
        String providerUsed,
        String error,
        boolean fallbackUsed
) {
    public static final String NONE = "none";
    public static final String ERROR_PREFIX = "Error:";
    public static final String NO_CONTENT = "No content to summarize";

    public SummaryResponse {
        Objects.requireNonNull(summary, "Summary is required");
        if (processingTime == null) {
            processingTime = Duration.ZERO;
        }
        if (modelUsed == null) {
            modelUsed = NONE;
        }
        if (providerUsed == null) {
            providerUsed = NONE;
        }
    }

    public static SummaryResponse success(
            String summary,
            int tokensUsed,
            Duration processingTime,
            String modelUsed,
            String providerUsed,
            boolean fallbackUsed
    ) {
        return new SummaryResponse(summary, tokensUsed, processingTime, modelUsed, providerUsed, null, fallbackUsed);
    }

    public static SummaryResponse failure(
            String summary,
            Duration processingTime,
            String modelUsed,
            String providerUsed,
            String error,
            boolean fallbackUsed
    ) {
        return new SummaryResponse(summary, 0, processingTime, modelUsed, providerUsed,
                error != null ? error : "unknown error", fallbackUsed);
    }

    /**
     * Degenerate success for an aggregation with nothing to combine.
     */
    public static SummaryResponse empty() {
        return new SummaryResponse(NO_CONTENT, 0, Duration.ZERO, NONE, NONE, null, false);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }
}
