package fr.lapetina.codex.summarizer.batch;

import fr.lapetina.codex.summarizer.domain.model.SummaryResponse;

/**
 * Summary produced for one input unit of a batch.
 */
public record UnitSummary(String identifier, String language, String summary) {

    public boolean isError() {
        return summary.startsWith(SummaryResponse.ERROR_PREFIX);
    }
}
