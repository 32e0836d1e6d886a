package fr.lapetina.codex.summarizer.batch;

import fr.lapetina.codex.summarizer.engine.UsageSnapshot;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a batch run.
 *
 * @param summaries      one entry per input unit, in input order
 * @param errors         messages of the units that failed
 * @param fallbackCount  responses served by a fallback provider
 * @param masterSummary  aggregate of all valid summaries
 * @param masterFromAi   false when the master summary was assembled locally
 * @param usage          ledger snapshot taken at the end of the run
 * @param processingTime wall time of the run
 */
public record BatchResult(
        List<UnitSummary> summaries,
        List<String> errors,
        int fallbackCount,
        String masterSummary,
        boolean masterFromAi,
        UsageSnapshot usage,
        Duration processingTime
) {
    public BatchResult {
        summaries = List.copyOf(summaries);
        errors = List.copyOf(errors);
    }

    public long successCount() {
        return summaries.stream().filter(s -> !s.isError()).count();
    }
}
