package fr.lapetina.codex.summarizer.engine;

import fr.lapetina.codex.summarizer.domain.provider.ProviderChain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running request, token and error counters for one engine.
 *
 * All updates and reads are serialized on the ledger's monitor, so totals stay
 * exact under parallel summarization. Contention is negligible next to network
 * latency.
 */
public final class UsageLedger {

    /**
     * Flat estimate applied to every token regardless of provider or model.
     */
    public static final double COST_PER_TOKEN = 0.00002;

    private long totalRequests;
    private long totalTokensUsed;
    private final Map<String, MutableStats> providerStats = new LinkedHashMap<>();

    /**
     * Records a request answered by {@code provider}.
     */
    public synchronized void recordSuccess(String provider, int tokensUsed) {
        totalRequests++;
        totalTokensUsed += tokensUsed;
        MutableStats stats = statsFor(provider);
        stats.requests++;
        stats.tokens += tokensUsed;
    }

    /**
     * Records one failed attempt against {@code provider}.
     */
    public synchronized void recordError(String provider) {
        statsFor(provider).errors++;
    }

    public synchronized long getTotalRequests() {
        return totalRequests;
    }

    public synchronized long getTotalTokensUsed() {
        return totalTokensUsed;
    }

    public synchronized double getEstimatedCost() {
        return totalTokensUsed * COST_PER_TOKEN;
    }

    /**
     * Copies the current counters together with the chain's metadata.
     */
    public synchronized UsageSnapshot snapshot(ProviderChain chain, boolean fallbackEnabled) {
        Map<String, ProviderStats> copy = new LinkedHashMap<>();
        providerStats.forEach((name, stats) ->
                copy.put(name, new ProviderStats(stats.requests, stats.tokens, stats.errors)));

        return new UsageSnapshot(
                totalRequests,
                totalTokensUsed,
                totalTokensUsed * COST_PER_TOKEN,
                chain.primary().getProviderName(),
                chain.primary().getModelName(),
                chain.size(),
                fallbackEnabled,
                copy
        );
    }

    private MutableStats statsFor(String provider) {
        return providerStats.computeIfAbsent(provider, p -> new MutableStats());
    }

    private static final class MutableStats {
        long requests;
        long tokens;
        long errors;
    }
}
