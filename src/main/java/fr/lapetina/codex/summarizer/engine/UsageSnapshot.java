package fr.lapetina.codex.summarizer.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time copy of the usage ledger plus chain metadata.
 * Detached from the live counters; safe to hand out and serialize.
 */
public record UsageSnapshot(
        long totalRequests,
        long totalTokensUsed,
        double estimatedCost,
        String primaryProvider,
        String primaryModel,
        int providersConfigured,
        boolean fallbackEnabled,
        Map<String, ProviderStats> providerStats
) {
    public UsageSnapshot {
        providerStats = providerStats != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(providerStats))
                : Map.of();
    }

    /**
     * Stats for one provider, or {@link ProviderStats#EMPTY} if it was never used.
     */
    public ProviderStats statsFor(String provider) {
        return providerStats.getOrDefault(provider, ProviderStats.EMPTY);
    }
}
