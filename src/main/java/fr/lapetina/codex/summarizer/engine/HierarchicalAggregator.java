package fr.lapetina.codex.summarizer.engine;

import fr.lapetina.codex.summarizer.domain.exception.ProviderException;
import fr.lapetina.codex.summarizer.domain.provider.ProviderAdapter;
import fr.lapetina.codex.summarizer.domain.token.TokenAccountant;
import fr.lapetina.codex.summarizer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines many summaries into one on a single provider, reducing in
 * fixed-size batches when the joined text does not fit that provider's
 * content budget.
 *
 * Each reduction goes through {@link AggregationStep}, which owns retries.
 * Fallback to another provider happens one level up and restarts the whole
 * aggregation. A level of n summaries yields ceil(n / batchSize) summaries, so
 * the reduction terminates for any batch size of at least 2.
 */
public final class HierarchicalAggregator {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalAggregator.class);

    public static final int DEFAULT_BATCH_SIZE = 10;
    static final String SEPARATOR = "\n\n";

    /**
     * One aggregation request over already joined summaries.
     */
    @FunctionalInterface
    public interface AggregationStep {
        ProviderReply reduce(ProviderAdapter provider, String combinedSummaries);
    }

    private final AggregationStep step;
    private final TokenAccountant tokenAccountant;
    private final MetricsRegistry metrics;
    private final int batchSize;

    public HierarchicalAggregator(
            AggregationStep step,
            TokenAccountant tokenAccountant,
            MetricsRegistry metrics,
            int batchSize
    ) {
        if (batchSize < 2) {
            throw new IllegalArgumentException("Batch size must be at least 2: " + batchSize);
        }
        this.step = step;
        this.tokenAccountant = tokenAccountant;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    /**
     * Aggregates {@code summaries} with {@code provider} alone.
     *
     * @throws ProviderException as soon as any request to the provider fails
     */
    public ProviderReply aggregate(List<String> summaries, ProviderAdapter provider) {
        if (summaries.isEmpty()) {
            throw new IllegalArgumentException("No summaries to aggregate");
        }

        String combined = String.join(SEPARATOR, summaries);
        int budget = tokenAccountant.contentBudget(provider.getModelConfig());
        int combinedTokens = tokenAccountant.countTokens(combined, provider.getModelName());

        if (summaries.size() == 1 || combinedTokens <= budget) {
            return step.reduce(provider, combined);
        }

        log.info("Summaries exceed budget, aggregating hierarchically: provider={}, count={}, tokens={}, "
                        + "budget={}, batchSize={}",
                provider.getProviderName(), summaries.size(), combinedTokens, budget, batchSize);

        List<String> level = List.copyOf(summaries);
        int totalTokens = 0;
        int depth = 0;

        while (level.size() > 1) {
            depth++;
            List<String> next = new ArrayList<>();
            for (List<String> batch : partition(level, batchSize)) {
                ProviderReply reply = step.reduce(provider, String.join(SEPARATOR, batch));
                metrics.incrementAggregationBatches();
                totalTokens += reply.tokensUsed();
                next.add(reply.text());
            }
            log.debug("Aggregation level reduced: provider={}, level={}, from={}, to={}",
                    provider.getProviderName(), depth, level.size(), next.size());
            level = next;
        }

        return new ProviderReply(level.get(0), totalTokens);
    }

    /**
     * Splits {@code items} into consecutive sublists of at most {@code size}
     * elements, preserving order.
     */
    public static List<List<String>> partition(List<String> items, int size) {
        List<List<String>> batches = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            batches.add(items.subList(i, Math.min(i + size, items.size())));
        }
        return batches;
    }
}
