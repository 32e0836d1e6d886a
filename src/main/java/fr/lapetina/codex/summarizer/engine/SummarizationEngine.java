package fr.lapetina.codex.summarizer.engine;

import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;
import fr.lapetina.codex.summarizer.domain.exception.ProviderException;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;
import fr.lapetina.codex.summarizer.domain.model.ProviderErrorType;
import fr.lapetina.codex.summarizer.domain.model.SummaryRequest;
import fr.lapetina.codex.summarizer.domain.model.SummaryResponse;
import fr.lapetina.codex.summarizer.domain.provider.ProviderAdapter;
import fr.lapetina.codex.summarizer.domain.provider.ProviderChain;
import fr.lapetina.codex.summarizer.domain.provider.ProviderFactory;
import fr.lapetina.codex.summarizer.domain.token.TokenAccountant;
import fr.lapetina.codex.summarizer.infrastructure.http.HttpProviderFactory;
import fr.lapetina.codex.summarizer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns summarization requests into responses over an ordered provider chain.
 *
 * <p>Every request walks the chain from the primary. Each provider gets its own
 * content budget and truncation, then up to {@code retryAttempts} tries with
 * exponential backoff. The first success wins; failures fall through to the
 * next provider unless fallback is disabled. Public methods never throw for
 * provider failures: a failed call produces a response whose summary starts
 * with {@value SummaryResponse#ERROR_PREFIX}.
 *
 * <p>Thread-safe. One engine is shared by every worker of a run.
 */
public final class SummarizationEngine {

    private static final Logger log = LoggerFactory.getLogger(SummarizationEngine.class);

    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_CHUNK_SIZE_THRESHOLD = 2000;
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(1);

    // keeps 2^attempt well inside a long
    private static final int MAX_BACKOFF_SHIFT = 30;

    private final ProviderChain chain;
    private final TokenAccountant tokenAccountant;
    private final UsageLedger ledger;
    private final MetricsRegistry metrics;
    private final Sleeper sleeper;
    private final int retryAttempts;
    private final boolean fallbackEnabled;
    private final int chunkSizeThreshold;
    private final Duration backoffBase;
    private final HierarchicalAggregator aggregator;

    private SummarizationEngine(Builder builder) {
        this.chain = builder.chain;
        this.tokenAccountant = builder.tokenAccountant != null ? builder.tokenAccountant : new TokenAccountant();
        this.ledger = new UsageLedger();
        this.metrics = builder.metrics != null ? builder.metrics : new MetricsRegistry();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.retryAttempts = builder.retryAttempts;
        this.fallbackEnabled = builder.fallbackEnabled;
        this.chunkSizeThreshold = builder.chunkSizeThreshold;
        this.backoffBase = builder.backoffBase;
        this.aggregator = new HierarchicalAggregator(
                this::aggregateOnce, tokenAccountant, metrics, builder.aggregationBatchSize);

        metrics.registerGauge("ledger_requests", "Requests answered by any provider", ledger::getTotalRequests);
        metrics.registerGauge("ledger_tokens", "Tokens billed across providers", ledger::getTotalTokensUsed);

        log.info("SummarizationEngine created: chain={}, retryAttempts={}, fallbackEnabled={}, chunkSizeThreshold={}",
                chain, retryAttempts, fallbackEnabled, chunkSizeThreshold);
    }

    /**
     * Builds an engine over HTTP adapters with default timeouts.
     *
     * @throws ConfigurationException if no provider could be initialized
     */
    public static SummarizationEngine create(
            List<ModelConfig> configs,
            int retryAttempts,
            boolean fallbackEnabled,
            int chunkSizeThreshold
    ) {
        ProviderFactory factory = HttpProviderFactory.create(Duration.ofSeconds(10), Duration.ofSeconds(60));
        return builder()
                .chain(ProviderChain.build(configs, factory))
                .retryAttempts(retryAttempts)
                .fallbackEnabled(fallbackEnabled)
                .chunkSizeThreshold(chunkSizeThreshold)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Summarizes one piece of content.
     */
    public SummaryResponse summarize(SummaryRequest request) {
        Objects.requireNonNull(request, "Request is required");

        int primaryTokens = tokenAccountant.countTokens(request.content(), chain.primary().getModelName());
        PromptTemplate template = primaryTokens > chunkSizeThreshold
                ? PromptTemplate.FILE_SUMMARY
                : PromptTemplate.CHUNK_SUMMARY;

        log.debug("Summarizing: identifier={}, language={}, tokens={}, template={}",
                request.identifier(), request.language(), primaryTokens, template);

        return executeWithFallback(request.identifier(), provider -> {
            String content = tokenAccountant.truncate(
                    request.content(), contentBudget(provider), provider.getModelName());
            String prompt = template.format(Map.of(
                    "file_path", request.identifier(),
                    "language", request.language(),
                    "chunk_type", request.chunkType().label(),
                    "content", content));
            return request(provider, prompt, content);
        });
    }

    /**
     * Combines summaries into one. Each provider tried decides on its own
     * budget whether one request suffices or the list must be reduced in
     * batches; a provider failing midway hands the whole list to the next.
     */
    public SummaryResponse aggregate(List<String> summaries) {
        if (summaries == null || summaries.isEmpty()) {
            return SummaryResponse.empty();
        }
        List<String> input = List.copyOf(summaries);
        return executeWithFallback("aggregate", provider -> aggregator.aggregate(input, provider));
    }

    public UsageSnapshot usageSnapshot() {
        return ledger.snapshot(chain, fallbackEnabled);
    }

    public ProviderChain getChain() {
        return chain;
    }

    public TokenAccountant getTokenAccountant() {
        return tokenAccountant;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }

    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    /**
     * Content budget of {@code provider}: context window minus prompt reserve,
     * capped by its configured max tokens.
     */
    public int contentBudget(ProviderAdapter provider) {
        return tokenAccountant.contentBudget(provider.getModelConfig());
    }

    private ProviderReply aggregateOnce(ProviderAdapter provider, String combinedSummaries) {
        String content = tokenAccountant.truncate(combinedSummaries, contentBudget(provider), provider.getModelName());
        String prompt = PromptTemplate.AGGREGATE_SUMMARY.format(Map.of("summaries", content));
        return request(provider, prompt, content);
    }

    /**
     * One request with retries; the ledger is charged for the content sent
     * plus the text returned.
     */
    private ProviderReply request(ProviderAdapter provider, String prompt, String content) {
        String providerName = provider.getProviderName();
        String model = provider.getModelName();

        String text = invokeWithRetry(provider, prompt);
        int tokensUsed = tokenAccountant.countTokens(content, model) + tokenAccountant.countTokens(text, model);

        ledger.recordSuccess(providerName, tokensUsed);
        metrics.recordTokens(providerName, tokensUsed);
        return new ProviderReply(text.strip(), tokensUsed);
    }

    private SummaryResponse executeWithFallback(String target, ProviderCall call) {
        Instant start = Instant.now();

        for (int i = 0; i < chain.size(); i++) {
            ProviderAdapter provider = chain.get(i);
            String providerName = provider.getProviderName();
            String model = provider.getModelName();
            boolean fallback = i > 0;
            boolean lastProvider = i == chain.size() - 1;

            try {
                ProviderReply reply = call.execute(provider);
                if (fallback) {
                    metrics.incrementFallback(providerName);
                }

                log.debug("Request completed: target={}, provider={}, model={}, tokens={}, fallback={}",
                        target, providerName, model, reply.tokensUsed(), fallback);
                return SummaryResponse.success(reply.text(), reply.tokensUsed(), elapsedSince(start),
                        model, providerName, fallback);

            } catch (ProviderException e) {
                if (e.getErrorType() == ProviderErrorType.INTERRUPTED) {
                    log.warn("Request interrupted: target={}, provider={}", target, providerName);
                    return SummaryResponse.failure(SummaryResponse.ERROR_PREFIX + " Interrupted while calling "
                            + providerName, elapsedSince(start), model, providerName, e.getMessage(), fallback);
                }

                if (lastProvider) {
                    log.error("All providers failed: target={}, providers={}, lastError={}",
                            target, chain.size(), e.getMessage());
                    return SummaryResponse.failure(
                            SummaryResponse.ERROR_PREFIX + " All AI providers failed. Last error: " + e.getMessage(),
                            elapsedSince(start), SummaryResponse.NONE, SummaryResponse.NONE,
                            e.getMessage(), fallback);
                }

                if (!fallbackEnabled) {
                    log.error("Provider failed and fallback is disabled: target={}, provider={}, error={}",
                            target, providerName, e.getMessage());
                    return SummaryResponse.failure(
                            SummaryResponse.ERROR_PREFIX + " " + providerName + " failed and fallback disabled",
                            elapsedSince(start), model, providerName, e.getMessage(), false);
                }

                ProviderAdapter next = chain.get(i + 1);
                log.warn("Provider failed, falling back: target={}, from={}, to={}, error={}",
                        target, providerName, next.getProviderName(), e.getMessage());
            }
        }

        // ProviderChain is never empty
        throw new IllegalStateException("Provider chain exhausted without a result");
    }

    private String invokeWithRetry(ProviderAdapter provider, String prompt) {
        String providerName = provider.getProviderName();
        String model = provider.getModelName();
        ProviderException lastError = null;

        for (int attempt = 0; attempt < retryAttempts; attempt++) {
            Instant attemptStart = Instant.now();
            try {
                String text = provider.invoke(prompt);
                if (text == null) {
                    throw new ProviderException(providerName, ProviderErrorType.MALFORMED_RESPONSE,
                            "Provider returned no text");
                }
                metrics.recordLatency(providerName, model, elapsedSince(attemptStart));
                metrics.incrementAttempt(providerName, model, MetricsRegistry.OUTCOME_SUCCESS);
                return text;
            } catch (ProviderException e) {
                lastError = e;
            } catch (RuntimeException e) {
                lastError = new ProviderException(providerName, ProviderErrorType.INTERNAL_ERROR,
                        e.getClass().getSimpleName() + ": " + e.getMessage(), e);
            }

            ledger.recordError(providerName);
            metrics.recordLatency(providerName, model, elapsedSince(attemptStart));
            metrics.incrementAttempt(providerName, model, MetricsRegistry.OUTCOME_FAILURE);
            metrics.incrementErrorCount(providerName, lastError.getErrorType());

            if (!lastError.isRetryable()) {
                throw lastError;
            }

            if (attempt < retryAttempts - 1) {
                Duration wait = backoffBase.multipliedBy(1L << Math.min(attempt, MAX_BACKOFF_SHIFT));
                log.warn("Attempt failed, retrying: provider={}, attempt={}/{}, waitMs={}, error={}",
                        providerName, attempt + 1, retryAttempts, wait.toMillis(), lastError.getMessage());
                try {
                    sleeper.sleep(wait);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException(providerName, ProviderErrorType.INTERRUPTED,
                            "Interrupted during retry backoff", ie);
                }
            } else {
                log.warn("Final attempt failed: provider={}, attempts={}, error={}",
                        providerName, retryAttempts, lastError.getMessage());
            }
        }

        throw new ProviderException(providerName, lastError.getErrorType(),
                "All retry attempts failed for " + providerName + ". Last error: " + lastError.getMessage(),
                lastError);
    }

    private static Duration elapsedSince(Instant start) {
        return Duration.between(start, Instant.now());
    }

    /**
     * Work done against a single provider; throws to hand over to the next one.
     */
    @FunctionalInterface
    private interface ProviderCall {
        ProviderReply execute(ProviderAdapter provider);
    }

    /**
     * Builder for {@link SummarizationEngine}.
     */
    public static final class Builder {
        private ProviderChain chain;
        private TokenAccountant tokenAccountant;
        private MetricsRegistry metrics;
        private Sleeper sleeper;
        private int retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        private boolean fallbackEnabled = true;
        private int chunkSizeThreshold = DEFAULT_CHUNK_SIZE_THRESHOLD;
        private Duration backoffBase = DEFAULT_BACKOFF_BASE;
        private int aggregationBatchSize = HierarchicalAggregator.DEFAULT_BATCH_SIZE;

        private Builder() {
        }

        public Builder chain(ProviderChain chain) {
            this.chain = chain;
            return this;
        }

        public Builder providers(List<? extends ProviderAdapter> providers) {
            this.chain = ProviderChain.of(providers);
            return this;
        }

        public Builder tokenAccountant(TokenAccountant tokenAccountant) {
            this.tokenAccountant = tokenAccountant;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder fallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
            return this;
        }

        public Builder chunkSizeThreshold(int chunkSizeThreshold) {
            this.chunkSizeThreshold = chunkSizeThreshold;
            return this;
        }

        public Builder backoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder aggregationBatchSize(int aggregationBatchSize) {
            this.aggregationBatchSize = aggregationBatchSize;
            return this;
        }

        public SummarizationEngine build() {
            if (chain == null) {
                throw new ConfigurationException("Provider chain is required");
            }
            if (retryAttempts < 1) {
                throw new ConfigurationException("Retry attempts must be at least 1: " + retryAttempts);
            }
            if (backoffBase == null || backoffBase.isNegative()) {
                throw new ConfigurationException("Backoff base must be a non-negative duration");
            }
            return new SummarizationEngine(this);
        }
    }
}
