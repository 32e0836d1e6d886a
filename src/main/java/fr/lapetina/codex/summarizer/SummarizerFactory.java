package fr.lapetina.codex.summarizer;

import fr.lapetina.codex.summarizer.batch.ParallelSummarizer;
import fr.lapetina.codex.summarizer.batch.TokenWindowChunker;
import fr.lapetina.codex.summarizer.domain.provider.ProviderChain;
import fr.lapetina.codex.summarizer.domain.provider.ProviderFactory;
import fr.lapetina.codex.summarizer.domain.token.TokenAccountant;
import fr.lapetina.codex.summarizer.engine.SummarizationEngine;
import fr.lapetina.codex.summarizer.infrastructure.config.ConfigLoader;
import fr.lapetina.codex.summarizer.infrastructure.config.SummarizerConfig;
import fr.lapetina.codex.summarizer.infrastructure.http.HttpProviderFactory;
import fr.lapetina.codex.summarizer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Factory for creating a fully-wired summarizer from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SummarizerFactory factory = SummarizerFactory.create("config.yaml")) {
 *     BatchResult result = factory.getParallelSummarizer().summarize(units);
 * }
 * }</pre>
 */
public class SummarizerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SummarizerFactory.class);

    private final SummarizerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ProviderChain chain;
    private final SummarizationEngine engine;
    private final ParallelSummarizer parallelSummarizer;

    protected SummarizerFactory(String configPath, ProviderFactory providerFactoryOverride) {
        log.info("Initializing SummarizerFactory from config: {}", configPath);

        // Load configuration
        ConfigLoader configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Provider factory (allow override for testing)
        ProviderFactory providerFactory = providerFactoryOverride != null
                ? providerFactoryOverride
                : HttpProviderFactory.create(
                        Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                        Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()));

        // Fails before any closeable resource exists
        this.chain = ProviderChain.build(configLoader.toModelConfigs(config), providerFactory);

        this.metricsRegistry = createMetricsRegistry(config);
        try {
            SummarizerConfig.ProcessingConfig processing = config.getProcessing();
            TokenAccountant tokenAccountant = new TokenAccountant();

            this.engine = SummarizationEngine.builder()
                    .chain(chain)
                    .tokenAccountant(tokenAccountant)
                    .metrics(metricsRegistry)
                    .retryAttempts(config.getRetry().getAttempts())
                    .backoffBase(Duration.ofMillis(config.getRetry().getBackoffBaseMs()))
                    .fallbackEnabled(config.getRetry().isFallbackEnabled())
                    .chunkSizeThreshold(processing.getChunkSize())
                    .build();

            TokenWindowChunker chunker = new TokenWindowChunker(
                    tokenAccountant,
                    chain.primary().getModelName(),
                    processing.getChunkSize(),
                    processing.getChunkOverlap(),
                    processing.getMaxChunksPerFile());

            this.parallelSummarizer = new ParallelSummarizer(
                    engine,
                    chunker,
                    processing.getChunkSize(),
                    processing.getMaxWorkers(),
                    processing.getTimeoutSeconds());
        } catch (RuntimeException e) {
            metricsRegistry.close();
            throw e;
        }

        log.info("SummarizerFactory initialized: providers={}, fallbackEnabled={}",
                chain.size(), config.getRetry().isFallbackEnabled());
    }

    protected MetricsRegistry createMetricsRegistry(SummarizerConfig config) {
        return new MetricsRegistry(config.getMetrics().getPrefix());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static SummarizerFactory create(String configPath) {
        return new SummarizerFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static SummarizerFactory create() {
        return create("config.yaml");
    }

    public SummarizationEngine getEngine() {
        return engine;
    }

    public ParallelSummarizer getParallelSummarizer() {
        return parallelSummarizer;
    }

    public ProviderChain getChain() {
        return chain;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public SummarizerConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        log.info("Shutting down SummarizerFactory...");

        try {
            parallelSummarizer.close();
        } catch (Exception e) {
            log.warn("Error closing parallel summarizer", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("SummarizerFactory shut down");
    }
}
