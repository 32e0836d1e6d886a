package fr.lapetina.codex.summarizer.infrastructure.metrics;

import fr.lapetina.codex.summarizer.domain.model.ProviderErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Provider attempt counters by outcome
 * - Provider latency timers
 * - Error counters by type
 * - Fallback and aggregation batch counters
 * - Token usage distribution per provider
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> fallbackCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> tokenSummaries = new ConcurrentHashMap<>();
    private final Counter aggregationBatches;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        this.aggregationBatches = Counter.builder(prefix + "_aggregation_batches_total")
                .description("Batch reductions performed by hierarchical aggregation")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("codex");
    }

    /**
     * Counts one provider attempt (a single invoke, retries included).
     */
    public void incrementAttempt(String provider, String model, String outcome) {
        String key = provider + ":" + model + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_attempts_total")
                        .description("Provider invocations by outcome")
                        .tag("provider", provider)
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the latency of one provider invocation.
     */
    public void recordLatency(String provider, String model, Duration latency) {
        String key = provider + ":" + model;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_provider_latency")
                        .description("Provider request latency")
                        .tag("provider", provider)
                        .tag("model", model)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String provider, ProviderErrorType errorType) {
        String key = provider + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_errors_total")
                        .description("Provider errors by type")
                        .tag("provider", provider)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a request answered by a provider other than the primary.
     */
    public void incrementFallback(String provider) {
        fallbackCounters.computeIfAbsent(provider, k ->
                Counter.builder(prefix + "_fallbacks_total")
                        .description("Requests served by a fallback provider")
                        .tag("provider", provider)
                        .register(registry)
        ).increment();
    }

    /**
     * Records the tokens billed for one successful request.
     */
    public void recordTokens(String provider, int tokens) {
        tokenSummaries.computeIfAbsent(provider, k ->
                DistributionSummary.builder(prefix + "_tokens_per_request")
                        .description("Input plus output tokens per successful request")
                        .tag("provider", provider)
                        .register(registry)
        ).record(tokens);
    }

    public void incrementAggregationBatches() {
        aggregationBatches.increment();
    }

    /**
     * Registers a gauge backed by the given supplier.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(prefix + "_" + name, valueSupplier, s -> s.get().doubleValue())
                .description(description)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
