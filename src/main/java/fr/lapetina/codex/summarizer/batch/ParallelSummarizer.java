package fr.lapetina.codex.summarizer.batch;

import fr.lapetina.codex.summarizer.domain.exception.ProcessingException;
import fr.lapetina.codex.summarizer.domain.model.SummaryRequest;
import fr.lapetina.codex.summarizer.domain.model.SummaryResponse;
import fr.lapetina.codex.summarizer.engine.SummarizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Summarizes many units concurrently over one shared engine, then aggregates
 * the results into a master summary.
 *
 * <p>Units run on a fixed pool of {@code maxWorkers} threads. Once a worker
 * picks a unit up, the engine runs it on a separate thread and the worker waits
 * at most {@code timeoutSeconds}, so time spent queued never counts against the
 * unit. A timed-out unit is interrupted and abandoned. A unit that fails or
 * times out becomes an {@code "Error: Failed to process ..."} entry and the
 * run continues. Units
 * larger than four chunk windows are split by the {@link TokenWindowChunker}
 * and summarized chunk by chunk.
 */
public final class ParallelSummarizer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelSummarizer.class);

    static final String EMPTY_UNIT = "Empty file";
    static final String NO_VALID_SUMMARIES = "No valid summaries could be generated.";
    static final String CHUNKED_PREFIX = "File summary (chunked):\n";
    static final int FALLBACK_UNITS_PER_LANGUAGE = 10;
    static final int FALLBACK_EXCERPT_LENGTH = 200;

    private final SummarizationEngine engine;
    private final TokenWindowChunker chunker;
    private final int chunkSize;
    private final long timeoutSeconds;
    private final ExecutorService executor;
    private final ExecutorService engineExecutor;

    public ParallelSummarizer(
            SummarizationEngine engine,
            TokenWindowChunker chunker,
            int chunkSize,
            int maxWorkers,
            long timeoutSeconds
    ) {
        this.engine = engine;
        this.chunker = chunker;
        this.chunkSize = chunkSize;
        this.timeoutSeconds = timeoutSeconds;
        this.executor = Executors.newFixedThreadPool(maxWorkers, new WorkerThreadFactory("summarizer-worker"));
        this.engineExecutor = Executors.newCachedThreadPool(new WorkerThreadFactory("summarizer-engine"));

        log.info("ParallelSummarizer created: maxWorkers={}, timeoutSeconds={}, chunkSize={}",
                maxWorkers, timeoutSeconds, chunkSize);
    }

    /**
     * Summarizes every unit and aggregates the valid results.
     * Never throws for provider or unit failures.
     */
    public BatchResult summarize(List<SummaryRequest> units) {
        Instant start = Instant.now();
        AtomicInteger fallbackCount = new AtomicInteger();

        List<CompletableFuture<String>> futures = new ArrayList<>(units.size());
        for (SummaryRequest unit : units) {
            futures.add(CompletableFuture.supplyAsync(() -> runWithTimeout(unit, fallbackCount), executor));
        }

        List<UnitSummary> summaries = new ArrayList<>(units.size());
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            SummaryRequest unit = units.get(i);
            String summary;
            try {
                summary = futures.get(i).join();
                log.debug("Processed unit: identifier={}", unit.identifier());
            } catch (CompletionException e) {
                String errorMessage = "Failed to process " + unit.identifier() + ": " + describe(e.getCause());
                log.error(errorMessage);
                errors.add(errorMessage);
                summary = SummaryResponse.ERROR_PREFIX + " " + errorMessage;
            }
            summaries.add(new UnitSummary(unit.identifier(), unit.language(), summary));
        }

        MasterSummary master = createMasterSummary(summaries, fallbackCount);
        Duration elapsed = Duration.between(start, Instant.now());

        log.info("Batch completed: units={}, errors={}, fallbacks={}, elapsedMs={}",
                units.size(), errors.size(), fallbackCount.get(), elapsed.toMillis());

        return new BatchResult(summaries, errors, fallbackCount.get(), master.text(), master.fromAi(),
                engine.usageSnapshot(), elapsed);
    }

    /**
     * Runs on a worker: the timeout clock starts here, not at submission.
     */
    private String runWithTimeout(SummaryRequest unit, AtomicInteger fallbackCount) {
        Future<String> task = engineExecutor.submit(() -> processUnit(unit, fallbackCount));
        try {
            return task.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("Unit timed out, abandoning: identifier={}, timeoutSeconds={}",
                    unit.identifier(), timeoutSeconds);
            throw new CompletionException(e);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        }
    }

    private String processUnit(SummaryRequest unit, AtomicInteger fallbackCount) {
        if (unit.content().isBlank()) {
            return EMPTY_UNIT;
        }

        String primaryModel = engine.getChain().primary().getModelName();
        int tokens = engine.getTokenAccountant().countTokens(unit.content(), primaryModel);
        if (tokens > chunkSize * 4) {
            return processLargeUnit(unit, fallbackCount);
        }

        SummaryResponse response = engine.summarize(unit);
        countFallback(response, unit.identifier(), fallbackCount);
        if (response.isError()) {
            throw new ProcessingException("AI summarization failed: " + response.error());
        }
        return response.summary();
    }

    private String processLargeUnit(SummaryRequest unit, AtomicInteger fallbackCount) {
        List<SummaryRequest> chunks = chunker.chunk(unit);
        List<String> chunkSummaries = new ArrayList<>();

        for (SummaryRequest chunk : chunks) {
            SummaryResponse response = engine.summarize(chunk);
            countFallback(response, chunk.identifier(), fallbackCount);
            if (response.isError()) {
                log.warn("Failed to summarize chunk: identifier={}, error={}", chunk.identifier(), response.error());
            } else {
                chunkSummaries.add(response.summary());
            }
        }

        if (chunkSummaries.isEmpty()) {
            return "Could not summarize file " + unit.identifier() + " (all chunks failed)";
        }
        return CHUNKED_PREFIX + String.join("\n\n", chunkSummaries);
    }

    private MasterSummary createMasterSummary(List<UnitSummary> summaries, AtomicInteger fallbackCount) {
        List<String> valid = new ArrayList<>();
        for (UnitSummary summary : summaries) {
            if (!summary.isError()) {
                valid.add(summary.summary());
            }
        }
        if (valid.isEmpty()) {
            return new MasterSummary(NO_VALID_SUMMARIES, false);
        }

        log.info("Aggregating summaries: count={}", valid.size());
        SummaryResponse response = engine.aggregate(valid);
        countFallback(response, "aggregate", fallbackCount);
        if (response.isError()) {
            log.warn("AI aggregation failed, assembling summary locally: error={}", response.error());
            return new MasterSummary(fallbackSummary(summaries), false);
        }
        return new MasterSummary(response.summary(), true);
    }

    /**
     * Plain per-language listing used when aggregation fails on every provider.
     */
    static String fallbackSummary(List<UnitSummary> summaries) {
        Map<String, List<UnitSummary>> byLanguage = new LinkedHashMap<>();
        for (UnitSummary summary : summaries) {
            byLanguage.computeIfAbsent(summary.language(), k -> new ArrayList<>()).add(summary);
        }

        StringBuilder sb = new StringBuilder("# Codebase Summary\n\n");
        byLanguage.forEach((language, units) -> {
            sb.append("## ").append(titleCase(language)).append(" Files\n");
            for (UnitSummary unit : units.subList(0, Math.min(units.size(), FALLBACK_UNITS_PER_LANGUAGE))) {
                if (!unit.isError()) {
                    String text = unit.summary();
                    String excerpt = text.length() > FALLBACK_EXCERPT_LENGTH
                            ? text.substring(0, FALLBACK_EXCERPT_LENGTH)
                            : text;
                    sb.append("**").append(unit.identifier()).append("**: ").append(excerpt).append("...\n");
                }
            }
            sb.append('\n');
        });
        return sb.toString();
    }

    private static String titleCase(String language) {
        if (language.isEmpty()) {
            return language;
        }
        return language.substring(0, 1).toUpperCase(Locale.ROOT) + language.substring(1);
    }

    private static void countFallback(SummaryResponse response, String identifier, AtomicInteger fallbackCount) {
        if (response.fallbackUsed()) {
            fallbackCount.incrementAndGet();
            log.info("Used fallback provider: identifier={}, provider={}", identifier, response.providerUsed());
        }
    }

    private String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "timed out after " + timeoutSeconds + "s";
        }
        return cause != null ? cause.getMessage() : "unknown error";
    }

    @Override
    public void close() {
        shutdown(executor);
        shutdown(engineExecutor);
        log.info("ParallelSummarizer shut down");
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Workers did not finish in time, interrupting");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record MasterSummary(String text, boolean fromAi) {
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
