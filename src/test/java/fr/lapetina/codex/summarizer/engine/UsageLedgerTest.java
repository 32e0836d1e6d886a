package fr.lapetina.codex.summarizer.engine;

import fr.lapetina.codex.summarizer.domain.model.ProviderType;
import fr.lapetina.codex.summarizer.domain.provider.ProviderChain;
import fr.lapetina.codex.summarizer.support.StubProviderAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class UsageLedgerTest {

    private static final ProviderChain CHAIN = ProviderChain.of(List.of(
            StubProviderAdapter.of(ProviderType.PERPLEXITY, "sonar-large-chat"),
            StubProviderAdapter.of(ProviderType.OPENAI, "gpt-4o")));

    @Test
    @DisplayName("should keep exact totals under concurrent updates")
    void shouldKeepExactTotalsUnderConcurrency() throws Exception {
        UsageLedger ledger = new UsageLedger();
        int threads = 8;
        int perThread = 1000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String provider = t % 2 == 0 ? "perplexity" : "openai";
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        ledger.recordSuccess(provider, 3);
                        ledger.recordError(provider);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        UsageSnapshot snapshot = ledger.snapshot(CHAIN, true);
        assertThat(snapshot.totalRequests()).isEqualTo(8000L);
        assertThat(snapshot.totalTokensUsed()).isEqualTo(24000L);
        assertThat(snapshot.estimatedCost()).isCloseTo(0.48, within(1e-9));
        assertThat(snapshot.statsFor("perplexity")).isEqualTo(new ProviderStats(4000, 12000, 4000));
        assertThat(snapshot.statsFor("openai")).isEqualTo(new ProviderStats(4000, 12000, 4000));
    }

    @Test
    @DisplayName("should detach snapshots from later updates")
    void shouldDetachSnapshot() {
        UsageLedger ledger = new UsageLedger();
        ledger.recordSuccess("openai", 10);

        UsageSnapshot before = ledger.snapshot(CHAIN, false);
        ledger.recordSuccess("openai", 5);
        ledger.recordError("anthropic");

        assertThat(before.totalRequests()).isEqualTo(1L);
        assertThat(before.statsFor("openai").tokens()).isEqualTo(10L);
        assertThat(before.providerStats()).doesNotContainKey("anthropic");
        assertThat(ledger.getTotalTokensUsed()).isEqualTo(15L);
    }

    @Test
    @DisplayName("should describe the chain")
    void shouldDescribeChain() {
        UsageSnapshot snapshot = new UsageLedger().snapshot(CHAIN, true);

        assertThat(snapshot.primaryProvider()).isEqualTo("perplexity");
        assertThat(snapshot.primaryModel()).isEqualTo("sonar-large-chat");
        assertThat(snapshot.providersConfigured()).isEqualTo(2);
        assertThat(snapshot.fallbackEnabled()).isTrue();
        assertThat(snapshot.statsFor("unused")).isEqualTo(ProviderStats.EMPTY);
        assertThat(snapshot.estimatedCost()).isZero();
    }
}
