package fr.lapetina.codex.summarizer.integration;

import fr.lapetina.codex.summarizer.CodexSummarizerApplication;
import fr.lapetina.codex.summarizer.batch.BatchResult;
import fr.lapetina.codex.summarizer.domain.model.ProviderErrorType;
import fr.lapetina.codex.summarizer.domain.model.ProviderType;
import fr.lapetina.codex.summarizer.domain.model.SummaryRequest;
import fr.lapetina.codex.summarizer.domain.model.SummaryResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests from configuration to master summary.
 * Configuration is externalized to test-config.yaml.
 */
class SummarizerIntegrationTest {

    private TestSummarizerFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestSummarizerFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should wire chain in configuration order")
    void shouldWireChain() {
        assertThat(factory.getChain().size()).isEqualTo(2);
        assertThat(factory.getChain().primary().getProviderName()).isEqualTo("perplexity");
        assertThat(factory.getEngine().isFallbackEnabled()).isTrue();
    }

    @Test
    @DisplayName("should fall back to secondary provider end to end")
    void shouldFallBackEndToEnd() {
        factory.stub(ProviderType.PERPLEXITY).failWith(ProviderErrorType.RATE_LIMITED, "HTTP 429: slow down");
        factory.stub(ProviderType.OPENAI).respondWith("Summary from OpenAI");

        SummaryResponse response = factory.getEngine()
                .summarize(SummaryRequest.ofFile("main.py", "python", "print('hi')"));

        assertThat(response.summary()).isEqualTo("Summary from OpenAI");
        assertThat(response.fallbackUsed()).isTrue();
        // retry.attempts is 2 in test-config.yaml
        assertThat(factory.stub(ProviderType.PERPLEXITY).getCallCount()).isEqualTo(2);
        assertThat(factory.getEngine().usageSnapshot().statsFor("perplexity").errors()).isEqualTo(2L);
    }

    @Test
    @DisplayName("should summarize files and report master summary")
    void shouldSummarizeFiles(@TempDir Path dir) throws IOException {
        Path first = Files.writeString(dir.resolve("Service.java"), "class Service { void run() {} }");
        Path second = Files.writeString(dir.resolve("util.py"), "def helper():\n    return 42\n");
        factory.stub(ProviderType.PERPLEXITY).respondWith(prompt ->
                prompt.contains("File summaries:") ? "Project overview" : "A unit");

        CodexSummarizerApplication app = new CodexSummarizerApplication(factory);
        BatchResult result = app.run(List.of(first, second));

        assertThat(result.summaries()).hasSize(2);
        assertThat(result.summaries().get(0).language()).isEqualTo("java");
        assertThat(result.summaries().get(1).language()).isEqualTo("python");
        assertThat(result.masterSummary()).isEqualTo("Project overview");
        assertThat(result.usage().totalRequests()).isEqualTo(3L);
        assertThat(factory.stub(ProviderType.OPENAI).getCallCount()).isZero();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        app.report(result, new PrintStream(out, true, StandardCharsets.UTF_8));
        assertThat(out.toString(StandardCharsets.UTF_8)).startsWith("Project overview");
    }

    @Test
    @DisplayName("should expose provider metrics")
    void shouldExposeMetrics() {
        factory.stub(ProviderType.PERPLEXITY).respondWith("ok");

        factory.getEngine().summarize(SummaryRequest.ofFile("a.go", "go", "package main"));

        assertThat(factory.getMetricsRegistry().scrape())
                .contains("codex_test_provider_attempts_total")
                .contains("outcome=\"success\"");
    }
}
