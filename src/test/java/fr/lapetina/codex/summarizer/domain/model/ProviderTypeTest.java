package fr.lapetina.codex.summarizer.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderTypeTest {

    @ParameterizedTest
    @CsvSource({
            "gpt-4o, OPENAI",
            "claude-3-opus-20240229, ANTHROPIC",
            "sonar-large-chat, PERPLEXITY",
            "mistral-large, OPENAI"
    })
    @DisplayName("should detect provider from model prefix")
    void shouldDetectProviderFromModel(String model, ProviderType expected) {
        assertThat(ProviderType.detectFromModel(model)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should resolve ids case-insensitively")
    void shouldResolveIds() {
        assertThat(ProviderType.fromId("Anthropic")).contains(ProviderType.ANTHROPIC);
        assertThat(ProviderType.fromId("cohere")).isEmpty();
        assertThat(ProviderType.fromId(null)).isEmpty();
    }

    @Test
    @DisplayName("should cap response tokens for capped providers only")
    void shouldCapResponseTokens() {
        assertThat(ProviderType.PERPLEXITY.capResponseTokens(16000)).isEqualTo(4096);
        assertThat(ProviderType.ANTHROPIC.capResponseTokens(100000)).isEqualTo(4096);
        assertThat(ProviderType.ANTHROPIC.capResponseTokens(1000)).isEqualTo(1000);
        assertThat(ProviderType.OPENAI.capResponseTokens(8000)).isEqualTo(8000);
    }

    @Test
    @DisplayName("should map HTTP status to error type")
    void shouldMapStatusToErrorType() {
        assertThat(ProviderErrorType.fromStatus(429)).isEqualTo(ProviderErrorType.RATE_LIMITED);
        assertThat(ProviderErrorType.fromStatus(408)).isEqualTo(ProviderErrorType.TIMEOUT);
        assertThat(ProviderErrorType.fromStatus(401)).isEqualTo(ProviderErrorType.CLIENT_ERROR);
        assertThat(ProviderErrorType.fromStatus(503)).isEqualTo(ProviderErrorType.PROVIDER_ERROR);
    }
}
