package fr.lapetina.codex.summarizer;

import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;
import fr.lapetina.codex.summarizer.domain.model.ProviderType;
import fr.lapetina.codex.summarizer.domain.provider.ProviderFactory;
import fr.lapetina.codex.summarizer.infrastructure.config.SummarizerConfig;
import fr.lapetina.codex.summarizer.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.codex.summarizer.support.StubProviderAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SummarizerFactoryTest {

    private static final List<MetricsRegistry> CREATED_REGISTRIES = new CopyOnWriteArrayList<>();

    /**
     * Records every metrics registry the factory creates.
     */
    private static final class TrackingFactory extends SummarizerFactory {
        TrackingFactory(ProviderFactory providerFactory) {
            super("test-config.yaml", providerFactory);
        }

        @Override
        protected MetricsRegistry createMetricsRegistry(SummarizerConfig config) {
            MetricsRegistry registry = super.createMetricsRegistry(config);
            CREATED_REGISTRIES.add(registry);
            return registry;
        }
    }

    @BeforeEach
    void setUp() {
        CREATED_REGISTRIES.clear();
    }

    @Test
    @DisplayName("should not create metrics when no provider can be built")
    void shouldNotCreateMetricsWhenChainFails() {
        ProviderFactory nothingRegistered = new ProviderFactory();

        assertThatThrownBy(() -> new TrackingFactory(nothingRegistered))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("No AI providers");
        assertThat(CREATED_REGISTRIES).isEmpty();
    }

    @Test
    @DisplayName("should close its metrics registry on close")
    void shouldCloseMetricsRegistry() {
        ProviderFactory stubs = new ProviderFactory();
        for (ProviderType type : ProviderType.values()) {
            stubs.register(type, StubProviderAdapter::new);
        }

        TrackingFactory factory = new TrackingFactory(stubs);
        factory.close();

        assertThat(CREATED_REGISTRIES).hasSize(1);
        assertThat(CREATED_REGISTRIES.get(0).getRegistry().isClosed()).isTrue();
    }
}
