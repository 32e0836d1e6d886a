package fr.lapetina.codex.summarizer.domain.provider;

import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, immutable list of provider adapters. Index 0 is the primary; the
 * rest are fallbacks consulted strictly in order.
 */
public final class ProviderChain implements Iterable<ProviderAdapter> {

    private static final Logger log = LoggerFactory.getLogger(ProviderChain.class);

    private final List<ProviderAdapter> providers;

    private ProviderChain(List<ProviderAdapter> providers) {
        this.providers = List.copyOf(providers);
    }

    /**
     * Builds a chain from configuration order. Entries whose adapter cannot be
     * constructed are logged and skipped.
     *
     * @throws ConfigurationException if no entry could be initialized
     */
    public static ProviderChain build(List<ModelConfig> configs, ProviderFactory factory) {
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (ModelConfig config : configs) {
            try {
                ProviderAdapter adapter = factory.create(config);
                adapters.add(adapter);
                log.info("Initialized provider: provider={}, model={}, position={}",
                        config.provider(), config.model(), adapters.size() - 1);
            } catch (RuntimeException e) {
                log.warn("Failed to initialize provider, skipping: provider={}, model={}, error={}",
                        config.provider(), config.model(), e.getMessage());
            }
        }
        return of(adapters);
    }

    /**
     * Wraps already constructed adapters.
     *
     * @throws ConfigurationException if {@code adapters} is empty
     */
    public static ProviderChain of(List<? extends ProviderAdapter> adapters) {
        if (adapters == null || adapters.isEmpty()) {
            throw new ConfigurationException("No AI providers could be initialized");
        }
        return new ProviderChain(new ArrayList<>(adapters));
    }

    public ProviderAdapter primary() {
        return providers.get(0);
    }

    public List<ProviderAdapter> fallbacks() {
        return providers.subList(1, providers.size());
    }

    public ProviderAdapter get(int index) {
        return providers.get(index);
    }

    public int size() {
        return providers.size();
    }

    public List<ProviderAdapter> asList() {
        return providers;
    }

    @Override
    public Iterator<ProviderAdapter> iterator() {
        return providers.iterator();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ProviderChain[");
        for (int i = 0; i < providers.size(); i++) {
            if (i > 0) {
                sb.append(" -> ");
            }
            sb.append(providers.get(i).getProviderName()).append('/').append(providers.get(i).getModelName());
        }
        return sb.append(']').toString();
    }
}
