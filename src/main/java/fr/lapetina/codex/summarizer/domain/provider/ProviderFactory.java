package fr.lapetina.codex.summarizer.domain.provider;

import fr.lapetina.codex.summarizer.domain.exception.ConfigurationException;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;
import fr.lapetina.codex.summarizer.domain.model.ProviderType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry mapping each {@link ProviderType} to the constructor of its adapter.
 *
 * Instances are populated once during wiring and then only read.
 */
public final class ProviderFactory {

    private final Map<ProviderType, Function<ModelConfig, ProviderAdapter>> registry =
            new EnumMap<>(ProviderType.class);

    /**
     * Registers (or replaces) the adapter constructor for a provider kind.
     */
    public ProviderFactory register(ProviderType type, Function<ModelConfig, ProviderAdapter> constructor) {
        registry.put(type, constructor);
        return this;
    }

    /**
     * Builds the adapter for {@code config}.
     *
     * @throws ConfigurationException if no constructor is registered or construction fails
     */
    public ProviderAdapter create(ModelConfig config) {
        Function<ModelConfig, ProviderAdapter> constructor = registry.get(config.provider());
        if (constructor == null) {
            throw new ConfigurationException("No adapter registered for provider: " + config.provider());
        }
        try {
            return constructor.apply(config);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException(
                    "Failed to initialize " + config.provider() + " provider: " + e.getMessage(), e);
        }
    }

    public Set<ProviderType> getRegisteredTypes() {
        return Set.copyOf(registry.keySet());
    }
}
