package fr.lapetina.codex.summarizer.support;

import fr.lapetina.codex.summarizer.domain.exception.ProviderException;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;
import fr.lapetina.codex.summarizer.domain.model.ProviderErrorType;
import fr.lapetina.codex.summarizer.domain.model.ProviderType;
import fr.lapetina.codex.summarizer.domain.provider.ProviderAdapter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * In-memory provider whose answers are scripted by the test.
 */
public final class StubProviderAdapter implements ProviderAdapter {

    private final ModelConfig modelConfig;
    private final AtomicInteger callCount = new AtomicInteger();
    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private volatile Function<String, String> behaviour = prompt -> "stub summary";

    public StubProviderAdapter(ModelConfig modelConfig) {
        this.modelConfig = modelConfig;
    }

    public static StubProviderAdapter of(ProviderType type, String model) {
        return new StubProviderAdapter(ModelConfig.of(type, model, "test-key"));
    }

    public static StubProviderAdapter of(ProviderType type, String model, int maxTokens) {
        return new StubProviderAdapter(ModelConfig.of(type, model, "test-key", maxTokens));
    }

    /**
     * Always answers {@code text}.
     */
    public StubProviderAdapter respondWith(String text) {
        this.behaviour = prompt -> text;
        return this;
    }

    public StubProviderAdapter respondWith(Function<String, String> behaviour) {
        this.behaviour = behaviour;
        return this;
    }

    /**
     * Always fails with the given error type.
     */
    public StubProviderAdapter failWith(ProviderErrorType type, String message) {
        this.behaviour = prompt -> {
            throw new ProviderException(getProviderName(), type, message);
        };
        return this;
    }

    /**
     * Fails the first {@code failures} calls, then answers {@code text}.
     */
    public StubProviderAdapter failTimesThenRespond(int failures, String text) {
        AtomicInteger remaining = new AtomicInteger(failures);
        this.behaviour = prompt -> {
            if (remaining.getAndDecrement() > 0) {
                throw new ProviderException(getProviderName(), ProviderErrorType.PROVIDER_ERROR, "HTTP 500: boom");
            }
            return text;
        };
        return this;
    }

    @Override
    public String invoke(String prompt) {
        callCount.incrementAndGet();
        prompts.add(prompt);
        return behaviour.apply(prompt);
    }

    @Override
    public ModelConfig getModelConfig() {
        return modelConfig;
    }

    public int getCallCount() {
        return callCount.get();
    }

    public List<String> getPrompts() {
        return List.copyOf(prompts);
    }

    public String lastPrompt() {
        return prompts.isEmpty() ? null : prompts.get(prompts.size() - 1);
    }
}
