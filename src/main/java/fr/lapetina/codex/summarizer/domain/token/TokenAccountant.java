package fr.lapetina.codex.summarizer.domain.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import fr.lapetina.codex.summarizer.domain.model.ModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token counting, context-window lookup and budget truncation.
 *
 * Counting is exact under the BPE encoding jtokkit associates with the model;
 * models it does not know are counted with {@code cl100k_base}. Encoders are
 * memoized per model name and are read-only once created, so a single instance
 * can be shared by all worker threads.
 */
public final class TokenAccountant {

    private static final Logger log = LoggerFactory.getLogger(TokenAccountant.class);

    public static final int DEFAULT_CONTEXT_LIMIT = 4096;
    public static final int PROMPT_RESERVE = 1000;
    public static final int TRUNCATION_RESERVE = 10;
    public static final String TRUNCATION_MARKER = "\n... [truncated]";

    private static final Map<String, Integer> CONTEXT_LIMITS = Map.ofEntries(
            // OpenAI
            Map.entry("gpt-4", 8192),
            Map.entry("gpt-4-turbo", 128000),
            Map.entry("gpt-4o", 128000),
            Map.entry("gpt-4o-mini", 128000),
            Map.entry("gpt-3.5-turbo", 4096),
            Map.entry("gpt-3.5-turbo-16k", 16384),
            // Perplexity
            Map.entry("sonar-large-chat", 16384),
            Map.entry("sonar-medium-chat", 16384),
            Map.entry("sonar-small-chat", 16384),
            Map.entry("sonar-large-online", 16384),
            Map.entry("sonar-medium-online", 16384),
            Map.entry("sonar", 127072),
            Map.entry("sonar-pro", 200000),
            // Anthropic
            Map.entry("claude-3-opus-20240229", 200000),
            Map.entry("claude-3-sonnet-20240229", 200000),
            Map.entry("claude-3-haiku-20240307", 200000),
            Map.entry("claude-3-5-sonnet-20240620", 200000),
            Map.entry("claude-2.1", 200000),
            Map.entry("claude-2.0", 100000),
            Map.entry("claude-instant-1.2", 100000)
    );

    private final EncodingRegistry registry;
    private final Encoding defaultEncoding;
    private final Map<String, Encoding> encoders = new ConcurrentHashMap<>();

    public TokenAccountant() {
        this(Encodings.newLazyEncodingRegistry());
    }

    public TokenAccountant(EncodingRegistry registry) {
        this.registry = registry;
        this.defaultEncoding = registry.getEncoding(EncodingType.CL100K_BASE);
    }

    /**
     * Counts tokens in {@code text} under the tokenizer of {@code model}.
     * Special-token markers are counted as ordinary text.
     */
    public int countTokens(String text, String model) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoderFor(model).countTokensOrdinary(text);
    }

    /**
     * Maximum context window of {@code model}, or {@value #DEFAULT_CONTEXT_LIMIT}
     * for unknown models.
     */
    public int contextLimit(String model) {
        if (model == null) {
            return DEFAULT_CONTEXT_LIMIT;
        }
        return CONTEXT_LIMITS.getOrDefault(model, DEFAULT_CONTEXT_LIMIT);
    }

    /**
     * Tokens available to content for the given model once prompt scaffolding
     * and the expected response are reserved.
     */
    public int contentBudget(ModelConfig config) {
        int budget = Math.min(contextLimit(config.model()) - PROMPT_RESERVE, config.maxTokens());
        return Math.max(0, budget);
    }

    /**
     * Cuts {@code text} down to at most {@code maxTokens} tokens.
     *
     * <p>Text that already fits is returned as-is. Otherwise the token prefix is
     * decoded and {@link #TRUNCATION_MARKER} appended, leaving
     * {@value #TRUNCATION_RESERVE} tokens of room. Re-encoding a decoded prefix can
     * merge across the cut, so the prefix shrinks until the whole result fits.
     * Applying it twice yields the same text.
     */
    public String truncate(String text, int maxTokens, String model) {
        if (text == null || text.isEmpty()) {
            return text == null ? "" : text;
        }
        Encoding encoding = encoderFor(model);
        IntArrayList tokens = encoding.encodeOrdinary(text);
        if (tokens.size() <= maxTokens) {
            return text;
        }
        if (maxTokens <= 0) {
            return "";
        }

        String marker = TRUNCATION_MARKER;
        int keep = maxTokens - TRUNCATION_RESERVE;
        if (keep <= 0) {
            // no room for the marker
            marker = "";
            keep = maxTokens;
        }

        String candidate = decodePrefix(encoding, tokens, keep) + marker;
        while (keep > 0 && encoding.countTokensOrdinary(candidate) > maxTokens) {
            keep--;
            candidate = decodePrefix(encoding, tokens, keep) + marker;
        }
        if (encoding.countTokensOrdinary(candidate) > maxTokens) {
            return "";
        }
        return candidate;
    }

    private String decodePrefix(Encoding encoding, IntArrayList tokens, int length) {
        if (length <= 0) {
            return "";
        }
        IntArrayList prefix = new IntArrayList(length);
        for (int i = 0; i < length; i++) {
            prefix.add(tokens.get(i));
        }
        return encoding.decode(prefix);
    }

    private Encoding encoderFor(String model) {
        if (model == null || model.isBlank()) {
            return defaultEncoding;
        }
        return encoders.computeIfAbsent(model, this::resolveEncoding);
    }

    private Encoding resolveEncoding(String model) {
        return registry.getEncodingForModel(model).orElseGet(() -> {
            log.debug("No tokenizer registered for model={}, using cl100k_base", model);
            return defaultEncoding;
        });
    }
}
