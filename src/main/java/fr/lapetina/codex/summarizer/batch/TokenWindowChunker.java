package fr.lapetina.codex.summarizer.batch;

import fr.lapetina.codex.summarizer.domain.model.ChunkType;
import fr.lapetina.codex.summarizer.domain.model.SummaryRequest;
import fr.lapetina.codex.summarizer.domain.token.TokenAccountant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits oversized content into line-aligned chunks of roughly
 * {@code chunkSize} tokens.
 *
 * Lines are accumulated until the next one would push the chunk over the
 * window. The following chunk starts with the tail of the previous one,
 * {@code lines * overlap / chunkSize} lines long. A single line larger than
 * the window becomes a chunk of its own.
 */
public final class TokenWindowChunker {

    private static final Logger log = LoggerFactory.getLogger(TokenWindowChunker.class);

    private final TokenAccountant tokenAccountant;
    private final String model;
    private final int chunkSize;
    private final int overlap;
    private final int maxChunks;

    public TokenWindowChunker(TokenAccountant tokenAccountant, String model, int chunkSize, int overlap, int maxChunks) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("Overlap must not be negative: " + overlap);
        }
        if (maxChunks <= 0) {
            throw new IllegalArgumentException("Max chunks must be positive: " + maxChunks);
        }
        this.tokenAccountant = tokenAccountant;
        this.model = model;
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.maxChunks = maxChunks;
    }

    /**
     * Chunks one unit. Each chunk keeps the unit's language and is identified
     * as {@code identifier:startLine-endLine} (0-based start, exclusive end).
     */
    public List<SummaryRequest> chunk(SummaryRequest unit) {
        List<String> lines = Arrays.asList(unit.content().split("\n", -1));
        List<SummaryRequest> chunks = new ArrayList<>();

        List<String> current = new ArrayList<>();
        int currentTokens = 0;

        for (int i = 0; i < lines.size() && chunks.size() < maxChunks; i++) {
            String line = lines.get(i);
            int lineTokens = tokenAccountant.countTokens(line, model);

            if (currentTokens + lineTokens > chunkSize && !current.isEmpty()) {
                chunks.add(toChunk(unit, current, i - current.size(), i));

                int overlapLines = Math.min(current.size() * overlap / chunkSize, current.size() - 1);
                current = overlapLines > 0
                        ? new ArrayList<>(current.subList(current.size() - overlapLines, current.size()))
                        : new ArrayList<>();
                currentTokens = 0;
                for (String kept : current) {
                    currentTokens += tokenAccountant.countTokens(kept, model);
                }
            }

            current.add(line);
            currentTokens += lineTokens;
        }

        if (!current.isEmpty() && chunks.size() < maxChunks) {
            chunks.add(toChunk(unit, current, lines.size() - current.size(), lines.size()));
        }

        if (chunks.size() >= maxChunks) {
            log.debug("Chunk limit reached: identifier={}, maxChunks={}", unit.identifier(), maxChunks);
        }
        log.debug("Chunked unit: identifier={}, lines={}, chunks={}", unit.identifier(), lines.size(), chunks.size());
        return chunks;
    }

    private static SummaryRequest toChunk(SummaryRequest unit, List<String> lines, int start, int end) {
        return SummaryRequest.builder()
                .content(String.join("\n", lines))
                .identifier(unit.identifier() + ":" + start + "-" + end)
                .language(unit.language())
                .chunkType(ChunkType.BLOCK)
                .metadata(unit.metadata())
                .build();
    }
}
