package fr.lapetina.codex.summarizer.batch;

import fr.lapetina.codex.summarizer.domain.model.ChunkType;
import fr.lapetina.codex.summarizer.domain.model.SummaryRequest;
import fr.lapetina.codex.summarizer.domain.token.TokenAccountant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenWindowChunkerTest {

    private static final TokenAccountant TOKENS = new TokenAccountant();
    private static final String MODEL = "gpt-4o";

    private static SummaryRequest unit(int lines) {
        List<String> content = new ArrayList<>();
        for (int i = 0; i < lines; i++) {
            content.add("int value" + i + " = compute(" + i + ");");
        }
        return SummaryRequest.ofFile("src/Main.java", "java", String.join("\n", content));
    }

    private static int start(SummaryRequest chunk) {
        String range = chunk.identifier().substring(chunk.identifier().lastIndexOf(':') + 1);
        return Integer.parseInt(range.split("-")[0]);
    }

    private static int end(SummaryRequest chunk) {
        String range = chunk.identifier().substring(chunk.identifier().lastIndexOf(':') + 1);
        return Integer.parseInt(range.split("-")[1]);
    }

    @Test
    @DisplayName("should cover content contiguously without overlap")
    void shouldCoverContentWithoutOverlap() {
        SummaryRequest unit = unit(60);
        TokenWindowChunker chunker = new TokenWindowChunker(TOKENS, MODEL, 50, 0, 100);

        List<SummaryRequest> chunks = chunker.chunk(unit);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(start(chunks.get(0))).isZero();
        assertThat(end(chunks.get(chunks.size() - 1))).isEqualTo(60);
        for (int i = 1; i < chunks.size(); i++) {
            assertThat(start(chunks.get(i))).isEqualTo(end(chunks.get(i - 1)));
        }
        List<String> contents = chunks.stream().map(SummaryRequest::content).toList();
        assertThat(String.join("\n", contents)).isEqualTo(unit.content());
    }

    @Test
    @DisplayName("should keep chunks within the window")
    void shouldKeepChunksWithinWindow() {
        TokenWindowChunker chunker = new TokenWindowChunker(TOKENS, MODEL, 50, 0, 100);

        for (SummaryRequest chunk : chunker.chunk(unit(60))) {
            // joining newlines may merge with line tokens, allow one per line
            int lines = chunk.content().split("\n", -1).length;
            assertThat(TOKENS.countTokens(chunk.content(), MODEL)).isLessThanOrEqualTo(50 + lines);
        }
    }

    @Test
    @DisplayName("should carry overlapping lines into the next chunk")
    void shouldCarryOverlap() {
        TokenWindowChunker chunker = new TokenWindowChunker(TOKENS, MODEL, 50, 20, 100);

        List<SummaryRequest> chunks = chunker.chunk(unit(60));

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(start(chunks.get(1))).isLessThan(end(chunks.get(0)));
        String lastLineOfFirst = chunks.get(0).content().substring(chunks.get(0).content().lastIndexOf('\n') + 1);
        assertThat(chunks.get(1).content()).contains(lastLineOfFirst);
    }

    @Test
    @DisplayName("should label chunks as blocks of the unit")
    void shouldLabelChunks() {
        TokenWindowChunker chunker = new TokenWindowChunker(TOKENS, MODEL, 50, 0, 100);

        List<SummaryRequest> chunks = chunker.chunk(unit(60));

        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.chunkType()).isEqualTo(ChunkType.BLOCK);
            assertThat(chunk.language()).isEqualTo("java");
            assertThat(chunk.identifier()).matches("src/Main\\.java:\\d+-\\d+");
        });
    }

    @Test
    @DisplayName("should stop at the chunk limit")
    void shouldStopAtChunkLimit() {
        TokenWindowChunker chunker = new TokenWindowChunker(TOKENS, MODEL, 20, 0, 3);

        assertThat(chunker.chunk(unit(200))).hasSize(3);
    }

    @Test
    @DisplayName("should return a single chunk for small content")
    void shouldReturnSingleChunk() {
        TokenWindowChunker chunker = new TokenWindowChunker(TOKENS, MODEL, 2000, 400, 10);

        List<SummaryRequest> chunks = chunker.chunk(unit(3));

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).identifier()).isEqualTo("src/Main.java:0-3");
    }

    @Test
    @DisplayName("should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new TokenWindowChunker(TOKENS, MODEL, 0, 0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenWindowChunker(TOKENS, MODEL, 10, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
