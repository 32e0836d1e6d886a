package fr.lapetina.codex.summarizer.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * A unit of content to summarize. Immutable and thread-safe.
 *
 * @param content    text sent to the model
 * @param identifier file path or {@code path:start-end}, used for logging and attribution only
 * @param language   language hint used in the prompt
 * @param chunkType  granularity of the content
 * @param metadata   caller-owned attributes, opaque to the engine
 */
public record SummaryRequest(
        String content,
        String identifier,
        String language,
        ChunkType chunkType,
        Map<String, Object> metadata
) {
    public SummaryRequest {
        Objects.requireNonNull(content, "Content is required");
        Objects.requireNonNull(identifier, "Identifier is required");
        if (language == null || language.isBlank()) {
            language = "unknown";
        }
        if (chunkType == null) {
            chunkType = ChunkType.UNKNOWN;
        }
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Creates a whole-file request.
     */
    public static SummaryRequest ofFile(String path, String language, String content) {
        return new SummaryRequest(content, path, language, ChunkType.FILE, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String content;
        private String identifier;
        private String language;
        private ChunkType chunkType;
        private Map<String, Object> metadata;

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder chunkType(ChunkType chunkType) {
            this.chunkType = chunkType;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public SummaryRequest build() {
            return new SummaryRequest(content, identifier, language, chunkType, metadata);
        }
    }
}
