package fr.lapetina.codex.summarizer.domain.model;

import java.util.Locale;

/**
 * Granularity of the content carried by a {@link SummaryRequest}.
 */
public enum ChunkType {
    FILE,
    FUNCTION,
    CLASS,
    BLOCK,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; anything unrecognized becomes {@link #UNKNOWN}.
     */
    public static ChunkType fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
