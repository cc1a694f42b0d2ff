package com.fsmgen.core.model;

import java.util.Objects;

/**
 * A physical line of a diagram, located for diagnostics.
 *
 * <p>{@code originalText} is the line exactly as read; {@code text} is the normalized form the
 * parser stages match against. Neither carries any meaning once the model is built.
 *
 * @param sourceId identity of the diagram (usually its file name)
 * @param lineNumber 1-based line number, or 0 when the whole diagram is meant
 * @param originalText raw line text
 * @param text normalized line text
 */
public record SourceLine(
    String sourceId,
    int lineNumber,
    String originalText,
    String text
) {
    /**
     * Compact constructor with validation.
     */
    public SourceLine {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(originalText, "originalText must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (lineNumber < 0) {
            throw new IllegalArgumentException("lineNumber must not be negative: " + lineNumber);
        }
    }

    /**
     * Creates a placeholder line referring to the diagram as a whole.
     *
     * @param sourceId identity of the diagram
     * @return line with number 0 and empty text
     */
    public static SourceLine wholeSource(String sourceId) {
        return new SourceLine(sourceId, 0, "", "");
    }

    /**
     * Returns {@code sourceId:lineNumber}, or just the source id for whole-source lines.
     *
     * @return location string
     */
    public String location() {
        return lineNumber == 0 ? sourceId : sourceId + ":" + lineNumber;
    }

    @Override
    public String toString() {
        return location();
    }
}
