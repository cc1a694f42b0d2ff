package com.fsmgen.core.parser;

import com.fsmgen.core.model.SourceLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw diagram text into located, cleaned lines.
 *
 * <p>Lines starting with a directive ({@code @startuml}), {@code title }, {@code hide empty } or
 * {@code note } are blanked. Other lines lose their color tags and everything from the first
 * quote character on, and are trimmed. Lines that end up empty are dropped. This stage never
 * rejects input.
 */
public class LineNormalizer {

    /**
     * Normalizes the lines of a diagram.
     *
     * @param sourceId identity of the diagram, kept on every line for diagnostics
     * @param content raw diagram text
     * @return non-empty cleaned lines in source order
     */
    public List<SourceLine> normalize(String sourceId, String content) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(content, "content must not be null");

        String[] rawLines = content.split("\n", -1);
        List<SourceLine> lines = new ArrayList<>();

        for (int i = 0; i < rawLines.length; i++) {
            String text = clean(rawLines[i]);
            if (!text.isEmpty()) {
                lines.add(new SourceLine(sourceId, i + 1, rawLines[i], text));
            }
        }
        return lines;
    }

    /**
     * Cleans a single raw line.
     *
     * @param raw raw line text
     * @return normalized text, possibly empty
     */
    String clean(String raw) {
        for (String prefix : DiagramPatterns.IGNORED_LINE_PREFIXES) {
            if (raw.startsWith(prefix)) {
                return "";
            }
        }

        String text = DiagramPatterns.COLOR_TAG.matcher(raw).replaceAll("");
        int quote = text.indexOf(DiagramPatterns.COMMENT_QUOTE);
        if (quote >= 0) {
            text = text.substring(0, quote);
        }
        return text.strip();
    }
}
