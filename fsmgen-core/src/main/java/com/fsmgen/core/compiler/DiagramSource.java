package com.fsmgen.core.compiler;

import java.util.Objects;

/**
 * A diagram handed to the compiler.
 *
 * @param sourceId identity used in diagnostics, e.g. the file name
 * @param content diagram text
 * @param name name hint for the generated unit, e.g. the file stem
 */
public record DiagramSource(
    String sourceId,
    String content,
    String name
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramSource {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }
}
