package com.fsmgen.core.renderer;

import java.util.Objects;

/**
 * Generated code for one diagram, ready to be rendered.
 *
 * @param relativePath path of the output file relative to the output directory (e.g. "lights/traffic.inc")
 * @param content file content
 * @param sourceId identity of the diagram the content was generated from
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String sourceId
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
    }
}
