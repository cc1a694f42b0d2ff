package com.fsmgen.core.generator;

import java.util.Objects;

/**
 * Represents generated code for one diagram.
 *
 * @param name name hint the code was generated for
 * @param content generated source text
 * @param fileExtension file extension for this content
 */
public record GeneratedCode(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedCode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }
}
