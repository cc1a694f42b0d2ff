package com.fsmgen.core.generator;

import java.util.Objects;

/**
 * Configuration for code generation.
 *
 * @param namespace name hint for the generated unit, usually the diagram's file stem
 * @param indentWidth spaces per indentation level
 * @param emitComments whether to annotate dispatch cases with the transitions they come from
 */
public record GeneratorConfig(
    String namespace,
    int indentWidth,
    boolean emitComments
) {
    public static final int DEFAULT_INDENT_WIDTH = 2;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        Objects.requireNonNull(namespace, "namespace must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (indentWidth < 0 || indentWidth > 8) {
            throw new IllegalArgumentException("indentWidth must be between 0 and 8: " + indentWidth);
        }
    }

    /**
     * Creates a default configuration: two-space indentation with comments.
     *
     * @param namespace name hint for the generated unit
     * @return default generator config
     */
    public static GeneratorConfig defaults(String namespace) {
        return new GeneratorConfig(namespace, DEFAULT_INDENT_WIDTH, true);
    }
}
