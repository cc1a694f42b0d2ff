package com.fsmgen.core.parser;

/**
 * Options controlling how strictly diagrams are parsed.
 *
 * @param strictNesting fail with {@link ErrorKind#CONFLICTING_PARENT} when a state is reopened
 *                      under a different parent instead of keeping the first parent
 */
public record ParserOptions(
    boolean strictNesting
) {
    /**
     * Creates the default options (lenient nesting).
     *
     * @return default parser options
     */
    public static ParserOptions defaults() {
        return new ParserOptions(false);
    }
}
