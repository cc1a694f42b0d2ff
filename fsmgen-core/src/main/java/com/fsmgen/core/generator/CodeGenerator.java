package com.fsmgen.core.generator;

import com.fsmgen.core.resolver.DispatchTable;

/**
 * Interface for code generators that render a resolved state machine in a target language.
 *
 * <p>Generators do no resolution of their own: the order of exit actions, transition actions and
 * entry actions comes from the {@link DispatchTable} and is rendered as is.
 *
 * <p>Generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.fsmgen.core.generator.CodeGenerator}
 *
 * @see DispatchTable
 * @see GeneratorConfig
 * @see GeneratedCode
 */
public interface CodeGenerator {

    /**
     * Returns unique identifier for this generator, referenced from configuration (e.g. "c").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the default file extension of generated files, without leading dot.
     *
     * @return file extension
     */
    String getFileExtension();

    /**
     * Renders the dispatch table.
     *
     * <p>Output must be deterministic: the same table and config always give the same text.
     *
     * @param table resolved state machine
     * @param config generation settings
     * @return generated code
     */
    GeneratedCode generate(DispatchTable table, GeneratorConfig config);
}
