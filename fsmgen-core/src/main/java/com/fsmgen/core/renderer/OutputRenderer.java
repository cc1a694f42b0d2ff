package com.fsmgen.core.renderer;

/**
 * Interface for output renderers that deliver generated code to a destination.
 *
 * <p>A renderer is handed one file at a time, only after the diagram it belongs to compiled
 * successfully. Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.fsmgen.core.renderer.OutputRenderer}
 *
 * @see GeneratedFile
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g. "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders one generated file.
     *
     * @param file the generated file
     * @param context rendering context with output directory and settings
     * @throws IllegalStateException if the file cannot be delivered
     */
    void render(GeneratedFile file, RenderContext context);
}
