package com.fsmgen.core.renderer.impl;

import com.fsmgen.core.renderer.GeneratedFile;
import com.fsmgen.core.renderer.OutputRenderer;
import com.fsmgen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints generated files to a stream (standard output by default).
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.showHeaders} - print a header line before each file ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    /** Setting that prefixes each file with a comment naming it and its diagram. */
    public static final String SHOW_HEADERS = "console.showHeaders";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedFile file, RenderContext context) {
        boolean showHeaders = context.isEnabled(SHOW_HEADERS, true);
        if (showHeaders) {
            out.println("// ----- " + file.relativePath() + " (from " + file.sourceId() + ") -----");
        }
        out.print(file.content());
        out.flush();
        logger.debug("Printed {} ({} bytes)", file.relativePath(), file.content().length());
    }
}
