package com.fsmgen.core.renderer.impl;

import com.fsmgen.core.renderer.GeneratedFile;
import com.fsmgen.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ConsoleRenderer renderer;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_defaultSettings_printsHeaderAndContent() {
        // Given
        GeneratedFile file = new GeneratedFile("fsm.inc", "State init() {}\n", "fsm.puml");

        // When
        renderer.render(file, new RenderContext(Path.of("."), Map.of()));

        // Then
        assertThat(output())
            .isEqualTo("// ----- fsm.inc (from fsm.puml) -----" + System.lineSeparator() + "State init() {}\n");
    }

    @Test
    void render_headersDisabled_printsContentOnly() {
        GeneratedFile file = new GeneratedFile("fsm.inc", "State init() {}\n", "fsm.puml");

        renderer.render(file, new RenderContext(Path.of("."), Map.of("console.showHeaders", "false")));

        assertThat(output()).isEqualTo("State init() {}\n");
    }

    private String output() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }
}
