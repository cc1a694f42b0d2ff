package com.fsmgen.core.renderer.impl;

import com.fsmgen.core.renderer.GeneratedFile;
import com.fsmgen.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private FileSystemRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new FileSystemRenderer();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_nestedPath_createsDirectoriesAndWritesUtf8() throws IOException {
        // Given
        GeneratedFile file = new GeneratedFile("lights/traffic.inc", "// ampel äöü\n", "lights/traffic.puml");
        RenderContext context = new RenderContext(tempDir, Map.of());

        // When
        renderer.render(file, context);

        // Then
        Path written = tempDir.resolve("lights/traffic.inc");
        assertThat(written).exists();
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).isEqualTo("// ampel äöü\n");
    }

    @Test
    void render_existingFile_isOverwritten() throws IOException {
        Files.writeString(tempDir.resolve("fsm.inc"), "old content that is longer");

        renderer.render(new GeneratedFile("fsm.inc", "new", "fsm.puml"), new RenderContext(tempDir, Map.of()));

        assertThat(Files.readString(tempDir.resolve("fsm.inc"))).isEqualTo("new");
    }

    @Test
    void render_unwritableTarget_throwsIllegalStateException() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "a file, not a directory");
        GeneratedFile file = new GeneratedFile("blocker/fsm.inc", "x", "fsm.puml");

        assertThatThrownBy(() -> renderer.render(file, new RenderContext(tempDir, Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to write file")
            .hasCauseInstanceOf(IOException.class);
    }
}
