package com.fsmgen.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_recursivePattern_matchesRootAndSubdirectories() throws IOException {
        Path top = tempDir.resolve("top.puml");
        Path nested = tempDir.resolve("lights/traffic.puml");
        Files.createDirectories(nested.getParent());
        Files.writeString(top, "x");
        Files.writeString(nested, "x");
        Files.writeString(tempDir.resolve("lights/readme.txt"), "x");

        List<Path> files = FileUtils.findFiles(tempDir, "**/*.puml");

        assertThat(files).containsExactlyInAnyOrder(top, nested);
    }

    @Test
    void findFiles_resultIsSorted() throws IOException {
        Files.writeString(tempDir.resolve("b.puml"), "x");
        Files.writeString(tempDir.resolve("a.puml"), "x");
        Files.writeString(tempDir.resolve("c.puml"), "x");

        List<Path> files = FileUtils.findFiles(tempDir, "*.puml");

        assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("a.puml", "b.puml", "c.puml");
    }

    @Test
    void findFiles_withNoMatches_returnsEmptyList() throws IOException {
        assertThat(FileUtils.findFiles(tempDir, "**/*.puml")).isEmpty();
    }

    @Test
    void getStem_dropsExtension() {
        assertThat(FileUtils.getStem(Path.of("dir/traffic_lights.puml"))).isEqualTo("traffic_lights");
        assertThat(FileUtils.getStem(Path.of("archive.tar.gz"))).isEqualTo("archive.tar");
    }

    @Test
    void withExtension_replacesExtensionInSameDirectory() {
        assertThat(FileUtils.withExtension(Path.of("lights", "traffic.puml"), "inc"))
            .isEqualTo(Path.of("lights", "traffic.inc"));
    }
}
