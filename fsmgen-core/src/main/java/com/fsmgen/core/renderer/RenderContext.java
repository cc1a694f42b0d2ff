package com.fsmgen.core.renderer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Where and how renderers write generated code.
 *
 * @param outputDirectory directory relative output paths are resolved against
 * @param settings renderer-specific settings, e.g. {@code console.showHeaders}
 */
public record RenderContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        outputDirectory = outputDirectory.normalize();
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Resolves a generated file's path against the output directory.
     *
     * @param relativePath path relative to the output directory
     * @return the normalized target path
     * @throws IllegalArgumentException if the path is absolute or leaves the output directory
     */
    public Path resolve(String relativePath) {
        Path relative = Path.of(relativePath);
        if (relative.isAbsolute()) {
            throw new IllegalArgumentException("Output path must be relative: " + relativePath);
        }
        Path target = outputDirectory.resolve(relative).normalize();
        if (!target.startsWith(outputDirectory)) {
            throw new IllegalArgumentException("Output path leaves " + outputDirectory + ": " + relativePath);
        }
        return target;
    }

    public boolean isEnabled(String key, boolean defaultValue) {
        String value = settings.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.strip());
    }
}
