package com.fsmgen.core.renderer.impl;

import com.fsmgen.core.renderer.GeneratedFile;
import com.fsmgen.core.renderer.OutputRenderer;
import com.fsmgen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renderer that writes generated files to the filesystem as UTF-8.
 *
 * <p>Creates missing parent directories and overwrites existing files.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedFile file, RenderContext context) {
        Path targetPath = context.resolve(file.relativePath());
        logger.debug("Writing file: {}", targetPath);

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.info("Generated {} from {} ({} bytes)", targetPath, file.sourceId(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + targetPath, e);
        }
    }
}
