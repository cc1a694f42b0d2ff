package com.fsmgen.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern below a root directory, in sorted order.
     *
     * <p>The pattern is matched against the path relative to {@code rootPath}. A leading
     * {@code **}{@code /} also matches files directly in the root.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return sorted list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        PathMatcher topLevelMatcher = globPattern.startsWith("**/")
            ? FileSystems.getDefault().getPathMatcher("glob:" + globPattern.substring(3))
            : matcher;

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matcher.matches(relativePath) || topLevelMatcher.matches(relativePath);
                })
                .sorted()
                .toList();
        }
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return file stem
     */
    public static String getStem(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Replaces the extension of a path.
     *
     * @param path file path
     * @param extension new extension without dot
     * @return sibling path with the new extension
     */
    public static Path withExtension(Path path, String extension) {
        return path.resolveSibling(getStem(path) + "." + extension);
    }
}
