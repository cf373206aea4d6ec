package com.queryscope.analyzer.stack;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Locates the application's project directory: the nearest ancestor of the
 * working directory that holds a build file, else the working directory itself.
 */
public final class ProjectRoot {

    private static final List<String> MARKERS = List.of(
        "pom.xml", "build.gradle", "build.gradle.kts", "settings.gradle", "settings.gradle.kts");

    private ProjectRoot() {}

    public static Path detect() {
        return detect(Path.of("").toAbsolutePath());
    }

    public static Path detect(Path start) {
        Path normalized = start.toAbsolutePath().normalize();
        return findMarked(normalized).orElse(normalized);
    }

    static Optional<Path> findMarked(Path start) {
        for (Path dir = start; dir != null; dir = dir.getParent()) {
            for (String marker : MARKERS) {
                if (Files.isRegularFile(dir.resolve(marker))) {
                    return Optional.of(dir);
                }
            }
        }
        return Optional.empty();
    }
}
