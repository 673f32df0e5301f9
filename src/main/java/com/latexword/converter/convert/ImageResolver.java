package com.latexword.converter.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the file behind an {@code \includegraphics} argument. The base
 * directory and its immediate subdirectories are searched, trying the
 * name as written and then with common image extensions.
 */
public class ImageResolver {
    private static final Logger log = LoggerFactory.getLogger(ImageResolver.class);

    static final List<String> EXTENSIONS = List.of("", ".png", ".jpg", ".jpeg", ".pdf", ".eps", ".svg");

    private final Path baseDir;

    public ImageResolver(Path baseDir) {
        this.baseDir = baseDir == null ? Path.of(".") : baseDir;
    }

    public Optional<Path> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.strip();
        for (Path dir : searchDirs()) {
            for (String ext : EXTENSIONS) {
                Path candidate = dir.resolve(trimmed + ext);
                if (Files.isRegularFile(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        log.debug("Image '{}' not found under {}", trimmed, baseDir);
        return Optional.empty();
    }

    private List<Path> searchDirs() {
        List<Path> dirs = new ArrayList<>();
        dirs.add(baseDir);
        if (!Files.isDirectory(baseDir)) {
            return dirs;
        }
        try (Stream<Path> children = Files.list(baseDir)) {
            children.filter(Files::isDirectory).sorted().forEach(dirs::add);
        } catch (IOException e) {
            log.warn("Cannot list image directory {}: {}", baseDir, e.getMessage());
        }
        return dirs;
    }

    public static boolean isPdf(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
