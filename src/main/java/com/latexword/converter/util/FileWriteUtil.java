package com.latexword.converter.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public final class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes a file through the given writer.
     */
    @FunctionalInterface
    public interface FileWriter {
        void write(Path file) throws IOException;
    }

    /**
     * Creates the parent directories of a file if needed.
     */
    public static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }

    /**
     * Writes to a temporary sibling of {@code target}, then moves it over the
     * target. On failure the target is untouched and the temporary file is
     * removed.
     */
    public static void writeAtomically(Path target, FileWriter writer) throws IOException {
        createParentDirectories(target);
        Path temp = target.toAbsolutePath().resolveSibling(target.getFileName() + ".tmp");
        try {
            writer.write(temp);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
