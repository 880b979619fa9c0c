package com.graphsync.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Writes to a sibling temp file, then moves it over the target.
     */
    public static void replaceString(Path filePath, String content) throws IOException {
        Path tmp = filePath.resolveSibling(filePath.getFileName() + ".tmp");
        safeWriteString(tmp, content);
        Files.move(tmp, filePath, StandardCopyOption.REPLACE_EXISTING);
    }
}
