package com.winmd.generator.codegen.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility for writing generated files without leaving partial output behind.
 */
public class FileWriteUtil {
    private static final Logger log = LoggerFactory.getLogger(FileWriteUtil.class);

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a temporary sibling of {@code filePath} and moves it into place,
     * creating parent directories if needed. An existing file is replaced. Output is always UTF-8.
     */
    public static void writeAtomically(Path filePath, String content) throws IOException {
        Path target = filePath.toAbsolutePath();
        Path parentDir = target.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }

        Path temp = Files.createTempFile(parentDir, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to plain replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
