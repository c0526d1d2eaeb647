package io.github.gitstore.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public final class AtomicWrites {
    private AtomicWrites() {}

    /**
     * Replaces the content of {@code targetPath} with UTF-8 {@code content}, creating parent directories as needed.
     *
     * <p>The text goes to a temporary sibling file first and is then moved over the target, atomically where the
     * filesystem allows it, so a reader never observes a half-written object file.
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        var parent = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tempFile = Files.createTempFile(parent, ".tmp-", ".partial");

        try {
            Files.writeString(tempFile, content, StandardCharsets.UTF_8);
            try {
                Files.move(tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }
}
