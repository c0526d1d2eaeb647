package io.github.gitstore.util;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class FileUtil {
    private static final Logger logger = LogManager.getLogger(FileUtil.class);

    private FileUtil() {
        /* utility class - no instances */
    }

    /**
     * Deletes {@code path} and everything beneath it. Does not follow symlinks.
     *
     * @return true if the path no longer exists afterwards
     * @throws IOException if the tree cannot be walked or an entry cannot be deleted
     */
    public static boolean deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            for (var p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
        return !Files.exists(path);
    }

    /**
     * Removes empty directories from {@code start} upwards, stopping at (and never removing) {@code stopAt}.
     * Directories that still have entries are left alone.
     */
    public static void pruneEmptyParents(Path start, Path stopAt) {
        var stop = stopAt.toAbsolutePath().normalize();
        var dir = start.toAbsolutePath().normalize();
        while (dir != null && dir.startsWith(stop) && !dir.equals(stop)) {
            if (!Files.isDirectory(dir)) {
                dir = dir.getParent();
                continue;
            }
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isPresent()) {
                    return;
                }
            } catch (IOException e) {
                logger.debug("Cannot list {} while pruning: {}", dir, e.getMessage());
                return;
            }
            try {
                Files.delete(dir);
            } catch (DirectoryNotEmptyException e) {
                return;
            } catch (IOException e) {
                logger.warn("Failed to remove empty directory {}", dir, e);
                return;
            }
            dir = dir.getParent();
        }
    }
}
