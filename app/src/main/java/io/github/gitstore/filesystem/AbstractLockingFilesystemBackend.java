package io.github.gitstore.filesystem;

import io.github.gitstore.util.AtomicWrites;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Backend storing each object as one UTF-8 text file. Subclasses supply the text format through {@link #parseData}
 * and {@link #dumpData}.
 *
 * <p>Every read and write holds a {@link FileAccessLock} on the resolved file, so a file is never read while it is
 * being written nor written twice at once.
 */
public abstract class AbstractLockingFilesystemBackend<T> implements FilesystemBackend<T> {
    private static final Logger logger = LogManager.getLogger(AbstractLockingFilesystemBackend.class);

    private final Path baseDir;
    private final FileAccessLock fileAccessLock = new FileAccessLock();

    protected AbstractLockingFilesystemBackend(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    @Override
    public Path baseDir() {
        return baseDir;
    }

    @Override
    public Path expandPath(String objId) {
        return checkedPath(objId);
    }

    /**
     * Resolves {@code relPath} against the base directory, rejecting refs that are blank or would escape it. Refs may
     * span several path segments; subclasses decide which of those they accept as object IDs.
     */
    protected final Path checkedPath(String relPath) {
        if (relPath.isBlank()) {
            throw new IllegalArgumentException("Object ID must not be blank");
        }
        var resolved = baseDir.resolve(relPath).normalize();
        if (!resolved.startsWith(baseDir) || resolved.equals(baseDir)) {
            throw new IllegalArgumentException("Object ID resolves outside of " + baseDir + ": " + relPath);
        }
        return resolved;
    }

    /** Path of {@code absPath} relative to the base directory, with {@code /} separators. */
    public String makeRelativePath(Path absPath) {
        if (!absPath.isAbsolute()) {
            throw new IllegalArgumentException("Expecting an absolute path, but got relative: " + absPath);
        }
        return toSlashPath(baseDir.relativize(absPath.normalize()));
    }

    static String toSlashPath(Path relative) {
        var parts = new ArrayList<String>();
        for (var segment : relative) {
            parts.add(segment.toString());
        }
        return String.join("/", parts);
    }

    @Override
    public boolean isValidId(String candidate) {
        return !candidate.isBlank() && !candidate.startsWith(".");
    }

    @Override
    public Optional<String> resolveObjectId(String relativePath) {
        var slash = relativePath.indexOf('/');
        var first = slash >= 0 ? relativePath.substring(0, slash) : relativePath;
        if (first.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(first);
    }

    @Override
    public List<T> readAll() throws IOException {
        if (!Files.isDirectory(baseDir)) {
            logger.debug("Base directory {} does not exist yet", baseDir);
            return List.of();
        }
        List<String> names;
        try (Stream<Path> entries = Files.list(baseDir)) {
            names = entries.map(p -> p.getFileName().toString()).sorted().toList();
        }
        var objs = new ArrayList<T>();
        for (var name : names) {
            if (!isValidId(name)) {
                continue;
            }
            var objId = resolveObjectId(name);
            if (objId.isPresent()) {
                objs.add(read(objId.get()));
            }
        }
        return objs;
    }

    @Override
    public boolean exists(String objId) throws IOException {
        return Files.exists(expandPath(objId));
    }

    @Override
    public T read(String objId) throws IOException {
        var filePath = expandPath(objId);
        return fileAccessLock.acquire(filePath, () -> {
            if (!Files.isRegularFile(filePath)) {
                throw new NoSuchFileException(filePath.toString(), null, "object " + objId + " does not exist");
            }
            return parseData(Files.readString(filePath, StandardCharsets.UTF_8));
        });
    }

    @Override
    public List<String> write(String objId, @Nullable T newContents) throws IOException {
        var filePath = expandPath(objId);
        return fileAccessLock.acquire(filePath, () -> {
            if (newContents != null) {
                AtomicWrites.atomicOverwrite(filePath, dumpData(newContents));
            } else {
                Files.deleteIfExists(filePath);
            }
            return List.of(makeRelativePath(filePath));
        });
    }

    protected abstract T parseData(String contents) throws IOException;

    protected abstract String dumpData(T data) throws IOException;
}
