package io.github.gitstore.filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Durable storage of objects as files under a base directory.
 *
 * <p>A backend has its own notion of object IDs ("refs"): strings that map deterministically to a filesystem entry
 * under {@link #baseDir()} and back. For every valid ref, {@code resolveObjectId(relative(expandPath(ref)))} yields
 * the ref again. A backend that stores one file per object would typically strip the file extension from its refs.
 *
 * @param <T> the in-memory representation of one stored object
 */
public interface FilesystemBackend<T> {

    /** Absolute, normalized directory this backend owns. Nothing outside it is touched. */
    Path baseDir();

    /** Reads the object. Fails with an {@link IOException} if it does not exist. */
    T read(String objId) throws IOException;

    /** Scans the base directory and reads every entry that {@link #isValidId(String) looks like an object}. */
    List<T> readAll() throws IOException;

    /**
     * Stores {@code data} under {@code objId}, or deletes the object when {@code data} is null.
     *
     * @return paths touched by the write, relative to {@link #baseDir()} and using {@code /} as separator
     */
    List<String> write(String objId, @Nullable T data) throws IOException;

    /** Absolute path of the object file or directory, including any extension. */
    Path expandPath(String objId);

    /**
     * Given a path relative to {@link #baseDir()}, returns the ref of the object owning it, or empty if the path cannot
     * belong to any object of this backend.
     */
    Optional<String> resolveObjectId(String relativePath);

    boolean exists(String objId) throws IOException;

    /**
     * Returns true if {@code candidate}, the name of an entry directly under {@link #baseDir()}, is an object. Used to
     * weed out unrelated files such as {@code .DS_Store}.
     */
    boolean isValidId(String candidate);
}
