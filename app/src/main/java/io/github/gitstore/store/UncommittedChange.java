package io.github.gitstore.store;

import org.jetbrains.annotations.Nullable;

/**
 * A changed file under a store's base directory.
 *
 * @param path path relative to the Git working directory
 * @param objectRef backend ref of the owning object, or null for an orphan file no object accounts for
 */
public record UncommittedChange(String path, @Nullable String objectRef) {
    public boolean isOrphan() {
        return objectRef == null;
    }
}
