package io.github.gitstore.git;

import org.jetbrains.annotations.Nullable;

/** Complete view of how the local repository stands relative to the remote. */
public record RemoteStorageStatus(
        boolean isOffline,
        boolean isMisconfigured,
        boolean needsPassword,
        boolean hasLocalChanges,
        boolean isPushing,
        boolean isPulling,
        @Nullable Relative statusRelativeToLocal) {

    public enum Relative {
        AHEAD,
        BEHIND,
        DIVERGED,
        UPDATED
    }

    public static final RemoteStorageStatus INITIAL =
            new RemoteStorageStatus(false, false, false, false, false, false, null);

    /** Overlays the fields {@code update} carries, keeping the rest. */
    public RemoteStorageStatus apply(RemoteStatusUpdate update) {
        return new RemoteStorageStatus(
                pick(update.isOffline(), isOffline),
                pick(update.isMisconfigured(), isMisconfigured),
                pick(update.needsPassword(), needsPassword),
                pick(update.hasLocalChanges(), hasLocalChanges),
                pick(update.isPushing(), isPushing),
                pick(update.isPulling(), isPulling),
                update.statusRelativeToLocal() != null ? update.statusRelativeToLocal() : statusRelativeToLocal);
    }

    private static boolean pick(@Nullable Boolean value, boolean fallback) {
        return value != null ? value : fallback;
    }
}
