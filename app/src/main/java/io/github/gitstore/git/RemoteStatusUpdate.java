package io.github.gitstore.git;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.gitstore.git.RemoteStorageStatus.Relative;
import org.jetbrains.annotations.Nullable;

/**
 * Partial {@link RemoteStorageStatus}: only non-null fields changed. This is the payload of the
 * {@value GitController#STATUS_EVENT} broadcast.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RemoteStatusUpdate(
        @Nullable Boolean isOffline,
        @Nullable Boolean isMisconfigured,
        @Nullable Boolean needsPassword,
        @Nullable Boolean hasLocalChanges,
        @Nullable Boolean isPushing,
        @Nullable Boolean isPulling,
        @Nullable Relative statusRelativeToLocal) {

    public static RemoteStatusUpdate offline(boolean value) {
        return new RemoteStatusUpdate(value, null, null, null, null, null, null);
    }

    public static RemoteStatusUpdate misconfigured(boolean value) {
        return new RemoteStatusUpdate(null, value, null, null, null, null, null);
    }

    public static RemoteStatusUpdate needsPassword(boolean value) {
        return new RemoteStatusUpdate(null, null, value, null, null, null, null);
    }

    public static RemoteStatusUpdate localChanges(boolean value) {
        return new RemoteStatusUpdate(null, null, null, value, null, null, null);
    }

    public static RemoteStatusUpdate pushing(boolean value) {
        return new RemoteStatusUpdate(null, null, null, null, value, null, null);
    }

    public static RemoteStatusUpdate pulling(boolean value) {
        return new RemoteStatusUpdate(null, null, null, null, null, value, null);
    }

    public static RemoteStatusUpdate relative(Relative value) {
        return new RemoteStatusUpdate(null, null, null, null, null, null, value);
    }

    /** Successful round trip: up to date, and whatever blocked earlier attempts is resolved. */
    public static RemoteStatusUpdate updated() {
        return new RemoteStatusUpdate(null, false, false, null, null, null, Relative.UPDATED);
    }
}
