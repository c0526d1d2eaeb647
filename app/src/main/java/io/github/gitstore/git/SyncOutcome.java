package io.github.gitstore.git;

/** Where a {@link GitController#synchronize()} run stopped. */
public enum SyncOutcome {
    /** Uncommitted changes present; nothing was pulled or pushed. */
    LOCAL_CHANGES,
    OFFLINE,
    NEEDS_PASSWORD,
    PULL_FAILED,
    PUSH_FAILED,
    /** First clone of the repository failed. */
    CLONE_FAILED,
    /** A local check (auth, working tree status) failed before the remote was contacted. */
    CHECK_FAILED,
    UPDATED,
    /** Repository was cloned for the first time. */
    INITIALIZED
}
