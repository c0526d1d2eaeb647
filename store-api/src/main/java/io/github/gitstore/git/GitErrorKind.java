package io.github.gitstore.git;

/**
 * Closed set of Git failures the storage layer knows how to react to. Anything else is {@link #UNKNOWN} and is
 * propagated or logged as-is.
 */
public enum GitErrorKind {
    /** Fast-forward pull impossible: local and remote histories diverged. */
    FAST_FORWARD_FAILED(SyncEffect.DIVERGED),

    /** Remote changes would need a real merge, which is never attempted. */
    MERGE_NOT_SUPPORTED(SyncEffect.DIVERGED),

    /** Remote refused a push because it is not a fast-forward. */
    PUSH_REJECTED_NON_FAST_FORWARD(SyncEffect.DIVERGED),

    MISSING_USERNAME(SyncEffect.MISCONFIGURED),

    /**
     * {@code user.name} or {@code user.email} is not set. Author and committer both come from these keys, so this
     * also covers a missing committer.
     */
    MISSING_AUTHOR(SyncEffect.MISCONFIGURED),

    MISSING_PASSWORD(SyncEffect.NEEDS_PASSWORD),

    /** Remote answered HTTP 401. */
    HTTP_UNAUTHORIZED(SyncEffect.NEEDS_PASSWORD),

    /** Pull would overwrite files with local modifications. */
    CHECKOUT_CONFLICT(SyncEffect.NONE),

    /** Walk over local history did not reach the remote branch. */
    MAX_SEARCH_DEPTH_EXCEEDED(SyncEffect.NONE),

    /** Transport failure not covered by a more specific kind (host unreachable, remote not found). */
    TRANSPORT(SyncEffect.NONE),

    UNKNOWN(SyncEffect.NONE);

    /** What a failure of this kind means for the remote storage status. */
    public enum SyncEffect {
        DIVERGED,
        MISCONFIGURED,
        NEEDS_PASSWORD,
        NONE
    }

    private final SyncEffect syncEffect;

    GitErrorKind(SyncEffect syncEffect) {
        this.syncEffect = syncEffect;
    }

    public SyncEffect syncEffect() {
        return syncEffect;
    }
}
