package io.github.gitstore.store;

import io.github.gitstore.git.GitErrorKind;

/**
 * Thrown when changes were written but could not be committed. The {@link GitErrorKind} tells recoverable
 * conditions (missing identity, credentials) apart from genuine commit failures.
 */
public class CommitException extends StoreException {
    private final GitErrorKind kind;

    public CommitException(GitErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GitErrorKind getKind() {
        return kind;
    }
}
