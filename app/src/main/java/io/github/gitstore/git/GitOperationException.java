package io.github.gitstore.git;

import org.eclipse.jgit.api.errors.GitAPIException;

/**
 * A Git operation failed for a logical reason the controller detected itself (history diverged, identity missing,
 * credentials missing). The {@link GitErrorKind} says which.
 */
public class GitOperationException extends GitAPIException {
    private final GitErrorKind kind;

    public GitOperationException(GitErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GitOperationException(GitErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public GitErrorKind getKind() {
        return kind;
    }
}
