package io.github.gitstore.git;

import org.eclipse.jgit.api.errors.GitAPIException;

/** The staging lock could not be obtained: too many callers queued, the wait timed out, or it was interrupted. */
public class StagingLockException extends GitAPIException {
    public StagingLockException(String message) {
        super(message);
    }

    public StagingLockException(String message, Throwable cause) {
        super(message, cause);
    }
}
