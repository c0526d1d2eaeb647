package io.github.gitstore.git;

import java.io.IOException;
import org.eclipse.jgit.api.errors.GitAPIException;

public class GitWrappedIOException extends GitAPIException {
    public GitWrappedIOException(IOException e) {
        this(e.getMessage() != null ? e.getMessage() : e.toString(), e);
    }

    public GitWrappedIOException(String message, IOException e) {
        super(message, e);
    }
}
