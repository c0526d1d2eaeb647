package io.github.gitstore.git;

import org.jetbrains.annotations.Nullable;

/** Asks the user for the repository URL when none is configured. Blocks until answered. */
@FunctionalInterface
public interface RepoUrlPrompt {
    /** The URL entered, or null if the user gave up. */
    @Nullable
    String promptForRepoUrl();
}
