package io.github.gitstore.git;

/** Tells whether the remote is worth contacting at all. */
@FunctionalInterface
public interface ConnectivityProbe {
    boolean isOnline();
}
