package io.github.gitstore.filesystem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion keyed by filesystem path. Holders of the same path run one at a time, in request order; different
 * paths never block each other. Entries are dropped once nobody holds or waits for them.
 */
public final class FileAccessLock {

    @FunctionalInterface
    public interface IOCallable<T> {
        T call() throws IOException;
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock(true);
        int users;
    }

    private final Map<Path, Entry> entries = new HashMap<>();

    public <T> T acquire(Path path, IOCallable<T> action) throws IOException {
        var key = path.toAbsolutePath().normalize();
        Entry entry;
        synchronized (entries) {
            entry = entries.computeIfAbsent(key, k -> new Entry());
            entry.users++;
        }
        entry.lock.lock();
        try {
            return action.call();
        } finally {
            entry.lock.unlock();
            synchronized (entries) {
                if (--entry.users == 0) {
                    entries.remove(key);
                }
            }
        }
    }

    /** Number of paths currently held or waited for. */
    int activeKeys() {
        synchronized (entries) {
            return entries.size();
        }
    }
}
