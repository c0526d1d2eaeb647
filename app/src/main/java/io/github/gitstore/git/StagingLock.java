package io.github.gitstore.git;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Mutex over everything that touches the index or HEAD of one repository. Waiters are served in arrival order. At
 * most {@code maxPending} callers may wait at once, and none waits longer than {@code timeout}.
 *
 * <p>The lock is reentrant, so a holder may call other locked operations of the same controller.
 */
public final class StagingLock {
    private static final Logger logger = LogManager.getLogger(StagingLock.class);

    @FunctionalInterface
    public interface LockedCallable<T, E extends Exception> {
        T call() throws E;
    }

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Duration timeout;
    private final int maxPending;

    public StagingLock(Duration timeout, int maxPending) {
        if (maxPending < 1) {
            throw new IllegalArgumentException("maxPending must be positive: " + maxPending);
        }
        this.timeout = timeout;
        this.maxPending = maxPending;
    }

    public <T, E extends Exception> T run(String operation, LockedCallable<T, E> action)
            throws E, StagingLockException {
        if (lock.isHeldByCurrentThread()) {
            lock.lock();
        } else {
            acquire(operation);
        }
        try {
            return action.call();
        } finally {
            lock.unlock();
        }
    }

    private void acquire(String operation) throws StagingLockException {
        if (lock.getQueueLength() >= maxPending) {
            throw new StagingLockException(
                    "Too many pending Git operations (" + maxPending + "), refusing to queue " + operation);
        }
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StagingLockException("Interrupted while waiting to " + operation, e);
        }
        if (!acquired) {
            throw new StagingLockException("Timed out after " + timeout.toMillis() + " ms waiting to " + operation);
        }
        logger.trace("Staging lock acquired for {}", operation);
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    public int getQueueLength() {
        return lock.getQueueLength();
    }
}
