package io.github.gitstore.git;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Runs {@link GitController#synchronize()} periodically, and on request, on one background thread. */
public class SyncScheduler implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SyncScheduler.class);

    private final GitController controller;
    private final Duration interval;
    private final ScheduledExecutorService executor;
    private @Nullable ScheduledFuture<?> periodic;

    public SyncScheduler(GitController controller, Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Sync interval must be positive: " + interval);
        }
        this.controller = controller;
        this.interval = interval;
        ThreadFactory factory = r -> {
            var t = Executors.defaultThreadFactory().newThread(r);
            t.setName("gitstore-sync");
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((thr, ex) -> logger.error("Unhandled exception in {}", thr.getName(), ex));
            return t;
        };
        this.executor = Executors.newSingleThreadScheduledExecutor(factory);
    }

    /** Starts periodic synchronization; the first run happens immediately. Calling it again has no effect. */
    public synchronized void start() {
        if (periodic != null) {
            return;
        }
        logger.info("Synchronizing every {} s", interval.toSeconds());
        periodic = executor.scheduleWithFixedDelay(this::runOnce, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Queues one extra synchronization, e.g. after credentials changed. */
    public Future<?> triggerNow() {
        return executor.submit(this::runOnce);
    }

    void runOnce() {
        try {
            var outcome = controller.synchronize();
            logger.debug("Background synchronization: {}", outcome);
        } catch (StagingLockException e) {
            logger.warn("Skipping synchronization: {}", e.getMessage());
        } catch (RuntimeException e) {
            // keep the schedule alive
            logger.error("Synchronization failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (periodic != null) {
            periodic.cancel(false);
        }
        executor.shutdownNow();
    }
}
