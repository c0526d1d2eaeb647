package io.github.gitstore.git;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Notifier decorator that folds every {@link RemoteStatusUpdate} broadcast into the latest full
 * {@link RemoteStorageStatus} before passing the event on.
 */
public final class RemoteStorageStatusTracker implements WindowNotifier {
    private static final Logger logger = LogManager.getLogger(RemoteStorageStatusTracker.class);

    private final WindowNotifier delegate;
    private volatile RemoteStorageStatus current = RemoteStorageStatus.INITIAL;

    public RemoteStorageStatusTracker(WindowNotifier delegate) {
        this.delegate = delegate;
    }

    @Override
    public void notifyAllWindows(String eventName, Object payload) {
        if (GitController.STATUS_EVENT.equals(eventName) && payload instanceof RemoteStatusUpdate update) {
            synchronized (this) {
                current = current.apply(update);
            }
            logger.trace("Remote storage status now {}", current);
        }
        delegate.notifyAllWindows(eventName, payload);
    }

    public RemoteStorageStatus current() {
        return current;
    }
}
