package io.github.gitstore.git;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gitstore.git.RemoteStorageStatus.Relative;
import io.github.gitstore.testutil.RecordingNotifier;
import org.junit.jupiter.api.Test;

class RemoteStorageStatusTrackerTest {

    @Test
    void foldsPartialUpdates() {
        var downstream = new RecordingNotifier();
        var tracker = new RemoteStorageStatusTracker(downstream);

        tracker.notifyAllWindows(GitController.STATUS_EVENT, RemoteStatusUpdate.needsPassword(true));
        tracker.notifyAllWindows(GitController.STATUS_EVENT, RemoteStatusUpdate.pulling(true));
        tracker.notifyAllWindows(GitController.STATUS_EVENT, RemoteStatusUpdate.pulling(false));
        tracker.notifyAllWindows(GitController.STATUS_EVENT, RemoteStatusUpdate.localChanges(true));

        var status = tracker.current();
        assertTrue(status.needsPassword());
        assertTrue(status.hasLocalChanges());
        assertFalse(status.isPulling());
        assertNull(status.statusRelativeToLocal());

        tracker.notifyAllWindows(GitController.STATUS_EVENT, RemoteStatusUpdate.updated());
        assertFalse(tracker.current().needsPassword());
        assertEquals(Relative.UPDATED, tracker.current().statusRelativeToLocal());
        assertTrue(tracker.current().hasLocalChanges());
        assertEquals(5, downstream.events().size());
    }

    @Test
    void otherEventsPassThroughUntouched() {
        var downstream = new RecordingNotifier();
        var tracker = new RemoteStorageStatusTracker(downstream);

        tracker.notifyAllWindows("storage-changed", "notes");

        assertEquals(RemoteStorageStatus.INITIAL, tracker.current());
        assertEquals(1, downstream.events("storage-changed").size());
    }
}
