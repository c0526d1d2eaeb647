package io.github.gitstore.testutil;

import io.github.gitstore.git.GitController;
import io.github.gitstore.git.RemoteStatusUpdate;
import io.github.gitstore.git.WindowNotifier;
import java.util.ArrayList;
import java.util.List;

/** Remembers every broadcast. */
public class RecordingNotifier implements WindowNotifier {
    public record Event(String name, Object payload) {}

    private final List<Event> events = new ArrayList<>();

    @Override
    public synchronized void notifyAllWindows(String eventName, Object payload) {
        events.add(new Event(eventName, payload));
    }

    public synchronized List<Event> events() {
        return List.copyOf(events);
    }

    public synchronized List<Event> events(String name) {
        return events.stream().filter(e -> e.name().equals(name)).toList();
    }

    public synchronized List<RemoteStatusUpdate> statusUpdates() {
        return events(GitController.STATUS_EVENT).stream()
                .map(e -> (RemoteStatusUpdate) e.payload())
                .toList();
    }

    public synchronized void clear() {
        events.clear();
    }
}
