package io.github.gitstore.git;

/** Fire-and-forget broadcast to every open application window. */
@FunctionalInterface
public interface WindowNotifier {
    void notifyAllWindows(String eventName, Object payload);
}
