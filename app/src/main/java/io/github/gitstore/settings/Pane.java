package io.github.gitstore.settings;

import org.jetbrains.annotations.Nullable;

/** A group of settings shown together in the settings window. */
public record Pane(String id, String label, @Nullable String icon) {
    public Pane(String id, String label) {
        this(id, label, null);
    }
}
