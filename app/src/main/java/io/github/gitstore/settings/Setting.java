package io.github.gitstore.settings;

/**
 * A user-configurable value.
 *
 * @param paneId pane to show the setting under
 * @param id unique across all settings
 * @param input widget the settings window uses for editing
 * @param required whether the application can operate without a value
 * @param label shown to the user; should be unique within its pane
 */
public record Setting(String paneId, String id, Input input, boolean required, String label) {
    public enum Input {
        TEXT,
        NUMBER
    }
}
