package io.github.gitstore.api;

import io.github.gitstore.settings.SettingManager;
import org.jetbrains.annotations.Nullable;

/** Requests for reading and changing settings. Values are passed through, never logged. */
public final class SettingsEndpoints {
    public record SetSettingInput(String name, @Nullable Object value) {}

    public record SettingName(String name) {}

    public record SettingValue(String name, @Nullable Object value) {}

    private SettingsEndpoints() {}

    public static void register(ApiRouter router, SettingManager settings) {
        router.listen("set-setting", SetSettingInput.class, in -> {
            var value = in.value();
            if (value == null) {
                settings.deleteValue(in.name());
            } else {
                settings.setValue(in.name(), value);
            }
            return null;
        });
        router.listen("get-setting", SettingName.class, in -> new SettingValue(in.name(), settings.getValue(in.name())));
        router.listen("clear-setting", SettingName.class, in -> {
            settings.deleteValue(in.name());
            return null;
        });
    }
}
