package io.github.gitstore.api;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gitstore.api.SettingsEndpoints.SettingValue;
import io.github.gitstore.settings.Pane;
import io.github.gitstore.settings.Setting;
import io.github.gitstore.settings.SettingManager;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SettingsEndpointsTest {

    @TempDir
    Path tempDir;

    private SettingManager settings;
    private ApiRouter router;

    @BeforeEach
    void setUp() {
        settings = new SettingManager(tempDir.resolve("settings.yaml"));
        settings.configurePane(new Pane("general", "General"));
        settings.register(new Setting("general", "repoUrl", Setting.Input.TEXT, true, "Repository URL"));
        router = new ApiRouter();
        SettingsEndpoints.register(router, settings);
    }

    @Test
    void setAndGet() throws Exception {
        assertTrue(router.dispatch("set-setting", "{\"name\":\"repoUrl\",\"value\":\"https://example.com/d.git\"}")
                .isSuccess());

        var response = router.dispatch("get-setting", "{\"name\":\"repoUrl\"}");
        assertEquals(new SettingValue("repoUrl", "https://example.com/d.git"), response.result());
        assertEquals("https://example.com/d.git", settings.getValue("repoUrl"));
    }

    @Test
    void nullValueAndClearDelete() throws Exception {
        settings.setValue("repoUrl", "x");
        router.dispatch("set-setting", "{\"name\":\"repoUrl\",\"value\":null}");
        assertNull(settings.getValue("repoUrl"));

        settings.setValue("repoUrl", "y");
        router.dispatch("clear-setting", "{\"name\":\"repoUrl\"}");
        assertNull(settings.getValue("repoUrl"));
    }

    @Test
    void unknownSettingIsReported() {
        var response = router.dispatch("get-setting", "{\"name\":\"missing\"}");
        assertEquals(List.of("Setting is not found: missing"), response.errors());
    }
}
