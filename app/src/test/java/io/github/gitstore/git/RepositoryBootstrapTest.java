package io.github.gitstore.git;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gitstore.settings.SettingManager;
import io.github.gitstore.testutil.GitTestCleanupUtil;
import io.github.gitstore.testutil.RecordingNotifier;
import io.github.gitstore.testutil.TestRemote;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RepositoryBootstrapTest {

    @TempDir
    Path tempDir;

    private TestRemote remote;
    private SettingManager settings;
    private Path workDir;
    private GitController controller;

    @BeforeEach
    void setUp() throws Exception {
        remote = TestRemote.create(tempDir.resolve("remote"));
        settings = new SettingManager(tempDir.resolve("settings.yaml"));
        RepositoryBootstrap.registerSettings(settings);
        workDir = tempDir.resolve("work");
    }

    @AfterEach
    void tearDown() {
        GitTestCleanupUtil.cleanupGitResources(controller);
        remote.close();
    }

    private GitController init(boolean force, RepoUrlPrompt prompt) throws Exception {
        return RepositoryBootstrap.initRepo(
                workDir, null, force, settings, prompt, TestRemote.CONFIG, new RecordingNotifier(), () -> true);
    }

    private static RepoUrlPrompt failingPrompt() {
        return () -> {
            throw new AssertionError("prompt should not be shown");
        };
    }

    @Test
    void registersSettingsPane() {
        assertEquals(RepositoryBootstrap.PANE_ID, settings.getPanes().get(0).id());
        assertEquals(4, settings.getSettings().size());
    }

    @Test
    void clonesAndAppliesIdentity() throws Exception {
        settings.setValue(RepositoryBootstrap.REPO_URL, remote.url());
        settings.setValue(RepositoryBootstrap.AUTHOR_NAME, "Ada");
        settings.setValue(RepositoryBootstrap.AUTHOR_EMAIL, "ada@example.com");
        settings.setValue(RepositoryBootstrap.USERNAME, "ada");

        controller = init(false, failingPrompt());

        assertTrue(controller.isInitialized());
        assertTrue(Files.exists(workDir.resolve("README.md")));
        assertEquals("Ada", controller.configGet("user.name"));
        assertEquals("ada@example.com", controller.configGet("user.email"));
        assertEquals("ada", controller.configGet("credentials.username"));
        assertEquals("ada", controller.getUsername());
    }

    @Test
    void promptsForMissingUrlAndSavesIt() throws Exception {
        var prompts = new AtomicInteger();
        controller = init(false, () -> {
            prompts.incrementAndGet();
            return "  " + remote.url() + " ";
        });

        assertEquals(1, prompts.get());
        assertEquals(remote.url(), settings.getValue(RepositoryBootstrap.REPO_URL));
        assertEquals(remote.url(), controller.getRepoUrl());
        assertTrue(controller.isInitialized());
    }

    @Test
    void missingUrlWithoutAnswerFails() {
        var e = assertThrows(IllegalStateException.class, () -> init(false, () -> null));
        assertEquals("Repository URL was not provided", e.getMessage());
        assertFalse(Files.exists(workDir));
    }

    @Test
    void keepsExistingCloneWithMatchingRemote() throws Exception {
        settings.setValue(RepositoryBootstrap.REPO_URL, remote.url());
        controller = init(false, failingPrompt());
        Files.writeString(workDir.resolve("local.txt"), "keep me");
        controller.close();

        controller = init(false, failingPrompt());

        assertTrue(Files.exists(workDir.resolve("local.txt")));
    }

    @Test
    void reclonesWhenForcedOrRemoteChanged() throws Exception {
        settings.setValue(RepositoryBootstrap.REPO_URL, remote.url());
        controller = init(false, failingPrompt());
        Files.writeString(workDir.resolve("local.txt"), "lost");
        controller.close();

        controller = init(true, failingPrompt());
        assertFalse(Files.exists(workDir.resolve("local.txt")));
        controller.close();

        controller.configSet("remote.origin.url", "file:///elsewhere.git");
        controller.close();
        Files.writeString(workDir.resolve("local.txt"), "lost again");

        controller = init(false, failingPrompt());
        assertFalse(Files.exists(workDir.resolve("local.txt")));
        assertTrue(controller.isUsingRemoteURLs(remote.url(), null));
    }
}
