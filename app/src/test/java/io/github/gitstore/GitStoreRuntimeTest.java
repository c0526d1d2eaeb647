package io.github.gitstore;

import static org.junit.jupiter.api.Assertions.*;

import io.github.gitstore.api.StorageEndpoints;
import io.github.gitstore.filesystem.YamlBackend;
import io.github.gitstore.git.RemoteStorageStatus.Relative;
import io.github.gitstore.git.RepositoryBootstrap;
import io.github.gitstore.settings.SettingManager;
import io.github.gitstore.testutil.GitTestCleanupUtil;
import io.github.gitstore.testutil.Note;
import io.github.gitstore.testutil.RecordingNotifier;
import io.github.gitstore.testutil.TestRemote;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitStoreRuntimeTest {

    @TempDir
    Path tempDir;

    private TestRemote remote;
    private RecordingNotifier notifier;
    private GitStoreRuntime runtime;

    @BeforeEach
    void setUp() throws Exception {
        remote = TestRemote.create(tempDir.resolve("remote"));
        var settingsFile = tempDir.resolve("settings.yaml");
        var settings = new SettingManager(settingsFile);
        RepositoryBootstrap.registerSettings(settings);
        settings.setValue(RepositoryBootstrap.REPO_URL, remote.url());
        settings.setValue(RepositoryBootstrap.AUTHOR_NAME, "Ada");
        settings.setValue(RepositoryBootstrap.AUTHOR_EMAIL, "ada@example.com");
        settings.setValue(RepositoryBootstrap.USERNAME, "ada");

        notifier = new RecordingNotifier();
        runtime = GitStoreRuntime.open(
                tempDir.resolve("work"),
                settingsFile,
                null,
                () -> null,
                notifier,
                TestRemote.CONFIG,
                () -> true);
    }

    @AfterEach
    void tearDown() {
        runtime.close();
        GitTestCleanupUtil.cleanupGitResources(runtime.getController());
        remote.close();
    }

    @Test
    void servesStorageRequestsForRegisteredTypes() {
        var workDir = runtime.getController().getWorkDir();
        runtime.registerContentType(
                "notes", "note", new YamlBackend<>(workDir.resolve("notes"), Note.class), Note.class, String.class);

        var created = runtime.getRouter()
                .dispatch("storage-create-one-in-notes", "{\"object\":{\"id\":\"a\",\"title\":\"First\"},\"commit\":true}");

        assertTrue(created.isSuccess(), () -> String.valueOf(created.errors()));
        assertEquals(1, notifier.events(StorageEndpoints.CHANGED_EVENT).size());
        assertTrue(runtime.getRouter().names().contains("git-config-get"));
        assertTrue(runtime.getRouter().names().contains("get-setting"));
    }

    @Test
    void duplicateContentTypeIsRejected() {
        var workDir = runtime.getController().getWorkDir();
        var backend = new YamlBackend<>(workDir.resolve("notes"), Note.class);
        runtime.registerContentType("notes", "note", backend, Note.class, String.class);

        assertThrows(
                IllegalArgumentException.class,
                () -> runtime.registerContentType("notes", "note", backend, Note.class, String.class));
    }

    @Test
    void tracksStatusOfSynchronization() throws Exception {
        runtime.getController().setPassword("secret");

        runtime.getRouter().dispatch("sync-to-remote", "");

        var status = runtime.getRemoteStatus();
        assertEquals(Relative.UPDATED, status.statusRelativeToLocal());
        assertFalse(status.isOffline());
        assertFalse(status.hasLocalChanges());
        assertFalse(notifier.statusUpdates().isEmpty());
    }
}
