package io.github.gitstore.git;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpServer;
import io.github.gitstore.git.RemoteStorageStatus.Relative;
import io.github.gitstore.testutil.GitTestCleanupUtil;
import io.github.gitstore.testutil.RecordingNotifier;
import io.github.gitstore.testutil.TestRemote;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.TransportException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitControllerTest {

    @TempDir
    Path tempDir;

    private TestRemote remote;
    private Path workDir;
    private RecordingNotifier notifier;
    private final AtomicBoolean online = new AtomicBoolean(true);
    private GitController controller;

    @BeforeEach
    void setUp() throws Exception {
        remote = TestRemote.create(tempDir.resolve("remote"));
        workDir = tempDir.resolve("work");
        notifier = new RecordingNotifier();
        controller = remote.cloneController(workDir, notifier, online::get);
    }

    @AfterEach
    void tearDown() {
        GitTestCleanupUtil.cleanupGitResources(controller);
        remote.close();
    }

    private void writeFile(String path, String content) throws Exception {
        var file = workDir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private String head() throws Exception {
        try (var git = Git.open(workDir.toFile())) {
            return git.getRepository().resolve(Constants.HEAD).getName();
        }
    }

    private String headMessage() throws Exception {
        try (var git = Git.open(workDir.toFile())) {
            return git.log().setMaxCount(1).call().iterator().next().getFullMessage();
        }
    }

    private boolean inHead(String path) throws Exception {
        try (var git = Git.open(workDir.toFile());
                var walk = new RevWalk(git.getRepository())) {
            var tree = walk.parseCommit(git.getRepository().resolve(Constants.HEAD)).getTree();
            try (var treeWalk = TreeWalk.forPath(git.getRepository(), path, tree)) {
                return treeWalk != null;
            }
        }
    }

    @Test
    void forceInitializeClonesRemote() throws Exception {
        assertTrue(controller.isInitialized());
        assertTrue(Files.isRegularFile(workDir.resolve("README.md")));
        assertTrue(controller.isUsingRemoteURLs(remote.url(), null));
        assertFalse(controller.isUsingRemoteURLs("file:///somewhere/else.git", null));
        assertFalse(controller.isUsingRemoteURLs(remote.url(), "file:///upstream.git"));
        assertEquals(remote.remoteHead(), head());
    }

    @Test
    void forceInitializeAddsUpstreamRemote() throws Exception {
        var upstreamUrl = "https://example.com/upstream/data.git";
        var withUpstream = new GitController(
                tempDir.resolve("work2"), remote.url(), upstreamUrl, TestRemote.CONFIG, notifier, online::get);
        try {
            withUpstream.forceInitialize();
            assertEquals(upstreamUrl, withUpstream.configGet("remote.upstream.url"));
            assertTrue(withUpstream.isUsingRemoteURLs(remote.url(), upstreamUrl));
            assertFalse(withUpstream.isUsingRemoteURLs(remote.url(), null));
        } finally {
            withUpstream.close();
        }
    }

    @Test
    void forceInitializeDiscardsLocalState() throws Exception {
        writeFile("scratch.txt", "local only");
        controller.forceInitialize();
        assertFalse(Files.exists(workDir.resolve("scratch.txt")));
        assertTrue(controller.isInitialized());
    }

    @Test
    void configValues() throws Exception {
        controller.configSet("user.name", "Someone Else");
        assertEquals("Someone Else", controller.configGet("user.name"));
        assertEquals("origin", controller.configGet("branch.master.remote"));
        assertNull(controller.configGet("user.nickname"));
        assertThrows(IllegalArgumentException.class, () -> controller.configGet("name"));
    }

    @Test
    void stageAndCommitCommitsOnlyGivenPaths() throws Exception {
        writeFile("objects/a.yaml", "id: a\n");
        writeFile("objects/b.yaml", "id: b\n");

        int count = controller.stageAndCommit(List.of("objects/a.yaml"), "create object a");

        assertEquals(1, count);
        assertEquals("create object a", headMessage());
        assertTrue(inHead("objects/a.yaml"));
        assertFalse(inHead("objects/b.yaml"));
        assertEquals(Set.of("objects/b.yaml"), controller.listChangedFiles());
    }

    @Test
    void stageAndCommitWithoutChangesIsNoOp() throws Exception {
        var before = head();
        assertEquals(0, controller.stageAndCommit(List.of("README.md"), "nothing"));
        assertEquals(before, head());
    }

    @Test
    void stageAndCommitRejectsEmptyPathList() {
        assertThrows(IllegalArgumentException.class, () -> controller.stageAndCommit(List.of(), "empty"));
    }

    @Test
    void stageAndCommitRecordsDeletion() throws Exception {
        writeFile("objects/a.yaml", "id: a\n");
        controller.stageAndCommit(List.of("objects/a.yaml"), "create");
        Files.delete(workDir.resolve("objects/a.yaml"));

        assertEquals(1, controller.stageAndCommit(List.of("objects/a.yaml"), "delete"));
        assertFalse(inHead("objects/a.yaml"));
        assertTrue(controller.listChangedFiles().isEmpty());
    }

    @Test
    void commitRequiresAuthorIdentity() throws Exception {
        controller.configSet("user.name", "");
        writeFile("objects/a.yaml", "id: a\n");

        var e = assertThrows(
                GitOperationException.class, () -> controller.stageAndCommit(List.of("objects/a.yaml"), "create"));
        assertEquals(GitErrorKind.MISSING_AUTHOR, e.getKind());
    }

    @Test
    void commitWithoutEmailReportsMissingAuthor() throws Exception {
        controller.configSet("user.email", "");
        writeFile("objects/a.yaml", "id: a\n");

        var e = assertThrows(
                GitOperationException.class, () -> controller.stageAndCommit(List.of("objects/a.yaml"), "create"));
        assertEquals(GitErrorKind.MISSING_AUTHOR, e.getKind());
    }

    @Test
    void listChangedFilesHonoursPathSpecs() throws Exception {
        writeFile("objects/a.yaml", "id: a\n");
        writeFile("other/b.yaml", "id: b\n");
        writeFile("README.md", "changed\n");

        assertEquals(Set.of("objects/a.yaml"), controller.listChangedFiles(List.of("objects")));
        assertEquals(
                Set.of("objects/a.yaml", "other/b.yaml", "README.md"), controller.listChangedFiles(List.of(".")));
    }

    @Test
    void resetFilesRestoresTrackedAndRemovesUntracked() throws Exception {
        writeFile("README.md", "modified\n");
        writeFile("objects/new/x.yaml", "id: x\n");

        controller.resetFiles(null);

        assertEquals("data repository\n", Files.readString(workDir.resolve("README.md")));
        assertFalse(Files.exists(workDir.resolve("objects/new/x.yaml")));
        assertFalse(Files.exists(workDir.resolve("objects")));
        assertTrue(controller.listChangedFiles().isEmpty());
    }

    @Test
    void resetFilesOnlyTouchesGivenPaths() throws Exception {
        writeFile("README.md", "modified\n");
        writeFile("objects/x.yaml", "id: x\n");

        controller.resetFiles(List.of("objects/x.yaml"));

        assertEquals("modified\n", Files.readString(workDir.resolve("README.md")));
        assertEquals(Set.of("README.md"), controller.listChangedFiles());
    }

    @Test
    void resetFilesRestoresDeletedFile() throws Exception {
        Files.delete(workDir.resolve("README.md"));
        controller.resetFiles(List.of("README.md"));
        assertTrue(Files.exists(workDir.resolve("README.md")));
    }

    @Test
    void listLocalCommitsNewestFirst() throws Exception {
        assertEquals(List.of(), controller.listLocalCommits());

        writeFile("objects/a.yaml", "id: a\n");
        controller.stageAndCommit(List.of("objects/a.yaml"), "first");
        var first = head();
        writeFile("objects/b.yaml", "id: b\n");
        controller.stageAndCommit(List.of("objects/b.yaml"), "second");
        var second = head();

        assertEquals(List.of(second, first), controller.listLocalCommits());
    }

    @Test
    void listLocalCommitsGivesUpOnRunawayHistory() throws Exception {
        for (int i = 0; i <= GitController.MAX_LOCAL_COMMIT_SEARCH_DEPTH; i++) {
            writeFile("objects/counter.yaml", "n: " + i + "\n");
            controller.stageAndCommit(List.of("objects/counter.yaml"), "commit " + i);
        }
        var e = assertThrows(GitOperationException.class, () -> controller.listLocalCommits());
        assertEquals(GitErrorKind.MAX_SEARCH_DEPTH_EXCEEDED, e.getKind());
    }

    @Test
    void fetchUpdatesRemoteTrackingBranch() throws Exception {
        remote.commitOnRemote("objects/remote.yaml", "id: remote\n", "remote change");

        controller.fetchRemote();
        controller.fetchUpstream();

        try (var git = Git.open(workDir.toFile())) {
            var tracking = git.getRepository().resolve(Constants.R_REMOTES + "origin/master");
            assertEquals(remote.remoteHead(), tracking.getName());
        }
        assertFalse(Files.exists(workDir.resolve("objects/remote.yaml")));
    }

    @Test
    void pushRejectsNonFastForward() throws Exception {
        remote.commitOnRemote("objects/remote.yaml", "id: remote\n", "remote change");
        writeFile("objects/local.yaml", "id: local\n");
        controller.stageAndCommit(List.of("objects/local.yaml"), "local change");

        var e = assertThrows(GitOperationException.class, () -> controller.push(false));
        assertEquals(GitErrorKind.PUSH_REJECTED_NON_FAST_FORWARD, e.getKind());

        controller.push(true);
        assertEquals(head(), remote.remoteHead());
    }

    @Test
    void synchronizeStopsOnLocalChanges() throws Exception {
        remote.commitOnRemote("objects/remote.yaml", "id: remote\n", "remote change");
        var remoteHead = remote.remoteHead();
        writeFile("objects/local.yaml", "id: local\n");

        assertEquals(SyncOutcome.LOCAL_CHANGES, controller.synchronize());

        assertTrue(notifier.statusUpdates().contains(RemoteStatusUpdate.localChanges(true)));
        assertFalse(notifier.statusUpdates().contains(RemoteStatusUpdate.pulling(true)));
        assertFalse(Files.exists(workDir.resolve("objects/remote.yaml")));
        assertEquals(remoteHead, remote.remoteHead());
    }

    @Test
    void synchronizeStopsWhenOffline() throws Exception {
        online.set(false);
        assertEquals(SyncOutcome.OFFLINE, controller.synchronize());
        assertTrue(notifier.statusUpdates().contains(RemoteStatusUpdate.offline(true)));
    }

    @Test
    void synchronizeStopsWithoutPassword() throws Exception {
        controller.setPassword(null);
        assertEquals(SyncOutcome.NEEDS_PASSWORD, controller.synchronize());
        assertTrue(notifier.statusUpdates().contains(RemoteStatusUpdate.needsPassword(true)));
    }

    @Test
    void synchronizePullsRemoteChanges() throws Exception {
        remote.commitOnRemote("objects/remote.yaml", "id: remote\n", "remote change");

        assertEquals(SyncOutcome.UPDATED, controller.synchronize());

        assertTrue(Files.exists(workDir.resolve("objects/remote.yaml")));
        assertEquals(remote.remoteHead(), head());
        var updates = notifier.statusUpdates();
        assertTrue(updates.contains(RemoteStatusUpdate.pulling(true)));
        assertTrue(updates.contains(RemoteStatusUpdate.pulling(false)));
        assertEquals(RemoteStatusUpdate.updated(), updates.get(updates.size() - 1));
    }

    @Test
    void synchronizePushesLocalCommits() throws Exception {
        writeFile("objects/local.yaml", "id: local\n");
        controller.stageAndCommit(List.of("objects/local.yaml"), "local change");

        assertEquals(SyncOutcome.UPDATED, controller.synchronize());

        assertEquals(head(), remote.remoteHead());
        assertEquals(List.of(), controller.listLocalCommits());
    }

    @Test
    void synchronizeReportsDivergence() throws Exception {
        remote.commitOnRemote("objects/remote.yaml", "id: remote\n", "remote change");
        var remoteHead = remote.remoteHead();
        writeFile("objects/local.yaml", "id: local\n");
        controller.stageAndCommit(List.of("objects/local.yaml"), "local change");

        assertEquals(SyncOutcome.PULL_FAILED, controller.synchronize());

        assertTrue(notifier.statusUpdates().contains(RemoteStatusUpdate.relative(Relative.DIVERGED)));
        assertTrue(notifier.statusUpdates().contains(RemoteStatusUpdate.pulling(false)));
        assertEquals(remoteHead, remote.remoteHead());
    }

    @Test
    void synchronizeReportsMissingUsername() throws Exception {
        controller.configSet("credentials.username", "");

        assertEquals(SyncOutcome.PULL_FAILED, controller.synchronize());

        assertTrue(notifier.statusUpdates().contains(RemoteStatusUpdate.misconfigured(true)));
    }

    @Test
    void synchronizeClearsRejectedPassword() throws Exception {
        var requests = new AtomicInteger();
        var server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            requests.incrementAndGet();
            exchange.getResponseHeaders().add("WWW-Authenticate", "Basic realm=\"data\"");
            exchange.sendResponseHeaders(401, -1);
            exchange.close();
        });
        server.start();
        try {
            var port = server.getAddress().getPort();
            controller.configSet("remote.origin.url", "http://127.0.0.1:" + port + "/data.git");

            assertEquals(SyncOutcome.PULL_FAILED, controller.synchronize());

            assertTrue(requests.get() > 0);
            assertTrue(controller.needsPassword());
            assertTrue(notifier.statusUpdates().contains(RemoteStatusUpdate.needsPassword(true)));
            assertTrue(notifier.statusUpdates().contains(RemoteStatusUpdate.pulling(false)));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void authFailureClearsPassword() {
        notifier.clear();
        assertFalse(controller.needsPassword());

        controller.handleGitError("pull", new TransportException("https://host/data.git: not authorized"));

        assertTrue(controller.needsPassword());
        assertEquals(List.of(RemoteStatusUpdate.needsPassword(true)), notifier.statusUpdates());
    }

    @Test
    void unrelatedTransportFailureKeepsPassword() {
        notifier.clear();
        controller.handleGitError("pull", new TransportException("connection to host:4010 refused"));

        assertFalse(controller.needsPassword());
        assertEquals(List.of(), notifier.statusUpdates());
    }

    @Test
    void synchronizeClonesUninitializedRepository() throws Exception {
        var fresh = remote.newController(tempDir.resolve("fresh"), notifier, online::get);
        try {
            fresh.setUsername("tester");
            fresh.setPassword("secret");

            assertEquals(SyncOutcome.INITIALIZED, fresh.synchronize());

            assertTrue(fresh.isInitialized());
            assertTrue(Files.exists(tempDir.resolve("fresh/README.md")));
        } finally {
            fresh.close();
        }
    }

    @Test
    void synchronizeWaitsForStagingLock() throws Exception {
        var config = TestRemote.CONFIG.withStagingLock(Duration.ofMillis(100), 10);
        var busy = new GitController(workDir, remote.url(), null, config, notifier, online::get);
        var held = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var holder = new Thread(() -> {
            try {
                busy.getStagingLock().run("hold", () -> {
                    held.countDown();
                    return release.await(10, TimeUnit.SECONDS);
                });
            } catch (Exception e) {
                throw new RuntimeException(e);
            }
        });
        holder.start();
        try {
            assertTrue(held.await(5, TimeUnit.SECONDS));
            assertThrows(StagingLockException.class, busy::synchronize);
            assertThrows(StagingLockException.class, () -> busy.stageAndCommit(List.of("README.md"), "blocked"));
        } finally {
            release.countDown();
            holder.join(5000);
            busy.close();
        }
    }
}
