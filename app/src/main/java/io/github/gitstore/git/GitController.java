package io.github.gitstore.git;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import io.github.gitstore.config.GitStoreConfig;
import io.github.gitstore.git.RemoteStorageStatus.Relative;
import io.github.gitstore.util.FileUtil;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.transport.URIish;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.jetbrains.annotations.Nullable;

/**
 * Owns one Git working tree and serializes every operation that touches its index or HEAD through a
 * {@link StagingLock}.
 *
 * <p>The repository tracks a single branch of two remotes: {@code origin}, the writable fork, and optionally
 * {@code upstream}, the canonical source the fork came from.
 *
 * <p>{@link #synchronize()} never throws Git errors at its caller. It reports progress and failures as
 * {@link RemoteStatusUpdate} broadcasts under {@link #STATUS_EVENT}, since it normally runs from a timer.
 */
public class GitController implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GitController.class);

    public static final String STATUS_EVENT = "remote-storage-status";
    public static final String ORIGIN = "origin";
    public static final String UPSTREAM = "upstream";

    static final int MAX_LOCAL_COMMIT_SEARCH_DEPTH = 100;

    private static final Splitter CONFIG_KEY_SPLITTER = Splitter.on('.');

    private final Path workDir;
    private final String repoUrl;
    private final @Nullable String upstreamUrl;
    private final GitStoreConfig config;
    private final WindowNotifier notifier;
    private final ConnectivityProbe connectivityProbe;
    private final StagingLock stagingLock;

    private @Nullable Git git;
    private volatile @Nullable String username;
    private volatile @Nullable String password;

    public GitController(
            Path workDir,
            String repoUrl,
            @Nullable String upstreamUrl,
            GitStoreConfig config,
            WindowNotifier notifier,
            ConnectivityProbe connectivityProbe) {
        this.workDir = workDir.toAbsolutePath().normalize();
        this.repoUrl = repoUrl;
        this.upstreamUrl = upstreamUrl;
        this.config = config;
        this.notifier = notifier;
        this.connectivityProbe = connectivityProbe;
        this.stagingLock = new StagingLock(config.stagingLockTimeout(), config.stagingLockMaxPending());
    }

    public Path getWorkDir() {
        return workDir;
    }

    public String getRepoUrl() {
        return repoUrl;
    }

    public @Nullable String getUpstreamUrl() {
        return upstreamUrl;
    }

    public String getMainBranch() {
        return config.mainBranch();
    }

    StagingLock getStagingLock() {
        return stagingLock;
    }

    private synchronized Git git() throws GitAPIException {
        if (git == null) {
            try {
                git = Git.open(workDir.toFile());
            } catch (IOException e) {
                throw new GitWrappedIOException("Cannot open repository at " + workDir, e);
            }
        }
        return git;
    }

    private synchronized void closeGit() {
        if (git != null) {
            git.close();
            git = null;
        }
    }

    @Override
    public void close() {
        closeGit();
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Initialization

    public boolean isInitialized() {
        return Files.isDirectory(workDir.resolve(Constants.DOT_GIT));
    }

    /** True if the configured remotes point at exactly the given URLs. No upstream means none must be configured. */
    public boolean isUsingRemoteURLs(String originUrl, @Nullable String upstream) throws GitAPIException {
        var cfg = git().getRepository().getConfig();
        var actualOrigin = cfg.getString("remote", ORIGIN, "url");
        var actualUpstream = cfg.getString("remote", UPSTREAM, "url");
        if (actualOrigin == null || !actualOrigin.trim().equals(originUrl.trim())) {
            return false;
        }
        if (upstream == null) {
            return actualUpstream == null;
        }
        return actualUpstream != null && actualUpstream.trim().equals(upstream.trim());
    }

    /**
     * Deletes the working directory and clones the repository again (shallow, main branch only), then adds the
     * upstream remote if one is configured. Any local work not pushed is lost.
     */
    public void forceInitialize() throws GitAPIException {
        stagingLock.run("initialize repository", () -> {
            logger.warn("Force-initializing {} from {}", workDir, repoUrl);
            closeGit();
            try {
                FileUtil.deleteRecursively(workDir);
            } catch (IOException e) {
                throw new GitWrappedIOException("Cannot clear " + workDir, e);
            }

            var branchRef = Constants.R_HEADS + config.mainBranch();
            var clone = Git.cloneRepository()
                    .setURI(repoUrl)
                    .setDirectory(workDir.toFile())
                    .setBranch(branchRef)
                    .setBranchesToClone(List.of(branchRef))
                    .setCloneAllBranches(false)
                    .setTimeout(networkTimeoutSeconds())
                    .setCredentialsProvider(credentials());
            if (config.cloneDepth() > 0) {
                clone.setDepth(config.cloneDepth());
            }
            var cloned = clone.call();
            synchronized (this) {
                git = cloned;
            }

            if (upstreamUrl != null) {
                try {
                    cloned.remoteAdd().setName(UPSTREAM).setUri(new URIish(upstreamUrl)).call();
                } catch (URISyntaxException e) {
                    throw new GitOperationException(GitErrorKind.UNKNOWN, "Invalid upstream URL " + upstreamUrl, e);
                }
            }
            logger.info("Cloned {} into {}", repoUrl, workDir);
            return null;
        });
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Config and authentication

    private record ConfigKey(String section, @Nullable String subsection, String name) {
        static ConfigKey parse(String key) {
            var parts = CONFIG_KEY_SPLITTER.splitToList(key);
            if (parts.size() < 2 || parts.stream().anyMatch(String::isEmpty)) {
                throw new IllegalArgumentException("Invalid Git config key: " + key);
            }
            var subsection = parts.size() > 2 ? String.join(".", parts.subList(1, parts.size() - 1)) : null;
            return new ConfigKey(parts.get(0), subsection, parts.get(parts.size() - 1));
        }
    }

    /** Sets a repository-local Git config value, e.g. {@code user.name}. */
    public void configSet(String key, String value) throws GitAPIException {
        var parsed = ConfigKey.parse(key);
        var cfg = git().getRepository().getConfig();
        cfg.setString(parsed.section(), parsed.subsection(), parsed.name(), value);
        try {
            cfg.save();
        } catch (IOException e) {
            throw new GitWrappedIOException(e);
        }
        logger.debug("Set Git config {}", key);
    }

    public @Nullable String configGet(String key) throws GitAPIException {
        var parsed = ConfigKey.parse(key);
        return git().getRepository().getConfig().getString(parsed.section(), parsed.subsection(), parsed.name());
    }

    public void setPassword(@Nullable String password) {
        this.password = password;
    }

    public void setUsername(@Nullable String username) {
        this.username = username;
    }

    public @Nullable String getUsername() {
        return username;
    }

    public boolean needsPassword() {
        var pw = password;
        return pw == null || pw.isEmpty();
    }

    /** Reads the remote username from {@code credentials.username} in the repository config. */
    public void loadAuth() throws GitAPIException {
        username = configGet("credentials.username");
    }

    private @Nullable CredentialsProvider credentials() throws GitOperationException {
        var pw = password;
        if (pw == null || pw.isEmpty()) {
            return null;
        }
        var user = username;
        if (user == null || user.isBlank()) {
            throw new GitOperationException(GitErrorKind.MISSING_USERNAME, "Password is set but username is not");
        }
        return new UsernamePasswordCredentialsProvider(user, pw);
    }

    private int networkTimeoutSeconds() {
        return (int) config.networkTimeout().toSeconds();
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Remote operations

    public void fetchRemote() throws GitAPIException {
        logger.debug("Fetching {}", ORIGIN);
        git().fetch()
                .setRemote(ORIGIN)
                .setTimeout(networkTimeoutSeconds())
                .setCredentialsProvider(credentials())
                .call();
    }

    /** Fetches the upstream remote; does nothing if no upstream is configured. */
    public void fetchUpstream() throws GitAPIException {
        if (upstreamUrl == null) {
            logger.debug("No upstream configured, skipping fetch");
            return;
        }
        logger.debug("Fetching {}", UPSTREAM);
        git().fetch()
                .setRemote(UPSTREAM)
                .setTimeout(networkTimeoutSeconds())
                .setCredentialsProvider(credentials())
                .call();
    }

    /** Pulls the main branch from origin, fast-forward only. */
    public void pull() throws GitAPIException {
        logger.debug("Pulling {} from {}", config.mainBranch(), ORIGIN);
        var result = git().pull()
                .setRemote(ORIGIN)
                .setRemoteBranchName(config.mainBranch())
                .setFastForward(MergeCommand.FastForwardMode.FF_ONLY)
                .setTimeout(networkTimeoutSeconds())
                .setCredentialsProvider(credentials())
                .call();

        var mergeResult = result.getMergeResult();
        if (mergeResult != null) {
            var status = mergeResult.getMergeStatus();
            if (status == MergeResult.MergeStatus.ABORTED) {
                throw new GitOperationException(
                        GitErrorKind.FAST_FORWARD_FAILED, "Cannot fast-forward: local and remote histories diverged");
            }
            if (status == MergeResult.MergeStatus.NOT_SUPPORTED) {
                throw new GitOperationException(GitErrorKind.MERGE_NOT_SUPPORTED, "Merge is not supported");
            }
            if (status == MergeResult.MergeStatus.CONFLICTING
                    || status == MergeResult.MergeStatus.CHECKOUT_CONFLICT
                    || status == MergeResult.MergeStatus.FAILED) {
                throw new GitOperationException(
                        GitErrorKind.CHECKOUT_CONFLICT, "Pull would overwrite local files: " + status);
            }
        }
        if (!result.isSuccessful()) {
            throw new GitOperationException(GitErrorKind.UNKNOWN, "Pull from " + ORIGIN + " failed: " + result);
        }
    }

    /** Pushes the main branch to origin. The synchronization workflow never forces. */
    public void push(boolean force) throws GitAPIException {
        var branchRef = Constants.R_HEADS + config.mainBranch();
        logger.debug("Pushing {} to {}{}", branchRef, ORIGIN, force ? " (forced)" : "");
        var refSpec = new RefSpec(branchRef + ":" + branchRef).setForceUpdate(force);
        Iterable<PushResult> results = git().push()
                .setRemote(ORIGIN)
                .setRefSpecs(refSpec)
                .setForce(force)
                .setTimeout(networkTimeoutSeconds())
                .setCredentialsProvider(credentials())
                .call();

        boolean nonFastForward = false;
        var rejections = new ArrayList<String>();
        for (var result : results) {
            for (var update : result.getRemoteUpdates()) {
                var status = update.getStatus();
                if (status == RemoteRefUpdate.Status.OK || status == RemoteRefUpdate.Status.UP_TO_DATE) {
                    continue;
                }
                if (status == RemoteRefUpdate.Status.REJECTED_NONFASTFORWARD
                        || status == RemoteRefUpdate.Status.REJECTED_REMOTE_CHANGED) {
                    nonFastForward = true;
                }
                var message = update.getRemoteName() + ": " + status;
                if (update.getMessage() != null) {
                    message += " (" + update.getMessage() + ")";
                }
                rejections.add(message);
            }
        }
        if (!rejections.isEmpty()) {
            throw new GitOperationException(
                    nonFastForward ? GitErrorKind.PUSH_REJECTED_NON_FAST_FORWARD : GitErrorKind.UNKNOWN,
                    "Push rejected by remote: " + String.join("; ", rejections));
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Working tree

    public Set<String> listChangedFiles() throws GitAPIException {
        return listChangedFiles(List.of("."));
    }

    /**
     * Paths, relative to the work dir, whose working tree state differs from HEAD, restricted to {@code pathSpecs}.
     * A path spec of {@code "."} means the whole tree.
     */
    public Set<String> listChangedFiles(Collection<String> pathSpecs) throws GitAPIException {
        var statusCommand = git().status();
        for (var pathSpec : pathSpecs) {
            if (!pathSpec.isBlank() && !".".equals(pathSpec)) {
                statusCommand.addPath(pathSpec);
            }
        }
        var status = statusCommand.call();

        var changed = new TreeSet<String>();
        changed.addAll(status.getAdded());
        changed.addAll(status.getChanged());
        changed.addAll(status.getModified());
        changed.addAll(status.getRemoved());
        changed.addAll(status.getMissing());
        changed.addAll(status.getUntracked());
        changed.addAll(status.getConflicting());
        changed.removeIf(path -> !isInsideRepository(path));
        return changed;
    }

    private boolean isInsideRepository(String relativePath) {
        if (relativePath.startsWith("..")) {
            return false;
        }
        return workDir.resolve(relativePath).normalize().startsWith(workDir);
    }

    public void stage(Collection<String> paths) throws GitAPIException {
        if (paths.isEmpty()) {
            return;
        }
        var add = git().add();
        paths.forEach(add::addFilepattern);
        add.call();
        // a second pass with update picks up deletions
        var update = git().add().setUpdate(true);
        paths.forEach(update::addFilepattern);
        update.call();
    }

    public void unstageAll() throws GitAPIException {
        git().reset().call();
    }

    /** Commits the index. Requires {@code user.name} and {@code user.email} in the repository config. */
    public void commit(String message) throws GitAPIException {
        var cfg = git().getRepository().getConfig();
        var name = cfg.getString("user", null, "name");
        var email = cfg.getString("user", null, "email");
        if (name == null || name.isBlank() || email == null || email.isBlank()) {
            throw new GitOperationException(GitErrorKind.MISSING_AUTHOR, "Author name or email is not configured");
        }
        git().commit().setMessage(message).setSign(false).call();
    }

    /**
     * Commits exactly {@code paths} with {@code message}, under the staging lock.
     *
     * @return number of the given paths that had changes; 0 means nothing was committed
     */
    public int stageAndCommit(List<String> paths, String message) throws GitAPIException {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No paths to commit");
        }
        return stagingLock.run("commit", () -> {
            var changed = listChangedFiles(paths);
            if (changed.isEmpty()) {
                logger.debug("Nothing changed among {}, not committing", paths);
                return 0;
            }
            unstageAll();
            stage(paths);
            commit(message);
            logger.debug("Committed {} file(s): {}", changed.size(), message);
            return changed.size();
        });
    }

    /**
     * Discards working tree and index changes to {@code paths}, or to every changed path if null. Paths known to
     * HEAD are restored from it; paths HEAD does not know are deleted.
     */
    public void resetFiles(@Nullable List<String> paths) throws GitAPIException {
        stagingLock.run("reset files", () -> {
            List<String> targets = paths != null ? paths : List.copyOf(listChangedFiles());
            if (targets.isEmpty()) {
                return null;
            }
            var repository = git().getRepository();
            var tracked = new ArrayList<String>();
            var untracked = new ArrayList<String>();
            try (var revWalk = new RevWalk(repository)) {
                var head = repository.resolve(Constants.HEAD);
                RevTree headTree = head != null ? revWalk.parseCommit(head).getTree() : null;
                for (var path : targets) {
                    if (headTree == null) {
                        untracked.add(path);
                        continue;
                    }
                    try (var treeWalk = TreeWalk.forPath(repository, path, headTree)) {
                        if (treeWalk != null) {
                            tracked.add(path);
                        } else {
                            untracked.add(path);
                        }
                    }
                }
            } catch (IOException e) {
                throw new GitWrappedIOException(e);
            }

            if (!tracked.isEmpty()) {
                git().checkout().setStartPoint(Constants.HEAD).addPaths(tracked).call();
            }
            if (!untracked.isEmpty()) {
                var reset = git().reset();
                untracked.forEach(reset::addPath);
                reset.call();
                for (var path : untracked) {
                    var file = workDir.resolve(path).normalize();
                    if (!file.startsWith(workDir)) {
                        continue;
                    }
                    try {
                        Files.deleteIfExists(file);
                    } catch (IOException e) {
                        throw new GitWrappedIOException("Cannot delete " + path, e);
                    }
                    FileUtil.pruneEmptyParents(file.getParent(), workDir);
                }
            }
            logger.debug("Reset {} tracked and {} untracked path(s)", tracked.size(), untracked.size());
            return null;
        });
    }

    /**
     * Commit IDs on HEAD not yet on {@code origin/<main>}, newest first.
     *
     * @throws GitOperationException with {@link GitErrorKind#MAX_SEARCH_DEPTH_EXCEEDED} if no commit of the remote
     *     branch shows up within {@value #MAX_LOCAL_COMMIT_SEARCH_DEPTH} commits
     */
    public List<String> listLocalCommits() throws GitAPIException {
        return stagingLock.run("list local commits", () -> {
            var repository = git().getRepository();
            try (var walk = new RevWalk(repository);
                    var ancestry = new RevWalk(repository)) {
                var head = repository.resolve(Constants.HEAD);
                if (head == null) {
                    return List.<String>of();
                }
                var remoteRef = Constants.R_REMOTES + ORIGIN + "/" + config.mainBranch();
                var remoteId = repository.resolve(remoteRef);
                if (remoteId == null) {
                    throw new GitOperationException(GitErrorKind.UNKNOWN, "Missing remote-tracking branch " + remoteRef);
                }
                var remoteCommit = ancestry.parseCommit(remoteId);
                walk.markStart(walk.parseCommit(head));

                var local = new ArrayList<String>();
                int visited = 0;
                for (var commit : walk) {
                    if (visited++ >= MAX_LOCAL_COMMIT_SEARCH_DEPTH) {
                        break;
                    }
                    if (ancestry.isMergedInto(ancestry.parseCommit(commit), remoteCommit)) {
                        return List.copyOf(local);
                    }
                    local.add(commit.getName());
                }
                throw new GitOperationException(
                        GitErrorKind.MAX_SEARCH_DEPTH_EXCEEDED,
                        "No commit of " + remoteRef + " within " + MAX_LOCAL_COMMIT_SEARCH_DEPTH + " commits of HEAD");
            } catch (IOException e) {
                throw new GitWrappedIOException(e);
            }
        });
    }

    /** Broadcasts and returns whether the working tree has uncommitted changes. */
    public boolean checkUncommitted() throws GitAPIException {
        var hasChanges = !listChangedFiles().isEmpty();
        broadcast(RemoteStatusUpdate.localChanges(hasChanges));
        return hasChanges;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Synchronization

    @FunctionalInterface
    private interface StageAction {
        /** Empty to continue with the next stage, or the outcome to stop with. */
        Optional<SyncOutcome> run() throws GitAPIException;
    }

    private record SyncStage(String name, StageAction action, SyncOutcome onFailure) {}

    private static final Optional<SyncOutcome> CONTINUE = Optional.empty();

    /**
     * Brings the local repository in line with origin: clone if missing, otherwise pull then push. Stops early, with
     * a status broadcast, on local changes, when offline, or when no password is set.
     *
     * @return where the run stopped; callers not waiting on the result can rely on the broadcasts instead
     * @throws StagingLockException if another operation holds the repository for too long
     */
    public SyncOutcome synchronize() throws StagingLockException {
        return stagingLock.run("synchronize", this::runSyncPipeline);
    }

    private SyncOutcome runSyncPipeline() {
        boolean initialized = isInitialized();
        var stages = new ArrayList<SyncStage>();
        stages.add(new SyncStage("load auth", () -> {
            if (initialized) {
                loadAuth();
            }
            return CONTINUE;
        }, SyncOutcome.CHECK_FAILED));
        stages.add(new SyncStage(
                "check local changes",
                () -> initialized && checkUncommitted() ? Optional.of(SyncOutcome.LOCAL_CHANGES) : CONTINUE,
                SyncOutcome.CHECK_FAILED));
        stages.add(new SyncStage("check connectivity", this::checkOnline, SyncOutcome.OFFLINE));
        stages.add(new SyncStage("check password", this::checkPassword, SyncOutcome.NEEDS_PASSWORD));
        if (initialized) {
            stages.add(new SyncStage("pull", this::pullStage, SyncOutcome.PULL_FAILED));
            stages.add(new SyncStage("push", this::pushStage, SyncOutcome.PUSH_FAILED));
        } else {
            stages.add(new SyncStage("clone", () -> {
                forceInitialize();
                loadAuth();
                return CONTINUE;
            }, SyncOutcome.CLONE_FAILED));
        }

        for (var stage : stages) {
            Optional<SyncOutcome> outcome;
            try {
                outcome = stage.action().run();
            } catch (GitAPIException | JGitInternalException e) {
                handleGitError(stage.name(), e);
                return stage.onFailure();
            }
            if (outcome.isPresent()) {
                logger.debug("Synchronization stopped at {}: {}", stage.name(), outcome.get());
                return outcome.get();
            }
        }

        broadcast(RemoteStatusUpdate.updated());
        var result = initialized ? SyncOutcome.UPDATED : SyncOutcome.INITIALIZED;
        logger.info("Synchronization finished: {}", result);
        return result;
    }

    private Optional<SyncOutcome> checkOnline() {
        boolean online = connectivityProbe.isOnline();
        broadcast(RemoteStatusUpdate.offline(!online));
        return online ? CONTINUE : Optional.of(SyncOutcome.OFFLINE);
    }

    private Optional<SyncOutcome> checkPassword() {
        if (needsPassword()) {
            broadcast(RemoteStatusUpdate.needsPassword(true));
            return Optional.of(SyncOutcome.NEEDS_PASSWORD);
        }
        return CONTINUE;
    }

    private Optional<SyncOutcome> pullStage() throws GitAPIException {
        broadcast(RemoteStatusUpdate.pulling(true));
        try {
            pull();
        } finally {
            broadcast(RemoteStatusUpdate.pulling(false));
        }
        return CONTINUE;
    }

    private Optional<SyncOutcome> pushStage() throws GitAPIException {
        broadcast(RemoteStatusUpdate.pushing(true));
        try {
            push(false);
        } finally {
            broadcast(RemoteStatusUpdate.pushing(false));
        }
        return CONTINUE;
    }

    @VisibleForTesting
    void handleGitError(String operation, Exception e) {
        var kind = GitErrorClassifier.classify(e);
        switch (kind.syncEffect()) {
            case DIVERGED -> {
                logger.warn("{} failed, local and remote histories diverged: {}", operation, e.getMessage());
                broadcast(RemoteStatusUpdate.relative(Relative.DIVERGED));
            }
            case MISCONFIGURED -> {
                logger.warn("{} failed, Git identity is not configured: {}", operation, e.getMessage());
                broadcast(RemoteStatusUpdate.misconfigured(true));
            }
            case NEEDS_PASSWORD -> {
                logger.warn("{} failed, credentials rejected or missing", operation);
                setPassword(null);
                broadcast(RemoteStatusUpdate.needsPassword(true));
            }
            case NONE -> logger.error("{} failed ({})", operation, kind, e);
        }
    }

    private void broadcast(RemoteStatusUpdate update) {
        notifier.notifyAllWindows(STATUS_EVENT, update);
    }
}
