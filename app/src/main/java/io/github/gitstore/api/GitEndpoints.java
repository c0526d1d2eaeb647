package io.github.gitstore.api;

import io.github.gitstore.api.ApiRouter.NoInput;
import io.github.gitstore.git.GitController;
import io.github.gitstore.git.SyncOutcome;
import io.github.gitstore.git.SyncScheduler;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/** Requests for inspecting and driving the data repository. */
public final class GitEndpoints {
    private static final Logger logger = LogManager.getLogger(GitEndpoints.class);

    public record GitIdentity(@Nullable String name, @Nullable String email, @Nullable String username) {}

    public record GitConfigView(
            @Nullable String originURL, @Nullable String name, @Nullable String email, @Nullable String username) {}

    public record PasswordInput(String password) {}

    public record LocalChanges(List<String> filenames) {}

    public record CommitFilesInput(List<String> paths, String commitMsg) {}

    public record CommitFilesResult(int numCommitted) {}

    public record DiscardInput(@Nullable List<String> paths) {}

    public record SyncResult(SyncOutcome outcome) {}

    private final GitController git;
    private final @Nullable SyncScheduler scheduler;

    /** @param scheduler receives a sync request after credentials change; null to skip */
    public GitEndpoints(GitController git, @Nullable SyncScheduler scheduler) {
        this.git = git;
        this.scheduler = scheduler;
    }

    public void register(ApiRouter router) {
        router.listen("git-config-set", GitIdentity.class, this::setConfig);
        router.listen("git-config-get", NoInput.class, in -> getConfig());
        router.listen("git-set-password", PasswordInput.class, in -> {
            git.setPassword(in.password());
            requestSync();
            return null;
        });
        router.listen("list-local-changes", NoInput.class, in -> new LocalChanges(List.copyOf(git.listChangedFiles())));
        router.listen("commit-files", CommitFilesInput.class, in -> {
            if (in.paths() == null || in.paths().isEmpty()) {
                return new CommitFilesResult(0);
            }
            return new CommitFilesResult(git.stageAndCommit(in.paths(), in.commitMsg()));
        });
        router.listen("discard-local-changes", DiscardInput.class, in -> {
            git.resetFiles(in.paths());
            return null;
        });
        router.listen("sync-to-remote", NoInput.class, in -> new SyncResult(git.synchronize()));
    }

    private @Nullable Void setConfig(GitIdentity identity) throws GitAPIException {
        if (identity.name() != null) {
            git.configSet("user.name", identity.name());
        }
        if (identity.email() != null) {
            git.configSet("user.email", identity.email());
        }
        if (identity.username() != null) {
            git.configSet("credentials.username", identity.username());
            git.setUsername(identity.username());
        }
        requestSync();
        return null;
    }

    private GitConfigView getConfig() throws GitAPIException {
        return new GitConfigView(
                git.configGet("remote." + GitController.ORIGIN + ".url"),
                git.configGet("user.name"),
                git.configGet("user.email"),
                git.configGet("credentials.username"));
    }

    private void requestSync() {
        if (scheduler != null) {
            logger.debug("Requesting synchronization");
            scheduler.triggerNow();
        }
    }
}
