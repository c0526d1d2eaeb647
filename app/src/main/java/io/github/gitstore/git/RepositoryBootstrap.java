package io.github.gitstore.git;

import io.github.gitstore.config.GitStoreConfig;
import io.github.gitstore.settings.Pane;
import io.github.gitstore.settings.Setting;
import io.github.gitstore.settings.SettingManager;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/** First-run setup of the data repository: settings, clone, Git identity. */
public final class RepositoryBootstrap {
    private static final Logger logger = LogManager.getLogger(RepositoryBootstrap.class);

    public static final String PANE_ID = "dataSync";
    public static final String REPO_URL = "gitRepoUrl";
    public static final String AUTHOR_NAME = "gitAuthorName";
    public static final String AUTHOR_EMAIL = "gitAuthorEmail";
    public static final String USERNAME = "gitUsername";

    private RepositoryBootstrap() {}

    public static void registerSettings(SettingManager settings) {
        settings.configurePane(new Pane(PANE_ID, "Data synchronization", "git-merge"));
        settings.register(new Setting(PANE_ID, REPO_URL, Setting.Input.TEXT, true, "Git repository URL"));
        settings.register(new Setting(PANE_ID, AUTHOR_NAME, Setting.Input.TEXT, true, "Author name"));
        settings.register(new Setting(PANE_ID, AUTHOR_EMAIL, Setting.Input.TEXT, true, "Author email"));
        settings.register(new Setting(PANE_ID, USERNAME, Setting.Input.TEXT, true, "Username"));
    }

    /**
     * Returns a controller for {@code workDir} whose repository is cloned and has the configured identity.
     *
     * <p>The repository is cloned again when {@code forceInit} is set, when it does not exist, or when its remotes
     * point elsewhere than configured.
     *
     * @throws IllegalStateException if no repository URL is configured and the prompt returns none
     */
    public static GitController initRepo(
            Path workDir,
            @Nullable String upstreamUrl,
            boolean forceInit,
            SettingManager settings,
            RepoUrlPrompt prompt,
            GitStoreConfig config,
            WindowNotifier notifier,
            ConnectivityProbe connectivityProbe)
            throws IOException, GitAPIException {
        registerSettings(settings);

        var repoUrl = settings.getString(REPO_URL).orElse(null);
        if (repoUrl == null) {
            logger.info("Repository URL not configured, asking the user");
            repoUrl = prompt.promptForRepoUrl();
            if (repoUrl == null || repoUrl.isBlank()) {
                throw new IllegalStateException("Repository URL was not provided");
            }
            settings.setValue(REPO_URL, repoUrl.trim());
            repoUrl = repoUrl.trim();
        }

        var controller = new GitController(workDir, repoUrl, upstreamUrl, config, notifier, connectivityProbe);
        if (needsInitialization(controller, repoUrl, upstreamUrl, forceInit)) {
            controller.forceInitialize();
        }

        var name = settings.getString(AUTHOR_NAME);
        if (name.isPresent()) {
            controller.configSet("user.name", name.get());
        }
        var email = settings.getString(AUTHOR_EMAIL);
        if (email.isPresent()) {
            controller.configSet("user.email", email.get());
        }
        var username = settings.getString(USERNAME);
        if (username.isPresent()) {
            controller.configSet("credentials.username", username.get());
        }
        controller.loadAuth();
        return controller;
    }

    private static boolean needsInitialization(
            GitController controller, String repoUrl, @Nullable String upstreamUrl, boolean forceInit) {
        if (forceInit) {
            logger.warn("Re-initialization of {} requested", controller.getWorkDir());
            return true;
        }
        if (!controller.isInitialized()) {
            logger.info("No repository at {} yet", controller.getWorkDir());
            return true;
        }
        try {
            if (!controller.isUsingRemoteURLs(repoUrl, upstreamUrl)) {
                logger.warn("Remote URLs of {} differ from configuration", controller.getWorkDir());
                return true;
            }
        } catch (GitAPIException e) {
            logger.warn("Cannot read remotes of {}, re-initializing", controller.getWorkDir(), e);
            return true;
        }
        return false;
    }
}
