package io.github.gitstore;

import com.fasterxml.jackson.databind.JavaType;
import io.github.gitstore.api.ApiRouter;
import io.github.gitstore.api.GitEndpoints;
import io.github.gitstore.api.SettingsEndpoints;
import io.github.gitstore.api.StorageEndpoints;
import io.github.gitstore.config.GitStoreConfig;
import io.github.gitstore.filesystem.FilesystemBackend;
import io.github.gitstore.git.ConnectivityProbe;
import io.github.gitstore.git.DnsConnectivityProbe;
import io.github.gitstore.git.GitController;
import io.github.gitstore.git.RemoteStorageStatus;
import io.github.gitstore.git.RemoteStorageStatusTracker;
import io.github.gitstore.git.RepoUrlPrompt;
import io.github.gitstore.git.RepositoryBootstrap;
import io.github.gitstore.git.SyncScheduler;
import io.github.gitstore.git.WindowNotifier;
import io.github.gitstore.settings.SettingManager;
import io.github.gitstore.store.GitFilesystemStore;
import io.github.gitstore.store.IndexableObject;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * Wires the data repository for one application session: settings, the bootstrapped {@link GitController}, the
 * background {@link SyncScheduler}, and an {@link ApiRouter} exposing Git, settings and storage requests.
 *
 * <p>Content types are added with {@link #registerContentType}; each gets its own store under the work dir.
 */
public final class GitStoreRuntime implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GitStoreRuntime.class);

    private final GitStoreConfig config;
    private final SettingManager settings;
    private final RemoteStorageStatusTracker statusTracker;
    private final GitController controller;
    private final SyncScheduler scheduler;
    private final ApiRouter router = new ApiRouter();
    private final Map<String, GitFilesystemStore<?, ?>> stores = new LinkedHashMap<>();

    private GitStoreRuntime(
            GitStoreConfig config,
            SettingManager settings,
            RemoteStorageStatusTracker statusTracker,
            GitController controller) {
        this.config = config;
        this.settings = settings;
        this.statusTracker = statusTracker;
        this.controller = controller;
        this.scheduler = new SyncScheduler(controller, config.syncInterval());

        new GitEndpoints(controller, scheduler).register(router);
        SettingsEndpoints.register(router, settings);
    }

    /** Opens the repository with the classpath configuration, probing DNS for connectivity. */
    public static GitStoreRuntime open(
            Path workDir,
            Path settingsFile,
            @Nullable String upstreamUrl,
            RepoUrlPrompt prompt,
            WindowNotifier notifier)
            throws IOException, GitAPIException {
        var config = GitStoreConfig.load();
        return open(
                workDir,
                settingsFile,
                upstreamUrl,
                prompt,
                notifier,
                config,
                new DnsConnectivityProbe(config.connectivityProbeHost()));
    }

    public static GitStoreRuntime open(
            Path workDir,
            Path settingsFile,
            @Nullable String upstreamUrl,
            RepoUrlPrompt prompt,
            WindowNotifier notifier,
            GitStoreConfig config,
            ConnectivityProbe connectivityProbe)
            throws IOException, GitAPIException {
        logger.info("Opening data repository at {}", workDir);
        var settings = new SettingManager(settingsFile);
        var tracker = new RemoteStorageStatusTracker(notifier);
        var controller = RepositoryBootstrap.initRepo(
                workDir, upstreamUrl, false, settings, prompt, config, tracker, connectivityProbe);
        return new GitStoreRuntime(config, settings, tracker, controller);
    }

    /**
     * Creates a store for objects kept under {@code backend}'s base directory and registers its storage requests
     * under {@code contentType}.
     *
     * @throws IllegalArgumentException if the content type is already registered or the backend lies outside the
     *     work dir
     */
    public <O extends IndexableObject<ID>, ID> GitFilesystemStore<O, ID> registerContentType(
            String contentType,
            String objectLabel,
            FilesystemBackend<O> backend,
            Class<O> objectType,
            Class<ID> idType) {
        synchronized (stores) {
            if (stores.containsKey(contentType)) {
                throw new IllegalArgumentException("Content type already registered: " + contentType);
            }
            var store = new GitFilesystemStore<>(objectLabel, backend, controller, idType);
            var types = router.mapper().getTypeFactory();
            JavaType objectJavaType = types.constructType(objectType);
            JavaType idJavaType = types.constructType(idType);
            new StorageEndpoints<>(contentType, store, objectJavaType, idJavaType, statusTracker).register(router);
            stores.put(contentType, store);
            logger.debug("Registered content type {} at {}", contentType, backend.baseDir());
            return store;
        }
    }

    /** Starts background synchronization at the configured interval. */
    public void startSync() {
        scheduler.start();
    }

    public GitStoreConfig getConfig() {
        return config;
    }

    public SettingManager getSettings() {
        return settings;
    }

    public GitController getController() {
        return controller;
    }

    public ApiRouter getRouter() {
        return router;
    }

    /** Latest remote storage status, folded from every broadcast so far. */
    public RemoteStorageStatus getRemoteStatus() {
        return statusTracker.current();
    }

    @Override
    public void close() {
        logger.info("Closing data repository at {}", controller.getWorkDir());
        scheduler.close();
        controller.close();
    }
}
