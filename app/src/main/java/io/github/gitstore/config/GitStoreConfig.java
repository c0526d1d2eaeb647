package io.github.gitstore.config;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tunables for the Git-backed store.
 *
 * <p>Defaults live in the {@code gitstore.properties} classpath resource; any key can be overridden with a system
 * property of the same name.
 */
public record GitStoreConfig(
        Duration stagingLockTimeout,
        int stagingLockMaxPending,
        int cloneDepth,
        Duration networkTimeout,
        String connectivityProbeHost,
        Duration syncInterval,
        String mainBranch) {
    private static final Logger logger = LogManager.getLogger(GitStoreConfig.class);

    public static final String RESOURCE = "gitstore.properties";

    static final String KEY_LOCK_TIMEOUT = "gitstore.stagingLock.timeoutMillis";
    static final String KEY_LOCK_MAX_PENDING = "gitstore.stagingLock.maxPending";
    static final String KEY_CLONE_DEPTH = "gitstore.clone.depth";
    static final String KEY_NETWORK_TIMEOUT = "gitstore.git.networkTimeoutSeconds";
    static final String KEY_PROBE_HOST = "gitstore.connectivity.probeHost";
    static final String KEY_SYNC_INTERVAL = "gitstore.sync.intervalSeconds";
    static final String KEY_MAIN_BRANCH = "gitstore.mainBranch";

    public GitStoreConfig {
        if (stagingLockMaxPending < 1) {
            throw new IllegalArgumentException("stagingLockMaxPending must be >= 1");
        }
        if (cloneDepth < 0) {
            throw new IllegalArgumentException("cloneDepth must be >= 0");
        }
        if (mainBranch.isBlank()) {
            throw new IllegalArgumentException("mainBranch must not be blank");
        }
    }

    public static GitStoreConfig defaults() {
        return new GitStoreConfig(
                Duration.ofSeconds(20), 10, 5, Duration.ofMinutes(5), "github.com", Duration.ofMinutes(5), "master");
    }

    /** Loads the classpath defaults and applies system property overrides. */
    public static GitStoreConfig load() {
        var props = new Properties();
        var in = GitStoreConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in != null) {
            try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Failed to read {}: {}", RESOURCE, e.getMessage());
            }
        } else {
            logger.debug("{} not found on classpath, using built-in defaults", RESOURCE);
        }
        for (var key : List.of(
                KEY_LOCK_TIMEOUT,
                KEY_LOCK_MAX_PENDING,
                KEY_CLONE_DEPTH,
                KEY_NETWORK_TIMEOUT,
                KEY_PROBE_HOST,
                KEY_SYNC_INTERVAL,
                KEY_MAIN_BRANCH)) {
            var override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    /** Builds a config from {@code props}; missing keys fall back to {@link #defaults()}. */
    public static GitStoreConfig fromProperties(Properties props) {
        var d = defaults();
        return new GitStoreConfig(
                Duration.ofMillis(longValue(props, KEY_LOCK_TIMEOUT, d.stagingLockTimeout().toMillis())),
                (int) longValue(props, KEY_LOCK_MAX_PENDING, d.stagingLockMaxPending()),
                (int) longValue(props, KEY_CLONE_DEPTH, d.cloneDepth()),
                Duration.ofSeconds(longValue(props, KEY_NETWORK_TIMEOUT, d.networkTimeout().toSeconds())),
                props.getProperty(KEY_PROBE_HOST, d.connectivityProbeHost()).trim(),
                Duration.ofSeconds(longValue(props, KEY_SYNC_INTERVAL, d.syncInterval().toSeconds())),
                props.getProperty(KEY_MAIN_BRANCH, d.mainBranch()).trim());
    }

    public GitStoreConfig withCloneDepth(int depth) {
        return new GitStoreConfig(
                stagingLockTimeout,
                stagingLockMaxPending,
                depth,
                networkTimeout,
                connectivityProbeHost,
                syncInterval,
                mainBranch);
    }

    public GitStoreConfig withStagingLock(Duration timeout, int maxPending) {
        return new GitStoreConfig(
                timeout, maxPending, cloneDepth, networkTimeout, connectivityProbeHost, syncInterval, mainBranch);
    }

    private static long longValue(Properties props, String key, long fallback) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value for {}: {}", key, raw);
            return fallback;
        }
    }
}
