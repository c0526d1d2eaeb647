package io.github.gitstore.settings;

import io.github.gitstore.util.AtomicWrites;
import io.github.gitstore.yaml.YamlCodec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Registry of settings and their values, persisted as a single YAML mapping. The file is read on first access and
 * rewritten on every change.
 *
 * <p>Values may be secrets and are never logged.
 */
public class SettingManager {
    private static final Logger logger = LogManager.getLogger(SettingManager.class);

    private final Path settingsPath;
    private final YamlCodec codec = YamlCodec.instance;
    private final List<Pane> panes = new ArrayList<>();
    private final Map<String, Setting> registry = new LinkedHashMap<>();
    private @Nullable Map<String, Object> data;

    public SettingManager(Path settingsPath) {
        this.settingsPath = settingsPath;
        logger.debug("Settings stored in {}", settingsPath);
    }

    public synchronized void configurePane(Pane pane) {
        if (panes.stream().noneMatch(p -> p.id().equals(pane.id()))) {
            panes.add(pane);
        }
    }

    public synchronized void register(Setting setting) {
        if (panes.stream().noneMatch(p -> p.id().equals(setting.paneId()))) {
            throw new IllegalArgumentException("Invalid pane ID: " + setting.paneId());
        }
        logger.debug("Registering setting {}", setting.id());
        registry.put(setting.id(), setting);
    }

    public synchronized List<Pane> getPanes() {
        return List.copyOf(panes);
    }

    public synchronized List<Setting> getSettings() {
        return List.copyOf(registry.values());
    }

    /** IDs of required settings that have no value yet. */
    public synchronized List<String> listMissingRequiredSettings() throws IOException {
        var missing = new ArrayList<String>();
        for (var setting : registry.values()) {
            if (setting.required() && getValue(setting.id()) == null) {
                missing.add(setting.id());
            }
        }
        return missing;
    }

    public synchronized @Nullable Object getValue(String id) throws IOException {
        requireSetting(id);
        return loadData().get(id);
    }

    /** The value as a string, or empty if unset or blank. */
    public Optional<String> getString(String id) throws IOException {
        var value = getValue(id);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    public synchronized void setValue(String id, Object value) throws IOException {
        var setting = requireSetting(id);
        logger.debug("Setting value for {}", id);
        loadData().put(id, toStoreable(setting, value));
        save();
    }

    public synchronized void deleteValue(String id) throws IOException {
        requireSetting(id);
        logger.debug("Deleting value for {}", id);
        if (loadData().remove(id) != null) {
            save();
        }
    }

    private Setting requireSetting(String id) {
        var setting = registry.get(id);
        if (setting == null) {
            logger.warn("Attempted to access non-existent setting {}", id);
            throw new IllegalArgumentException("Setting is not found: " + id);
        }
        return setting;
    }

    private static Object toStoreable(Setting setting, Object value) {
        if (setting.input() == Setting.Input.NUMBER && value instanceof String s) {
            try {
                return s.contains(".") ? (Object) Double.parseDouble(s) : (Object) Long.parseLong(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Setting " + setting.id() + " expects a number", e);
            }
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> loadData() throws IOException {
        if (data == null) {
            var loaded = new LinkedHashMap<String, Object>();
            if (Files.isRegularFile(settingsPath)) {
                var parsed = codec.parse(Files.readString(settingsPath, StandardCharsets.UTF_8));
                if (parsed instanceof Map<?, ?> map) {
                    loaded.putAll((Map<String, Object>) map);
                } else if (parsed != null) {
                    throw new IOException("Settings file " + settingsPath + " does not contain a mapping");
                }
            }
            data = loaded;
        }
        return data;
    }

    private void save() throws IOException {
        logger.info("Saving settings");
        AtomicWrites.atomicOverwrite(settingsPath, codec.dump(loadData()));
    }
}
