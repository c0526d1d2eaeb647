package io.github.gitstore.filesystem;

import com.fasterxml.jackson.databind.JavaType;
import io.github.gitstore.util.FileUtil;
import io.github.gitstore.yaml.YamlCodec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Stores each object as a directory. Properties listed as meta properties go together into {@code meta.yaml}; every
 * other property gets its own {@code <property>.yaml} file, which keeps diffs of large fields readable.
 *
 * <p>A directory is an object only if it contains {@code meta.yaml}.
 */
public class YamlDirectoryBackend<T> implements FilesystemBackend<T> {
    private static final Logger logger = LogManager.getLogger(YamlDirectoryBackend.class);

    public static final String META_FILE_BASENAME = "meta";

    private final YamlCodec codec = YamlCodec.instance;
    private final JavaType type;
    private final Set<String> metaProperties;
    private final YamlBackend<Object> files;
    private final FileAccessLock directoryLock = new FileAccessLock();

    public YamlDirectoryBackend(Path baseDir, Class<T> type, Set<String> metaProperties) {
        this(baseDir, YamlCodec.instance.mapper().constructType(type), metaProperties);
    }

    public YamlDirectoryBackend(Path baseDir, JavaType type, Set<String> metaProperties) {
        this.type = type;
        this.metaProperties = Set.copyOf(metaProperties);
        this.files = new YamlBackend<>(baseDir, Object.class);
    }

    @Override
    public Path baseDir() {
        return files.baseDir();
    }

    @Override
    public Path expandPath(String objId) {
        if (objId.contains("/")) {
            throw new IllegalArgumentException("Object ID must be a single path segment: " + objId);
        }
        return files.checkedPath(objId);
    }

    @Override
    public boolean exists(String objId) throws IOException {
        var dir = expandPath(objId);
        if (!Files.exists(dir)) {
            return false;
        }
        if (!Files.isDirectory(dir)) {
            throw new IOException("File is expected to be a directory: " + dir);
        }
        return true;
    }

    @Override
    public boolean isValidId(String candidate) {
        if (candidate.isBlank() || candidate.startsWith(".") || candidate.contains("/")) {
            return false;
        }
        return Files.isRegularFile(baseDir().resolve(candidate).resolve(META_FILE_BASENAME + YamlBackend.YAML_EXT));
    }

    @Override
    public Optional<String> resolveObjectId(String relativePath) {
        var segments = relativePath.split("/", -1);
        if (segments.length == 0 || segments[0].isEmpty() || segments[0].startsWith(".")) {
            return Optional.empty();
        }
        if (segments.length == 1) {
            return Optional.of(segments[0]);
        }
        if (segments.length == 2
                && segments[1].endsWith(YamlBackend.YAML_EXT)
                && segments[1].length() > YamlBackend.YAML_EXT.length()) {
            return Optional.of(segments[0]);
        }
        return Optional.empty();
    }

    @Override
    public List<T> readAll() throws IOException {
        var base = baseDir();
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        List<String> names;
        try (Stream<Path> entries = Files.list(base)) {
            names = entries.map(p -> p.getFileName().toString()).sorted().toList();
        }
        var objs = new ArrayList<T>();
        for (var name : names) {
            if (isValidId(name)) {
                objs.add(read(name));
            }
        }
        return objs;
    }

    @Override
    public T read(String objId) throws IOException {
        var objDir = expandPath(objId);
        return directoryLock.acquire(objDir, () -> {
            if (!Files.isRegularFile(objDir.resolve(META_FILE_BASENAME + YamlBackend.YAML_EXT))) {
                throw new NoSuchFileException(objDir.toString(), null, "meta file for object " + objId + " missing");
            }
            var data = new LinkedHashMap<String, Object>();
            if (files.read(fieldRef(objId, META_FILE_BASENAME)) instanceof Map<?, ?> meta) {
                for (var entry : meta.entrySet()) {
                    var key = String.valueOf(entry.getKey());
                    if (metaProperties.contains(key)) {
                        data.put(key, entry.getValue());
                    } else {
                        logger.debug("Ignoring unknown meta property {} of {}", key, objId);
                    }
                }
            }
            for (var field : listFieldFiles(objDir)) {
                if (!field.equals(META_FILE_BASENAME)) {
                    data.put(field, files.read(fieldRef(objId, field)));
                }
            }
            return codec.fromMap(data, type);
        });
    }

    @Override
    public List<String> write(String objId, @Nullable T newData) throws IOException {
        var objDir = expandPath(objId);
        return directoryLock.acquire(objDir, () -> {
            var touched = new ArrayList<String>();
            var existing = listFieldFiles(objDir);

            if (newData == null) {
                for (var field : existing) {
                    touched.addAll(files.write(fieldRef(objId, field), null));
                }
                if (Files.exists(objDir)) {
                    FileUtil.deleteRecursively(objDir);
                }
                return touched;
            }

            var meta = new LinkedHashMap<String, Object>();
            var fields = new LinkedHashMap<String, Object>();
            for (var entry : codec.toMap(newData).entrySet()) {
                if (metaProperties.contains(entry.getKey())) {
                    if (entry.getValue() != null) {
                        meta.put(entry.getKey(), entry.getValue());
                    }
                } else {
                    checkFieldName(entry.getKey());
                    fields.put(entry.getKey(), entry.getValue());
                }
            }

            touched.addAll(files.write(fieldRef(objId, META_FILE_BASENAME), meta));
            for (var entry : fields.entrySet()) {
                if (entry.getValue() != null || existing.contains(entry.getKey())) {
                    touched.addAll(files.write(fieldRef(objId, entry.getKey()), entry.getValue()));
                }
            }
            for (var stale : existing) {
                if (!stale.equals(META_FILE_BASENAME) && !fields.containsKey(stale)) {
                    logger.debug("Removing stale field file {} of {}", stale, objId);
                    touched.addAll(files.write(fieldRef(objId, stale), null));
                }
            }
            return touched;
        });
    }

    private static String fieldRef(String objId, String field) {
        return objId + "/" + field;
    }

    private static void checkFieldName(String field) {
        if (field.isEmpty() || field.startsWith(".") || field.contains("/") || field.contains("\\")) {
            throw new IllegalArgumentException("Property name cannot be used as a file name: " + field);
        }
    }

    /** Names (without extension) of the YAML files directly inside the object directory. */
    private static Set<String> listFieldFiles(Path objDir) throws IOException {
        var names = new LinkedHashSet<String>();
        if (!Files.isDirectory(objDir)) {
            return names;
        }
        try (Stream<Path> entries = Files.list(objDir)) {
            entries.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> !n.startsWith(".") && n.endsWith(YamlBackend.YAML_EXT))
                    .sorted()
                    .forEach(n -> names.add(n.substring(0, n.length() - YamlBackend.YAML_EXT.length())));
        }
        return names;
    }
}
