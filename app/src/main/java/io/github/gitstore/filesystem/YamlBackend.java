package io.github.gitstore.filesystem;

import com.fasterxml.jackson.databind.JavaType;
import io.github.gitstore.yaml.YamlCodec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Stores each object as {@code <baseDir>/<objId>.yaml}. */
public class YamlBackend<T> extends AbstractLockingFilesystemBackend<T> {
    public static final String YAML_EXT = ".yaml";

    private final YamlCodec codec;
    private final JavaType type;

    public YamlBackend(Path baseDir, Class<T> type) {
        this(baseDir, YamlCodec.instance.mapper().constructType(type));
    }

    public YamlBackend(Path baseDir, JavaType type) {
        super(baseDir);
        this.codec = YamlCodec.instance;
        this.type = type;
    }

    @Override
    public Path expandPath(String objId) {
        if (objId.isBlank()) {
            throw new IllegalArgumentException("Object ID must not be blank");
        }
        return checkedPath(objId + YAML_EXT);
    }

    @Override
    public boolean isValidId(String candidate) {
        return super.isValidId(candidate)
                && candidate.endsWith(YAML_EXT)
                && candidate.length() > YAML_EXT.length()
                && Files.isRegularFile(baseDir().resolve(candidate));
    }

    @Override
    public Optional<String> resolveObjectId(String relativePath) {
        if (relativePath.contains("/") || relativePath.startsWith(".") || !relativePath.endsWith(YAML_EXT)) {
            return Optional.empty();
        }
        var stem = relativePath.substring(0, relativePath.length() - YAML_EXT.length());
        return stem.isEmpty() ? Optional.empty() : Optional.of(stem);
    }

    @Override
    protected T parseData(String contents) throws IOException {
        T data = codec.parse(contents, type);
        if (data == null) {
            throw new IOException("Object file is empty");
        }
        return data;
    }

    @Override
    protected String dumpData(T data) throws IOException {
        return codec.dump(data);
    }
}
