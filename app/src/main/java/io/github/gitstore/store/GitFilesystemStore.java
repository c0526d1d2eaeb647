package io.github.gitstore.store;

import io.github.gitstore.filesystem.FilesystemBackend;
import io.github.gitstore.git.GitController;
import io.github.gitstore.git.GitErrorClassifier;
import io.github.gitstore.yaml.YamlCodec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * {@link VersionedStore} keeping objects in files through a {@link FilesystemBackend} and versioning them in the
 * repository of a {@link GitController}.
 *
 * <p>Writes go to disk first and are committed afterwards when asked to. A failure in between leaves an uncommitted
 * change that {@link #listUncommitted()} reports.
 */
public class GitFilesystemStore<O extends IndexableObject<ID>, ID> implements VersionedStore<O, ID> {
    private static final Logger logger = LogManager.getLogger(GitFilesystemStore.class);

    private final String objectLabel;
    private final FilesystemBackend<O> backend;
    private final GitController git;
    private final Class<ID> idType;
    private final String basePath;

    private @Nullable Map<String, O> index;

    /**
     * @param objectLabel names the content type in generated commit messages
     * @throws IllegalArgumentException if the backend's base directory is not strictly inside the Git work dir
     */
    public GitFilesystemStore(String objectLabel, FilesystemBackend<O> backend, GitController git, Class<ID> idType) {
        this.objectLabel = objectLabel;
        this.backend = backend;
        this.git = git;
        this.idType = idType;
        this.basePath = relativeBasePath(git.getWorkDir(), backend.baseDir());
    }

    private static String relativeBasePath(Path workDir, Path baseDir) {
        var base = baseDir.toAbsolutePath().normalize();
        if (!base.startsWith(workDir) || base.equals(workDir)) {
            throw new IllegalArgumentException(
                    "Filesystem backend base directory " + base + " must be a subdirectory of " + workDir);
        }
        var parts = new ArrayList<String>();
        for (var segment : workDir.relativize(base)) {
            parts.add(segment.toString());
        }
        return String.join("/", parts);
    }

    public String getObjectLabel() {
        return objectLabel;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Reading

    @Override
    public O read(ID objId) throws IOException {
        return backend.read(getRef(objId));
    }

    /** Rescans the backend, replacing the cached index. */
    @Override
    public Map<String, O> getIndex() throws IOException {
        var fresh = new LinkedHashMap<String, O>();
        for (var obj : backend.readAll()) {
            fresh.put(String.valueOf(obj.getId()), obj);
        }
        synchronized (this) {
            index = fresh;
            return Collections.unmodifiableMap(new LinkedHashMap<>(fresh));
        }
    }

    /** The cached index, loaded on first use. */
    public Map<String, O> getCachedIndex() throws IOException {
        synchronized (this) {
            if (index != null) {
                return Collections.unmodifiableMap(new LinkedHashMap<>(index));
            }
        }
        return getIndex();
    }

    public Map<String, O> findObjects(Predicate<? super O> query) throws IOException {
        var found = new LinkedHashMap<String, O>();
        for (var entry : getCachedIndex().entrySet()) {
            if (query.test(entry.getValue())) {
                found.put(entry.getKey(), entry.getValue());
            }
        }
        return found;
    }

    private synchronized void updateInIndex(String key, @Nullable O obj) {
        if (index == null) {
            return;
        }
        if (obj != null) {
            index.put(key, obj);
        } else {
            index.remove(key);
        }
    }

    private synchronized void dropIndex() {
        index = null;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Writing

    @Override
    public void create(O obj) throws IOException, StoreException {
        create(obj, false);
    }

    @Override
    public void create(O obj, boolean commit) throws IOException, StoreException {
        doCreate(obj, commit ? commitMessage("create", obj.getId()) : null);
    }

    @Override
    public void create(O obj, String commitMessage) throws IOException, StoreException {
        doCreate(obj, commitMessage);
    }

    private void doCreate(O obj, @Nullable String commitMessage) throws IOException, StoreException {
        var ref = getRef(obj.getId());
        if (backend.exists(ref)) {
            throw new IDTakenException(obj.getId());
        }
        var paths = backend.write(ref, obj);
        updateInIndex(String.valueOf(obj.getId()), obj);
        commitIfRequested(paths, commitMessage);
    }

    @Override
    public void update(ID objId, O obj) throws IOException, StoreException {
        update(objId, obj, false);
    }

    @Override
    public void update(ID objId, O obj, boolean commit) throws IOException, StoreException {
        doUpdate(objId, obj, commit ? commitMessage("update", objId) : null);
    }

    @Override
    public void update(ID objId, O obj, String commitMessage) throws IOException, StoreException {
        doUpdate(objId, obj, commitMessage);
    }

    private void doUpdate(ID objId, O obj, @Nullable String commitMessage) throws IOException, StoreException {
        if (!String.valueOf(objId).equals(String.valueOf(obj.getId()))) {
            throw new IllegalArgumentException(
                    "Updating object IDs is not supported (" + objId + " -> " + obj.getId() + ")");
        }
        var paths = backend.write(getRef(objId), obj);
        updateInIndex(String.valueOf(objId), obj);
        commitIfRequested(paths, commitMessage);
    }

    @Override
    public void delete(ID objId) throws IOException, StoreException {
        delete(objId, false);
    }

    @Override
    public void delete(ID objId, boolean commit) throws IOException, StoreException {
        doDelete(objId, commit ? commitMessage("delete", objId) : null);
    }

    @Override
    public void delete(ID objId, String commitMessage) throws IOException, StoreException {
        doDelete(objId, commitMessage);
    }

    private void doDelete(ID objId, @Nullable String commitMessage) throws IOException, StoreException {
        var paths = backend.write(getRef(objId), null);
        updateInIndex(String.valueOf(objId), null);
        commitIfRequested(paths, commitMessage);
    }

    private String commitMessage(String verb, Object objId) {
        return verb + " " + objectLabel + " " + objId;
    }

    private void commitIfRequested(List<String> backendPaths, @Nullable String commitMessage)
            throws CommitException {
        if (commitMessage == null || backendPaths.isEmpty()) {
            return;
        }
        commitGitPaths(backendPaths.stream().map(this::toGitPath).toList(), commitMessage);
    }

    private void commitGitPaths(List<String> gitPaths, String commitMessage) throws CommitException {
        try {
            git.stageAndCommit(gitPaths, commitMessage);
        } catch (GitAPIException e) {
            var kind = GitErrorClassifier.classify(e);
            throw new CommitException(kind, "Failed to commit \"" + commitMessage + "\": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Versioning

    /** Commits changes to the given objects in one commit. Objects without changes are skipped. */
    @Override
    public void commit(List<ID> objIds, String commitMessage) throws IOException, StoreException {
        var paths = changedPathsOf(objIds);
        if (paths.isEmpty()) {
            logger.debug("No changes to commit for {} {}", objectLabel, objIds);
            return;
        }
        commitGitPaths(paths, commitMessage);
    }

    @Override
    public void discard(List<ID> objIds) throws IOException, StoreException {
        var paths = changedPathsOf(objIds);
        if (paths.isEmpty()) {
            return;
        }
        try {
            git.resetFiles(paths);
        } catch (GitAPIException e) {
            throw new StoreException("Failed to discard changes to " + objectLabel + " " + objIds, e);
        }
        dropIndex();
    }

    /**
     * IDs of objects with uncommitted changes. Changed files that belong to no object are reset as a side effect.
     */
    @Override
    public List<ID> listUncommitted() throws IOException, StoreException {
        var ids = new LinkedHashSet<ID>();
        for (var change : listUncommittedChanges()) {
            if (change.objectRef() != null) {
                ids.add(toObjectId(change.objectRef()));
            }
        }
        return List.copyOf(ids);
    }

    /** Changed files under this store's base directory, after resetting orphans. */
    public List<UncommittedChange> listUncommittedChanges() throws IOException, StoreException {
        var changes = new ArrayList<UncommittedChange>();
        var orphans = new ArrayList<String>();
        for (var change : classifyChangedFiles()) {
            if (change.isOrphan()) {
                orphans.add(change.path());
            } else {
                changes.add(change);
            }
        }
        if (!orphans.isEmpty()) {
            logger.warn("Resetting {} file(s) under {} that belong to no {}: {}", orphans.size(), basePath,
                    objectLabel, orphans);
            try {
                git.resetFiles(orphans);
            } catch (GitAPIException e) {
                throw new StoreException("Failed to reset orphan files " + orphans, e);
            }
        }
        return changes;
    }

    private List<UncommittedChange> classifyChangedFiles() throws StoreException {
        Set<String> changed;
        try {
            changed = git.listChangedFiles(List.of(basePath));
        } catch (GitAPIException e) {
            throw new StoreException("Failed to list changed files under " + basePath, e);
        }
        var prefix = basePath + "/";
        var result = new ArrayList<UncommittedChange>();
        for (var path : changed) {
            if (!path.startsWith(prefix)) {
                continue;
            }
            var relative = path.substring(prefix.length());
            var ref = backend.resolveObjectId(relative).orElse(null);
            if (ref != null && Files.exists(backend.baseDir().resolve(relative))) {
                var entry = relative.contains("/") ? relative.substring(0, relative.indexOf('/')) : relative;
                if (!backend.isValidId(entry)) {
                    ref = null;
                }
            }
            result.add(new UncommittedChange(path, ref));
        }
        return result;
    }

    private List<String> changedPathsOf(List<ID> objIds) throws StoreException {
        if (objIds.isEmpty()) {
            return List.of();
        }
        var refs = new LinkedHashSet<String>();
        for (var id : objIds) {
            refs.add(getRef(id));
        }
        var paths = new ArrayList<String>();
        for (var change : classifyChangedFiles()) {
            if (change.objectRef() != null && refs.contains(change.objectRef())) {
                paths.add(change.path());
            }
        }
        return paths;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // IDs and paths

    private String getRef(ID objId) {
        var ref = String.valueOf(objId);
        if (ref.isBlank() || ref.contains("/") || ref.contains("\\") || ref.equals(".") || ref.equals("..")) {
            throw new IllegalArgumentException("Invalid " + objectLabel + " ID: \"" + ref + "\"");
        }
        return ref;
    }

    private ID toObjectId(String ref) {
        if (idType == String.class) {
            return idType.cast(ref);
        }
        return YamlCodec.instance.mapper().convertValue(ref, idType);
    }

    private String toGitPath(String backendPath) {
        return basePath + "/" + backendPath;
    }
}
