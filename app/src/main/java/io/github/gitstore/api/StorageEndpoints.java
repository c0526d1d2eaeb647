package io.github.gitstore.api;

import com.fasterxml.jackson.databind.JavaType;
import io.github.gitstore.api.ApiRouter.NoInput;
import io.github.gitstore.git.WindowNotifier;
import io.github.gitstore.store.GitFilesystemStore;
import io.github.gitstore.store.IndexableObject;
import io.github.gitstore.store.StoreException;
import java.io.IOException;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * CRUD and versioning requests for one content type, named {@code storage-<action>-in-<contentType>}. Every request
 * that changes objects is followed by a {@value #CHANGED_EVENT} broadcast.
 *
 * <p>Write requests take an optional {@code commit}: {@code true} to commit with a generated message, or a string to
 * use as the commit message.
 */
public final class StorageEndpoints<O extends IndexableObject<ID>, ID> {
    public static final String CHANGED_EVENT = "storage-changed";

    public record ObjectRef<K>(K objectId) {}

    public record CreateRequest<T>(T object, @Nullable Object commit) {}

    public record UpdateRequest<K, T>(K objectId, T object, @Nullable Object commit) {}

    public record DeleteRequest<K>(K objectId, @Nullable Object commit) {}

    public record ObjectIdsRequest<K>(List<K> objectIds, @Nullable String commitMessage) {}

    public record StorageChanged(String contentType, List<?> objectIds) {}

    private final String contentType;
    private final GitFilesystemStore<O, ID> store;
    private final JavaType objectType;
    private final JavaType idType;
    private final WindowNotifier notifier;

    public StorageEndpoints(
            String contentType,
            GitFilesystemStore<O, ID> store,
            JavaType objectType,
            JavaType idType,
            WindowNotifier notifier) {
        this.contentType = contentType;
        this.store = store;
        this.objectType = objectType;
        this.idType = idType;
        this.notifier = notifier;
    }

    private String name(String action) {
        return "storage-" + action + "-in-" + contentType;
    }

    public void register(ApiRouter router) {
        var types = router.mapper().getTypeFactory();

        router.listen(name("read-all"), NoInput.class, in -> store.getCachedIndex());

        router.<ObjectRef<ID>>listen(
                name("read-one"),
                types.constructParametricType(ObjectRef.class, idType),
                in -> store.read(in.objectId()));

        router.<CreateRequest<O>>listen(
                name("create-one"), types.constructParametricType(CreateRequest.class, objectType), in -> {
                    var obj = in.object();
                    var commit = in.commit();
                    if (commit instanceof String message) {
                        store.create(obj, message);
                    } else {
                        store.create(obj, Boolean.TRUE.equals(commit));
                    }
                    notifyChanged(List.of(obj.getId()));
                    return new ObjectRef<>(obj.getId());
                });

        router.<UpdateRequest<ID, O>>listen(
                name("update-one"), types.constructParametricType(UpdateRequest.class, idType, objectType), in -> {
                    var commit = in.commit();
                    if (commit instanceof String message) {
                        store.update(in.objectId(), in.object(), message);
                    } else {
                        store.update(in.objectId(), in.object(), Boolean.TRUE.equals(commit));
                    }
                    notifyChanged(List.of(in.objectId()));
                    return null;
                });

        router.<DeleteRequest<ID>>listen(
                name("delete-one"), types.constructParametricType(DeleteRequest.class, idType), in -> {
                    var commit = in.commit();
                    if (commit instanceof String message) {
                        store.delete(in.objectId(), message);
                    } else {
                        store.delete(in.objectId(), Boolean.TRUE.equals(commit));
                    }
                    notifyChanged(List.of(in.objectId()));
                    return null;
                });

        router.listen(name("read-modified"), NoInput.class, in -> store.listUncommitted());

        router.<ObjectIdsRequest<ID>>listen(
                name("commit-objects"), types.constructParametricType(ObjectIdsRequest.class, idType), in -> {
                    commitObjects(in);
                    return null;
                });

        router.<ObjectIdsRequest<ID>>listen(
                name("discard-objects"), types.constructParametricType(ObjectIdsRequest.class, idType), in -> {
                    store.discard(in.objectIds());
                    notifyChanged(in.objectIds());
                    return null;
                });
    }

    private void commitObjects(ObjectIdsRequest<ID> request) throws IOException, StoreException {
        var message = request.commitMessage();
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Commit message is required");
        }
        store.commit(request.objectIds(), message);
        notifyChanged(request.objectIds());
    }

    private void notifyChanged(List<?> objectIds) {
        notifier.notifyAllWindows(CHANGED_EVENT, new StorageChanged(contentType, objectIds));
    }
}
