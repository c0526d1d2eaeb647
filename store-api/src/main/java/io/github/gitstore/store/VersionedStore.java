package io.github.gitstore.store;

import java.io.IOException;
import java.util.List;

/**
 * A store whose changes are tracked by a version control system.
 *
 * <p>Each mutating method comes in two flavours: with a {@code boolean} flag, where {@code true} commits the change
 * with an automatically generated message, and with an explicit commit message. The plain {@link Store} methods never
 * commit.
 */
public interface VersionedStore<O extends IndexableObject<ID>, ID> extends Store<O, ID> {

    void create(O obj, boolean commit) throws IOException, StoreException;

    void create(O obj, String commitMessage) throws IOException, StoreException;

    void update(ID objId, O obj, boolean commit) throws IOException, StoreException;

    void update(ID objId, O obj, String commitMessage) throws IOException, StoreException;

    void delete(ID objId, boolean commit) throws IOException, StoreException;

    void delete(ID objId, String commitMessage) throws IOException, StoreException;

    /** Commits uncommitted changes made to the objects with given IDs. IDs without changes are ignored. */
    void commit(List<ID> objIds, String commitMessage) throws IOException, StoreException;

    /** Discards uncommitted changes made to the objects with given IDs. */
    void discard(List<ID> objIds) throws IOException, StoreException;

    /** Lists IDs of objects that have uncommitted changes. */
    List<ID> listUncommitted() throws IOException, StoreException;
}
