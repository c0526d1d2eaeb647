package io.github.gitstore.store;

import java.io.IOException;
import java.util.Map;

/** Basic object manipulation for one content type. */
public interface Store<O extends IndexableObject<ID>, ID> {

    /**
     * Scans the underlying storage and returns every object, keyed by the stringified object ID.
     */
    Map<String, O> getIndex() throws IOException;

    O read(ID objId) throws IOException;

    void create(O obj) throws IOException, StoreException;

    void update(ID objId, O obj) throws IOException, StoreException;

    void delete(ID objId) throws IOException, StoreException;
}
