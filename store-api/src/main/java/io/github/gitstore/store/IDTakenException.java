package io.github.gitstore.store;

/** Thrown when creating an object whose ID is already used by an existing object. */
public class IDTakenException extends StoreException {
    private final Object objectId;

    public IDTakenException(Object objectId) {
        super("ID is taken, such an object already exists: " + objectId);
        this.objectId = objectId;
    }

    public Object getObjectId() {
        return objectId;
    }
}
