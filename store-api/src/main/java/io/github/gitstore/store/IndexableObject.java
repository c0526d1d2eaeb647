package io.github.gitstore.store;

/**
 * A structured value that can be kept in a store. The only thing a store requires of it is a unique, stable
 * identifier; everything else about the object belongs to the application.
 *
 * @param <ID> identifier type, normally {@link String} or a boxed integral number
 */
public interface IndexableObject<ID> {
    ID getId();
}
