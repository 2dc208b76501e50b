package org.ismcore.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between caller-supplied element identifiers and matrix indices.
 */
public interface ElementIdMapper {

    /**
     * Converts an element identifier to its matrix index.
     * @param identifier The caller-facing identifier.
     * @return The matrix index of its first occurrence.
     * @throws UnknownElementException If the identifier is not mapped.
     */
    int toIndex(String identifier) throws UnknownElementException;

    /**
     * Converts a matrix index to the identifier at that position.
     * @param index The matrix index.
     * @return The identifier, or null when the caller supplied a null at that position.
     * @throws IndexOutOfBoundsException If the index is outside the mapped positions.
     */
    String toIdentifier(int index);

    /**
     * Checks whether an identifier has a mapped index.
     *
     * @param identifier identifier to test.
     * @return true when the identifier is present.
     */
    boolean containsIdentifier(String identifier);

    /**
     * Checks whether an index is within mapper bounds.
     *
     * @param index index to test.
     * @return true when the index is present.
     */
    boolean containsIndex(int index);

    /**
     * Returns number of mapped positions.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when an identifier cannot be found in the mapping.
     */
    @StandardException
    class UnknownElementException extends RuntimeException {
    }

    /**
     * Factory method for the default immutable implementation.
     *
     * @param identifiers identifiers in matrix order.
     * @return An immutable ElementIdMapper instance.
     */
    static ElementIdMapper fromIdentifiers(List<String> identifiers) {
        return new FastUtilElementIdMapper(identifiers);
    }
}
