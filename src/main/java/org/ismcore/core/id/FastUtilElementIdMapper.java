package org.ismcore.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * ElementIdMapper backed by a fastutil open hash map.
 *
 * <p>Positions are taken from the identifier list as given. A repeated identifier
 * maps to its first position; null entries occupy a position but are not
 * reachable through {@link #toIndex(String)}.</p>
 *
 * <p>Immutable and safe for concurrent reads.</p>
 */
public class FastUtilElementIdMapper implements ElementIdMapper {

    // identifier -> first index
    private final Object2IntOpenHashMap<String> forward;
    // index -> identifier
    private final String[] reverse;

    /**
     * Constructs the mapper from identifiers in matrix order.
     */
    public FastUtilElementIdMapper(List<String> identifiers) {
        if (identifiers == null) {
            throw new IllegalArgumentException("Identifiers cannot be null");
        }
        int size = identifiers.size();

        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        this.reverse = new String[size];

        for (int index = 0; index < size; index++) {
            String identifier = identifiers.get(index);
            this.reverse[index] = identifier;
            if (identifier != null) {
                this.forward.putIfAbsent(identifier, index);
            }
        }
        this.forward.trim();
    }

    @Override
    public int toIndex(String identifier) throws UnknownElementException {
        if (identifier == null) {
            throw new IllegalArgumentException("identifier cannot be null");
        }
        int index = forward.getInt(identifier);
        if (index == -1) {
            throw new UnknownElementException("Element identifier not found: " + identifier);
        }
        return index;
    }

    @Override
    public String toIdentifier(int index) {
        if (!containsIndex(index)) {
            throw new IndexOutOfBoundsException("Element index out of bounds: " + index);
        }
        return reverse[index];
    }

    @Override
    public boolean containsIdentifier(String identifier) {
        return identifier != null && forward.containsKey(identifier);
    }

    @Override
    public boolean containsIndex(int index) {
        return index >= 0 && index < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
