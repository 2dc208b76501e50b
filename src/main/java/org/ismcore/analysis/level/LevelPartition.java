package org.ismcore.analysis.level;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Arrays;

/**
 * One hierarchy level: a 1-based level number and its element indices in ascending order.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LevelPartition {
    private final int level;
    @Getter(AccessLevel.NONE)
    private final int[] elements;

    public LevelPartition(int level, int[] elements) {
        if (level < 1) {
            throw new IllegalArgumentException("level must be >= 1");
        }
        if (elements == null || elements.length == 0) {
            throw new IllegalArgumentException("level " + level + " must contain at least one element");
        }
        int[] copy = Arrays.copyOf(elements, elements.length);
        Arrays.sort(copy);
        this.level = level;
        this.elements = copy;
    }

    /**
     * Returns a defensive copy of the element indices.
     */
    public int[] elementsCopy() {
        return Arrays.copyOf(elements, elements.length);
    }

    /**
     * Returns number of elements on this level.
     */
    public int elementCount() {
        return elements.length;
    }

    /**
     * Returns whether the element index sits on this level.
     */
    public boolean contains(int element) {
        return Arrays.binarySearch(elements, element) >= 0;
    }
}
