package org.ismcore.analysis.hierarchy;

import lombok.experimental.UtilityClass;
import org.ismcore.analysis.level.LevelPartition;
import org.ismcore.analysis.matrix.BinaryMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Selects the direct edges worth drawing on a level diagram.
 *
 * <p>An edge {@code s -> t} of the initial matrix is kept when {@code level(s) - level(t)}
 * is 0 or 1. Edges spanning more levels, or pointing down the diagram, are omitted.</p>
 */
@UtilityClass
public final class HierarchyLinkExtractor {

    /**
     * Extracts drawable links ordered by source then target index.
     *
     * @param initial initial reachability matrix.
     * @param levels level partition covering every index of {@code initial}.
     * @return immutable link list.
     */
    public static List<HierarchyLink> extract(BinaryMatrix initial, List<LevelPartition> levels) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(levels, "levels");
        int size = initial.size();
        int[] levelByElement = levelByElement(size, levels);

        List<HierarchyLink> links = new ArrayList<>();
        for (int source = 0; source < size; source++) {
            for (int target = 0; target < size; target++) {
                if (source == target || !initial.get(source, target)) {
                    continue;
                }
                int levelDiff = levelByElement[source] - levelByElement[target];
                if (levelDiff == 0) {
                    links.add(new HierarchyLink(source, target, HierarchyLinkKind.SAME_LEVEL));
                } else if (levelDiff == 1) {
                    links.add(new HierarchyLink(source, target, HierarchyLinkKind.ADJACENT_LEVEL));
                }
            }
        }
        return Collections.unmodifiableList(links);
    }

    private static int[] levelByElement(int size, List<LevelPartition> levels) {
        int[] levelByElement = new int[size];
        for (LevelPartition partition : levels) {
            for (int element : partition.elementsCopy()) {
                if (element < 0 || element >= size) {
                    throw new IllegalArgumentException(
                            "level " + partition.getLevel() + " holds out-of-range element " + element
                    );
                }
                levelByElement[element] = partition.getLevel();
            }
        }
        for (int element = 0; element < size; element++) {
            if (levelByElement[element] == 0) {
                throw new IllegalArgumentException("element " + element + " is not assigned to any level");
            }
        }
        return levelByElement;
    }
}
