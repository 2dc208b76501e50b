package org.ismcore.analysis.level;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.ismcore.analysis.matrix.BinaryMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Iterative level partitioning of a reachability closure.
 *
 * <p>Each pass looks only at unassigned elements. For element i it takes
 * {@code Reach(i)}, the remaining elements i reaches, and {@code Ante(i)}, the remaining
 * elements reaching i. Elements with {@code Reach(i) ⊆ Ante(i)} form the next level.
 * Level 1 therefore holds the top (outcome) elements and the last level the drivers.</p>
 *
 * <p>When a pass finds no qualifying element, every remaining element is emitted as one
 * terminal level. The number of levels is capped at {@code N + capSlack}; reaching the cap
 * also flushes the remainder, so every index lands on exactly one level. The cap is purely
 * defensive: every pass assigns at least one element and a single remaining element always
 * qualifies, so no input matrix can reach it.</p>
 *
 * <p>Within a level, elements are listed in ascending index order.</p>
 */
public final class LevelPartitioner {
    public static final int DEFAULT_CAP_SLACK = 5;

    private static final Logger log = LoggerFactory.getLogger(LevelPartitioner.class);

    private LevelPartitioner() {
    }

    /**
     * Partitions with the default level cap of {@code N + 5}.
     *
     * @param closure final reachability matrix.
     * @return levels in emission order.
     */
    public static List<LevelPartition> partition(BinaryMatrix closure) {
        return partition(closure, DEFAULT_CAP_SLACK);
    }

    /**
     * Partitions with a level cap of {@code N + capSlack}.
     *
     * @param closure final reachability matrix.
     * @param capSlack levels allowed beyond N before the remainder is flushed; >= 0.
     * @return levels in emission order.
     */
    public static List<LevelPartition> partition(BinaryMatrix closure, int capSlack) {
        Objects.requireNonNull(closure, "closure");
        if (capSlack < 0) {
            throw new IllegalArgumentException("capSlack must be >= 0");
        }
        boolean[][] reach = closure.toBooleanArray();
        int size = reach.length;
        int maxLevels = size + capSlack;

        boolean[] assigned = new boolean[size];
        IntArrayList remaining = new IntArrayList(size);
        List<LevelPartition> levels = new ArrayList<>();
        int level = 1;

        while (true) {
            remaining.clear();
            for (int element = 0; element < size; element++) {
                if (!assigned[element]) {
                    remaining.add(element);
                }
            }
            if (remaining.isEmpty()) {
                break;
            }

            IntArrayList qualifying = selectLevel(reach, remaining);
            if (qualifying.isEmpty()) {
                log.debug("No element qualifies at level {}; emitting cyclic remainder of {} elements",
                        level, remaining.size());
                levels.add(new LevelPartition(level, remaining.toIntArray()));
                break;
            }
            if (level >= maxLevels && qualifying.size() < remaining.size()) {
                log.warn("Level cap {} reached with {} unassigned elements; flushing them as one level",
                        maxLevels, remaining.size());
                levels.add(new LevelPartition(level, remaining.toIntArray()));
                break;
            }

            levels.add(new LevelPartition(level, qualifying.toIntArray()));
            for (int i = 0; i < qualifying.size(); i++) {
                assigned[qualifying.getInt(i)] = true;
            }
            level++;
        }
        return Collections.unmodifiableList(levels);
    }

    /**
     * Returns the remaining elements whose reachability set is contained in their antecedent set.
     */
    static IntArrayList selectLevel(boolean[][] reach, IntArrayList remaining) {
        IntArrayList qualifying = new IntArrayList();
        for (int a = 0; a < remaining.size(); a++) {
            int element = remaining.getInt(a);
            if (reachesOnlyAntecedents(reach, remaining, element)) {
                qualifying.add(element);
            }
        }
        return qualifying;
    }

    /**
     * Checks {@code Reach(i) ⊆ Ante(i)} restricted to the remaining set.
     */
    private static boolean reachesOnlyAntecedents(boolean[][] reach, IntArrayList remaining, int element) {
        for (int b = 0; b < remaining.size(); b++) {
            int other = remaining.getInt(b);
            if (reach[element][other] && !reach[other][element]) {
                return false;
            }
        }
        return true;
    }
}
