package org.ismcore.analysis.canonical;

import lombok.experimental.UtilityClass;
import org.ismcore.analysis.matrix.BinaryMatrix;

import java.util.Objects;

/**
 * Two-hop transitive reduction of a reachability closure, used for hierarchy drawing.
 *
 * <p>A direct edge {@code i -> j} is dropped when some third element k has
 * {@code i -> k} and {@code k -> j} in the closure. Only two-hop redundancy is checked,
 * so the result is not a minimum equivalent graph. Inside a mutually reachable group
 * of three or more elements every edge has such a k and the group loses all its edges.
 * Edges leaving a mutually reachable pair can be dropped the same way, so reachability is
 * preserved only for cycle-free closures.</p>
 */
@UtilityClass
public final class Canonicalizer {

    /**
     * Reduces a closure matrix.
     *
     * @param closure final reachability matrix; not modified.
     * @return canonical matrix with an empty diagonal.
     */
    public static BinaryMatrix reduce(BinaryMatrix closure) {
        Objects.requireNonNull(closure, "closure");
        boolean[][] reach = closure.toBooleanArray();
        boolean[][] skeleton = closure.toBooleanArray();
        int size = reach.length;
        for (int i = 0; i < size; i++) {
            skeleton[i][i] = false;
        }

        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (skeleton[i][j] && hasIntermediate(reach, i, j)) {
                    skeleton[i][j] = false;
                }
            }
        }
        return BinaryMatrix.of(skeleton);
    }

    /**
     * Returns whether the closure has a path {@code i -> k -> j} with k distinct from i and j.
     */
    private static boolean hasIntermediate(boolean[][] reach, int i, int j) {
        for (int k = 0; k < reach.length; k++) {
            if (k != i && k != j && reach[i][k] && reach[k][j]) {
                return true;
            }
        }
        return false;
    }
}
