package org.ismcore.analysis.closure;

import lombok.experimental.UtilityClass;
import org.ismcore.analysis.matrix.BinaryMatrix;

import java.util.Objects;

/**
 * Transitive closure of an adjacency matrix (final reachability matrix).
 */
@UtilityClass
public final class ClosureComputer {

    /**
     * Computes the closure with Warshall propagation: for every intermediate k, every
     * pair (i, j) with {@code i -> k} and {@code k -> j} gains {@code i -> j}.
     *
     * @param matrix direct-edge matrix; not modified.
     * @return reachability closure of {@code matrix}.
     */
    public static BinaryMatrix close(BinaryMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix");
        boolean[][] reach = matrix.toBooleanArray();
        int size = reach.length;
        for (int k = 0; k < size; k++) {
            boolean[] viaRow = reach[k];
            for (int i = 0; i < size; i++) {
                if (!reach[i][k]) {
                    continue;
                }
                boolean[] row = reach[i];
                for (int j = 0; j < size; j++) {
                    if (viaRow[j]) {
                        row[j] = true;
                    }
                }
            }
        }
        return BinaryMatrix.of(reach);
    }
}
