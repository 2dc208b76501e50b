package org.ismcore.analysis.relation;

import lombok.experimental.UtilityClass;
import org.ismcore.analysis.matrix.BinaryMatrix;

import java.util.List;
import java.util.Objects;

/**
 * Builds the initial reachability matrix from pairwise relation judgments.
 *
 * <p>Only the upper triangle {@code (i < j)} of the lookup is consulted. The diagonal
 * is always set.</p>
 */
@UtilityClass
public final class RelationEncoder {

    /**
     * Encodes judgments for {@code n} elements into an {@code n x n} matrix.
     *
     * @param n element count; N is authoritative over the identifier list length.
     * @param identifiers identifiers in matrix order; positions past its end read as null.
     * @param lookup relation lookup.
     * @return initial reachability matrix.
     */
    public static BinaryMatrix encode(int n, List<String> identifiers, RelationLookup lookup) {
        if (n < 0) {
            throw new IllegalArgumentException("element count must be >= 0");
        }
        Objects.requireNonNull(lookup, "lookup");

        boolean[][] matrix = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = true;
            String rowId = identifierAt(identifiers, i);
            for (int j = i + 1; j < n; j++) {
                Relation relation = lookup(lookup, rowId, identifierAt(identifiers, j));
                matrix[i][j] = relation.forward();
                matrix[j][i] = relation.backward();
            }
        }
        return BinaryMatrix.of(matrix);
    }

    /**
     * Resolves one pair. A missing identifier or a null answer resolves to {@link Relation#O};
     * the lookup is never called with a null identifier.
     */
    public static Relation lookup(RelationLookup lookup, String rowId, String columnId) {
        if (rowId == null || columnId == null) {
            return Relation.O;
        }
        Relation relation = lookup.relationOf(rowId, columnId);
        return relation == null ? Relation.O : relation;
    }

    private static String identifierAt(List<String> identifiers, int index) {
        if (identifiers == null || index >= identifiers.size()) {
            return null;
        }
        return identifiers.get(index);
    }
}
