package org.ismcore.analysis.matrix;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BinaryMatrix Tests")
class BinaryMatrixTest {

    @Test
    @DisplayName("Row sums, column sums and edge count include the documented cells")
    void testSums() {
        BinaryMatrix matrix = BinaryMatrix.fromInts(new int[][]{
                {1, 1, 1},
                {0, 1, 1},
                {0, 0, 1}
        });

        assertEquals(3, matrix.size());
        assertEquals(3, matrix.rowSum(0));
        assertEquals(1, matrix.rowSum(2));
        assertEquals(1, matrix.columnSum(0));
        assertEquals(3, matrix.columnSum(2));
        assertEquals(3, matrix.edgeCount(), "diagonal is not counted as an edge");
    }

    @Test
    @DisplayName("Construction and accessors copy their arrays")
    void testDefensiveCopies() {
        boolean[][] source = {{true, false}, {false, true}};
        BinaryMatrix matrix = BinaryMatrix.of(source);
        source[0][1] = true;
        assertFalse(matrix.get(0, 1));

        boolean[][] exported = matrix.toBooleanArray();
        exported[1][0] = true;
        assertFalse(matrix.get(1, 0));

        int[][] ints = matrix.toIntArray();
        ints[0][0] = 0;
        assertTrue(matrix.get(0, 0));
    }

    @Test
    @DisplayName("Value equality follows cell contents")
    void testEquality() {
        BinaryMatrix left = BinaryMatrix.fromInts(new int[][]{{1, 0}, {1, 1}});
        BinaryMatrix right = BinaryMatrix.of(new boolean[][]{{true, false}, {true, true}});

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertNotEquals(left, BinaryMatrix.empty(2));
        assertEquals("1 0\n1 1\n", left.toString());
    }

    @Test
    @DisplayName("Non-square grids, non-binary values and bad indices are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> BinaryMatrix.of(new boolean[][]{{true, false}}));
        assertThrows(IllegalArgumentException.class, () -> BinaryMatrix.fromInts(new int[][]{{2}}));
        assertThrows(IllegalArgumentException.class, () -> BinaryMatrix.empty(-1));
        assertThrows(NullPointerException.class, () -> BinaryMatrix.of(new boolean[][]{null}));

        BinaryMatrix matrix = BinaryMatrix.empty(2);
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.get(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.get(0, -1));
        assertThrows(IndexOutOfBoundsException.class, () -> matrix.rowSum(5));
    }
}
