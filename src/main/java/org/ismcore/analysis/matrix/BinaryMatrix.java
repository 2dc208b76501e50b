package org.ismcore.analysis.matrix;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable square 0/1 adjacency matrix over element indices.
 *
 * <p>Array-valued accessors return defensive copies; construction copies its input,
 * so callers may keep mutating the arrays they pass in.</p>
 */
public final class BinaryMatrix {
    private final boolean[][] cells;

    private BinaryMatrix(boolean[][] cells) {
        this.cells = cells;
    }

    /**
     * Creates an all-zero matrix.
     *
     * @param size row and column count.
     * @return empty matrix of the given size.
     */
    public static BinaryMatrix empty(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        return new BinaryMatrix(new boolean[size][size]);
    }

    /**
     * Creates a matrix from a boolean grid.
     *
     * @param cells square grid; copied.
     * @return immutable matrix.
     */
    public static BinaryMatrix of(boolean[][] cells) {
        Objects.requireNonNull(cells, "cells");
        int size = cells.length;
        boolean[][] copy = new boolean[size][];
        for (int i = 0; i < size; i++) {
            boolean[] row = Objects.requireNonNull(cells[i], "cells[" + i + "]");
            requireRowWidth(row.length, size, i);
            copy[i] = row.clone();
        }
        return new BinaryMatrix(copy);
    }

    /**
     * Creates a matrix from a 0/1 integer grid.
     *
     * @param cells square grid holding only 0 and 1.
     * @return immutable matrix.
     */
    public static BinaryMatrix fromInts(int[][] cells) {
        Objects.requireNonNull(cells, "cells");
        int size = cells.length;
        boolean[][] copy = new boolean[size][size];
        for (int i = 0; i < size; i++) {
            int[] row = Objects.requireNonNull(cells[i], "cells[" + i + "]");
            requireRowWidth(row.length, size, i);
            for (int j = 0; j < size; j++) {
                int value = row[j];
                if (value != 0 && value != 1) {
                    throw new IllegalArgumentException(
                            "cells[" + i + "][" + j + "] must be 0 or 1, found " + value
                    );
                }
                copy[i][j] = value == 1;
            }
        }
        return new BinaryMatrix(copy);
    }

    /**
     * Returns the row and column count.
     */
    public int size() {
        return cells.length;
    }

    /**
     * Returns whether the edge {@code row -> column} is present.
     */
    public boolean get(int row, int column) {
        validateIndex(row, "row");
        validateIndex(column, "column");
        return cells[row][column];
    }

    /**
     * Returns the number of ones in a row, diagonal included.
     */
    public int rowSum(int row) {
        validateIndex(row, "row");
        int sum = 0;
        for (boolean cell : cells[row]) {
            if (cell) {
                sum++;
            }
        }
        return sum;
    }

    /**
     * Returns the number of ones in a column, diagonal included.
     */
    public int columnSum(int column) {
        validateIndex(column, "column");
        int sum = 0;
        for (boolean[] row : cells) {
            if (row[column]) {
                sum++;
            }
        }
        return sum;
    }

    /**
     * Returns the number of off-diagonal ones.
     */
    public int edgeCount() {
        int count = 0;
        for (int i = 0; i < cells.length; i++) {
            for (int j = 0; j < cells.length; j++) {
                if (i != j && cells[i][j]) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Returns a defensive 0/1 integer copy.
     */
    public int[][] toIntArray() {
        int size = cells.length;
        int[][] copy = new int[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                copy[i][j] = cells[i][j] ? 1 : 0;
            }
        }
        return copy;
    }

    /**
     * Returns a defensive boolean copy.
     */
    public boolean[][] toBooleanArray() {
        boolean[][] copy = new boolean[cells.length][];
        for (int i = 0; i < cells.length; i++) {
            copy[i] = cells[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BinaryMatrix)) {
            return false;
        }
        return Arrays.deepEquals(cells, ((BinaryMatrix) other).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (boolean[] row : cells) {
            for (int j = 0; j < row.length; j++) {
                if (j > 0) {
                    builder.append(' ');
                }
                builder.append(row[j] ? '1' : '0');
            }
            builder.append('\n');
        }
        return builder.toString();
    }

    private static void requireRowWidth(int width, int size, int rowIndex) {
        if (width != size) {
            throw new IllegalArgumentException(
                    "cells[" + rowIndex + "] length mismatch: " + width + " != " + size
            );
        }
    }

    private void validateIndex(int index, String name) {
        if (index < 0 || index >= cells.length) {
            throw new IndexOutOfBoundsException(name + " out of bounds: " + index);
        }
    }
}
