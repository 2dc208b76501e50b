package org.ismcore.analysis.testutil;

import org.ismcore.analysis.matrix.BinaryMatrix;
import org.ismcore.analysis.relation.Relation;
import org.ismcore.analysis.relation.SsimTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared relation-table fixtures for analysis tests.
 */
public final class SsimFixtures {
    private static final Relation[] RELATIONS = Relation.values();

    private SsimFixtures() {
    }

    public record Fixture(List<String> identifiers, SsimTable table) {
        public int size() {
            return identifiers.size();
        }
    }

    /**
     * Returns identifiers E0..E(n-1).
     */
    public static List<String> identifiers(int n) {
        List<String> identifiers = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            identifiers.add("E" + i);
        }
        return identifiers;
    }

    /**
     * Chain E0 -> E1 -> ... -> E(n-1) stated with V judgments only.
     */
    public static Fixture chain(int n) {
        List<String> identifiers = identifiers(n);
        SsimTable.Builder builder = SsimTable.builder();
        for (int i = 0; i + 1 < n; i++) {
            builder.put(identifiers.get(i), identifiers.get(i + 1), Relation.V);
        }
        return new Fixture(identifiers, builder.build());
    }

    /**
     * Upper-triangle table with uniformly drawn judgments.
     */
    public static Fixture random(int n, long seed) {
        Random random = new Random(seed);
        List<String> identifiers = identifiers(n);
        SsimTable.Builder builder = SsimTable.builder();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                builder.put(identifiers.get(i), identifiers.get(j), RELATIONS[random.nextInt(RELATIONS.length)]);
            }
        }
        return new Fixture(identifiers, builder.build());
    }

    /**
     * Upper-triangle table with V/O judgments only, so the stated graph is acyclic.
     */
    public static Fixture randomAcyclic(int n, long seed, double density) {
        Random random = new Random(seed);
        List<String> identifiers = identifiers(n);
        SsimTable.Builder builder = SsimTable.builder();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (random.nextDouble() < density) {
                    builder.put(identifiers.get(i), identifiers.get(j), Relation.V);
                }
            }
        }
        return new Fixture(identifiers, builder.build());
    }

    /**
     * Parses rows of '0'/'1' characters into a matrix, e.g. {@code "110", "010", "001"}.
     */
    public static BinaryMatrix matrix(String... rows) {
        int[][] cells = new int[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            cells[i] = new int[rows[i].length()];
            for (int j = 0; j < rows[i].length(); j++) {
                cells[i][j] = rows[i].charAt(j) == '1' ? 1 : 0;
            }
        }
        return BinaryMatrix.fromInts(cells);
    }

    /**
     * Returns whether {@code target} is reachable from {@code source} over the matrix edges.
     */
    public static boolean pathExists(BinaryMatrix matrix, int source, int target) {
        int size = matrix.size();
        boolean[] seen = new boolean[size];
        int[] stack = new int[size];
        int top = 0;
        stack[top++] = source;
        seen[source] = true;
        while (top > 0) {
            int node = stack[--top];
            if (node == target) {
                return true;
            }
            for (int next = 0; next < size; next++) {
                if (!seen[next] && matrix.get(node, next)) {
                    seen[next] = true;
                    stack[top++] = next;
                }
            }
        }
        return false;
    }
}
