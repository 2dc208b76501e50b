package org.ismcore.analysis.relation;

import java.util.Locale;

/**
 * Pairwise influence judgment for an ordered pair (i, j) with i before j.
 *
 * <p>{@code V}: i influences j. {@code A}: j influences i.
 * {@code X}: mutual influence. {@code O}: no direct influence.</p>
 */
public enum Relation {
    V(true, false),
    A(false, true),
    X(true, true),
    O(false, false);

    private final boolean forward;
    private final boolean backward;

    Relation(boolean forward, boolean backward) {
        this.forward = forward;
        this.backward = backward;
    }

    /**
     * Returns whether the judgment sets the edge i -> j.
     */
    public boolean forward() {
        return forward;
    }

    /**
     * Returns whether the judgment sets the edge j -> i.
     */
    public boolean backward() {
        return backward;
    }

    /**
     * Parses a one-letter symbol, case-insensitive. Null or blank input is {@link #O}.
     *
     * @param symbol V, A, X or O.
     * @return parsed relation.
     * @throws IllegalArgumentException for any other symbol.
     */
    public static Relation fromSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return O;
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "V":
                return V;
            case "A":
                return A;
            case "X":
                return X;
            case "O":
                return O;
            default:
                throw new IllegalArgumentException("unknown relation symbol: " + symbol);
        }
    }
}
