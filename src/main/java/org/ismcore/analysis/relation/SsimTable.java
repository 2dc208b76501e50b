package org.ismcore.analysis.relation;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable structural self-interaction table keyed by identifier pairs.
 *
 * <p>Storage is a two-level map {@code rowId -> columnId -> relation}. Pairs with no
 * entry, null keys and null values all resolve to {@link Relation#O}.</p>
 */
public final class SsimTable implements RelationLookup {
    private final Map<String, Map<String, Relation>> entries;

    private SsimTable(Map<String, Map<String, Relation>> entries) {
        this.entries = entries;
    }

    /**
     * Creates a table from a nested map; copied.
     *
     * @param source {@code rowId -> columnId -> relation} entries.
     * @return immutable table.
     */
    public static SsimTable of(Map<String, ? extends Map<String, Relation>> source) {
        Objects.requireNonNull(source, "source");
        Builder builder = builder();
        for (Map.Entry<String, ? extends Map<String, Relation>> row : source.entrySet()) {
            if (row.getKey() == null || row.getValue() == null) {
                continue;
            }
            for (Map.Entry<String, Relation> cell : row.getValue().entrySet()) {
                if (cell.getKey() != null && cell.getValue() != null) {
                    builder.put(row.getKey(), cell.getKey(), cell.getValue());
                }
            }
        }
        return builder.build();
    }

    /**
     * Returns an empty table builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Relation relationOf(String rowId, String columnId) {
        if (rowId == null || columnId == null) {
            return Relation.O;
        }
        Map<String, Relation> row = entries.get(rowId);
        if (row == null) {
            return Relation.O;
        }
        return row.getOrDefault(columnId, Relation.O);
    }

    /**
     * Returns number of stated judgments, {@code O} entries included.
     */
    public int entryCount() {
        int count = 0;
        for (Map<String, Relation> row : entries.values()) {
            count += row.size();
        }
        return count;
    }

    /**
     * Returns an unmodifiable view of the stated judgments.
     */
    public Map<String, Map<String, Relation>> asMap() {
        return entries;
    }

    /**
     * Mutable builder for {@link SsimTable}. Later puts for the same pair win.
     */
    public static final class Builder {
        private final Map<String, Map<String, Relation>> entries = new HashMap<>();

        private Builder() {
        }

        /**
         * States the judgment for {@code (rowId, columnId)}.
         */
        public Builder put(String rowId, String columnId, Relation relation) {
            Objects.requireNonNull(rowId, "rowId");
            Objects.requireNonNull(columnId, "columnId");
            Objects.requireNonNull(relation, "relation");
            entries.computeIfAbsent(rowId, key -> new HashMap<>()).put(columnId, relation);
            return this;
        }

        /**
         * States the judgment for {@code (rowId, columnId)} from its one-letter symbol.
         */
        public Builder put(String rowId, String columnId, String symbol) {
            return put(rowId, columnId, Relation.fromSymbol(symbol));
        }

        public SsimTable build() {
            Map<String, Map<String, Relation>> copy = new HashMap<>(entries.size());
            for (Map.Entry<String, Map<String, Relation>> row : entries.entrySet()) {
                copy.put(row.getKey(), Collections.unmodifiableMap(new HashMap<>(row.getValue())));
            }
            return new SsimTable(Collections.unmodifiableMap(copy));
        }
    }
}
