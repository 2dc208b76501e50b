package org.ismcore.analysis.relation;

/**
 * Total lookup of the relation judgment between two element identifiers.
 *
 * <p>Implementations never return null: a pair without a stated judgment
 * resolves to {@link Relation#O}.</p>
 */
@FunctionalInterface
public interface RelationLookup {

    /**
     * Resolves the judgment for {@code (rowId, columnId)}.
     *
     * @param rowId identifier of the earlier element; never null.
     * @param columnId identifier of the later element; never null.
     * @return stated judgment, or {@link Relation#O} when none is stated.
     */
    Relation relationOf(String rowId, String columnId);

    /**
     * Returns a lookup that states no judgments.
     */
    static RelationLookup none() {
        return (rowId, columnId) -> Relation.O;
    }
}
