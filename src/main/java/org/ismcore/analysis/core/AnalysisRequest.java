package org.ismcore.analysis.core;

import lombok.Builder;
import lombok.Value;
import org.ismcore.analysis.relation.RelationLookup;

import java.util.List;

/**
 * Snapshot of analysis inputs.
 *
 * <p>The element count is authoritative; identifiers are matched to matrix positions
 * by list order and only used for relation lookup and result lookups.</p>
 */
@Value
@Builder
public class AnalysisRequest {
    /** Number of elements N. */
    int elementCount;
    /** Identifiers in matrix order; expected length N. */
    List<String> identifiers;
    /** Pairwise relation judgments keyed by identifiers. */
    RelationLookup relations;

    /**
     * Creates a request whose element count is the identifier list length.
     */
    public static AnalysisRequest of(List<String> identifiers, RelationLookup relations) {
        return new AnalysisRequest(identifiers == null ? 0 : identifiers.size(), identifiers, relations);
    }
}
