package org.ismcore.analysis.core;

import lombok.Builder;
import lombok.Value;
import org.ismcore.analysis.level.LevelPartitioner;

/**
 * Tunables for {@link IsmAnalyzer}.
 */
@Value
@Builder
public class AnalysisConfig {
    /**
     * Identifier/count mismatch handling.
     */
    @Builder.Default
    IdentifierPolicy identifierPolicy = IdentifierPolicy.TOLERATE;

    /**
     * Levels allowed beyond the element count before the remainder is flushed.
     */
    @Builder.Default
    int levelCapSlack = LevelPartitioner.DEFAULT_CAP_SLACK;

    /**
     * Computes the MICMAC report; an empty report is attached otherwise.
     */
    @Builder.Default
    boolean includeMicmac = true;

    /**
     * Computes drawable hierarchy links; an empty list is attached otherwise.
     */
    @Builder.Default
    boolean includeHierarchyLinks = true;

    /**
     * Returns the default configuration.
     */
    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }
}
