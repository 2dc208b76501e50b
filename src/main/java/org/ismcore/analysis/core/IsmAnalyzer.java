package org.ismcore.analysis.core;

import lombok.Builder;
import org.ismcore.analysis.canonical.Canonicalizer;
import org.ismcore.analysis.closure.ClosureComputer;
import org.ismcore.analysis.hierarchy.HierarchyLink;
import org.ismcore.analysis.hierarchy.HierarchyLinkExtractor;
import org.ismcore.analysis.level.LevelPartition;
import org.ismcore.analysis.level.LevelPartitioner;
import org.ismcore.analysis.matrix.BinaryMatrix;
import org.ismcore.analysis.micmac.MicmacAnalyzer;
import org.ismcore.analysis.micmac.MicmacReport;
import org.ismcore.analysis.relation.RelationEncoder;
import org.ismcore.analysis.relation.RelationLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Main ISM analysis entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the request and apply the configured {@link IdentifierPolicy}.</li>
 * <li>Encode pairwise judgments into the initial reachability matrix.</li>
 * <li>Close the matrix transitively.</li>
 * <li>Reduce the closure to the canonical matrix.</li>
 * <li>Partition the closure into levels.</li>
 * <li>Derive the MICMAC report and drawable hierarchy links when enabled.</li>
 * </ul>
 *
 * <p>Instances hold only configuration and may be shared across threads.</p>
 */
public final class IsmAnalyzer {
    public static final String REASON_REQUEST_REQUIRED = "ISM_REQUEST_REQUIRED";
    public static final String REASON_RELATION_LOOKUP_REQUIRED = "ISM_RELATION_LOOKUP_REQUIRED";
    public static final String REASON_INVALID_INPUT = "ISM_INVALID_INPUT";
    public static final String REASON_ANALYSIS_FAILED = "ISM_ANALYSIS_FAILED";

    private static final Logger log = LoggerFactory.getLogger(IsmAnalyzer.class);

    private final AnalysisConfig config;

    /**
     * Creates an analyzer.
     *
     * @param config tunables; defaults apply when null.
     */
    @Builder
    public IsmAnalyzer(AnalysisConfig config) {
        this.config = config == null ? AnalysisConfig.defaults() : config;
        if (this.config.getIdentifierPolicy() == null) {
            throw new IllegalArgumentException("identifierPolicy must be provided");
        }
        if (this.config.getLevelCapSlack() < 0) {
            throw new IllegalArgumentException("levelCapSlack must be >= 0");
        }
    }

    /**
     * Creates an analyzer with default configuration.
     */
    public IsmAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    /**
     * Returns the active configuration.
     */
    public AnalysisConfig config() {
        return config;
    }

    /**
     * Runs the analysis on raw inputs.
     *
     * @param elementCount number of elements N.
     * @param identifiers identifiers in matrix order.
     * @param relations pairwise relation lookup.
     * @return immutable analysis result.
     * @throws IsmAnalysisException when input contracts fail.
     */
    public AnalysisResult analyze(int elementCount, List<String> identifiers, RelationLookup relations) {
        return analyze(new AnalysisRequest(elementCount, identifiers, relations));
    }

    /**
     * Runs the analysis on one request snapshot.
     *
     * @param request analysis inputs.
     * @return immutable analysis result.
     * @throws IsmAnalysisException when input contracts fail.
     */
    public AnalysisResult analyze(AnalysisRequest request) {
        validate(request);
        int n = request.getElementCount();
        List<String> identifiers = request.getIdentifiers();

        long startNanos = System.nanoTime();
        try {
            BinaryMatrix initial = RelationEncoder.encode(n, identifiers, request.getRelations());
            BinaryMatrix closure = ClosureComputer.close(initial);
            BinaryMatrix canonical = Canonicalizer.reduce(closure);
            List<LevelPartition> levels = LevelPartitioner.partition(closure, config.getLevelCapSlack());

            MicmacReport micmac = config.isIncludeMicmac()
                    ? MicmacAnalyzer.analyze(closure)
                    : MicmacReport.empty();
            List<HierarchyLink> links = config.isIncludeHierarchyLinks()
                    ? HierarchyLinkExtractor.extract(initial, levels)
                    : List.of();

            AnalysisResult result = AnalysisResult.builder()
                    .identifiers(identifiers)
                    .initialReachability(initial)
                    .finalReachability(closure)
                    .canonical(canonical)
                    .levels(levels)
                    .micmac(micmac)
                    .hierarchyLinks(links)
                    .build();
            if (log.isDebugEnabled()) {
                log.debug("Analyzed {} elements: {} direct edges, {} closure edges, {} canonical edges, {} levels in {} us",
                        n, initial.edgeCount(), closure.edgeCount(), canonical.edgeCount(), levels.size(),
                        (System.nanoTime() - startNanos) / 1_000L);
            }
            return result;
        } catch (IllegalArgumentException ex) {
            throw new IsmAnalysisException(REASON_ANALYSIS_FAILED, "analysis of " + n + " elements failed", ex);
        }
    }

    /**
     * Applies request contracts and the identifier policy.
     */
    private void validate(AnalysisRequest request) {
        if (request == null) {
            throw new IsmAnalysisException(REASON_REQUEST_REQUIRED, "analysis request must be provided");
        }
        if (request.getElementCount() < 0) {
            throw new IsmAnalysisException(
                    REASON_INVALID_INPUT,
                    "element count must be >= 0, found " + request.getElementCount()
            );
        }
        if (request.getRelations() == null) {
            throw new IsmAnalysisException(REASON_RELATION_LOOKUP_REQUIRED, "relation lookup must be provided");
        }

        List<String> identifiers = request.getIdentifiers();
        int identifierCount = identifiers == null ? 0 : identifiers.size();
        if (identifierCount == request.getElementCount()) {
            return;
        }
        if (config.getIdentifierPolicy() == IdentifierPolicy.STRICT) {
            throw new IsmAnalysisException(
                    REASON_INVALID_INPUT,
                    "identifier count " + identifierCount + " does not match element count " + request.getElementCount()
            );
        }
        log.warn("Identifier count {} does not match element count {}; using element count, "
                        + "positions without an identifier relate to nothing",
                identifierCount, request.getElementCount());
    }
}
