package org.ismcore.analysis.core;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.ismcore.analysis.hierarchy.HierarchyLink;
import org.ismcore.analysis.level.LevelPartition;
import org.ismcore.analysis.matrix.BinaryMatrix;
import org.ismcore.analysis.micmac.MicmacReport;
import org.ismcore.core.id.ElementIdMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable output of one analysis run.
 *
 * <p>Holds the initial reachability matrix, its closure, the canonical matrix, the level
 * partition and the derived reports. A result is never patched; changed inputs produce a
 * new result.</p>
 */
@Getter
public final class AnalysisResult {
    /** Identifiers by matrix position; null where the caller supplied none. */
    private final List<String> identifiers;
    /** Direct edges plus self-loops. */
    private final BinaryMatrix initialReachability;
    /** Transitive closure of the initial matrix. */
    private final BinaryMatrix finalReachability;
    /** Two-hop reduction of the closure without self-loops. */
    private final BinaryMatrix canonical;
    /** Levels in emission order, top elements first. */
    private final List<LevelPartition> levels;
    /** Driving/dependence classification. */
    private final MicmacReport micmac;
    /** Direct edges to draw on the level diagram. */
    private final List<HierarchyLink> hierarchyLinks;
    @Getter(AccessLevel.NONE)
    private final ElementIdMapper elementIds;
    @Getter(AccessLevel.NONE)
    private final int[] levelByElement;

    @Builder
    private AnalysisResult(
            List<String> identifiers,
            BinaryMatrix initialReachability,
            BinaryMatrix finalReachability,
            BinaryMatrix canonical,
            List<LevelPartition> levels,
            MicmacReport micmac,
            List<HierarchyLink> hierarchyLinks
    ) {
        this.initialReachability = Objects.requireNonNull(initialReachability, "initialReachability");
        this.finalReachability = Objects.requireNonNull(finalReachability, "finalReachability");
        this.canonical = Objects.requireNonNull(canonical, "canonical");
        this.levels = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(levels, "levels")));
        this.micmac = micmac == null ? MicmacReport.empty() : micmac;
        this.hierarchyLinks = hierarchyLinks == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(hierarchyLinks));

        int size = initialReachability.size();
        if (finalReachability.size() != size || canonical.size() != size) {
            throw new IllegalArgumentException(
                    "matrix size mismatch: initial=" + size
                            + ", final=" + finalReachability.size()
                            + ", canonical=" + canonical.size()
            );
        }
        List<String> positional = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            positional.add(identifiers != null && i < identifiers.size() ? identifiers.get(i) : null);
        }
        this.identifiers = Collections.unmodifiableList(positional);
        this.elementIds = ElementIdMapper.fromIdentifiers(positional);
        this.levelByElement = indexLevels(size, this.levels);
    }

    /**
     * Returns number of elements N.
     */
    public int elementCount() {
        return initialReachability.size();
    }

    /**
     * Returns number of emitted levels.
     */
    public int levelCount() {
        return levels.size();
    }

    /**
     * Returns the level number of an element index.
     */
    public int levelOf(int element) {
        if (element < 0 || element >= levelByElement.length) {
            throw new IndexOutOfBoundsException("element out of bounds: " + element);
        }
        return levelByElement[element];
    }

    /**
     * Returns the level number of an element identifier.
     *
     * @throws ElementIdMapper.UnknownElementException if the identifier is not part of this run.
     */
    public int levelOf(String identifier) {
        return levelOf(indexOf(identifier));
    }

    /**
     * Returns the matrix index of an element identifier (first occurrence).
     *
     * @throws ElementIdMapper.UnknownElementException if the identifier is not part of this run.
     */
    public int indexOf(String identifier) {
        return elementIds.toIndex(identifier);
    }

    /**
     * Returns the identifier at a matrix index, or null when none was supplied.
     */
    public String identifierAt(int element) {
        return elementIds.toIdentifier(element);
    }

    /**
     * Returns whether {@code i -> j} exists only through transitivity: present in the
     * closure, absent from the initial matrix. ISM tables mark these cells {@code 1*}.
     */
    public boolean transitiveOnly(int i, int j) {
        return finalReachability.get(i, j) && !initialReachability.get(i, j);
    }

    private static int[] indexLevels(int size, List<LevelPartition> levels) {
        int[] levelByElement = new int[size];
        for (LevelPartition partition : levels) {
            for (int element : partition.elementsCopy()) {
                if (element < 0 || element >= size) {
                    throw new IllegalArgumentException("level element out of bounds: " + element);
                }
                if (levelByElement[element] != 0) {
                    throw new IllegalArgumentException("element " + element + " assigned to more than one level");
                }
                levelByElement[element] = partition.getLevel();
            }
        }
        return levelByElement;
    }
}
