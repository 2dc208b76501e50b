package org.ismcore.analysis.hierarchy;

/**
 * Placement of a drawn link relative to the level diagram.
 *
 * <p>{@code SAME_LEVEL} joins two elements on one level.</p>
 * <p>{@code ADJACENT_LEVEL} joins an element to one on the level directly above it.</p>
 */
public enum HierarchyLinkKind {
    SAME_LEVEL,
    ADJACENT_LEVEL
}
