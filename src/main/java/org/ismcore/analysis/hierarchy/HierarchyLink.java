package org.ismcore.analysis.hierarchy;

import lombok.Value;

/**
 * One drawable direct-influence link between element indices.
 */
@Value
public class HierarchyLink {
    int source;
    int target;
    HierarchyLinkKind kind;
}
