package com.architecture.flowforge.dto.graph;

/**
 * How arrowheads on a connector are rendered.
 */
public enum ArrowDirection {
    FORWARD,        // Arrowhead at the target only
    UNDIRECTED,     // No arrowheads
    BIDIRECTIONAL   // Arrowhead at the origin; emitted as two opposite directed connectors
}
