package com.architecture.flowforge.dto.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Typed result of mapping a vertex style string.
 * Downstream code switches on {@link NodeShape}, never on raw style text.
 */
@Value
@Builder
public class ShapeDescriptor {

    NodeShape shape;

    // Style marks the vertex as a group, swimlane, lane or explicit container
    boolean containerMarker;

    // Explicit shape= value no rule recognised; null when the style was understood
    String unrecognizedMarker;

    public static ShapeDescriptor rectangle() {
        return ShapeDescriptor.builder().shape(NodeShape.RECTANGLE).build();
    }
}
