package com.architecture.flowforge.dto.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Typed result of mapping an edge style string.
 */
@Value
@Builder
public class ArrowDescriptor {

    LineStyle lineStyle;
    boolean startArrow;
    boolean endArrow;

    public ArrowDirection getDirection() {
        if (startArrow) {
            return ArrowDirection.BIDIRECTIONAL;
        }
        return endArrow ? ArrowDirection.FORWARD : ArrowDirection.UNDIRECTED;
    }

    public boolean isDirected() {
        return getDirection() != ArrowDirection.UNDIRECTED;
    }

    public static ArrowDescriptor solidArrow() {
        return ArrowDescriptor.builder().lineStyle(LineStyle.SOLID).endArrow(true).build();
    }
}
