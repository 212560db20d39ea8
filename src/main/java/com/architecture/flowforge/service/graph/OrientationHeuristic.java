package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.graph.ContainmentForest;
import com.architecture.flowforge.dto.graph.DiagramNode;
import com.architecture.flowforge.dto.graph.LayoutDirection;
import com.architecture.flowforge.model.CellGeometry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Suggests a layout direction from the bounding box of the leaf nodes.
 * Containers are left out so a wide group box does not skew the result.
 */
@Service
@Slf4j
public class OrientationHeuristic {

    public LayoutDirection suggest(ContainmentForest forest) {
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        int measured = 0;

        for (int i = 0; i < forest.size(); i++) {
            DiagramNode node = forest.node(i);
            CellGeometry geometry = node.getGeometry();
            if (node.isContainer() || geometry == null) {
                continue;
            }

            // Child geometry is relative to the parent container
            double x = geometry.getX();
            double y = geometry.getY();
            for (int parent = forest.parentOf(i); parent != ContainmentForest.NO_PARENT; parent = forest.parentOf(parent)) {
                CellGeometry parentGeometry = forest.node(parent).getGeometry();
                if (parentGeometry != null) {
                    x += parentGeometry.getX();
                    y += parentGeometry.getY();
                }
            }

            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x + geometry.getWidth());
            maxY = Math.max(maxY, y + geometry.getHeight());
            measured++;
        }

        if (measured == 0) {
            log.debug("No leaf geometry available, defaulting to {}", LayoutDirection.TD);
            return LayoutDirection.TD;
        }

        double horizontalSpan = maxX - minX;
        double verticalSpan = maxY - minY;
        LayoutDirection direction = horizontalSpan > verticalSpan ? LayoutDirection.LR : LayoutDirection.TD;
        log.debug("Leaf extents {}x{} over {} nodes -> {}", horizontalSpan, verticalSpan, measured, direction);
        return direction;
    }
}
