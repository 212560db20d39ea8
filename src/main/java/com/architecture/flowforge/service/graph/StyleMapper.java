package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.graph.ArrowDescriptor;
import com.architecture.flowforge.dto.graph.ClassifiedCells;
import com.architecture.flowforge.dto.graph.DiagramEdge;
import com.architecture.flowforge.dto.graph.DiagramNode;
import com.architecture.flowforge.dto.graph.LineStyle;
import com.architecture.flowforge.dto.graph.NodeShape;
import com.architecture.flowforge.dto.graph.ShapeDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Predicate;

/**
 * Maps draw.io style strings to typed Mermaid shape and connector descriptors.
 *
 * Node rules are evaluated in priority order, first match wins:
 * 1. Configured shape overrides
 * 2. Decision markers (rhombus, diamond) -> {}
 * 3. Round-corner markers (rounded=1, stadium, terminator) -> () / ([])
 * 4. Ellipse markers (ellipse, doubleEllipse) -> (()) / ((()))
 * 5. Other known shapes (hexagon, cylinder, parallelogram, trapezoid, process, step)
 * 6. Rectangle
 *
 * A style can carry several markers at once (a rounded rectangle inside a group, a rhombus with
 * rounded=1), so the order above is what makes the result deterministic.
 */
@Service
@Slf4j
public class StyleMapper {

    private static final String FLOWCHART_PREFIX = "mxgraph.flowchart.";

    private static final double THICK_STROKE_WIDTH = 3.0;

    private static final Set<String> CONTAINER_MARKERS = Set.of("group", "swimlane", "lane", "pool");

    // shape= values that are plain rectangles and need no warning
    private static final Set<String> RECTANGULAR_SHAPES = Set.of(
            "rect", "rectangle", "label", "text", "image", "note", FLOWCHART_PREFIX + "process");

    private static final List<ShapeRule> NODE_RULES = List.of(
            new ShapeRule(NodeShape.DIAMOND,
                    s -> s.hasMarker("rhombus") || s.hasMarker("diamond") || isFlowchart(s, "decision")),
            new ShapeRule(NodeShape.ROUNDED, s -> s.isOn("rounded")),
            new ShapeRule(NodeShape.STADIUM, s -> s.hasMarker("stadium") || isFlowchart(s, "terminator")),
            new ShapeRule(NodeShape.DOUBLE_CIRCLE, s -> s.hasMarker("doubleellipse")),
            new ShapeRule(NodeShape.CIRCLE,
                    s -> s.hasMarker("ellipse") || isFlowchart(s, "start_1") || isFlowchart(s, "start_2")
                            || isFlowchart(s, "on-page_reference")),
            new ShapeRule(NodeShape.HEXAGON, s -> s.hasMarker("hexagon") || isFlowchart(s, "preparation")),
            new ShapeRule(NodeShape.DATABASE,
                    s -> s.hasMarker("cylinder") || s.hasMarker("cylinder3") || s.hasMarker("datastore")
                            || isFlowchart(s, "database") || isFlowchart(s, "stored_data")),
            new ShapeRule(NodeShape.PARALLELOGRAM, s -> s.hasMarker("parallelogram") || isFlowchart(s, "data")),
            new ShapeRule(NodeShape.TRAPEZOID,
                    s -> s.hasMarker("trapezoid") || isFlowchart(s, "manual_operation")),
            new ShapeRule(NodeShape.SUBROUTINE,
                    s -> s.hasMarker("process") || isFlowchart(s, "predefined_process")),
            new ShapeRule(NodeShape.ASYMMETRIC, s -> s.hasMarker("step") || isFlowchart(s, "off-page_reference"))
    );

    /**
     * Attach shape descriptors to every node and arrow descriptors to every edge of a page.
     */
    public void applyTo(ClassifiedCells cells, ConversionOptions options, ConversionDiagnostics diagnostics) {
        Map<String, NodeShape> overrides = resolveOverrides(options.getShapeOverrides());

        for (DiagramNode node : cells.getNodesById().values()) {
            ShapeDescriptor descriptor = mapNodeStyle(node.getStyle(), overrides);
            if (descriptor.getUnrecognizedMarker() != null) {
                diagnostics.report(ErrorKind.UNRECOGNIZED_STYLE_MARKER, node.getSourceId(),
                        "Unknown shape '" + descriptor.getUnrecognizedMarker() + "', rendered as rectangle");
            }
            node.setShape(descriptor);
        }

        for (DiagramEdge edge : cells.getEdges()) {
            edge.setArrow(mapEdgeStyle(edge.getStyle()));
        }
    }

    public ShapeDescriptor mapNodeStyle(String style, Map<String, NodeShape> overrides) {
        ParsedStyle parsed = ParsedStyle.parse(style);
        boolean container = isContainerStyle(parsed);

        for (Map.Entry<String, NodeShape> override : overrides.entrySet()) {
            if (parsed.hasMarker(override.getKey())) {
                return descriptor(override.getValue(), container, null);
            }
        }

        for (ShapeRule rule : NODE_RULES) {
            if (rule.matches(parsed)) {
                return descriptor(rule.shape, container, null);
            }
        }

        String shape = parsed.shape();
        String unrecognized = null;
        if (shape != null && !RECTANGULAR_SHAPES.contains(shape) && !CONTAINER_MARKERS.contains(shape)) {
            unrecognized = parsed.get("shape");
        }
        return descriptor(NodeShape.RECTANGLE, container, unrecognized);
    }

    /**
     * Map an edge style.
     * draw.io defaults: endArrow absent means an arrowhead (classic), startArrow absent means none.
     */
    public ArrowDescriptor mapEdgeStyle(String style) {
        ParsedStyle parsed = ParsedStyle.parse(style);

        LineStyle lineStyle = LineStyle.SOLID;
        if (parsed.isOn("dashed")) {
            lineStyle = LineStyle.DASHED;
        } else if (parsed.getDouble("strokeWidth", 1.0) >= THICK_STROKE_WIDTH) {
            lineStyle = LineStyle.THICK;
        }

        String endArrow = parsed.get("endArrow");
        String startArrow = parsed.get("startArrow");

        return ArrowDescriptor.builder()
                .lineStyle(lineStyle)
                .endArrow(endArrow == null || !"none".equalsIgnoreCase(endArrow))
                .startArrow(startArrow != null && !startArrow.isEmpty() && !"none".equalsIgnoreCase(startArrow))
                .build();
    }

    /**
     * Resolve configured overrides (marker -> shape name or bracket pair), keeping configuration
     * order. Entries whose shape cannot be resolved are skipped.
     */
    public Map<String, NodeShape> resolveOverrides(Map<String, String> shapeOverrides) {
        Map<String, NodeShape> resolved = new LinkedHashMap<>();
        if (shapeOverrides == null) {
            return resolved;
        }
        shapeOverrides.forEach((marker, token) -> {
            NodeShape shape = NodeShape.fromToken(token);
            if (marker == null || marker.isBlank() || shape == null) {
                log.warn("Ignoring shape override '{}' -> '{}': unknown shape", marker, token);
            } else {
                resolved.put(marker.trim(), shape);
            }
        });
        return resolved;
    }

    public boolean isContainerStyle(ParsedStyle parsed) {
        if (parsed.isOn("container")) {
            return true;
        }
        for (String marker : CONTAINER_MARKERS) {
            if (parsed.hasMarker(marker)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isFlowchart(ParsedStyle parsed, String name) {
        return (FLOWCHART_PREFIX + name).equals(parsed.shape());
    }

    private ShapeDescriptor descriptor(NodeShape shape, boolean container, String unrecognized) {
        return ShapeDescriptor.builder()
                .shape(shape)
                .containerMarker(container)
                .unrecognizedMarker(unrecognized)
                .build();
    }

    private static final class ShapeRule {
        private final NodeShape shape;
        private final Predicate<ParsedStyle> condition;

        private ShapeRule(NodeShape shape, Predicate<ParsedStyle> condition) {
            this.shape = shape;
            this.condition = condition;
        }

        private boolean matches(ParsedStyle parsed) {
            return condition.test(parsed);
        }
    }
}
