package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.ConversionOptions;
import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.graph.ArrowDescriptor;
import com.architecture.flowforge.dto.graph.ArrowDirection;
import com.architecture.flowforge.dto.graph.CanonicalIdMap;
import com.architecture.flowforge.dto.graph.ContainmentForest;
import com.architecture.flowforge.dto.graph.DiagramEdge;
import com.architecture.flowforge.dto.graph.DiagramNode;
import com.architecture.flowforge.dto.graph.LayoutDirection;
import com.architecture.flowforge.dto.graph.LineStyle;
import com.architecture.flowforge.dto.graph.NodeShape;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Renders a page's containment forest and edges as Mermaid flowchart text.
 *
 * Output layout:
 * <pre>
 * flowchart TD
 *     start(("Start"))
 *     subgraph group_a["Group A"]
 *         step_1["Step 1"]
 *     end
 *     start --> step_1
 * </pre>
 * Nodes come first (depth-first, creation order), then every edge in input order.
 */
@Service
@Slf4j
public class MermaidFlowchartEmitter {

    private static final String INDENT = "    ";

    // Nesting below this depth keeps the same indentation
    static final int MAX_INDENT_DEPTH = 32;

    public String emit(ContainmentForest forest, CanonicalIdMap ids, List<DiagramEdge> edges,
                       LayoutDirection direction, ConversionOptions options, ConversionDiagnostics diagnostics) {
        List<String> lines = new ArrayList<>();
        lines.add("flowchart " + direction.name());

        emitNodes(forest, ids, lines);
        int connections = emitEdges(forest, ids, edges, options, diagnostics, lines);

        log.debug("Emitted {} nodes and {} connection lines", forest.size(), connections);
        return String.join("\n", lines);
    }

    /**
     * Depth-first walk over an explicit stack. Containers push an exit frame below their
     * children so the closing "end" is written after the last child.
     */
    private void emitNodes(ContainmentForest forest, CanonicalIdMap ids, List<String> lines) {
        Deque<Frame> stack = new ArrayDeque<>();
        pushChildren(stack, forest.getRootIndexes(), 1);

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            String indent = INDENT.repeat(Math.min(frame.depth, MAX_INDENT_DEPTH));

            if (frame.exit) {
                lines.add(indent + "end");
                continue;
            }

            DiagramNode node = forest.node(frame.index);
            String id = ids.get(node.getSourceId());
            if (node.isContainer()) {
                lines.add(indent + subgraphLine(id, node.getLabel()));
                stack.push(new Frame(frame.index, frame.depth, true));
                pushChildren(stack, forest.childrenOf(frame.index), frame.depth + 1);
            } else {
                lines.add(indent + declarationLine(id, node));
            }
        }
    }

    private void pushChildren(Deque<Frame> stack, List<Integer> children, int depth) {
        // Reverse push keeps creation order when popping
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame(children.get(i), depth, false));
        }
    }

    private int emitEdges(ContainmentForest forest, CanonicalIdMap ids, List<DiagramEdge> edges,
                          ConversionOptions options, ConversionDiagnostics diagnostics, List<String> lines) {
        int emitted = 0;
        for (DiagramEdge edge : edges) {
            String source = ids.get(edge.getSourceId());
            String target = ids.get(edge.getTargetId());

            if (source == null || target == null) {
                String missing = source == null ? edge.getSourceId() : edge.getTargetId();
                String end = source == null ? "source" : "target";
                diagnostics.report(ErrorKind.DANGLING_EDGE_REFERENCE, edge.getId(),
                        missing == null
                                ? "Edge has no " + end + "; dropped"
                                : "Edge " + end + " '" + missing + "' is not a known node; dropped");
                continue;
            }

            if (!options.isRetainContainerEdges()
                    && (isContainer(forest, edge.getSourceId()) || isContainer(forest, edge.getTargetId()))) {
                log.debug("Dropping edge {} attached to a container", edge.getId());
                continue;
            }

            ArrowDescriptor arrow = edge.getArrow() != null ? edge.getArrow() : ArrowDescriptor.solidArrow();
            lines.add(INDENT + connectionLine(source, target, edge.getLabel(), arrow));
            emitted++;

            // No two-headed connector: the reverse direction is a second line
            if (arrow.getDirection() == ArrowDirection.BIDIRECTIONAL) {
                lines.add(INDENT + connectionLine(target, source, "", arrow));
                emitted++;
            }
        }
        return emitted;
    }

    private boolean isContainer(ContainmentForest forest, String sourceId) {
        Integer index = forest.indexOf(sourceId);
        return index != null && forest.node(index).isContainer();
    }

    String subgraphLine(String id, String label) {
        if (label == null || label.isEmpty()) {
            return "subgraph " + id;
        }
        return "subgraph " + id + "[" + quote(label) + "]";
    }

    String declarationLine(String id, DiagramNode node) {
        NodeShape shape = node.getShape() != null && node.getShape().getShape() != null
                ? node.getShape().getShape()
                : NodeShape.RECTANGLE;
        String text = node.getLabel() == null || node.getLabel().isEmpty() ? id : node.getLabel();
        return id + shape.getOpen() + quote(text) + shape.getClose();
    }

    String connectionLine(String source, String target, String label, ArrowDescriptor arrow) {
        LineStyle lineStyle = arrow.getLineStyle() != null ? arrow.getLineStyle() : LineStyle.SOLID;
        boolean directed = arrow.isDirected();

        if (label == null || label.isEmpty()) {
            return source + " " + lineStyle.connector(directed) + " " + target;
        }
        return source + " " + lineStyle.labelOpen() + " " + quote(label) + " "
                + lineStyle.labelClose(directed) + " " + target;
    }

    /**
     * Labels are always double-quoted so brackets, pipes and keywords inside them are inert.
     * Embedded quotes and backticks (markdown strings) use Mermaid's entity codes; line breaks
     * become {@code <br>}.
     */
    static String quote(String text) {
        String escaped = text
                .replace("\"", "#quot;")
                .replace("`", "#96;")
                .replace("\r\n", "<br>")
                .replace("\n", "<br>")
                .replace("\r", "<br>");
        return "\"" + escaped + "\"";
    }

    private static final class Frame {
        private final int index;
        private final int depth;
        private final boolean exit;

        private Frame(int index, int depth, boolean exit) {
            this.index = index;
            this.depth = depth;
            this.exit = exit;
        }
    }
}
