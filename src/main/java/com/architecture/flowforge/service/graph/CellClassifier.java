package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.graph.ClassifiedCells;
import com.architecture.flowforge.dto.graph.DiagramEdge;
import com.architecture.flowforge.dto.graph.DiagramNode;
import com.architecture.flowforge.model.Cell;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Splits the flat cell list of a page into typed nodes and edges.
 *
 * Rules:
 * - Root cells (no parent, neither vertex nor edge) and layers (parent is a root) are structural and dropped
 * - Vertices become nodes, except edgeLabel vertices parented by an edge, which are that edge's label
 * - Edges become edges
 * - Anything else is reported as UNSUPPORTED_ELEMENT and skipped
 */
@Service
@Slf4j
public class CellClassifier {

    public ClassifiedCells classify(List<Cell> cells, ConversionDiagnostics diagnostics) {
        Set<String> structuralIds = findStructuralIds(cells);
        Set<String> edgeIds = new HashSet<>();
        for (Cell cell : cells) {
            if (cell.isEdge() && !cell.isVertex() && cell.getId() != null) {
                edgeIds.add(cell.getId());
            }
        }

        Map<String, DiagramNode> nodesById = new LinkedHashMap<>();
        Map<String, DiagramEdge> edgesById = new LinkedHashMap<>();
        Map<String, List<String>> edgeLabelFragments = new HashMap<>();

        for (Cell cell : cells) {
            String id = cell.getId();
            if (id == null) {
                diagnostics.report(ErrorKind.UNSUPPORTED_ELEMENT, null, "Cell has no id");
                continue;
            }
            if (structuralIds.contains(id)) {
                continue;
            }

            if (cell.isVertex()) {
                String label = LabelText.toPlainText(cell.getValue());
                if (edgeIds.contains(cell.getParentId())
                        && ParsedStyle.parse(cell.getStyle()).hasMarker("edgeLabel")) {
                    // Free-standing edge label: fold the text into the owning edge
                    if (!label.isEmpty()) {
                        edgeLabelFragments.computeIfAbsent(cell.getParentId(), k -> new ArrayList<>()).add(label);
                    }
                    log.debug("Cell {} is a label of edge {}", id, cell.getParentId());
                    continue;
                }
                nodesById.put(id, DiagramNode.builder()
                        .sourceId(id)
                        .label(label)
                        .style(cell.getStyle() != null ? cell.getStyle() : "")
                        .parentId(cell.getParentId())
                        .geometry(cell.getGeometry())
                        .build());
            } else if (cell.isEdge()) {
                edgesById.put(id, DiagramEdge.builder()
                        .id(id)
                        .sourceId(cell.getSourceId())
                        .targetId(cell.getTargetId())
                        .label(LabelText.toPlainText(cell.getValue()))
                        .style(cell.getStyle() != null ? cell.getStyle() : "")
                        .build());
            } else {
                diagnostics.report(ErrorKind.UNSUPPORTED_ELEMENT, id,
                        "Cell is neither a vertex nor an edge");
            }
        }

        edgeLabelFragments.forEach((edgeId, fragments) -> {
            DiagramEdge edge = edgesById.get(edgeId);
            List<String> parts = new ArrayList<>();
            if (!edge.getLabel().isEmpty()) {
                parts.add(edge.getLabel());
            }
            parts.addAll(fragments);
            edge.setLabel(String.join(" ", parts));
        });

        log.debug("Classified {} cells: {} nodes, {} edges, {} structural",
                cells.size(), nodesById.size(), edgesById.size(), structuralIds.size());

        return ClassifiedCells.builder()
                .nodesById(nodesById)
                .edges(new ArrayList<>(edgesById.values()))
                .structuralIds(structuralIds)
                .build();
    }

    /**
     * Root cells have no parent; layers hang directly off a root. Neither is a vertex nor an edge.
     */
    private Set<String> findStructuralIds(List<Cell> cells) {
        Set<String> roots = new LinkedHashSet<>();
        for (Cell cell : cells) {
            if (isPlain(cell) && (cell.getParentId() == null || cell.getParentId().isEmpty())) {
                roots.add(cell.getId());
            }
        }

        Set<String> structural = new LinkedHashSet<>(roots);
        for (Cell cell : cells) {
            if (isPlain(cell) && roots.contains(cell.getParentId())) {
                structural.add(cell.getId());
            }
        }
        return structural;
    }

    private boolean isPlain(Cell cell) {
        return cell.getId() != null && !cell.isVertex() && !cell.isEdge();
    }
}
