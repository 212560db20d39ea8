package com.architecture.flowforge.service.graph;

import com.architecture.flowforge.dto.ErrorKind;
import com.architecture.flowforge.dto.graph.ClassifiedCells;
import com.architecture.flowforge.dto.graph.ContainmentForest;
import com.architecture.flowforge.dto.graph.DiagramNode;
import com.architecture.flowforge.exception.ConversionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Builds the containment forest of a page and tags each node as container or leaf.
 *
 * A node is a container when its style carries a group/lane/container marker OR it has at
 * least one child. Both conditions are checked independently:
 * - a group-styled node without children is still a container (emitted as an empty block)
 * - a plain-styled node that other nodes name as parent becomes a container (its own shape is dropped)
 *
 * Containment cycles are fatal and abort the page.
 */
@Service
@Slf4j
public class HierarchyBuilder {

    public ContainmentForest build(ClassifiedCells cells, ConversionDiagnostics diagnostics) {
        Map<String, DiagramNode> nodesById = cells.getNodesById();
        Set<String> structuralIds = cells.getStructuralIds();

        // 1. Resolve each node's effective parent: a known node, or null for top level
        Map<String, String> effectiveParent = new HashMap<>();
        for (DiagramNode node : nodesById.values()) {
            String parentId = node.getParentId();
            if (parentId == null || parentId.isEmpty() || structuralIds.contains(parentId)) {
                effectiveParent.put(node.getSourceId(), null);
            } else if (nodesById.containsKey(parentId)) {
                effectiveParent.put(node.getSourceId(), parentId);
            } else {
                diagnostics.report(ErrorKind.UNRESOLVED_PARENT, node.getSourceId(),
                        "Parent '" + parentId + "' is not a known node; placed at top level");
                effectiveParent.put(node.getSourceId(), null);
            }
        }

        // 2. Every ancestor chain must end at the top level
        detectCycles(nodesById.keySet(), effectiveParent);

        // 3. Arena: creation-order node list with parent/child index lists
        List<DiagramNode> nodes = new ArrayList<>(nodesById.values());
        Map<String, Integer> indexBySourceId = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            DiagramNode node = nodes.get(i);
            node.setChildIds(new ArrayList<>());
            indexBySourceId.put(node.getSourceId(), i);
        }

        List<Integer> parentIndexes = new ArrayList<>(nodes.size());
        List<List<Integer>> childIndexes = new ArrayList<>(nodes.size());
        List<Integer> rootIndexes = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            childIndexes.add(new ArrayList<>());
        }

        for (int i = 0; i < nodes.size(); i++) {
            DiagramNode node = nodes.get(i);
            String parentId = effectiveParent.get(node.getSourceId());
            if (parentId == null) {
                parentIndexes.add(ContainmentForest.NO_PARENT);
                rootIndexes.add(i);
            } else {
                int parentIndex = indexBySourceId.get(parentId);
                parentIndexes.add(parentIndex);
                childIndexes.get(parentIndex).add(i);
                nodesById.get(parentId).getChildIds().add(node.getSourceId());
            }
        }

        int containers = 0;
        for (DiagramNode node : nodes) {
            boolean styledContainer = node.getShape() != null && node.getShape().isContainerMarker();
            node.setContainer(styledContainer || !node.getChildIds().isEmpty());
            if (node.isContainer()) {
                containers++;
            }
        }

        log.debug("Built containment forest: {} nodes, {} roots, {} containers",
                nodes.size(), rootIndexes.size(), containers);

        return new ContainmentForest(nodes, indexBySourceId, parentIndexes, childIndexes, rootIndexes);
    }

    /**
     * Walk each node's ancestor chain with a visited set. Chains already proven to reach the
     * top level are remembered so every node is walked at most once overall.
     */
    private void detectCycles(Collection<String> nodeIds, Map<String, String> effectiveParent) {
        Set<String> reachesTop = new HashSet<>();

        for (String start : nodeIds) {
            LinkedHashSet<String> chain = new LinkedHashSet<>();
            String current = start;
            while (current != null && !reachesTop.contains(current)) {
                if (!chain.add(current)) {
                    throw cycleError(current, chain);
                }
                current = effectiveParent.get(current);
            }
            reachesTop.addAll(chain);
        }
    }

    private ConversionException cycleError(String repeated, LinkedHashSet<String> chain) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String id : chain) {
            if (id.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(id);
            }
        }
        cycle.add(repeated); // close the cycle

        String description = "Containment cycle: " + String.join(" -> ", cycle);
        log.error(description);
        return new ConversionException(ErrorKind.CYCLIC_HIERARCHY, repeated, description);
    }
}
