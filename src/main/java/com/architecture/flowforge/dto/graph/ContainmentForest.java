package com.architecture.flowforge.dto.graph;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Containment forest over the nodes of one page, stored as an arena.
 *
 * Nodes live in a flat list in creation order; containment is expressed through index
 * lists only, so walks never follow object references and need no recursion.
 */
public class ContainmentForest {

    public static final int NO_PARENT = -1;

    private final List<DiagramNode> nodes;
    private final Map<String, Integer> indexBySourceId;
    private final List<Integer> parentIndexes;
    private final List<List<Integer>> childIndexes;
    private final List<Integer> rootIndexes;

    public ContainmentForest(List<DiagramNode> nodes,
                             Map<String, Integer> indexBySourceId,
                             List<Integer> parentIndexes,
                             List<List<Integer>> childIndexes,
                             List<Integer> rootIndexes) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.indexBySourceId = Collections.unmodifiableMap(indexBySourceId);
        this.parentIndexes = Collections.unmodifiableList(parentIndexes);
        this.childIndexes = Collections.unmodifiableList(childIndexes);
        this.rootIndexes = Collections.unmodifiableList(rootIndexes);
    }

    public List<DiagramNode> getNodes() {
        return nodes;
    }

    public DiagramNode node(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public Integer indexOf(String sourceId) {
        return indexBySourceId.get(sourceId);
    }

    public boolean contains(String sourceId) {
        return indexBySourceId.containsKey(sourceId);
    }

    public int parentOf(int index) {
        return parentIndexes.get(index);
    }

    public List<Integer> childrenOf(int index) {
        return Collections.unmodifiableList(childIndexes.get(index));
    }

    public List<Integer> getRootIndexes() {
        return rootIndexes;
    }
}
