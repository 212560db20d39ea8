package com.architecture.flowforge.dto.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of cell classification for one page.
 */
@Value
@Builder
public class ClassifiedCells {

    // Insertion-ordered, creation order of the vertices
    Map<String, DiagramNode> nodesById;
    List<DiagramEdge> edges;

    // Root and layer cell ids; a parent reference to one of these means "top level"
    Set<String> structuralIds;
}
