package com.architecture.flowforge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw mxCell record as found in a diagram page.
 * Vertices and edges share this shape; structural cells (root, layers) carry neither flag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cell {

    private String id;
    private String value;       // Label, may be empty or HTML markup
    private String style;       // Semicolon-delimited style tokens
    private boolean vertex;
    private boolean edge;
    private String parentId;
    private String sourceId;    // Edges only
    private String targetId;    // Edges only
    private CellGeometry geometry;
}
