package com.architecture.flowforge.dto.graph;

import com.architecture.flowforge.model.CellGeometry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A vertex cell after classification.
 * {@code shape} is filled by the style mapper, {@code childIds} and {@code container}
 * by the hierarchy builder.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiagramNode {

    private String sourceId;
    private String label;
    private String style;
    private String parentId;
    private CellGeometry geometry;
    private ShapeDescriptor shape;

    @Builder.Default
    private List<String> childIds = new ArrayList<>();

    private boolean container;
}
